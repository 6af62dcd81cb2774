package com.leaf.transform.model;

import java.io.Serializable;

/**
 * 分组编号配置。同一请求可串联多条，每条追加一列。
 */
public class GroupingConfig implements StepConfig, Serializable {

    public static final String TRANSFORMATION_ID = "group_id";

    private final GroupingRule rule;
    private final String outputColumnName;
    private final boolean resetOnChange;

    public GroupingConfig(GroupingRule rule, String outputColumnName, boolean resetOnChange) {
        this.rule = rule;
        this.outputColumnName = outputColumnName;
        this.resetOnChange = resetOnChange;
    }

    public static String defaultOutputName(String column) {
        return column + "_group_id";
    }

    public GroupingRule getRule() { return rule; }
    public boolean isResetOnChange() { return resetOnChange; }

    @Override
    public String getOutputColumnName() { return outputColumnName; }

    @Override
    public String getTransformationId() { return TRANSFORMATION_ID; }

    @Override
    public String artifactToken() {
        return outputColumnName;
    }

    @Override
    public String toString() {
        return "GroupingConfig{" + rule + " -> " + outputColumnName
                + (resetOnChange ? ", reset" : "") + "}";
    }
}
