package com.leaf.transform.model;

import java.io.Serializable;

/**
 * 时间分箱配置
 */
public class TimeBinConfig implements StepConfig, Serializable {

    public static final String TRANSFORMATION_ID = "time_bin";

    private final String sourceTable;
    private final String sourceColumn;
    private final TimeBinStrategy strategy;
    private final String outputColumnName;
    /** 可选的产物名称，为null时由管道自动生成 */
    private final String outputArtifactName;

    public TimeBinConfig(String sourceTable, String sourceColumn, TimeBinStrategy strategy,
                         String outputColumnName, String outputArtifactName) {
        this.sourceTable = sourceTable;
        this.sourceColumn = sourceColumn;
        this.strategy = strategy;
        this.outputColumnName = outputColumnName;
        this.outputArtifactName = outputArtifactName;
    }

    public TimeBinConfig(String sourceTable, String sourceColumn, TimeBinStrategy strategy,
                         String outputColumnName) {
        this(sourceTable, sourceColumn, strategy, outputColumnName, null);
    }

    /** 输出列名的默认建议 */
    public static String defaultOutputName(String sourceColumn) {
        return sourceColumn + "_bin";
    }

    public String getSourceTable() { return sourceTable; }
    public String getSourceColumn() { return sourceColumn; }
    public TimeBinStrategy getStrategy() { return strategy; }
    public String getOutputArtifactName() { return outputArtifactName; }

    @Override
    public String getOutputColumnName() { return outputColumnName; }

    @Override
    public String getTransformationId() { return TRANSFORMATION_ID; }

    @Override
    public String artifactToken() {
        return "timebin_" + sourceColumn;
    }

    @Override
    public String toString() {
        return "TimeBinConfig{" + sourceTable + "." + sourceColumn + ", " + strategy
                + " -> " + outputColumnName + "}";
    }
}
