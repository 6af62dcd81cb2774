package com.leaf.transform.model;

import java.io.Serializable;

/**
 * 分组编号规则：值变化 / 值等于 / 为空
 */
public class GroupingRule implements Serializable {

    public enum RuleType {
        VALUE_CHANGE,
        VALUE_EQUALS,
        IS_EMPTY
    }

    private final RuleType type;
    private final String column;
    /** 仅VALUE_EQUALS使用的目标值 */
    private final String value;

    private GroupingRule(RuleType type, String column, String value) {
        this.type = type;
        this.column = column;
        this.value = value;
    }

    public static GroupingRule valueChange(String column) {
        return new GroupingRule(RuleType.VALUE_CHANGE, column, null);
    }

    public static GroupingRule valueEquals(String column, String value) {
        return new GroupingRule(RuleType.VALUE_EQUALS, column, value);
    }

    public static GroupingRule isEmpty(String column) {
        return new GroupingRule(RuleType.IS_EMPTY, column, null);
    }

    public RuleType getType() { return type; }
    public String getColumn() { return column; }
    public String getValue() { return value; }

    public String displayName() {
        switch (type) {
            case VALUE_CHANGE: return "When '" + column + "' changes";
            case VALUE_EQUALS: return "When '" + column + "' = '" + value + "'";
            default: return "When '" + column + "' is empty";
        }
    }

    @Override
    public String toString() {
        return displayName();
    }
}
