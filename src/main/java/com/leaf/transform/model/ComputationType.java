package com.leaf.transform.model;

/**
 * 计算列的计算类型
 */
public enum ComputationType {
    DELTA("Delta (Row-to-Row Difference)",
            "Shows the change from one row to the next"),
    CUMULATIVE_SUM("Cumulative Sum",
            "Running total that adds up as you go down"),
    PERCENTAGE("Percentage of Total",
            "What percent each value is of the total"),
    RATIO("Ratio (Column A / Column B)",
            "Divide one column by another"),
    MOVING_AVERAGE("Moving Average",
            "Smooth out variations by averaging the most recent values"),
    Z_SCORE("Z-Score Normalization",
            "How many standard deviations each value is from the mean");

    private final String displayName;
    private final String description;

    ComputationType(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() { return displayName; }
    public String getDescription() { return description; }

    public boolean requiresSecondColumn() {
        return this == RATIO;
    }

    public boolean supportsWindowSize() {
        return this == MOVING_AVERAGE;
    }

    /**
     * 输出列名的默认建议
     */
    public String defaultOutputName(String sourceColumn, String secondColumn, int windowSize) {
        switch (this) {
            case DELTA: return sourceColumn + "_delta";
            case CUMULATIVE_SUM: return sourceColumn + "_cumsum";
            case PERCENTAGE: return sourceColumn + "_pct";
            case RATIO:
                return (secondColumn == null || secondColumn.isEmpty())
                        ? sourceColumn + "_ratio"
                        : sourceColumn + "_per_" + secondColumn;
            case MOVING_AVERAGE: return sourceColumn + "_ma" + windowSize;
            case Z_SCORE: return sourceColumn + "_zscore";
            default: throw new IllegalStateException("Unknown computation: " + this);
        }
    }
}
