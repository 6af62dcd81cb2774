package com.leaf.transform.model;

import java.io.Serializable;

/**
 * 计算列配置
 */
public class ComputedColumnConfig implements StepConfig, Serializable {

    public static final String TRANSFORMATION_ID = "computed_column";

    public static final int DEFAULT_WINDOW_SIZE = 5;

    private final ComputationType computationType;
    private final String sourceColumn;
    /** 仅RATIO使用的分母列 */
    private final String secondColumn;
    private final String outputName;
    /** 仅MOVING_AVERAGE使用的窗口大小 */
    private final int windowSize;
    private final NullHandling nullHandling;

    public ComputedColumnConfig(ComputationType computationType, String sourceColumn, String secondColumn,
                                String outputName, int windowSize, NullHandling nullHandling) {
        this.computationType = computationType;
        this.sourceColumn = sourceColumn;
        this.secondColumn = secondColumn;
        this.outputName = outputName;
        this.windowSize = windowSize;
        this.nullHandling = (nullHandling != null) ? nullHandling : NullHandling.SKIP_NULLS;
    }

    public ComputedColumnConfig(ComputationType computationType, String sourceColumn, String outputName) {
        this(computationType, sourceColumn, null, outputName, DEFAULT_WINDOW_SIZE, NullHandling.SKIP_NULLS);
    }

    public static ComputedColumnConfig ratio(String numerator, String denominator, String outputName) {
        return new ComputedColumnConfig(ComputationType.RATIO, numerator, denominator, outputName,
                DEFAULT_WINDOW_SIZE, NullHandling.SKIP_NULLS);
    }

    public static ComputedColumnConfig movingAverage(String sourceColumn, int windowSize,
                                                     NullHandling nullHandling, String outputName) {
        return new ComputedColumnConfig(ComputationType.MOVING_AVERAGE, sourceColumn, null, outputName,
                windowSize, nullHandling);
    }

    public ComputationType getComputationType() { return computationType; }
    public String getSourceColumn() { return sourceColumn; }
    public String getSecondColumn() { return secondColumn; }
    public String getOutputName() { return outputName; }
    public int getWindowSize() { return windowSize; }
    public NullHandling getNullHandling() { return nullHandling; }

    @Override
    public String getOutputColumnName() { return outputName; }

    @Override
    public String getTransformationId() { return TRANSFORMATION_ID; }

    @Override
    public String artifactToken() {
        switch (computationType) {
            case DELTA: return "delta_" + sourceColumn;
            case CUMULATIVE_SUM: return "cumsum_" + sourceColumn;
            case PERCENTAGE: return "pct_" + sourceColumn;
            case RATIO: return "ratio_" + sourceColumn + "_" + (secondColumn != null ? secondColumn : "unknown");
            case MOVING_AVERAGE: return "ma" + windowSize + "_" + sourceColumn;
            case Z_SCORE: return "zscore_" + sourceColumn;
            default: throw new IllegalStateException("Unknown computation: " + computationType);
        }
    }

    @Override
    public String toString() {
        return "ComputedColumnConfig{" + computationType + " of '" + sourceColumn + "'"
                + (secondColumn != null ? " / '" + secondColumn + "'" : "")
                + " -> " + outputName + ", " + nullHandling + "}";
    }
}
