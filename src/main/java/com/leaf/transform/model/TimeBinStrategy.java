package com.leaf.transform.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

/**
 * 时间分箱策略：固定间隔 / 手动边界 / 间隙阈值
 */
public class TimeBinStrategy implements Serializable {

    public enum StrategyType {
        /** 距当前箱起点的时间达到interval即开新箱 */
        FIXED_INTERVAL,
        /** 按距首行的偏移量落入的手动边界区间分箱 */
        MANUAL_INTERVALS,
        /** 与上一行的间隔严格超过threshold即开新箱 */
        THRESHOLD_BASED
    }

    private final StrategyType type;
    private final long seconds;
    private final List<String> boundaries;

    private TimeBinStrategy(StrategyType type, long seconds, List<String> boundaries) {
        this.type = type;
        this.seconds = seconds;
        this.boundaries = boundaries;
    }

    public static TimeBinStrategy fixedInterval(long intervalSeconds) {
        return new TimeBinStrategy(StrategyType.FIXED_INTERVAL, intervalSeconds, Collections.emptyList());
    }

    /**
     * @param boundaries 时长字符串（HH:MM:SS / MM:SS / 秒数），无需预先排序
     */
    public static TimeBinStrategy manualIntervals(List<String> boundaries) {
        return new TimeBinStrategy(StrategyType.MANUAL_INTERVALS, 0L, List.copyOf(boundaries));
    }

    public static TimeBinStrategy thresholdBased(long thresholdSeconds) {
        return new TimeBinStrategy(StrategyType.THRESHOLD_BASED, thresholdSeconds, Collections.emptyList());
    }

    public StrategyType getType() { return type; }

    /** FIXED_INTERVAL 的间隔秒数 */
    public long getIntervalSeconds() { return seconds; }

    /** THRESHOLD_BASED 的阈值秒数 */
    public long getThresholdSeconds() { return seconds; }

    public List<String> getBoundaries() { return boundaries; }

    @Override
    public String toString() {
        switch (type) {
            case FIXED_INTERVAL: return "FixedInterval{" + seconds + "s}";
            case THRESHOLD_BASED: return "ThresholdBased{" + seconds + "s}";
            default: return "ManualIntervals{" + boundaries + "}";
        }
    }
}
