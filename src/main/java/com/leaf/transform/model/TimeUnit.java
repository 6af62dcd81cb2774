package com.leaf.transform.model;

/**
 * 时间戳列的时间单位
 */
public enum TimeUnit {
    SECOND(1L),
    MILLISECOND(1_000L),
    MICROSECOND(1_000_000L),
    NANOSECOND(1_000_000_000L);

    /** 每秒包含的单位数 */
    private final long unitsPerSecond;

    TimeUnit(long unitsPerSecond) {
        this.unitsPerSecond = unitsPerSecond;
    }

    public long getUnitsPerSecond() { return unitsPerSecond; }

    /** 换算为整秒（向下取整，负值同样向负无穷取整） */
    public long toSeconds(long value) {
        return Math.floorDiv(value, unitsPerSecond);
    }

    /** 不足一秒的部分，换算为纳秒 */
    public long nanosOfSecond(long value) {
        return Math.floorMod(value, unitsPerSecond) * (1_000_000_000L / unitsPerSecond);
    }
}
