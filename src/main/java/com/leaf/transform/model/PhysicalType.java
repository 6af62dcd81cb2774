package com.leaf.transform.model;

/**
 * 列的物理类型。
 *
 * 封闭枚举：每种类型都必须在各个按类型分派的 switch 表达式中显式处理，
 * 新增类型时由编译器指出所有需要补充的位置。
 * 时间戳按时间单位拆分为四个常量。
 */
public enum PhysicalType {
    INT32(null),
    INT64(null),
    FLOAT32(null),
    FLOAT64(null),
    BOOLEAN(null),
    UTF8(null),
    /** 日期，按天存储（自1970-01-01起的天数） */
    DATE(null),
    TIMESTAMP_SECOND(TimeUnit.SECOND),
    TIMESTAMP_MILLISECOND(TimeUnit.MILLISECOND),
    TIMESTAMP_MICROSECOND(TimeUnit.MICROSECOND),
    TIMESTAMP_NANOSECOND(TimeUnit.NANOSECOND);

    private final TimeUnit timeUnit;

    PhysicalType(TimeUnit timeUnit) {
        this.timeUnit = timeUnit;
    }

    /** 时间戳类型的时间单位；非时间戳类型返回null */
    public TimeUnit getTimeUnit() { return timeUnit; }

    public boolean isTimestamp() { return timeUnit != null; }

    public boolean isNumeric() {
        return this == INT32 || this == INT64 || this == FLOAT32 || this == FLOAT64;
    }

    public boolean isIntegerFamily() {
        return this == INT32 || this == INT64;
    }
}
