package com.leaf.transform.model;

import java.util.Arrays;
import java.util.BitSet;

/**
 * 以long存储的列：INT32、INT64、DATE（天数）及四种时间戳（按各自单位）
 */
public class LongColumn extends Column {

    private final long[] values;

    public LongColumn(String name, PhysicalType type, long[] values, BitSet validity) {
        super(name, type, values.length, validity);
        switch (type) {
            case INT32:
            case INT64:
            case DATE:
            case TIMESTAMP_SECOND:
            case TIMESTAMP_MILLISECOND:
            case TIMESTAMP_MICROSECOND:
            case TIMESTAMP_NANOSECOND:
                break;
            default:
                throw new IllegalArgumentException("LongColumn cannot hold type " + type);
        }
        this.values = values.clone();
    }

    /**
     * 由装箱值构造，null元素即空值
     */
    public static LongColumn of(String name, PhysicalType type, Long... values) {
        Builder builder = new Builder(name, type, values.length);
        for (Long v : values) {
            if (v == null) {
                builder.appendNull();
            } else {
                builder.append(v);
            }
        }
        return builder.build();
    }

    public long getLong(int row) {
        checkIndex(row);
        return values[row];
    }

    public double getDouble(int row) {
        return (double) getLong(row);
    }

    @Override
    public Object getObject(int row) {
        if (isNull(row)) return null;
        if (getType() == PhysicalType.INT32) {
            return Integer.valueOf((int) values[row]);
        }
        return Long.valueOf(values[row]);
    }

    /**
     * 顺序追加的构建器
     */
    public static class Builder {
        private final String name;
        private final PhysicalType type;
        private long[] values;
        private final BitSet validity = new BitSet();
        private int size;

        public Builder(String name, PhysicalType type, int expectedSize) {
            this.name = name;
            this.type = type;
            this.values = new long[Math.max(expectedSize, 0)];
        }

        public Builder append(long value) {
            ensureCapacity();
            values[size] = value;
            validity.set(size);
            size++;
            return this;
        }

        public Builder appendNull() {
            ensureCapacity();
            size++;
            return this;
        }

        public LongColumn build() {
            return new LongColumn(name, type, Arrays.copyOf(values, size), validity);
        }

        private void ensureCapacity() {
            if (size == values.length) {
                values = Arrays.copyOf(values, Math.max(16, values.length * 2));
            }
        }
    }
}
