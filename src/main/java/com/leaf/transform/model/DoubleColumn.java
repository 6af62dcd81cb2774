package com.leaf.transform.model;

import java.util.Arrays;
import java.util.BitSet;

/**
 * 以double存储的浮点列：FLOAT32 / FLOAT64。
 * FLOAT32 的值在写入时已收窄为float精度。
 */
public class DoubleColumn extends Column {

    private final double[] values;

    public DoubleColumn(String name, PhysicalType type, double[] values, BitSet validity) {
        super(name, type, values.length, validity);
        if (type != PhysicalType.FLOAT32 && type != PhysicalType.FLOAT64) {
            throw new IllegalArgumentException("DoubleColumn cannot hold type " + type);
        }
        this.values = values.clone();
        if (type == PhysicalType.FLOAT32) {
            for (int i = 0; i < this.values.length; i++) {
                this.values[i] = (float) this.values[i];
            }
        }
    }

    public static DoubleColumn of(String name, PhysicalType type, Double... values) {
        Builder builder = new Builder(name, type, values.length);
        for (Double v : values) {
            if (v == null) {
                builder.appendNull();
            } else {
                builder.append(v);
            }
        }
        return builder.build();
    }

    public static DoubleColumn of(String name, Double... values) {
        return of(name, PhysicalType.FLOAT64, values);
    }

    public double getDouble(int row) {
        checkIndex(row);
        return values[row];
    }

    @Override
    public Object getObject(int row) {
        if (isNull(row)) return null;
        if (getType() == PhysicalType.FLOAT32) {
            return Float.valueOf((float) values[row]);
        }
        return Double.valueOf(values[row]);
    }

    public static class Builder {
        private final String name;
        private final PhysicalType type;
        private double[] values;
        private final BitSet validity = new BitSet();
        private int size;

        public Builder(String name, PhysicalType type, int expectedSize) {
            this.name = name;
            this.type = type;
            this.values = new double[Math.max(expectedSize, 0)];
        }

        public Builder append(double value) {
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

        public DoubleColumn build() {
            return new DoubleColumn(name, type, Arrays.copyOf(values, size), validity);
        }

        private void ensureCapacity() {
            if (size == values.length) {
                values = Arrays.copyOf(values, Math.max(16, values.length * 2));
            }
        }
    }
}
