package com.leaf.transform.model;

import java.util.BitSet;

/**
 * UTF-8 字符串列。空字符串是合法的非空值，与null（空值）区分。
 */
public class StringColumn extends Column {

    private final String[] values;

    public StringColumn(String name, String[] values, BitSet validity) {
        super(name, PhysicalType.UTF8, values.length, validity);
        this.values = values.clone();
    }

    /**
     * 由字符串数组构造，null元素即空值
     */
    public static StringColumn of(String name, String... values) {
        BitSet validity = new BitSet();
        for (int i = 0; i < values.length; i++) {
            if (values[i] != null) {
                validity.set(i);
            }
        }
        return new StringColumn(name, values, validity);
    }

    public String getString(int row) {
        checkIndex(row);
        return values[row];
    }

    @Override
    public Object getObject(int row) {
        return isNull(row) ? null : values[row];
    }
}
