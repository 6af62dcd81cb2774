package com.leaf.transform.model;

import java.util.BitSet;

/**
 * 布尔列
 */
public class BooleanColumn extends Column {

    private final BitSet values;

    public BooleanColumn(String name, BitSet values, int length, BitSet validity) {
        super(name, PhysicalType.BOOLEAN, length, validity);
        this.values = (BitSet) values.clone();
    }

    public static BooleanColumn of(String name, Boolean... values) {
        BitSet bits = new BitSet();
        BitSet validity = new BitSet();
        for (int i = 0; i < values.length; i++) {
            if (values[i] != null) {
                validity.set(i);
                bits.set(i, values[i]);
            }
        }
        return new BooleanColumn(name, bits, values.length, validity);
    }

    public boolean getBoolean(int row) {
        checkIndex(row);
        return values.get(row);
    }

    @Override
    public Object getObject(int row) {
        return isNull(row) ? null : Boolean.valueOf(values.get(row));
    }
}
