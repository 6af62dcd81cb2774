package com.leaf.transform.model;

import java.util.BitSet;

/**
 * 列存批次中的单列：名称 + 物理类型 + 值数组 + 有效性位图。
 *
 * 有效性位图中未置位的行为空值，该行存储的值没有语义，不得读取为真实值。
 * 列在构造后不可变，派生操作均返回新的列实例。
 */
public abstract class Column {

    private final String name;
    private final PhysicalType type;
    private final int length;

    /** 置位表示该行非空 */
    private final BitSet validity;

    protected Column(String name, PhysicalType type, int length, BitSet validity) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be null or blank");
        }
        this.name = name;
        this.type = type;
        this.length = length;
        this.validity = (BitSet) validity.clone();
    }

    public String getName() { return name; }
    public PhysicalType getType() { return type; }
    public int length() { return length; }

    public boolean isNull(int row) {
        checkIndex(row);
        return !validity.get(row);
    }

    public int nullCount() {
        return length - validity.cardinality();
    }

    /**
     * 以装箱对象返回指定行的值，空值返回null。
     * 仅用于调试输出和测试断言，计算路径应使用各子类的原生访问方法。
     */
    public abstract Object getObject(int row);

    protected void checkIndex(int row) {
        if (row < 0 || row >= length) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range for column '"
                    + name + "' of length " + length);
        }
    }

    @Override
    public String toString() {
        return "Column{name='" + name + "', type=" + type + ", length=" + length
                + ", nulls=" + nullCount() + "}";
    }
}
