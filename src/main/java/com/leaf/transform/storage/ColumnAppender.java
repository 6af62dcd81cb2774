package com.leaf.transform.storage;

import com.leaf.transform.model.BooleanColumn;
import com.leaf.transform.model.Column;
import com.leaf.transform.model.DoubleColumn;
import com.leaf.transform.model.LongColumn;
import com.leaf.transform.model.PhysicalType;
import com.leaf.transform.model.StringColumn;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * 按行追加单元格、最终生成对应物理类型的列，供各数据源在不知道行数时逐行装载
 */
final class ColumnAppender {

    private final String name;
    private final PhysicalType type;
    private final LongColumn.Builder longs;
    private final DoubleColumn.Builder doubles;
    private final List<String> strings;
    private final BitSet bits;
    private final BitSet validity;
    private int size;

    ColumnAppender(String name, PhysicalType type) {
        this.name = name;
        this.type = type;
        this.longs = usesLongs(type) ? new LongColumn.Builder(name, type, 64) : null;
        this.doubles = (type == PhysicalType.FLOAT32 || type == PhysicalType.FLOAT64)
                ? new DoubleColumn.Builder(name, type, 64) : null;
        this.strings = type == PhysicalType.UTF8 ? new ArrayList<>() : null;
        this.bits = type == PhysicalType.BOOLEAN ? new BitSet() : null;
        this.validity = new BitSet();
    }

    PhysicalType getType() { return type; }

    void appendNull() {
        if (longs != null) longs.appendNull();
        else if (doubles != null) doubles.appendNull();
        else if (strings != null) strings.add(null);
        size++;
    }

    void appendLong(long value) {
        longs.append(value);
        size++;
    }

    void appendDouble(double value) {
        doubles.append(value);
        size++;
    }

    void appendBoolean(boolean value) {
        validity.set(size);
        bits.set(size, value);
        size++;
    }

    void appendString(String value) {
        validity.set(size);
        strings.add(value);
        size++;
    }

    Column build() {
        return switch (type) {
            case INT32, INT64, DATE, TIMESTAMP_SECOND, TIMESTAMP_MILLISECOND, TIMESTAMP_MICROSECOND,
                    TIMESTAMP_NANOSECOND -> longs.build();
            case FLOAT32, FLOAT64 -> doubles.build();
            case BOOLEAN -> new BooleanColumn(name, bits, size, validity);
            case UTF8 -> new StringColumn(name, strings.toArray(new String[0]), validity);
        };
    }

    private static boolean usesLongs(PhysicalType type) {
        return type.isIntegerFamily() || type == PhysicalType.DATE || type.isTimestamp();
    }
}
