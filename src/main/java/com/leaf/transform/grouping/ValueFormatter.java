package com.leaf.transform.grouping;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.model.BooleanColumn;
import com.leaf.transform.model.Column;
import com.leaf.transform.model.DoubleColumn;
import com.leaf.transform.model.LongColumn;
import com.leaf.transform.model.StringColumn;
import com.leaf.transform.model.TimeUnit;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * 单元格字符串化，所有分组规则共用，保证"相等"在各规则间含义一致。
 * 空值渲染为空字符串。
 */
public final class ValueFormatter {

    private static final DateTimeFormatter TIME_SECONDS = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter TIME_MILLIS = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private ValueFormatter() {}

    public static String format(Column column, int row) throws TransformException {
        if (column.isNull(row)) {
            return "";
        }
        return switch (column.getType()) {
            case UTF8 -> ((StringColumn) column).getString(row);
            case INT32, INT64 -> Long.toString(((LongColumn) column).getLong(row));
            case FLOAT32 -> formatFloat((float) ((DoubleColumn) column).getDouble(row));
            case FLOAT64 -> formatDouble(((DoubleColumn) column).getDouble(row));
            case BOOLEAN -> Boolean.toString(((BooleanColumn) column).getBoolean(row));
            case DATE -> formatDate(((LongColumn) column).getLong(row));
            case TIMESTAMP_SECOND, TIMESTAMP_MILLISECOND, TIMESTAMP_MICROSECOND, TIMESTAMP_NANOSECOND ->
                    formatTimestamp(((LongColumn) column).getLong(row), column.getType().getTimeUnit());
        };
    }

    /**
     * 最短十进制表示，整数值不带 ".0"
     */
    static String formatDouble(double value) {
        if (Double.isNaN(value)) return "NaN";
        if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
        if (value == 0.0) return (1.0 / value < 0) ? "-0" : "0";
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static String formatFloat(float value) {
        if (Float.isNaN(value)) return "NaN";
        if (Float.isInfinite(value)) return value > 0 ? "inf" : "-inf";
        if (value == 0.0f) return (1.0f / value < 0) ? "-0" : "0";
        return new BigDecimal(Float.toString(value)).stripTrailingZeros().toPlainString();
    }

    private static String formatDate(long epochDay) throws TransformException {
        try {
            return LocalDate.ofEpochDay(epochDay).toString();
        } catch (DateTimeException e) {
            throw new TransformException(ErrorKind.UNSUPPORTED_TYPE, "Date value " + epochDay + " is out of range", e);
        }
    }

    private static String formatTimestamp(long raw, TimeUnit unit) throws TransformException {
        long seconds = unit.toSeconds(raw);
        int nanos = (int) unit.nanosOfSecond(raw);
        LocalDateTime dateTime;
        try {
            dateTime = LocalDateTime.ofEpochSecond(seconds, nanos, ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new TransformException(ErrorKind.UNSUPPORTED_TYPE,
                    "Timestamp value " + raw + " (" + unit + ") is out of range", e);
        }
        return unit == TimeUnit.SECOND ? TIME_SECONDS.format(dateTime) : TIME_MILLIS.format(dateTime);
    }
}
