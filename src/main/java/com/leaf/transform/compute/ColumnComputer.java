package com.leaf.transform.compute;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.model.Batch;
import com.leaf.transform.model.Column;
import com.leaf.transform.model.ComputedColumnConfig;
import com.leaf.transform.model.DoubleColumn;
import com.leaf.transform.model.LongColumn;
import com.leaf.transform.model.NullHandling;
import com.leaf.transform.model.PhysicalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 计算列生成器。
 * 源列必须为数值类型（INT32/INT64/FLOAT32/FLOAT64）。
 * Delta 与 CumulativeSum 保持整数/浮点族（整数族输出INT64，浮点族输出FLOAT64），其余输出FLOAT64。
 */
public class ColumnComputer {

    private static final Logger log = LoggerFactory.getLogger(ColumnComputer.class);

    public Column compute(Batch batch, ComputedColumnConfig config) throws TransformException {
        Column source = numericColumn(batch, config.getSourceColumn());
        if (source.length() == 0) {
            throw TransformException.emptyInput(config.getComputationType().getDisplayName()
                    + " for column '" + source.getName() + "'");
        }
        String out = config.getOutputName();

        Column result;
        switch (config.getComputationType()) {
            case DELTA:
                result = delta(source, out);
                break;
            case CUMULATIVE_SUM:
                result = cumulativeSum(source, config.getNullHandling(), out);
                break;
            case PERCENTAGE:
                result = percentage(source, out);
                break;
            case RATIO:
                if (config.getSecondColumn() == null || config.getSecondColumn().isBlank()) {
                    throw new TransformException(ErrorKind.INVALID_CONFIGURATION,
                            "Ratio requires a second (denominator) column");
                }
                result = ratio(source, numericColumn(batch, config.getSecondColumn()), out);
                break;
            case MOVING_AVERAGE:
                if (config.getWindowSize() < 1) {
                    throw new TransformException(ErrorKind.INVALID_CONFIGURATION,
                            "Moving average window must be at least 1, got " + config.getWindowSize());
                }
                result = movingAverage(source, config.getWindowSize(), config.getNullHandling(), out);
                break;
            case Z_SCORE:
                result = zScore(source, out);
                break;
            default:
                throw new TransformException(ErrorKind.INVALID_CONFIGURATION,
                        "Unknown computation: " + config.getComputationType());
        }

        log.debug("Computed {} of '{}' into '{}' ({} nulls)", config.getComputationType(),
                source.getName(), out, result.nullCount());
        return result;
    }

    private Column delta(Column source, String out) throws TransformException {
        int n = source.length();
        if (source.getType().isIntegerFamily()) {
            LongColumn values = (LongColumn) source;
            LongColumn.Builder builder = new LongColumn.Builder(out, PhysicalType.INT64, n);
            builder.appendNull();
            for (int i = 1; i < n; i++) {
                if (values.isNull(i) || values.isNull(i - 1)) {
                    builder.appendNull();
                } else {
                    try {
                        builder.append(Math.subtractExact(values.getLong(i), values.getLong(i - 1)));
                    } catch (ArithmeticException e) {
                        throw overflow(source, i, e);
                    }
                }
            }
            return builder.build();
        }
        DoubleColumn.Builder builder = new DoubleColumn.Builder(out, PhysicalType.FLOAT64, n);
        builder.appendNull();
        for (int i = 1; i < n; i++) {
            if (source.isNull(i) || source.isNull(i - 1)) {
                builder.appendNull();
            } else {
                builder.append(valueAt(source, i) - valueAt(source, i - 1));
            }
        }
        return builder.build();
    }

    private Column cumulativeSum(Column source, NullHandling nullHandling, String out) throws TransformException {
        int n = source.length();
        boolean integer = source.getType().isIntegerFamily();
        LongColumn.Builder longs = integer ? new LongColumn.Builder(out, PhysicalType.INT64, n) : null;
        DoubleColumn.Builder doubles = integer ? null : new DoubleColumn.Builder(out, PhysicalType.FLOAT64, n);

        long longTotal = 0;
        double doubleTotal = 0.0;
        boolean poisoned = false;
        for (int i = 0; i < n; i++) {
            boolean isNull = source.isNull(i);
            if (isNull && nullHandling == NullHandling.PROPAGATE_NULLS) {
                poisoned = true;
            }
            if (poisoned || (isNull && nullHandling == NullHandling.SKIP_NULLS)) {
                if (integer) longs.appendNull(); else doubles.appendNull();
                continue;
            }
            // 走到这里的空值只可能是 FILL_WITH_ZERO
            if (integer) {
                if (!isNull) {
                    try {
                        longTotal = Math.addExact(longTotal, ((LongColumn) source).getLong(i));
                    } catch (ArithmeticException e) {
                        throw overflow(source, i, e);
                    }
                }
                longs.append(longTotal);
            } else {
                doubleTotal += isNull ? 0.0 : valueAt(source, i);
                doubles.append(doubleTotal);
            }
        }
        return integer ? longs.build() : doubles.build();
    }

    private static TransformException overflow(Column source, int row, ArithmeticException cause) {
        return new TransformException(ErrorKind.NUMERIC_OVERFLOW,
                "Integer overflow in column '" + source.getName() + "' at row " + row, cause);
    }

    private Column percentage(Column source, String out) {
        double total = 0.0;
        for (int i = 0; i < source.length(); i++) {
            if (!source.isNull(i)) {
                total += valueAt(source, i);
            }
        }
        DoubleColumn.Builder builder = new DoubleColumn.Builder(out, PhysicalType.FLOAT64, source.length());
        for (int i = 0; i < source.length(); i++) {
            if (source.isNull(i) || total == 0.0) {
                builder.appendNull();
            } else {
                builder.append(valueAt(source, i) / total * 100.0);
            }
        }
        return builder.build();
    }

    private Column ratio(Column numerator, Column denominator, String out) {
        DoubleColumn.Builder builder = new DoubleColumn.Builder(out, PhysicalType.FLOAT64, numerator.length());
        for (int i = 0; i < numerator.length(); i++) {
            if (numerator.isNull(i) || denominator.isNull(i)) {
                builder.appendNull();
                continue;
            }
            double den = valueAt(denominator, i);
            if (den == 0.0) {
                builder.appendNull();
            } else {
                builder.append(valueAt(numerator, i) / den);
            }
        }
        return builder.build();
    }

    private Column movingAverage(Column source, int window, NullHandling nullHandling, String out) {
        int n = source.length();
        DoubleColumn.Builder builder = new DoubleColumn.Builder(out, PhysicalType.FLOAT64, n);
        // 窗口内的值与对应的空值标记；空值以0.0占位
        Deque<Double> recent = new ArrayDeque<>(window + 1);
        Deque<Boolean> nullFlags = new ArrayDeque<>(window + 1);
        int nullsInWindow = 0;

        for (int i = 0; i < n; i++) {
            boolean isNull = source.isNull(i);
            if (isNull && nullHandling == NullHandling.SKIP_NULLS) {
                builder.appendNull();
                continue;
            }
            recent.addLast(isNull ? 0.0 : valueAt(source, i));
            nullFlags.addLast(isNull);
            if (isNull) {
                nullsInWindow++;
            }
            if (recent.size() > window) {
                recent.removeFirst();
                if (nullFlags.removeFirst()) {
                    nullsInWindow--;
                }
            }

            if (nullHandling == NullHandling.PROPAGATE_NULLS && nullsInWindow > 0) {
                builder.appendNull();
            } else {
                builder.append(windowSum(recent) / recent.size());
            }
        }
        return builder.build();
    }

    /**
     * 每行对窗口重新求和，避免滚动加减在量级悬殊时丢失精度
     */
    private static double windowSum(Deque<Double> recent) {
        double sum = 0.0;
        for (double value : recent) {
            sum += value;
        }
        return sum;
    }

    private Column zScore(Column source, String out) {
        int count = 0;
        double mean = 0.0;
        double m2 = 0.0;
        // Welford 在线算法，总体方差
        for (int i = 0; i < source.length(); i++) {
            if (source.isNull(i)) continue;
            double x = valueAt(source, i);
            count++;
            double d = x - mean;
            mean += d / count;
            m2 += d * (x - mean);
        }
        double stddev = count > 0 ? Math.sqrt(m2 / count) : 0.0;

        DoubleColumn.Builder builder = new DoubleColumn.Builder(out, PhysicalType.FLOAT64, source.length());
        for (int i = 0; i < source.length(); i++) {
            if (source.isNull(i) || stddev == 0.0) {
                builder.appendNull();
            } else {
                builder.append((valueAt(source, i) - mean) / stddev);
            }
        }
        return builder.build();
    }

    private Column numericColumn(Batch batch, String name) throws TransformException {
        Column column = batch.column(name);
        if (!column.getType().isNumeric()) {
            throw new TransformException(ErrorKind.UNSUPPORTED_TYPE,
                    "Column '" + name + "' has type " + column.getType()
                            + "; computed columns require a numeric column");
        }
        return column;
    }

    private static double valueAt(Column column, int row) {
        return switch (column.getType()) {
            case INT32, INT64 -> ((LongColumn) column).getDouble(row);
            case FLOAT32, FLOAT64 -> ((DoubleColumn) column).getDouble(row);
            case BOOLEAN, UTF8, DATE, TIMESTAMP_SECOND, TIMESTAMP_MILLISECOND, TIMESTAMP_MICROSECOND,
                    TIMESTAMP_NANOSECOND -> throw new IllegalStateException(
                    "Column '" + column.getName() + "' is not numeric: " + column.getType());
        };
    }
}
