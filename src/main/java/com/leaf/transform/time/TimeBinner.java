package com.leaf.transform.time;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.model.Column;
import com.leaf.transform.model.LongColumn;
import com.leaf.transform.model.PhysicalType;
import com.leaf.transform.model.StringColumn;
import com.leaf.transform.model.TimeBinStrategy;
import com.leaf.transform.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 时间分箱器。
 * 按表中原有顺序逐行扫描，为每行分配箱编号，不按时间排序。
 * 数据非单调时分箱仍有确定结果，只是不一定对应时间上的区间。
 *
 * 空值行输出空值且不参与间隔判断；任一非空单元格无法解析时整列失败。
 */
public class TimeBinner {

    private static final Logger log = LoggerFactory.getLogger(TimeBinner.class);

    /**
     * 为整列分配箱编号
     *
     * @param column     时间列
     * @param strategy   分箱策略
     * @param outputName 输出列名
     * @return 与输入等长的INT64列
     */
    public LongColumn bin(Column column, TimeBinStrategy strategy, String outputName) throws TransformException {
        Long[] seconds = readSeconds(column);
        long[] bins = new long[seconds.length];

        switch (strategy.getType()) {
            case FIXED_INTERVAL:
                requirePositive(strategy.getIntervalSeconds(), "interval");
                assignFixedIntervalBins(seconds, strategy.getIntervalSeconds(), bins);
                break;
            case THRESHOLD_BASED:
                if (strategy.getThresholdSeconds() < 0) {
                    throw new TransformException(ErrorKind.INVALID_CONFIGURATION,
                            "Threshold must not be negative: " + strategy.getThresholdSeconds());
                }
                assignThresholdBins(seconds, strategy.getThresholdSeconds(), bins);
                break;
            case MANUAL_INTERVALS:
                assignManualBins(seconds, parseBoundaries(strategy.getBoundaries()), bins);
                break;
            default:
                throw new TransformException(ErrorKind.INVALID_CONFIGURATION,
                        "Unknown time bin strategy: " + strategy.getType());
        }

        LongColumn.Builder builder = new LongColumn.Builder(outputName, PhysicalType.INT64, seconds.length);
        for (int i = 0; i < seconds.length; i++) {
            if (seconds[i] == null) {
                builder.appendNull();
            } else {
                builder.append(bins[i]);
            }
        }
        LongColumn result = builder.build();
        log.debug("Binned column '{}' with {}: {} rows", column.getName(), strategy, seconds.length);
        return result;
    }

    /**
     * 生成分箱预览
     *
     * @param sampleLimit 样例中最多列出的箱数
     */
    public TimeBinPreview preview(Column column, TimeBinStrategy strategy, int sampleLimit) throws TransformException {
        LongColumn bins = bin(column, strategy, column.getName() + "_preview");

        Map<Long, Integer> counts = new LinkedHashMap<>();
        for (int i = 0; i < bins.length(); i++) {
            if (!bins.isNull(i)) {
                counts.merge(bins.getLong(i), 1, Integer::sum);
            }
        }

        int min = counts.values().stream().mapToInt(Integer::intValue).min().orElse(0);
        int max = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        double avg = counts.isEmpty() ? 0.0
                : counts.values().stream().mapToInt(Integer::intValue).sum() / (double) counts.size();

        List<Map.Entry<String, Integer>> samples = new ArrayList<>();
        for (Map.Entry<Long, Integer> entry : counts.entrySet()) {
            if (samples.size() >= sampleLimit) break;
            samples.add(new AbstractMap.SimpleImmutableEntry<>(
                    binLabel(strategy.getType(), entry.getKey()), entry.getValue()));
        }

        return new TimeBinPreview(column.length(), counts.size(), min, max, avg, samples);
    }

    /**
     * 抽样检查时间列是否可解析。
     * 前sampleSize个非空单元格全部无法解析为错误，部分无法解析为警告。
     */
    public ValidationResult validateTimeColumn(Column column, int sampleSize) {
        ValidationResult result = new ValidationResult();
        if (column.length() == 0) {
            return result.addError(ErrorKind.EMPTY_INPUT, "Column '" + column.getName() + "' has no rows");
        }

        int sampled = 0;
        int failed = 0;
        String firstFailure = null;
        for (int i = 0; i < column.length() && sampled < sampleSize; i++) {
            if (column.isNull(i)) continue;
            sampled++;
            try {
                TimestampParser.secondsAt(column, i);
            } catch (TransformException e) {
                if (e.getKind() == ErrorKind.UNSUPPORTED_TYPE) {
                    return result.addError(ErrorKind.UNSUPPORTED_TYPE, e.getMessage());
                }
                failed++;
                if (firstFailure == null && column instanceof StringColumn) {
                    firstFailure = ((StringColumn) column).getString(i);
                }
            }
        }

        if (sampled == 0) {
            result.addError(ErrorKind.PARSE_FAILURE, "Column '" + column.getName() + "' contains only empty values");
        } else if (failed == sampled) {
            result.addError(ErrorKind.PARSE_FAILURE, "Column '" + column.getName()
                    + "' does not appear to contain valid timestamp data (e.g. '" + firstFailure + "')");
        } else if (failed > 0) {
            result.addWarning(failed + " of " + sampled + " sampled values in column '" + column.getName()
                    + "' could not be parsed (e.g. '" + firstFailure + "')");
        }
        return result;
    }

    private Long[] readSeconds(Column column) throws TransformException {
        if (column.length() == 0) {
            throw TransformException.emptyInput("time bins for column '" + column.getName() + "'");
        }
        Long[] seconds = new Long[column.length()];
        for (int i = 0; i < seconds.length; i++) {
            seconds[i] = TimestampParser.secondsAt(column, i);
        }
        return seconds;
    }

    /**
     * 固定间隔：从当前箱第一行起累计的时间达到间隔时开新箱，新行成为新箱的起点。
     * 箱边界随数据漂移，不与整点对齐。
     */
    private void assignFixedIntervalBins(Long[] seconds, long interval, long[] bins) {
        long currentBin = 0;
        Long binStart = null;
        for (int i = 0; i < seconds.length; i++) {
            Long t = seconds[i];
            if (t == null) continue;
            if (binStart == null) {
                binStart = t;
            } else if (t - binStart >= interval) {
                currentBin++;
                binStart = t;
            }
            bins[i] = currentBin;
        }
    }

    /**
     * 阈值：与上一非空行的间隔严格大于阈值时开新箱
     */
    private void assignThresholdBins(Long[] seconds, long threshold, long[] bins) {
        long currentBin = 0;
        Long last = null;
        for (int i = 0; i < seconds.length; i++) {
            Long t = seconds[i];
            if (t == null) continue;
            if (last != null && t - last > threshold) {
                currentBin++;
            }
            bins[i] = currentBin;
            last = t;
        }
    }

    /**
     * 箱编号 = 不超过 (t - 首个非空时间) 的边界个数
     */
    private void assignManualBins(Long[] seconds, long[] boundaries, long[] bins) {
        Long origin = null;
        for (int i = 0; i < seconds.length; i++) {
            Long t = seconds[i];
            if (t == null) continue;
            if (origin == null) {
                origin = t;
            }
            long elapsed = t - origin;
            int bin = 0;
            while (bin < boundaries.length && boundaries[bin] <= elapsed) {
                bin++;
            }
            bins[i] = bin;
        }
    }

    private long[] parseBoundaries(List<String> boundaries) throws TransformException {
        if (boundaries == null || boundaries.isEmpty()) {
            throw new TransformException(ErrorKind.INVALID_CONFIGURATION,
                    "Manual intervals require at least one boundary");
        }
        long[] parsed = new long[boundaries.size()];
        for (int i = 0; i < parsed.length; i++) {
            parsed[i] = TimestampParser.parseDuration(boundaries.get(i));
        }
        Arrays.sort(parsed);
        return parsed;
    }

    private void requirePositive(long value, String what) throws TransformException {
        if (value <= 0) {
            throw new TransformException(ErrorKind.INVALID_CONFIGURATION,
                    "The " + what + " must be positive: " + value);
        }
    }

    private String binLabel(TimeBinStrategy.StrategyType type, long bin) {
        switch (type) {
            case FIXED_INTERVAL: return "Bin_" + bin;
            case MANUAL_INTERVALS: return "Interval_" + bin;
            default: return "Group_" + bin;
        }
    }
}
