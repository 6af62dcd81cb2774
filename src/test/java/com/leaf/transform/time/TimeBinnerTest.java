package com.leaf.transform.time;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TimestampParseException;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.model.DoubleColumn;
import com.leaf.transform.model.LongColumn;
import com.leaf.transform.model.PhysicalType;
import com.leaf.transform.model.StringColumn;
import com.leaf.transform.model.TimeBinStrategy;
import com.leaf.transform.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TimeBinnerTest {

    private final TimeBinner binner = new TimeBinner();

    private static List<Long> values(LongColumn column) {
        List<Long> out = new ArrayList<>();
        for (int i = 0; i < column.length(); i++) {
            out.add(column.isNull(i) ? null : column.getLong(i));
        }
        return out;
    }

    @Test
    void fixedIntervalOnTimeOfDayStrings() throws Exception {
        StringColumn times = StringColumn.of("t", "00:00:00", "00:00:30", "00:01:00", "00:01:30");

        LongColumn bins = binner.bin(times, TimeBinStrategy.fixedInterval(60), "t_bin");

        assertThat(bins.getName()).isEqualTo("t_bin");
        assertThat(bins.getType()).isEqualTo(PhysicalType.INT64);
        assertThat(values(bins)).containsExactly(0L, 0L, 1L, 1L);
    }

    @Test
    void fixedIntervalBinsAreMonotonicForIncreasingTimestamps() throws Exception {
        Long[] raw = new Long[40];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = 1_700_000_000L + i * 10L;
        }
        LongColumn bins = binner.bin(LongColumn.of("t", PhysicalType.INT64, raw),
                TimeBinStrategy.fixedInterval(45), "bin");

        for (int i = 1; i < bins.length(); i++) {
            long step = bins.getLong(i) - bins.getLong(i - 1);
            assertThat(step).isBetween(0L, 1L);
        }
        assertThat(bins.getLong(0)).isZero();
        // 每箱跨 0,10,20,30,40 共5行
        assertThat(bins.getLong(39)).isEqualTo(7L);
    }

    @Test
    void nullCellsStayNullAndDoNotMoveTheAnchor() throws Exception {
        StringColumn times = StringColumn.of("t", "00:00:00", null, "00:00:59", "00:01:00");

        LongColumn bins = binner.bin(times, TimeBinStrategy.fixedInterval(60), "bin");

        assertThat(values(bins)).containsExactly(0L, null, 0L, 1L);
    }

    @Test
    void thresholdUsesStrictGapSincePreviousRow() throws Exception {
        LongColumn times = LongColumn.of("t", PhysicalType.INT64, 0L, 30L, 90L, 200L, 230L);

        LongColumn bins = binner.bin(times, TimeBinStrategy.thresholdBased(60), "bin");

        assertThat(values(bins)).containsExactly(0L, 0L, 0L, 1L, 1L);
    }

    @Test
    void manualBoundariesCountElapsedTimeFromFirstRow() throws Exception {
        StringColumn times = StringColumn.of("t", "00:10:00", "00:10:30", "00:11:00", "00:12:00", "00:15:00");

        LongColumn bins = binner.bin(times, TimeBinStrategy.manualIntervals(List.of("00:01:00", "30")), "bin");

        assertThat(values(bins)).containsExactly(0L, 1L, 2L, 2L, 2L);
    }

    @Test
    void tableOrderIsPreservedForUnsortedData() throws Exception {
        LongColumn times = LongColumn.of("t", PhysicalType.INT64, 100L, 0L, 200L);

        LongColumn bins = binner.bin(times, TimeBinStrategy.thresholdBased(50), "bin");

        assertThat(values(bins)).containsExactly(0L, 0L, 1L);
    }

    @Test
    void nativeMillisecondTimestamps() throws Exception {
        LongColumn times = LongColumn.of("ts", PhysicalType.TIMESTAMP_MILLISECOND, 0L, 59_999L, 60_000L);

        LongColumn bins = binner.bin(times, TimeBinStrategy.fixedInterval(60), "bin");

        assertThat(values(bins)).containsExactly(0L, 0L, 1L);
    }

    @Test
    void unparseableCellFailsWholeColumn() {
        StringColumn times = StringColumn.of("t", "00:00:00", "not a time");

        assertThatThrownBy(() -> binner.bin(times, TimeBinStrategy.fixedInterval(60), "bin"))
                .isInstanceOfSatisfying(TimestampParseException.class,
                        e -> assertThat(e.getRawValue()).isEqualTo("not a time"));
    }

    @Test
    void emptyColumnIsEmptyInput() {
        assertThatThrownBy(() -> binner.bin(StringColumn.of("t"), TimeBinStrategy.fixedInterval(60), "bin"))
                .isInstanceOfSatisfying(TransformException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.EMPTY_INPUT));
    }

    @Test
    void invalidStrategiesAreRejected() {
        StringColumn times = StringColumn.of("t", "00:00:00");

        assertThatThrownBy(() -> binner.bin(times, TimeBinStrategy.fixedInterval(0), "bin"))
                .isInstanceOfSatisfying(TransformException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_CONFIGURATION));
        assertThatThrownBy(() -> binner.bin(times, TimeBinStrategy.thresholdBased(-1), "bin"))
                .isInstanceOfSatisfying(TransformException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_CONFIGURATION));
        assertThatThrownBy(() -> binner.bin(times, TimeBinStrategy.manualIntervals(List.of()), "bin"))
                .isInstanceOfSatisfying(TransformException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_CONFIGURATION));
    }

    @Test
    void previewSummarisesBinSizes() throws Exception {
        LongColumn times = LongColumn.of("t", PhysicalType.INT64, 0L, 30L, 60L, 90L, 120L);

        TimeBinPreview preview = binner.preview(times, TimeBinStrategy.fixedInterval(60), 2);

        assertThat(preview.getTotalRows()).isEqualTo(5);
        assertThat(preview.getBinCount()).isEqualTo(3);
        assertThat(preview.getMinBinSize()).isEqualTo(1);
        assertThat(preview.getMaxBinSize()).isEqualTo(2);
        assertThat(preview.getAvgBinSize()).isCloseTo(5.0 / 3, within(1e-9));
        assertThat(preview.getSampleBins()).hasSize(2);
        assertThat(preview.getSampleBins().get(0).getKey()).isEqualTo("Bin_0");
        assertThat(preview.getSampleBins().get(0).getValue()).isEqualTo(2);
    }

    @Test
    void previewLabelsFollowStrategy() throws Exception {
        LongColumn times = LongColumn.of("t", PhysicalType.INT64, 0L, 500L);

        assertThat(binner.preview(times, TimeBinStrategy.thresholdBased(10), 10).getSampleBins().get(1).getKey())
                .isEqualTo("Group_1");
        assertThat(binner.preview(times, TimeBinStrategy.manualIntervals(List.of("60")), 10)
                .getSampleBins().get(1).getKey())
                .isEqualTo("Interval_1");
    }

    @Test
    void validationDistinguishesErrorsFromWarnings() {
        ValidationResult allBad = binner.validateTimeColumn(StringColumn.of("t", "x", "y"), 100);
        assertThat(allBad.isValid()).isFalse();
        assertThat(allBad.getErrorKind()).isEqualTo(ErrorKind.PARSE_FAILURE);

        ValidationResult someBad = binner.validateTimeColumn(StringColumn.of("t", "00:00:01", "y", null), 100);
        assertThat(someBad.isValid()).isTrue();
        assertThat(someBad.getWarnings()).hasSize(1);

        ValidationResult floats = binner.validateTimeColumn(DoubleColumn.of("f", 1.0), 100);
        assertThat(floats.getErrorKind()).isEqualTo(ErrorKind.UNSUPPORTED_TYPE);
    }
}
