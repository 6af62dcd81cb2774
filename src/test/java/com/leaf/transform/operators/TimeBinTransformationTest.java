package com.leaf.transform.operators;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.model.Batch;
import com.leaf.transform.model.ComputationType;
import com.leaf.transform.model.ComputedColumnConfig;
import com.leaf.transform.model.DoubleColumn;
import com.leaf.transform.model.LongColumn;
import com.leaf.transform.model.StringColumn;
import com.leaf.transform.model.TimeBinConfig;
import com.leaf.transform.model.TimeBinStrategy;
import com.leaf.transform.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TimeBinTransformationTest {

    private final TimeBinTransformation transformation = new TimeBinTransformation();

    private final Batch batch = Batch.of(
            StringColumn.of("ts", "2024-01-01 10:00:00", "2024-01-01 10:00:05", "2024-01-01 10:01:00"),
            StringColumn.of("mixed", "10:00:00", "not a time", "10:02:00"),
            DoubleColumn.of("reading", 1.0, 2.0, 3.0));

    private static TimeBinConfig config(String column, TimeBinStrategy strategy, String output) {
        return new TimeBinConfig("events", column, strategy, output);
    }

    @Test
    void validConfigurationPasses() {
        ValidationResult result = transformation.validate(
                config("ts", TimeBinStrategy.fixedInterval(60), "ts_bin"), batch);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void partiallyParseableColumnOnlyWarns() {
        ValidationResult result = transformation.validate(
                config("mixed", TimeBinStrategy.thresholdBased(30), "mixed_bin"), batch);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).hasSize(1);
        assertThat(result.getWarnings().get(0)).contains("1 of 3");
    }

    @Test
    void floatColumnIsUnsupported() {
        ValidationResult result = transformation.validate(
                config("reading", TimeBinStrategy.fixedInterval(60), "reading_bin"), batch);

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.UNSUPPORTED_TYPE);
    }

    @Test
    void invalidStrategiesAreRejected() {
        assertThat(transformation.validate(config("ts", TimeBinStrategy.fixedInterval(0), "b"), batch).getErrorKind())
                .isEqualTo(ErrorKind.INVALID_CONFIGURATION);
        assertThat(transformation.validate(config("ts", TimeBinStrategy.thresholdBased(-1), "b"), batch).getErrorKind())
                .isEqualTo(ErrorKind.INVALID_CONFIGURATION);
        assertThat(transformation.validate(config("ts", TimeBinStrategy.manualIntervals(List.of()), "b"), batch)
                .getErrorKind()).isEqualTo(ErrorKind.INVALID_CONFIGURATION);
        assertThat(transformation.validate(config("ts", null, "b"), batch).getErrorKind())
                .isEqualTo(ErrorKind.INVALID_CONFIGURATION);
    }

    @Test
    void missingColumnAndTakenOutputName() {
        assertThat(transformation.validate(config("nope", TimeBinStrategy.fixedInterval(60), "b"), batch)
                .getErrorKind()).isEqualTo(ErrorKind.COLUMN_NOT_FOUND);
        assertThat(transformation.validate(config("ts", TimeBinStrategy.fixedInterval(60), "reading"), batch)
                .getErrorKind()).isEqualTo(ErrorKind.DUPLICATE_OUTPUT_NAME);
    }

    @Test
    void foreignConfigIsRejected() {
        ValidationResult result = transformation.validate(
                new ComputedColumnConfig(ComputationType.DELTA, "reading", "d"), batch);

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.INVALID_CONFIGURATION);
    }

    @Test
    void applyAppendsBinColumn() throws Exception {
        Batch out = transformation.apply(batch, config("ts", TimeBinStrategy.thresholdBased(10), "ts_bin"));

        LongColumn bins = (LongColumn) out.column("ts_bin");
        assertThat(out.columnCount()).isEqualTo(4);
        assertThat(List.of(bins.getLong(0), bins.getLong(1), bins.getLong(2))).containsExactly(0L, 0L, 1L);
    }
}
