package com.leaf.transform.operators;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.model.Batch;
import com.leaf.transform.model.ComputationType;
import com.leaf.transform.model.ComputedColumnConfig;
import com.leaf.transform.model.LongColumn;
import com.leaf.transform.model.NullHandling;
import com.leaf.transform.model.PhysicalType;
import com.leaf.transform.model.StringColumn;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ComputedColumnTransformationTest {

    private final ComputedColumnTransformation transformation = new ComputedColumnTransformation();

    private final Batch batch = Batch.of(
            LongColumn.of("revenue", PhysicalType.INT64, 100L, 200L, 300L),
            LongColumn.of("units", PhysicalType.INT32, 10L, 0L, 20L),
            StringColumn.of("region", "n", "s", "e"));

    @Test
    void validRatioPasses() {
        assertThat(transformation.validate(ComputedColumnConfig.ratio("revenue", "units", "price"), batch).isValid())
                .isTrue();
    }

    @Test
    void ratioNeedsNumericSecondColumn() {
        assertThat(transformation.validate(
                new ComputedColumnConfig(ComputationType.RATIO, "revenue", "r"), batch).getErrorKind())
                .isEqualTo(ErrorKind.INVALID_CONFIGURATION);
        assertThat(transformation.validate(ComputedColumnConfig.ratio("revenue", "region", "r"), batch).getErrorKind())
                .isEqualTo(ErrorKind.UNSUPPORTED_TYPE);
        assertThat(transformation.validate(ComputedColumnConfig.ratio("revenue", "nope", "r"), batch).getErrorKind())
                .isEqualTo(ErrorKind.COLUMN_NOT_FOUND);
    }

    @Test
    void windowMustBePositive() {
        assertThat(transformation.validate(
                ComputedColumnConfig.movingAverage("revenue", 0, NullHandling.SKIP_NULLS, "ma"), batch).getErrorKind())
                .isEqualTo(ErrorKind.INVALID_CONFIGURATION);
    }

    @Test
    void textSourceIsUnsupported() {
        assertThat(transformation.validate(
                new ComputedColumnConfig(ComputationType.PERCENTAGE, "region", "pct"), batch).getErrorKind())
                .isEqualTo(ErrorKind.UNSUPPORTED_TYPE);
    }

    @Test
    void applyAppendsComputedColumn() throws Exception {
        Batch out = transformation.apply(batch, ComputedColumnConfig.ratio("revenue", "units", "price"));

        assertThat(out.column("price").getObject(0)).isEqualTo(10.0);
        assertThat(out.column("price").isNull(1)).isTrue();
        assertThat(batch.hasColumn("price")).isFalse();
    }
}
