package com.leaf.transform.grouping;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.model.BooleanColumn;
import com.leaf.transform.model.DoubleColumn;
import com.leaf.transform.model.LongColumn;
import com.leaf.transform.model.PhysicalType;
import com.leaf.transform.model.StringColumn;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueFormatterTest {

    @Test
    void nullRendersAsEmptyString() throws Exception {
        assertThat(ValueFormatter.format(StringColumn.of("s", (String) null), 0)).isEmpty();
        assertThat(ValueFormatter.format(LongColumn.of("i", PhysicalType.INT64, (Long) null), 0)).isEmpty();
    }

    @Test
    void integersAndBooleans() throws Exception {
        assertThat(ValueFormatter.format(LongColumn.of("i", PhysicalType.INT32, -7L), 0)).isEqualTo("-7");
        assertThat(ValueFormatter.format(LongColumn.of("i", PhysicalType.INT64, 42L), 0)).isEqualTo("42");
        assertThat(ValueFormatter.format(BooleanColumn.of("b", true, false), 1)).isEqualTo("false");
    }

    @Test
    void floatsUseShortestDecimal() throws Exception {
        DoubleColumn doubles = DoubleColumn.of("f", 1.0, 2.5, 1e20, Double.NaN, 0.1);
        assertThat(ValueFormatter.format(doubles, 0)).isEqualTo("1");
        assertThat(ValueFormatter.format(doubles, 1)).isEqualTo("2.5");
        assertThat(ValueFormatter.format(doubles, 2)).isEqualTo("100000000000000000000");
        assertThat(ValueFormatter.format(doubles, 3)).isEqualTo("NaN");
        assertThat(ValueFormatter.format(doubles, 4)).isEqualTo("0.1");

        DoubleColumn floats = DoubleColumn.of("f", PhysicalType.FLOAT32, 0.1, 3.0);
        assertThat(ValueFormatter.format(floats, 0)).isEqualTo("0.1");
        assertThat(ValueFormatter.format(floats, 1)).isEqualTo("3");
    }

    @Test
    void datesAndTimestamps() throws Exception {
        long day = LocalDate.of(2024, 1, 15).toEpochDay();
        assertThat(ValueFormatter.format(LongColumn.of("d", PhysicalType.DATE, day), 0)).isEqualTo("2024-01-15");

        assertThat(ValueFormatter.format(LongColumn.of("t", PhysicalType.TIMESTAMP_SECOND, 37_800L), 0))
                .isEqualTo("10:30:00");
        assertThat(ValueFormatter.format(LongColumn.of("t", PhysicalType.TIMESTAMP_MILLISECOND, 37_800_250L), 0))
                .isEqualTo("10:30:00.250");
        assertThat(ValueFormatter.format(LongColumn.of("t", PhysicalType.TIMESTAMP_NANOSECOND, 37_800_000_000_000L), 0))
                .isEqualTo("10:30:00.000");
    }

    @Test
    void outOfRangeDateIsUnsupported() {
        LongColumn dates = LongColumn.of("d", PhysicalType.DATE, Long.MAX_VALUE);

        assertThatThrownBy(() -> ValueFormatter.format(dates, 0))
                .isInstanceOfSatisfying(TransformException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNSUPPORTED_TYPE));
    }
}
