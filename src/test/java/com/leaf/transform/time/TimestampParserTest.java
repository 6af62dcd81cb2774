package com.leaf.transform.time;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TimestampParseException;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.model.DoubleColumn;
import com.leaf.transform.model.LongColumn;
import com.leaf.transform.model.PhysicalType;
import com.leaf.transform.model.StringColumn;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimestampParserTest {

    private static final long JAN_15_1030 = LocalDateTime.of(2024, 1, 15, 10, 30).toEpochSecond(ZoneOffset.UTC);

    @Test
    void integerLiteralIsEpochSeconds() throws Exception {
        assertThat(TimestampParser.parse("1700000000")).isEqualTo(1_700_000_000L);
        assertThat(TimestampParser.parse("  42 ")).isEqualTo(42L);
    }

    @Test
    void offsetDateTimes() throws Exception {
        assertThat(TimestampParser.parse("2024-01-15T10:30:00Z")).isEqualTo(JAN_15_1030);
        assertThat(TimestampParser.parse("2024-01-15T10:30:00+02:00")).isEqualTo(JAN_15_1030 - 7200);
        assertThat(TimestampParser.parse("2024-01-15 10:30:00+02:00")).isEqualTo(JAN_15_1030 - 7200);
    }

    @Test
    void naiveDateTimesAreUtc() throws Exception {
        assertThat(TimestampParser.parse("2024-01-15 10:30:00")).isEqualTo(JAN_15_1030);
        assertThat(TimestampParser.parse("2024-01-15T10:30:00")).isEqualTo(JAN_15_1030);
        assertThat(TimestampParser.parse("2024-01-15 10:30:00.750")).isEqualTo(JAN_15_1030);
    }

    @Test
    void timeOnlyValuesUseFixedReferenceDate() throws Exception {
        assertThat(TimestampParser.parse("10:30:00")).isEqualTo(37_800L);
        assertThat(TimestampParser.parse("10:30")).isEqualTo(37_800L);
        assertThat(TimestampParser.parse("10:30:00.5")).isEqualTo(37_800L);
        assertThat(TimestampParser.parse("9:05:00")).isEqualTo(32_700L);
        assertThat(TimestampParser.parse("00:00:00")).isZero();
    }

    @Test
    void blankInputFails() {
        assertThatThrownBy(() -> TimestampParser.parse("   "))
                .isInstanceOf(TimestampParseException.class)
                .satisfies(e -> assertThat(((TransformException) e).getKind()).isEqualTo(ErrorKind.PARSE_FAILURE));
    }

    @Test
    void unmatchedInputCarriesRawValueAndFormats() {
        assertThatThrownBy(() -> TimestampParser.parse("yesterday"))
                .isInstanceOfSatisfying(TimestampParseException.class, e -> {
                    assertThat(e.getRawValue()).isEqualTo("yesterday");
                    assertThat(e.getAttemptedFormats()).containsExactlyElementsOf(TimestampParser.SUPPORTED_FORMATS);
                });
        assertThat(TimestampParser.canParse("yesterday")).isFalse();
        assertThat(TimestampParser.canParse("12:00")).isTrue();
    }

    @Test
    void nativeColumnsBypassTextParsing() throws Exception {
        LongColumn days = LongColumn.of("d", PhysicalType.DATE, 1L, null);
        assertThat(TimestampParser.secondsAt(days, 0)).isEqualTo(86_400L);
        assertThat(TimestampParser.secondsAt(days, 1)).isNull();

        LongColumn millis = LongColumn.of("ts", PhysicalType.TIMESTAMP_MILLISECOND, 1_500L, -1_500L);
        assertThat(TimestampParser.secondsAt(millis, 0)).isEqualTo(1L);
        assertThat(TimestampParser.secondsAt(millis, 1)).isEqualTo(-2L);

        LongColumn nanos = LongColumn.of("ts", PhysicalType.TIMESTAMP_NANOSECOND, 3_000_000_001L);
        assertThat(TimestampParser.secondsAt(nanos, 0)).isEqualTo(3L);

        assertThat(TimestampParser.secondsAt(StringColumn.of("s", "00:01:00"), 0)).isEqualTo(60L);
    }

    @Test
    void floatColumnsAreNotTimestamps() {
        DoubleColumn column = DoubleColumn.of("f", 1.5);
        assertThatThrownBy(() -> TimestampParser.secondsAt(column, 0))
                .isInstanceOfSatisfying(TransformException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNSUPPORTED_TYPE));
    }

    @Test
    void durations() throws Exception {
        assertThat(TimestampParser.parseDuration("01:30:00")).isEqualTo(5_400L);
        assertThat(TimestampParser.parseDuration("05:30")).isEqualTo(330L);
        assertThat(TimestampParser.parseDuration("90")).isEqualTo(90L);
        assertThat(TimestampParser.formatDuration(3_725L)).isEqualTo("01:02:05");
    }

    @Test
    void malformedDurationsFail() {
        assertThatThrownBy(() -> TimestampParser.parseDuration("1:2:3:4")).isInstanceOf(TimestampParseException.class);
        assertThatThrownBy(() -> TimestampParser.parseDuration("-5")).isInstanceOf(TimestampParseException.class);
        assertThatThrownBy(() -> TimestampParser.parseDuration("a:b")).isInstanceOf(TimestampParseException.class);
        assertThatThrownBy(() -> TimestampParser.parseDuration("")).isInstanceOf(TimestampParseException.class);
    }
}
