package com.leaf.transform.time;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TimestampParseException;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.model.Column;
import com.leaf.transform.model.LongColumn;
import com.leaf.transform.model.StringColumn;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 时间戳解析器。
 * 将文本或数值单元格统一换算为"自参考时刻起的秒数"。
 *
 * 文本解析顺序（首个匹配生效）：
 * 1. 整数字面量，视为Unix纪元秒
 * 2. 带偏移的 RFC 3339 / ISO 8601 日期时间
 * 3. 无时区日期时间：YYYY-MM-DD HH:MM:SS[.fraction]、YYYY-MM-DDTHH:MM:SS[.fraction]，按UTC换算
 * 4. 仅时间：HH:MM:SS.fraction、HH:MM:SS、HH:MM，落在固定参考日期上
 *
 * 仅时间的值使用固定参考日期而非"今天"，同一时刻在任何时候解析都得到同一个整数。
 */
public final class TimestampParser {

    /** 仅时间格式所落在的参考日期 */
    public static final LocalDate REFERENCE_DATE = LocalDate.of(1970, 1, 1);

    public static final List<String> SUPPORTED_FORMATS = List.of(
            "Unix timestamp",
            "RFC 3339",
            "YYYY-MM-DD HH:MM:SS[.fraction]",
            "YYYY-MM-DDTHH:MM:SS[.fraction]",
            "HH:MM:SS[.fraction]",
            "HH:MM:SS",
            "HH:MM");

    public static final List<String> DURATION_FORMATS = List.of("HH:MM:SS", "MM:SS", "seconds");

    private static final DateTimeFormatter NAIVE_SPACE = naiveDateTime(' ');
    private static final DateTimeFormatter NAIVE_T = naiveDateTime('T');

    private static final DateTimeFormatter TIME_WITH_FRACTION = new DateTimeFormatterBuilder()
            .appendPattern("H:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter TIME_SECONDS = DateTimeFormatter.ofPattern("H:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter TIME_MINUTES = DateTimeFormatter.ofPattern("H:mm")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private static final long REFERENCE_EPOCH_SECOND =
            REFERENCE_DATE.atStartOfDay().toEpochSecond(ZoneOffset.UTC);

    private TimestampParser() {}

    /**
     * 解析文本时间戳为秒数
     *
     * @throws TimestampParseException 空白输入或无任何格式匹配
     */
    public static long parse(String text) throws TimestampParseException {
        if (text == null || text.isBlank()) {
            throw new TimestampParseException(text == null ? "" : text, SUPPORTED_FORMATS,
                    "Empty timestamp string");
        }
        String value = text.trim();

        // 1. 整数字面量
        if (INTEGER.matcher(value).matches()) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new TimestampParseException(text, SUPPORTED_FORMATS, "Timestamp out of range: '" + text + "'");
            }
        }

        // 2. 带偏移的日期时间，RFC 3339 允许以空格代替T
        Long offset = tryOffsetDateTime(value);
        if (offset != null) return offset;

        // 3. 无时区日期时间
        for (DateTimeFormatter formatter : List.of(NAIVE_SPACE, NAIVE_T)) {
            Long seconds = tryLocalDateTime(value, formatter);
            if (seconds != null) return seconds;
        }

        // 4. 仅时间
        for (DateTimeFormatter formatter : List.of(TIME_WITH_FRACTION, TIME_SECONDS, TIME_MINUTES)) {
            Long seconds = tryLocalTime(value, formatter);
            if (seconds != null) return seconds;
        }

        throw new TimestampParseException(text, SUPPORTED_FORMATS);
    }

    /**
     * 判断文本能否被解析，用于时间列抽样校验
     */
    public static boolean canParse(String text) {
        try {
            parse(text);
            return true;
        } catch (TimestampParseException e) {
            return false;
        }
    }

    /**
     * 读取指定行的时间值（秒）。
     * 原生时间戳列不经过文本解析，按单位换算为秒；日期列按天数×86400；
     * 整数列视为纪元秒；字符串列走文本解析。
     *
     * @return 秒数；该行为空值时返回null
     * @throws TransformException 列类型不能表示时间（UNSUPPORTED_TYPE）或文本无法解析（PARSE_FAILURE）
     */
    public static Long secondsAt(Column column, int row) throws TransformException {
        if (column.isNull(row)) {
            return null;
        }
        return switch (column.getType()) {
            case UTF8 -> parse(((StringColumn) column).getString(row));
            case INT32, INT64 -> ((LongColumn) column).getLong(row);
            case DATE -> ((LongColumn) column).getLong(row) * 86_400L;
            case TIMESTAMP_SECOND, TIMESTAMP_MILLISECOND, TIMESTAMP_MICROSECOND, TIMESTAMP_NANOSECOND ->
                    column.getType().getTimeUnit().toSeconds(((LongColumn) column).getLong(row));
            case FLOAT32, FLOAT64, BOOLEAN -> throw new TransformException(ErrorKind.UNSUPPORTED_TYPE,
                    "Column '" + column.getName() + "' of type " + column.getType()
                            + " cannot be interpreted as a timestamp");
        };
    }

    /**
     * 解析时长字符串：HH:MM:SS、MM:SS 或秒数
     */
    public static long parseDuration(String text) throws TimestampParseException {
        if (text == null || text.isBlank()) {
            throw new TimestampParseException(text == null ? "" : text, DURATION_FORMATS,
                    "Empty duration string");
        }
        String[] parts = text.trim().split(":", -1);
        try {
            switch (parts.length) {
                case 1:
                    return nonNegative(parts[0]);
                case 2:
                    return nonNegative(parts[0]) * 60 + nonNegative(parts[1]);
                case 3:
                    return nonNegative(parts[0]) * 3600 + nonNegative(parts[1]) * 60 + nonNegative(parts[2]);
                default:
                    break;
            }
        } catch (NumberFormatException e) {
            throw new TimestampParseException(text, DURATION_FORMATS,
                    "Invalid duration '" + text + "': " + e.getMessage());
        }
        throw new TimestampParseException(text, DURATION_FORMATS, "Invalid duration format: '" + text + "'");
    }

    /**
     * 秒数渲染为 HH:MM:SS（小时可超过两位）
     */
    public static String formatDuration(long seconds) {
        long abs = Math.abs(seconds);
        String formatted = String.format("%02d:%02d:%02d", abs / 3600, (abs % 3600) / 60, abs % 60);
        return seconds < 0 ? "-" + formatted : formatted;
    }

    private static long nonNegative(String part) {
        long value = Long.parseLong(part.trim());
        if (value < 0) {
            throw new NumberFormatException("negative component " + value);
        }
        return value;
    }

    private static Long tryOffsetDateTime(String value) {
        String candidate = value;
        if (candidate.length() > 10 && candidate.charAt(10) == ' ') {
            candidate = candidate.substring(0, 10) + 'T' + candidate.substring(11);
        }
        try {
            return OffsetDateTime.parse(candidate, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toEpochSecond();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Long tryLocalDateTime(String value, DateTimeFormatter formatter) {
        try {
            return LocalDateTime.parse(value, formatter).toEpochSecond(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Long tryLocalTime(String value, DateTimeFormatter formatter) {
        try {
            return REFERENCE_EPOCH_SECOND + LocalTime.parse(value, formatter).toSecondOfDay();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static DateTimeFormatter naiveDateTime(char separator) {
        return new DateTimeFormatterBuilder()
                .appendPattern("uuuu-MM-dd")
                .appendLiteral(separator)
                .appendPattern("HH:mm:ss")
                .optionalStart()
                .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                .optionalEnd()
                .toFormatter()
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
