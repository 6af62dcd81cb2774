package com.leaf.transform.core;

import java.util.List;

/**
 * 时间戳或时长解析失败，携带原始字符串和已尝试的格式列表
 */
public class TimestampParseException extends TransformException {

    private final String rawValue;
    private final List<String> attemptedFormats;

    public TimestampParseException(String rawValue, List<String> attemptedFormats) {
        super(ErrorKind.PARSE_FAILURE, "Unable to parse timestamp: '" + rawValue
                + "'. Supported formats: " + String.join(", ", attemptedFormats));
        this.rawValue = rawValue;
        this.attemptedFormats = List.copyOf(attemptedFormats);
    }

    public TimestampParseException(String rawValue, List<String> attemptedFormats, String message) {
        super(ErrorKind.PARSE_FAILURE, message);
        this.rawValue = rawValue;
        this.attemptedFormats = List.copyOf(attemptedFormats);
    }

    public String getRawValue() { return rawValue; }
    public List<String> getAttemptedFormats() { return attemptedFormats; }
}
