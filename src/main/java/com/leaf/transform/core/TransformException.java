package com.leaf.transform.core;

/**
 * 变换引擎内部抛出的受检异常，携带错误类别。
 * 由管道统一捕获并转换为 {@link com.leaf.transform.model.PipelineResult}，不会逃逸到调用层。
 */
public class TransformException extends Exception {

    private final ErrorKind kind;

    public TransformException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TransformException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() { return kind; }

    public static TransformException columnNotFound(String column) {
        return new TransformException(ErrorKind.COLUMN_NOT_FOUND, "Column '" + column + "' not found");
    }

    public static TransformException emptyInput(String what) {
        return new TransformException(ErrorKind.EMPTY_INPUT,
                "Cannot compute " + what + " over an empty input");
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
