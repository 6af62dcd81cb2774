package com.leaf.transform.model;

import com.leaf.transform.core.ErrorKind;

import java.io.Serializable;

/**
 * 管道运行结果。
 * 成功时tableName为新产物的逻辑表名；失败时为未经修改的源表名，并携带错误类别和消息。
 */
public class PipelineResult implements Serializable {

    private final boolean success;
    private final String tableName;
    private final ErrorKind errorKind;
    private final String message;

    private PipelineResult(boolean success, String tableName, ErrorKind errorKind, String message) {
        this.success = success;
        this.tableName = tableName;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static PipelineResult success(String artifactName) {
        return new PipelineResult(true, artifactName, null, null);
    }

    public static PipelineResult failure(String sourceTable, ErrorKind kind, String message) {
        return new PipelineResult(false, sourceTable, kind, message);
    }

    public boolean isSuccess() { return success; }
    public String getTableName() { return tableName; }
    public ErrorKind getErrorKind() { return errorKind; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return success
                ? "PipelineResult{success, table='" + tableName + "'}"
                : "PipelineResult{failed, table='" + tableName + "', " + errorKind + ": " + message + "}";
    }
}
