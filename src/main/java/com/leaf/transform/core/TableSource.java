package com.leaf.transform.core;

import com.leaf.transform.model.Batch;

/**
 * 表数据源：按表名物化出完整批次，等价于 {@code SELECT * FROM <table>}，列顺序与表结构一致。
 */
public interface TableSource {

    /**
     * @throws TransformException SOURCE_FAILURE 表不存在或读取失败
     */
    Batch loadTable(String tableName) throws TransformException;

    /**
     * 释放数据源持有的资源
     */
    default void close() {}
}
