package com.leaf.transform.storage;

import com.leaf.transform.core.TableSource;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.model.Batch;

/**
 * 已写出的产物优先从产物目录读取，其余表交给数据库数据源
 */
public class RoutingTableSource implements TableSource {

    private final ArrowTableSource artifacts;
    private final TableSource database;

    public RoutingTableSource(ArrowTableSource artifacts, TableSource database) {
        this.artifacts = artifacts;
        this.database = database;
    }

    @Override
    public Batch loadTable(String tableName) throws TransformException {
        return artifacts.hasTable(tableName) ? artifacts.loadTable(tableName) : database.loadTable(tableName);
    }

    @Override
    public void close() {
        artifacts.close();
        database.close();
    }
}
