package com.leaf.transform.model;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TransformException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存列存批次：固定行数、有序且同名唯一的若干列。
 *
 * 批次不可变。每个变换步骤读取输入批次，通过 {@link #withColumn(Column)}
 * 得到追加了新列的新批次，原批次保持不变，因此步骤之间不存在别名共享。
 */
public class Batch {

    private final List<Column> columns;
    private final Map<String, Integer> columnIndex;
    private final int rowCount;

    public Batch(List<Column> columns) {
        List<Column> copy = new ArrayList<>(columns);
        Map<String, Integer> index = new HashMap<>();
        int rows = copy.isEmpty() ? 0 : copy.get(0).length();

        for (int i = 0; i < copy.size(); i++) {
            Column column = copy.get(i);
            if (column.length() != rows) {
                throw new IllegalArgumentException("Column '" + column.getName() + "' has "
                        + column.length() + " rows, expected " + rows);
            }
            if (index.putIfAbsent(column.getName(), i) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + column.getName());
            }
        }

        this.columns = Collections.unmodifiableList(copy);
        this.columnIndex = index;
        this.rowCount = rows;
    }

    public static Batch of(Column... columns) {
        return new Batch(List.of(columns));
    }

    public int rowCount() { return rowCount; }
    public int columnCount() { return columns.size(); }
    public boolean isEmpty() { return rowCount == 0; }

    public List<Column> getColumns() { return columns; }

    public List<SchemaField> getSchema() {
        List<SchemaField> schema = new ArrayList<>(columns.size());
        for (Column column : columns) {
            schema.add(new SchemaField(column.getName(), column.getType()));
        }
        return schema;
    }

    public boolean hasColumn(String name) {
        return columnIndex.containsKey(name);
    }

    /**
     * 按名称取列
     *
     * @return 列；不存在返回null
     */
    public Column getColumn(String name) {
        Integer idx = (name != null) ? columnIndex.get(name) : null;
        return idx == null ? null : columns.get(idx);
    }

    /**
     * 按名称取列
     *
     * @throws TransformException COLUMN_NOT_FOUND
     */
    public Column column(String name) throws TransformException {
        Integer idx = (name != null) ? columnIndex.get(name) : null;
        if (idx == null) {
            throw TransformException.columnNotFound(name);
        }
        return columns.get(idx);
    }

    /**
     * 返回末尾追加了指定列的新批次。
     *
     * @throws TransformException DUPLICATE_OUTPUT_NAME 列名已存在；
     *                            INVALID_CONFIGURATION 行数不一致
     */
    public Batch withColumn(Column column) throws TransformException {
        if (hasColumn(column.getName())) {
            throw new TransformException(ErrorKind.DUPLICATE_OUTPUT_NAME,
                    "Output column '" + column.getName() + "' already exists");
        }
        if (!columns.isEmpty() && column.length() != rowCount) {
            throw new TransformException(ErrorKind.INVALID_CONFIGURATION,
                    "Column '" + column.getName() + "' has " + column.length()
                            + " rows, batch has " + rowCount);
        }
        List<Column> next = new ArrayList<>(columns);
        next.add(column);
        return new Batch(next);
    }

    @Override
    public String toString() {
        return "Batch{rows=" + rowCount + ", schema=" + getSchema() + "}";
    }
}
