package com.leaf.transform.storage;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TableSource;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.model.Batch;
import com.leaf.transform.model.Column;
import com.leaf.transform.model.PhysicalType;
import com.leaf.transform.time.TimestampParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 基于SQLite的表数据源。
 *
 * 每次加载打开独立连接，读取 {@code SELECT * FROM "<table>"} 的完整结果，
 * 并按列的声明类型映射为物理类型：
 * - SMALLINT / TINYINT / MEDIUMINT → INT32（超出int范围的单元格视为源失败）
 * - INT / INTEGER / BIGINT → INT64
 * - FLOAT → FLOAT32；REAL / DOUBLE → FLOAT64
 * - BOOLEAN / BOOL → BOOLEAN
 * - DATE → DATE（文本按 YYYY-MM-DD 解析，数值视为纪元毫秒）
 * - TIMESTAMP / DATETIME → TIMESTAMP_MILLISECOND（数值视为纪元毫秒，文本按时间戳解析）
 * - 其余 → UTF8
 */
public class SQLiteTableSource implements TableSource {

    private static final Logger log = LoggerFactory.getLogger(SQLiteTableSource.class);

    private static final long MILLIS_PER_DAY = 86_400_000L;

    private final String databasePath;
    private final String jdbcUrl;

    public SQLiteTableSource(String databasePath) {
        this.databasePath = databasePath;
        this.jdbcUrl = "jdbc:sqlite:" + databasePath;
        log.info("SQLiteTableSource initialized. Database: {}", databasePath);
    }

    @Override
    public Batch loadTable(String tableName) throws TransformException {
        if (tableName == null || tableName.isBlank()) {
            throw new TransformException(ErrorKind.SOURCE_FAILURE, "Table name must not be empty");
        }
        if (!new File(databasePath).isFile()) {
            throw new TransformException(ErrorKind.SOURCE_FAILURE, "Database file not found: " + databasePath);
        }

        String sql = "SELECT * FROM \"" + tableName.replace("\"", "\"\"") + "\"";
        try (Connection conn = DriverManager.getConnection(jdbcUrl);
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {

            ResultSetMetaData meta = rs.getMetaData();
            List<ColumnAppender> appenders = new ArrayList<>(meta.getColumnCount());
            for (int c = 1; c <= meta.getColumnCount(); c++) {
                appenders.add(new ColumnAppender(meta.getColumnLabel(c), mapDeclaredType(meta.getColumnTypeName(c))));
            }

            int rows = 0;
            while (rs.next()) {
                for (int c = 0; c < appenders.size(); c++) {
                    appendCell(appenders.get(c), rs.getObject(c + 1), tableName);
                }
                rows++;
            }

            List<Column> columns = new ArrayList<>(appenders.size());
            for (ColumnAppender appender : appenders) {
                columns.add(appender.build());
            }
            log.debug("Loaded {} rows x {} columns from table '{}'", rows, columns.size(), tableName);
            return new Batch(columns);

        } catch (SQLException e) {
            log.error("Failed to load table '{}': {}", tableName, e.getMessage(), e);
            throw new TransformException(ErrorKind.SOURCE_FAILURE,
                    "Failed to load table '" + tableName + "': " + e.getMessage(), e);
        }
    }

    /**
     * 将SQLite声明类型映射为物理类型
     */
    static PhysicalType mapDeclaredType(String declared) {
        String type = declared == null ? "" : declared.trim().toUpperCase(Locale.ROOT);
        int paren = type.indexOf('(');
        if (paren >= 0) {
            type = type.substring(0, paren).trim();
        }
        switch (type) {
            case "SMALLINT":
            case "TINYINT":
            case "MEDIUMINT":
                return PhysicalType.INT32;
            case "INT":
            case "INTEGER":
            case "BIGINT":
                return PhysicalType.INT64;
            case "FLOAT":
                return PhysicalType.FLOAT32;
            case "REAL":
            case "DOUBLE":
            case "DOUBLE PRECISION":
                return PhysicalType.FLOAT64;
            case "BOOLEAN":
            case "BOOL":
                return PhysicalType.BOOLEAN;
            case "DATE":
                return PhysicalType.DATE;
            case "TIMESTAMP":
            case "DATETIME":
                return PhysicalType.TIMESTAMP_MILLISECOND;
            default:
                return PhysicalType.UTF8;
        }
    }

    private void appendCell(ColumnAppender appender, Object value, String tableName) throws TransformException {
        if (value == null) {
            appender.appendNull();
            return;
        }
        try {
            switch (appender.getType()) {
                case INT32:
                    appender.appendLong(value instanceof Number
                            ? Math.toIntExact(((Number) value).longValue()) : Integer.parseInt(value.toString().trim()));
                    break;
                case INT64:
                    appender.appendLong(value instanceof Number
                            ? ((Number) value).longValue() : Long.parseLong(value.toString().trim()));
                    break;
                case FLOAT32:
                case FLOAT64:
                    appender.appendDouble(value instanceof Number
                            ? ((Number) value).doubleValue() : Double.parseDouble(value.toString().trim()));
                    break;
                case BOOLEAN:
                    appender.appendBoolean(toBoolean(value));
                    break;
                case DATE:
                    appender.appendLong(value instanceof Number
                            ? Math.floorDiv(((Number) value).longValue(), MILLIS_PER_DAY)
                            : LocalDate.parse(value.toString().trim()).toEpochDay());
                    break;
                case TIMESTAMP_MILLISECOND:
                    appender.appendLong(value instanceof Number
                            ? ((Number) value).longValue()
                            : TimestampParser.parse(value.toString()) * 1000L);
                    break;
                default:
                    appender.appendString(value.toString());
            }
        } catch (NumberFormatException | ArithmeticException | DateTimeParseException e) {
            throw new TransformException(ErrorKind.SOURCE_FAILURE, "Table '" + tableName + "': value '"
                    + value + "' does not match declared type " + appender.getType(), e);
        }
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue() != 0;
        }
        String s = value.toString().trim();
        return s.equalsIgnoreCase("true") || s.equals("1");
    }
}
