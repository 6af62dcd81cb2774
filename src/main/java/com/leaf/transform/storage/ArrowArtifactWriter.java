package com.leaf.transform.storage;

import com.leaf.transform.core.ArtifactNaming;
import com.leaf.transform.core.ArtifactWriter;
import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.model.Batch;
import com.leaf.transform.model.BooleanColumn;
import com.leaf.transform.model.Column;
import com.leaf.transform.model.DoubleColumn;
import com.leaf.transform.model.LongColumn;
import com.leaf.transform.model.PhysicalType;
import com.leaf.transform.model.StringColumn;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowFileWriter;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 以 Arrow IPC 文件格式写出产物：{@code <输出目录>/<name>.arrow}。
 * 文件自带 schema，列顺序与批次一致，空值写入有效性位图。
 */
public class ArrowArtifactWriter implements ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArrowArtifactWriter.class);

    private final File outputDir;

    public ArrowArtifactWriter(String outputDir) {
        this.outputDir = new File(outputDir);
        if (!this.outputDir.exists() && !this.outputDir.mkdirs()) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir);
        }
        log.info("ArrowArtifactWriter initialized. Output: {}", this.outputDir.getAbsolutePath());
    }

    public File getOutputDir() { return outputDir; }

    /**
     * 产物名对应的文件
     */
    public File artifactFile(String name) {
        return new File(outputDir, ArtifactNaming.stripArtifactExtension(name) + ArtifactNaming.ARTIFACT_EXTENSION);
    }

    @Override
    public String write(Batch batch, String name) throws TransformException {
        if (name == null || name.isBlank()) {
            throw new TransformException(ErrorKind.IO_FAILURE, "Artifact name must not be empty");
        }
        String stem = ArtifactNaming.stripArtifactExtension(name);
        File file = artifactFile(stem);

        try (BufferAllocator allocator = new RootAllocator();
             VectorSchemaRoot root = VectorSchemaRoot.create(toArrowSchema(batch), allocator);
             FileOutputStream out = new FileOutputStream(file);
             ArrowFileWriter writer = new ArrowFileWriter(root, null, out.getChannel())) {

            root.allocateNew();
            List<Column> columns = batch.getColumns();
            for (int c = 0; c < columns.size(); c++) {
                fillVector(root.getVector(c), columns.get(c));
            }
            root.setRowCount(batch.rowCount());

            writer.start();
            writer.writeBatch();
            writer.end();
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write artifact '{}': {}", file, e.getMessage(), e);
            throw new TransformException(ErrorKind.IO_FAILURE,
                    "Failed to write artifact '" + file + "': " + e.getMessage(), e);
        }

        log.info("Artifact '{}' written: {} rows x {} columns", file.getName(), batch.rowCount(), batch.columnCount());
        return stem;
    }

    static Schema toArrowSchema(Batch batch) {
        List<Field> fields = new ArrayList<>(batch.columnCount());
        for (Column column : batch.getColumns()) {
            fields.add(Field.nullable(column.getName(), toArrowType(column.getType())));
        }
        return new Schema(fields);
    }

    static ArrowType toArrowType(PhysicalType type) {
        return switch (type) {
            case INT32 -> new ArrowType.Int(32, true);
            case INT64 -> new ArrowType.Int(64, true);
            case FLOAT32 -> new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
            case FLOAT64 -> new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
            case BOOLEAN -> ArrowType.Bool.INSTANCE;
            case UTF8 -> ArrowType.Utf8.INSTANCE;
            case DATE -> new ArrowType.Date(DateUnit.DAY);
            case TIMESTAMP_SECOND -> new ArrowType.Timestamp(org.apache.arrow.vector.types.TimeUnit.SECOND, null);
            case TIMESTAMP_MILLISECOND ->
                    new ArrowType.Timestamp(org.apache.arrow.vector.types.TimeUnit.MILLISECOND, null);
            case TIMESTAMP_MICROSECOND ->
                    new ArrowType.Timestamp(org.apache.arrow.vector.types.TimeUnit.MICROSECOND, null);
            case TIMESTAMP_NANOSECOND ->
                    new ArrowType.Timestamp(org.apache.arrow.vector.types.TimeUnit.NANOSECOND, null);
        };
    }

    private void fillVector(FieldVector vector, Column column) {
        int n = column.length();
        for (int i = 0; i < n; i++) {
            // allocateNew 后有效性位图全为0，空值行不写即为null
            if (column.isNull(i)) {
                continue;
            }
            switch (column.getType()) {
                case INT32:
                    ((IntVector) vector).setSafe(i, Math.toIntExact(((LongColumn) column).getLong(i)));
                    break;
                case INT64:
                    ((BigIntVector) vector).setSafe(i, ((LongColumn) column).getLong(i));
                    break;
                case FLOAT32:
                    ((Float4Vector) vector).setSafe(i, (float) ((DoubleColumn) column).getDouble(i));
                    break;
                case FLOAT64:
                    ((Float8Vector) vector).setSafe(i, ((DoubleColumn) column).getDouble(i));
                    break;
                case BOOLEAN:
                    ((BitVector) vector).setSafe(i, ((BooleanColumn) column).getBoolean(i) ? 1 : 0);
                    break;
                case UTF8:
                    ((VarCharVector) vector).setSafe(i,
                            ((StringColumn) column).getString(i).getBytes(StandardCharsets.UTF_8));
                    break;
                case DATE:
                    ((DateDayVector) vector).setSafe(i, Math.toIntExact(((LongColumn) column).getLong(i)));
                    break;
                case TIMESTAMP_SECOND:
                case TIMESTAMP_MILLISECOND:
                case TIMESTAMP_MICROSECOND:
                case TIMESTAMP_NANOSECOND:
                    ((TimeStampVector) vector).setSafe(i, ((LongColumn) column).getLong(i));
                    break;
                default:
                    throw new IllegalStateException("Unhandled type: " + column.getType());
            }
        }
        vector.setValueCount(n);
    }
}
