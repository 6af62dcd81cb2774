package com.leaf.transform.storage;

import com.leaf.transform.core.ArtifactNaming;
import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TableSource;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.model.Batch;
import com.leaf.transform.model.Column;
import com.leaf.transform.model.PhysicalType;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.FloatingPointVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowFileReader;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 读取已写出的 Arrow 产物作为表，使产物可以作为后续请求的源表。
 * 表名可带或不带 ".arrow" 后缀；文件中的多个记录批按顺序拼接。
 */
public class ArrowTableSource implements TableSource {

    private static final Logger log = LoggerFactory.getLogger(ArrowTableSource.class);

    private final File artifactDir;

    public ArrowTableSource(String artifactDir) {
        this.artifactDir = new File(artifactDir);
    }

    /**
     * 该表名是否对应目录中已存在的产物
     */
    public boolean hasTable(String tableName) {
        return tableName != null && fileFor(tableName).isFile();
    }

    @Override
    public Batch loadTable(String tableName) throws TransformException {
        File file = fileFor(tableName);
        if (!file.isFile()) {
            throw new TransformException(ErrorKind.SOURCE_FAILURE, "Artifact not found: " + file);
        }

        try (BufferAllocator allocator = new RootAllocator();
             FileInputStream in = new FileInputStream(file);
             ArrowFileReader reader = new ArrowFileReader(in.getChannel(), allocator)) {

            VectorSchemaRoot root = reader.getVectorSchemaRoot();
            List<Field> fields = root.getSchema().getFields();
            List<ColumnAppender> appenders = new ArrayList<>(fields.size());
            for (Field field : fields) {
                appenders.add(new ColumnAppender(field.getName(), toPhysicalType(field)));
            }

            while (reader.loadNextBatch()) {
                for (int c = 0; c < appenders.size(); c++) {
                    readVector(root.getVector(c), appenders.get(c), root.getRowCount());
                }
            }

            List<Column> columns = new ArrayList<>(appenders.size());
            for (ColumnAppender appender : appenders) {
                columns.add(appender.build());
            }
            Batch batch = new Batch(columns);
            log.debug("Loaded artifact '{}': {}", file.getName(), batch);
            return batch;

        } catch (IOException | RuntimeException e) {
            log.error("Failed to read artifact '{}': {}", file, e.getMessage(), e);
            throw new TransformException(ErrorKind.SOURCE_FAILURE,
                    "Failed to read artifact '" + file + "': " + e.getMessage(), e);
        }
    }

    private File fileFor(String tableName) {
        return new File(artifactDir, ArtifactNaming.stripArtifactExtension(tableName) + ArtifactNaming.ARTIFACT_EXTENSION);
    }

    static PhysicalType toPhysicalType(Field field) throws TransformException {
        ArrowType type = field.getType();
        switch (type.getTypeID()) {
            case Int:
                return ((ArrowType.Int) type).getBitWidth() == 64 ? PhysicalType.INT64 : PhysicalType.INT32;
            case FloatingPoint:
                return ((ArrowType.FloatingPoint) type).getPrecision() == FloatingPointPrecision.DOUBLE
                        ? PhysicalType.FLOAT64 : PhysicalType.FLOAT32;
            case Bool:
                return PhysicalType.BOOLEAN;
            case Utf8:
                return PhysicalType.UTF8;
            case Date:
                return PhysicalType.DATE;
            case Timestamp:
                switch (((ArrowType.Timestamp) type).getUnit()) {
                    case SECOND: return PhysicalType.TIMESTAMP_SECOND;
                    case MILLISECOND: return PhysicalType.TIMESTAMP_MILLISECOND;
                    case MICROSECOND: return PhysicalType.TIMESTAMP_MICROSECOND;
                    default: return PhysicalType.TIMESTAMP_NANOSECOND;
                }
            default:
                throw new TransformException(ErrorKind.UNSUPPORTED_TYPE,
                        "Arrow type " + type + " of field '" + field.getName() + "' is not supported");
        }
    }

    private void readVector(FieldVector vector, ColumnAppender appender, int rows) throws TransformException {
        for (int i = 0; i < rows; i++) {
            if (vector.isNull(i)) {
                appender.appendNull();
            } else if (vector instanceof BaseIntVector) {
                appender.appendLong(((BaseIntVector) vector).getValueAsLong(i));
            } else if (vector instanceof FloatingPointVector) {
                appender.appendDouble(((FloatingPointVector) vector).getValueAsDouble(i));
            } else if (vector instanceof BitVector) {
                appender.appendBoolean(((BitVector) vector).get(i) != 0);
            } else if (vector instanceof VarCharVector) {
                appender.appendString(new String(((VarCharVector) vector).get(i), StandardCharsets.UTF_8));
            } else if (vector instanceof DateDayVector) {
                appender.appendLong(((DateDayVector) vector).get(i));
            } else if (vector instanceof TimeStampVector) {
                appender.appendLong(((TimeStampVector) vector).get(i));
            } else {
                throw new TransformException(ErrorKind.UNSUPPORTED_TYPE,
                        "Unsupported vector " + vector.getClass().getSimpleName());
            }
        }
    }
}
