package com.leaf.transform.model;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TransformException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchTest {

    private final Batch batch = Batch.of(
            LongColumn.of("id", PhysicalType.INT64, 1L, 2L, 3L),
            StringColumn.of("name", "a", "b", null));

    @Test
    void withColumnReturnsNewBatchAndLeavesOriginalUntouched() throws Exception {
        Batch next = batch.withColumn(DoubleColumn.of("score", 1.0, 2.0, 3.0));

        assertThat(next.columnCount()).isEqualTo(3);
        assertThat(next.getSchema()).extracting(SchemaField::getName).containsExactly("id", "name", "score");
        assertThat(batch.columnCount()).isEqualTo(2);
        assertThat(batch.hasColumn("score")).isFalse();
    }

    @Test
    void duplicateColumnNameIsRejected() {
        assertThatThrownBy(() -> batch.withColumn(StringColumn.of("name", "x", "y", "z")))
                .isInstanceOfSatisfying(TransformException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.DUPLICATE_OUTPUT_NAME));
    }

    @Test
    void columnLengthMustMatchRowCount() {
        assertThatThrownBy(() -> batch.withColumn(LongColumn.of("short", PhysicalType.INT64, 1L)))
                .isInstanceOfSatisfying(TransformException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_CONFIGURATION));
        assertThatThrownBy(() -> Batch.of(LongColumn.of("a", PhysicalType.INT64, 1L), StringColumn.of("b")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lookupByName() throws Exception {
        assertThat(batch.column("name").getObject(1)).isEqualTo("b");
        assertThat(batch.getColumn("missing")).isNull();
        assertThatThrownBy(() -> batch.column("missing"))
                .isInstanceOfSatisfying(TransformException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.COLUMN_NOT_FOUND));
    }

    @Test
    void columnListIsReadOnly() throws Exception {
        List<Column> columns = batch.getColumns();

        assertThatThrownBy(() -> columns.add(StringColumn.of("x", "1", "2", "3")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(batch.rowCount()).isEqualTo(3);
        assertThat(batch.column("name")).isNotNull();
    }

    @Test
    void boxedValuesFollowPhysicalWidth() {
        assertThat(LongColumn.of("i", PhysicalType.INT32, 5L).getObject(0)).isInstanceOf(Integer.class).isEqualTo(5);
        assertThat(LongColumn.of("l", PhysicalType.INT64, 5L).getObject(0)).isInstanceOf(Long.class).isEqualTo(5L);
        assertThat(DoubleColumn.of("f", PhysicalType.FLOAT32, 0.5).getObject(0)).isInstanceOf(Float.class).isEqualTo(0.5f);
        assertThat(DoubleColumn.of("d", 0.5).getObject(0)).isInstanceOf(Double.class).isEqualTo(0.5);
    }
}
