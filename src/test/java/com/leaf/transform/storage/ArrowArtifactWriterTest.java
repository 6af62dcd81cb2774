package com.leaf.transform.storage;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.model.Batch;
import com.leaf.transform.model.BooleanColumn;
import com.leaf.transform.model.DoubleColumn;
import com.leaf.transform.model.LongColumn;
import com.leaf.transform.model.PhysicalType;
import com.leaf.transform.model.SchemaField;
import com.leaf.transform.model.StringColumn;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArrowArtifactWriterTest {

    @TempDir
    Path dir;

    private Batch sample() {
        return Batch.of(
                LongColumn.of("small", PhysicalType.INT32, 1L, null, -3L),
                LongColumn.of("big", PhysicalType.INT64, 10_000_000_000L, 2L, null),
                DoubleColumn.of("f32", PhysicalType.FLOAT32, 1.5, null, -0.25),
                DoubleColumn.of("f64", 0.1, 2.0, null),
                BooleanColumn.of("flag", true, null, false),
                StringColumn.of("label", "a", "", null),
                LongColumn.of("day", PhysicalType.DATE, 19723L, null, 0L),
                LongColumn.of("at", PhysicalType.TIMESTAMP_MILLISECOND, 1_700_000_000_000L, 5L, null));
    }

    @Test
    void writtenArtifactReadsBackWithSchemaAndNulls() throws Exception {
        ArrowArtifactWriter writer = new ArrowArtifactWriter(dir.toString());
        Batch original = sample();

        String stem = writer.write(original, "sample.arrow");

        assertThat(stem).isEqualTo("sample");
        assertThat(dir.resolve("sample.arrow")).exists();

        Batch loaded = new ArrowTableSource(dir.toString()).loadTable("sample");
        assertThat(loaded.getSchema()).containsExactlyElementsOf(original.getSchema());
        assertThat(loaded.rowCount()).isEqualTo(3);
        for (SchemaField field : original.getSchema()) {
            for (int row = 0; row < 3; row++) {
                assertThat(loaded.column(field.getName()).getObject(row))
                        .as("%s[%d]", field.getName(), row)
                        .isEqualTo(original.column(field.getName()).getObject(row));
            }
        }
    }

    @Test
    void artifactCanBeAddressedWithExtension() throws Exception {
        new ArrowArtifactWriter(dir.toString()).write(Batch.of(StringColumn.of("s", "x")), "t");
        ArrowTableSource source = new ArrowTableSource(dir.toString());

        assertThat(source.hasTable("t.arrow")).isTrue();
        assertThat(source.loadTable("t.arrow").column("s").getObject(0)).isEqualTo("x");
        assertThat(source.hasTable("other")).isFalse();
    }

    @Test
    void emptyNameIsRejected() {
        ArrowArtifactWriter writer = new ArrowArtifactWriter(dir.toString());

        assertThatThrownBy(() -> writer.write(sample(), " "))
                .isInstanceOfSatisfying(TransformException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.IO_FAILURE));
    }

    @Test
    void missingArtifactIsSourceFailure() {
        assertThatThrownBy(() -> new ArrowTableSource(dir.toString()).loadTable("absent"))
                .isInstanceOfSatisfying(TransformException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.SOURCE_FAILURE));
    }

    @Test
    void int32ValueOutsideIntRangeFailsTheWrite() {
        ArrowArtifactWriter writer = new ArrowArtifactWriter(dir.toString());
        Batch batch = Batch.of(LongColumn.of("small", PhysicalType.INT32, 3_000_000_000L));

        assertThatThrownBy(() -> writer.write(batch, "wide"))
                .isInstanceOfSatisfying(TransformException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.IO_FAILURE));
    }

    @Test
    void corruptArtifactIsSourceFailure() throws Exception {
        Files.write(dir.resolve("bad.arrow"), new byte[16]);

        assertThatThrownBy(() -> new ArrowTableSource(dir.toString()).loadTable("bad"))
                .isInstanceOfSatisfying(TransformException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.SOURCE_FAILURE));
    }
}
