package io.papertrail.parquet;

import io.papertrail.Fixtures;
import io.papertrail.config.ColumnType;
import io.papertrail.config.SchemaField;
import io.papertrail.core.Record;
import io.papertrail.error.SourceUnreadableException;
import io.papertrail.sink.ParquetBatchSink;
import io.papertrail.source.ParquetRowSource;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ParquetRowSourceTest {
    private static final List<SchemaField> SCHEMA = List.of(
            new SchemaField("bonica.rid", ColumnType.STRING),
            new SchemaField("cycle", ColumnType.INTEGER),
            new SchemaField("amount", ColumnType.FLOAT),
            new SchemaField("cycles", ColumnType.INTEGER_LIST));

    private static Path write(Path dir, int n) throws Exception {
        Path out = dir.resolve("rows.parquet");
        List<Record<Object[]>> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Object amount = i % 10 == 0 ? null : i * 1.5;
            rows.add(new Record<>(i, i + 1, new Object[]{"cand" + i, (long) (1980 + i % 40), amount, Arrays.asList(1980L, null, (long) i)}));
        }
        try (ParquetBatchSink sink = new ParquetBatchSink("test", out, Fixtures.engine())) {
            sink.open(SCHEMA);
            sink.acceptBatch(rows);
            assertEquals(n, sink.written());
        }
        return out;
    }

    @Test
    void reads_back_every_type_including_lists_and_dotted_names() throws Exception {
        Path out = write(Files.createTempDirectory("prs"), 20);
        assertEquals(SCHEMA, ParquetFiles.schema(out));
        assertEquals(20, ParquetFiles.rowCount(out));
        try (ParquetRowSource src = new ParquetRowSource(out)) {
            Object[] first = src.poll().orElseThrow().payload();
            assertEquals("cand0", first[0]);
            assertEquals(1980L, first[1]);
            assertNull(first[2]);
            assertEquals(Arrays.asList(1980L, null, 0L), first[3]);
        }
    }

    @Test
    void projection_returns_requested_columns_in_requested_order() throws Exception {
        Path out = write(Files.createTempDirectory("prs"), 5);
        try (ParquetRowSource src = new ParquetRowSource(out, List.of("amount", "bonica.rid"))) {
            assertEquals(List.of("amount", "bonica.rid"), src.fields().stream().map(SchemaField::name).toList());
            src.poll();
            assertArrayEquals(new Object[]{1.5, "cand1"}, src.poll().orElseThrow().payload());
        }
        assertThrows(SourceUnreadableException.class, () -> new ParquetRowSource(out, List.of("nope")));
    }

    @Test
    void skip_to_lands_on_the_requested_row_across_row_groups() throws Exception {
        Path out = write(Files.createTempDirectory("prs"), 20_000);
        try (ParquetRowSource src = new ParquetRowSource(out, List.of("bonica.rid"))) {
            assertEquals(20_000, src.totalRows());
            for (long target : new long[]{0, 1, 99, 5_000, 5_001, 12_345, 19_999}) {
                src.skipTo(target);
                Record<Object[]> r = src.poll().orElseThrow();
                assertEquals(target, r.seq());
                assertEquals("cand" + target, r.payload()[0]);
            }
            assertThrows(IllegalArgumentException.class, () -> src.skipTo(10));
            assertTrue(src.poll().isEmpty());
        }
    }

    @Test
    void missing_file_is_unreadable() throws Exception {
        Path dir = Files.createTempDirectory("prs");
        assertThrows(SourceUnreadableException.class, () -> new ParquetRowSource(dir.resolve("none.parquet")));
    }

    @Test
    void rows_are_returned_in_write_order() throws Exception {
        Path out = write(Files.createTempDirectory("prs"), 1_000);
        long expected = 0;
        try (ParquetRowSource src = new ParquetRowSource(out, List.of("bonica.rid"))) {
            Optional<Record<Object[]>> r;
            while ((r = src.poll()).isPresent()) {
                assertEquals("cand" + expected, r.get().payload()[0]);
                expected++;
            }
        }
        assertEquals(1_000, expected);
    }
}
