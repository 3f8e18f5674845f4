package io.papertrail.aggregate;

import io.papertrail.Fixtures;
import io.papertrail.config.ColumnType;
import io.papertrail.config.SchemaField;
import io.papertrail.core.Record;
import io.papertrail.error.SourceUnreadableException;
import io.papertrail.source.ParquetRowSource;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class GroupingAggregatorTest {
    private final GroupingAggregator aggregator = new GroupingAggregator(Fixtures.engine(), Fixtures.metrics());

    private static List<Object[]> read(Path out) throws Exception {
        List<Object[]> rows = new ArrayList<>();
        try (ParquetRowSource src = new ParquetRowSource(out)) {
            Optional<Record<Object[]>> r;
            while ((r = src.poll()).isPresent()) rows.add(r.get().payload());
        }
        return rows;
    }

    @Test
    void latest_value_comes_from_highest_ordering_row_and_list_is_ordered() throws Exception {
        Path dir = Files.createTempDirectory("agg");
        Path in = new MemberRows()
                .add("X", 2020L, "Smith, J. (2020)", 0.2)
                .add("Y", 2018L, "Jones", -0.4)
                .add("X", 2022L, "Smith, J. (2022)", 0.3)
                .add("X", 2018L, "Smith, J. (2018)", 0.1)
                .write(dir.resolve("members.parquet"));
        Path out = dir.resolve("legislators.parquet");

        GroupingAggregator.Outcome outcome = aggregator.aggregate(in, out, MemberRows.spec(null));

        assertEquals(4, outcome.sourceRows());
        assertEquals(2, outcome.outputKeys());
        List<Object[]> rows = read(out);
        assertEquals(2, rows.size());
        Object[] x = rows.get(0);
        assertEquals("X", x[0]);
        assertEquals("Smith, J. (2022)", x[1]);
        assertEquals(0.3, x[2]);
        assertEquals(List.of(2018L, 2020L, 2022L), x[3]);
        assertEquals(2018L, x[4]);
        assertEquals(2022L, x[5]);
        assertEquals(3L, x[6]);
        assertEquals(0.6, (Double) x[7], 1e-12);
        assertEquals("Y", rows.get(1)[0]);
    }

    @Test
    void output_schema_follows_reductions() throws Exception {
        Path dir = Files.createTempDirectory("agg");
        Path in = new MemberRows().add("A", 100L, "a", 0.0).write(dir.resolve("m.parquet"));
        GroupingAggregator.Outcome outcome = aggregator.aggregate(in, dir.resolve("o.parquet"), MemberRows.spec(null));
        assertEquals(List.of(
                new SchemaField("icpsr", ColumnType.STRING),
                new SchemaField("bioname", ColumnType.STRING),
                new SchemaField("nominate_dim1", ColumnType.FLOAT),
                new SchemaField("congresses_served", ColumnType.INTEGER_LIST),
                new SchemaField("first_congress", ColumnType.INTEGER),
                new SchemaField("last_congress", ColumnType.INTEGER),
                new SchemaField("terms", ColumnType.INTEGER),
                new SchemaField("dim1_total", ColumnType.FLOAT)), outcome.outputSchema());
    }

    @Test
    void filter_drops_early_rows_and_null_keys() throws Exception {
        Path dir = Files.createTempDirectory("agg");
        Path in = new MemberRows()
                .add("A", 95L, "old", 0.1)
                .add("A", 96L, "new", 0.2)
                .add("B", 90L, "gone", 0.3)
                .add(null, 100L, "nobody", 0.4)
                .write(dir.resolve("m.parquet"));
        Path out = dir.resolve("o.parquet");
        GroupingAggregator.Outcome outcome = aggregator.aggregate(in, out, MemberRows.spec(96L));

        assertEquals(1, outcome.sourceRows());
        List<Object[]> rows = read(out);
        assertEquals(1, rows.size());
        assertEquals("A", rows.get(0)[0]);
        assertEquals(List.of(96L), rows.get(0)[3]);
    }

    @Test
    void ties_on_ordering_value_go_to_the_later_row() throws Exception {
        Path dir = Files.createTempDirectory("agg");
        Path in = new MemberRows()
                .add("A", 100L, "first", null)
                .add("A", 100L, "second", null)
                .write(dir.resolve("m.parquet"));
        Path out = dir.resolve("o.parquet");
        aggregator.aggregate(in, out, MemberRows.spec(null));
        Object[] a = read(out).get(0);
        assertEquals("second", a[1]);
        assertNull(a[7]);
    }

    @Test
    void unknown_source_column_is_rejected() throws Exception {
        Path dir = Files.createTempDirectory("agg");
        Path in = new MemberRows().add("A", 100L, "a", 0.0).write(dir.resolve("m.parquet"));
        AggregationSpec spec = AggregationSpec.builder("bad").key("icpsr").orderBy("congress").latest("party_code").build();
        assertThrows(SourceUnreadableException.class, () -> aggregator.aggregate(in, dir.resolve("o.parquet"), spec));
    }
}
