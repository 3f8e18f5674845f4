package io.papertrail.aggregate;

import io.papertrail.Fixtures;
import io.papertrail.config.ColumnType;
import io.papertrail.config.SchemaField;
import io.papertrail.core.Record;
import io.papertrail.sink.ParquetBatchSink;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Builds member-per-congress style Parquet inputs for the aggregation tests. */
final class MemberRows {
    static final List<SchemaField> SCHEMA = List.of(
            new SchemaField("icpsr", ColumnType.STRING),
            new SchemaField("congress", ColumnType.INTEGER),
            new SchemaField("bioname", ColumnType.STRING),
            new SchemaField("nominate_dim1", ColumnType.FLOAT));

    private final List<Record<Object[]>> rows = new ArrayList<>();

    MemberRows add(String icpsr, Long congress, String bioname, Double dim1) {
        rows.add(new Record<>(rows.size(), rows.size() + 1, new Object[]{icpsr, congress, bioname, dim1}));
        return this;
    }

    Path write(Path out) throws Exception {
        try (ParquetBatchSink sink = new ParquetBatchSink("members", out, Fixtures.engine())) {
            sink.open(SCHEMA);
            sink.acceptBatch(rows);
        }
        return out;
    }

    static AggregationSpec spec(Long minCongress) {
        AggregationSpec.Builder b = AggregationSpec.builder("members")
                .key("icpsr")
                .orderBy("congress")
                .latest("bioname")
                .latest("nominate_dim1")
                .list("congresses_served", "congress")
                .min("first_congress", "congress")
                .max("last_congress", "congress")
                .count("terms", "congress")
                .sum("dim1_total", "nominate_dim1");
        if (minCongress != null) b.minOrder(minCongress);
        return b.build();
    }
}
