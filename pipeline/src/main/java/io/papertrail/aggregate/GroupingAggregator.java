package io.papertrail.aggregate;

import com.codahale.metrics.Timer;
import io.papertrail.config.ColumnType;
import io.papertrail.config.EngineConfig;
import io.papertrail.config.SchemaField;
import io.papertrail.core.Record;
import io.papertrail.error.ConversionException;
import io.papertrail.error.SourceUnreadableException;
import io.papertrail.metrics.Metrics;
import io.papertrail.sink.ParquetBatchSink;
import io.papertrail.source.ParquetRowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Groups the rows of a Parquet source by key and writes one row per key, ordered by key. The source is read
 * one row group at a time; state is kept per key, not per row.
 */
public class GroupingAggregator {
    private static final Logger log = LoggerFactory.getLogger(GroupingAggregator.class);

    /** Rows read after filtering, and rows written. */
    public record Outcome(long sourceRows, long outputKeys, List<SchemaField> outputSchema) {}

    private final EngineConfig config;
    private final Metrics metrics;

    public GroupingAggregator(EngineConfig config, Metrics metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    public Outcome aggregate(Path source, Path output, AggregationSpec spec) throws ConversionException {
        log.info("Aggregating {} -> {} with {}", source, output, spec);
        try (Timer.Context ignored = metrics.timer(Metrics.AGGREGATE_TIME).time()) {
            Map<Object, GroupState> groups = new HashMap<>();
            List<SchemaField> schema;
            long kept = 0;
            try (ParquetRowSource src = new ParquetRowSource(source, spec.sourceColumns())) {
                schema = outputSchema(source, spec, src.fields());
                int orderIndex = spec.sourceColumns().indexOf(spec.orderColumn());
                Optional<Record<Object[]>> next;
                while ((next = src.poll()).isPresent()) {
                    Object[] row = next.get().payload();
                    Object key = row[0];
                    Object order = row[orderIndex];
                    if (!spec.includes(key, order)) continue;
                    groups.computeIfAbsent(key, k -> new GroupState(k, spec.columns())).accept(spec.columnValues(row), order, next.get().seq());
                    kept++;
                }
            }
            log.info("  {} rows kept, {} distinct keys", kept, groups.size());

            List<Object> keys = new ArrayList<>(groups.keySet());
            keys.sort(OrderedValues::compare);
            ParquetBatchSink sink = new ParquetBatchSink(source.toString(), output, config);
            try (sink) {
                sink.open(schema);
                List<Record<Object[]>> batch = new ArrayList<>();
                long seq = 0;
                for (Object key : keys) {
                    batch.add(new Record<>(seq, seq + 1, groups.get(key).result()));
                    seq++;
                    if (batch.size() >= config.batchSize()) {
                        sink.acceptBatch(batch);
                        batch.clear();
                    }
                }
                if (!batch.isEmpty()) sink.acceptBatch(batch);
            }
            log.info("Wrote {} aggregated rows to {}", keys.size(), output);
            return new Outcome(kept, keys.size(), schema);
        }
    }

    static List<SchemaField> outputSchema(Path source, AggregationSpec spec, List<SchemaField> sourceFields) throws SourceUnreadableException {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (SchemaField f : sourceFields) types.put(f.name(), f.type());
        if (spec.minOrder().isPresent() && !types.get(spec.orderColumn()).isNumeric()) {
            throw new SourceUnreadableException(source.toString(), "ordering column " + spec.orderColumn() + " is not numeric", null);
        }
        try {
            return spec.outputSchema(types);
        } catch (IllegalArgumentException e) {
            throw new SourceUnreadableException(source.toString(), e.getMessage(), e);
        }
    }
}
