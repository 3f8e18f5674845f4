package io.papertrail.filter;

import com.codahale.metrics.Timer;
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
import java.util.List;
import java.util.Optional;

/**
 * Copies the rows of a Parquet source that satisfy a condition into a new Parquet file with the same schema,
 * in source order. The source is streamed one row group at a time.
 */
public class RowFilter {
    private static final Logger log = LoggerFactory.getLogger(RowFilter.class);

    /** Rows read and rows written. */
    public record Outcome(long sourceRows, long keptRows) {}

    private final EngineConfig config;
    private final Metrics metrics;

    public RowFilter(EngineConfig config, Metrics metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    public Outcome filter(Path source, Path output, RowCondition keep) throws ConversionException {
        log.info("Filtering {} -> {} keeping {}", source, output, keep);
        long read = 0;
        long kept = 0;
        try (Timer.Context ignored = metrics.timer(Metrics.FILTER_TIME).time();
             ParquetRowSource src = new ParquetRowSource(source);
             ParquetBatchSink sink = new ParquetBatchSink(source.toString(), output, config)) {
            List<SchemaField> schema = src.fields();
            int column = columnIndex(source, schema, keep);
            sink.open(schema);
            List<Record<Object[]>> batch = new ArrayList<>();
            Optional<Record<Object[]>> next;
            while ((next = src.poll()).isPresent()) {
                read++;
                Object[] row = next.get().payload();
                if (!keep.test(row[column])) continue;
                batch.add(new Record<>(kept, kept + 1, row));
                kept++;
                if (batch.size() >= config.batchSize()) {
                    sink.acceptBatch(batch);
                    batch.clear();
                }
            }
            if (!batch.isEmpty()) sink.acceptBatch(batch);
        }
        metrics.counter(Metrics.FILTER_ROWS_KEPT).inc(kept);
        metrics.counter(Metrics.FILTER_ROWS_DROPPED).inc(read - kept);
        log.info("Kept {} of {} rows ({} dropped) -> {}", kept, read, read - kept, output);
        return new Outcome(read, kept);
    }

    static int columnIndex(Path source, List<SchemaField> schema, RowCondition keep) throws SourceUnreadableException {
        for (int i = 0; i < schema.size(); i++) {
            if (schema.get(i).name().equals(keep.column())) return i;
        }
        throw new SourceUnreadableException(source.toString(), "filter column not present: " + keep.column(), null);
    }
}
