package io.papertrail.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.papertrail.config.EngineConfig;
import io.papertrail.config.TypeConfig;
import io.papertrail.core.Record;
import io.papertrail.error.ConversionException;
import io.papertrail.error.SourceUnreadableException;
import io.papertrail.metrics.Metrics;
import io.papertrail.sink.ParquetBatchSink;
import io.papertrail.source.CsvRecordSource;
import io.papertrail.source.CsvRow;
import io.papertrail.source.SourceHandle;
import io.papertrail.transform.TypeCoercionTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Streams a delimited source into a Parquet file batch by batch: source, type coercion, batch sink. Only one
 * batch is resident at a time. The writer opens with the first batch, or at end of input for a header-only
 * source so the output still carries the schema.
 *
 * <p>A failed run leaves a partial file at the output path; callers discard it.
 */
public class StreamingConverter {
    private static final Logger log = LoggerFactory.getLogger(StreamingConverter.class);

    private final EngineConfig config;
    private final Meter rows;
    private final Counter batches;
    private final Timer batchTime;

    public StreamingConverter(EngineConfig config, Metrics metrics) {
        this.config = config;
        this.rows = metrics.meter(Metrics.CONVERT_ROWS);
        this.batches = metrics.counter(Metrics.CONVERT_BATCHES);
        this.batchTime = metrics.timer(Metrics.CONVERT_BATCH_TIME);
    }

    public StreamingStats convert(SourceHandle source, Path output, TypeConfig typeConfig) throws ConversionException {
        return convert(source, output, typeConfig, config.batchSize());
    }

    public StreamingStats convert(SourceHandle source, Path output, TypeConfig typeConfig, int batchSize) throws ConversionException {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        log.info("Converting {} -> {} as {} (batch size {})", source.name(), output, typeConfig.name(), batchSize);
        StreamingStats stats = new StreamingStats(typeConfig);
        ParquetBatchSink sink = new ParquetBatchSink(source.name(), output, config);
        try (sink; CsvRecordSource src = new CsvRecordSource(source, typeConfig)) {
            if (src.header().isEmpty()) throw new SourceUnreadableException(source.name(), "source has no header line", null);
            TypeCoercionTransform coercion = new TypeCoercionTransform(source.name(), src.header(), typeConfig);
            List<Record<Object[]>> batch = new ArrayList<>(Math.min(batchSize, 1 << 16));
            long batchNo = 0;
            while (true) {
                Optional<Record<CsvRow>> next = src.poll();
                if (next.isPresent()) {
                    batch.add(coercion.apply(next.get()));
                    if (batch.size() < batchSize) continue;
                }
                if (!batch.isEmpty()) {
                    flush(batch, coercion, sink, stats);
                    batchNo++;
                    if (batchNo % config.progressEveryBatches() == 0) {
                        log.info("  batch {}: {} rows written", batchNo, stats.rowCount());
                    }
                }
                if (next.isEmpty()) break;
            }
            if (!sink.isOpen()) {
                log.info("No data rows in {}; writing schema only", source.name());
                stats.observeSchema(coercion.schema());
                sink.open(coercion.schema());
            }
        }
        stats.freeze();
        log.info("Converted {} rows from {}", stats.rowCount(), source.name());
        return stats;
    }

    private void flush(List<Record<Object[]>> batch, TypeCoercionTransform coercion, ParquetBatchSink sink, StreamingStats stats) throws ConversionException {
        try (Timer.Context ignored = batchTime.time()) {
            if (!sink.isOpen()) {
                stats.observeSchema(coercion.schema());
                sink.open(coercion.schema());
            }
            sink.acceptBatch(batch);
            stats.addBatch(batch);
        }
        rows.mark(batch.size());
        batches.inc();
        batch.clear();
    }
}
