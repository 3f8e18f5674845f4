package io.papertrail.validate;

import io.papertrail.core.Record;
import io.papertrail.error.ChecksumMismatchException;
import io.papertrail.error.ConversionException;
import io.papertrail.error.OutputWriteException;
import io.papertrail.error.SourceUnreadableException;
import io.papertrail.runtime.CompensatedSum;
import io.papertrail.runtime.StreamingStats;
import io.papertrail.source.ParquetRowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tier 2: recomputes the checksum column's sum and the key columns' non-null counts from the output,
 * reading only those columns, and compares them with the streamed statistics.
 */
public class ChecksumTier implements ValidationTier {
    private static final Logger log = LoggerFactory.getLogger(ChecksumTier.class);

    @Override
    public String name() { return "checksum"; }

    @Override
    public void verify(ValidationContext ctx, ValidationResult.Builder result) throws ConversionException {
        StreamingStats stats = ctx.stats();
        Optional<String> checksumColumn = stats.checksumColumn();
        List<String> keys = new ArrayList<>(stats.nonNullCounts().keySet());
        List<String> columns = new ArrayList<>();
        checksumColumn.ifPresent(columns::add);
        for (String k : keys) if (!columns.contains(k)) columns.add(k);
        if (columns.isEmpty()) {
            log.info("No checksum or key columns tracked for {}; nothing to compare", ctx.sourceName());
            result.checksumValid(true);
            return;
        }

        CompensatedSum sum = new CompensatedSum();
        long[] nonNull = new long[keys.size()];
        int sumIndex = checksumColumn.map(columns::indexOf).orElse(-1);
        int[] keyIndex = new int[keys.size()];
        for (int k = 0; k < keyIndex.length; k++) keyIndex[k] = columns.indexOf(keys.get(k));
        try (ParquetRowSource out = new ParquetRowSource(ctx.output(), columns)) {
            Optional<Record<Object[]>> next;
            while ((next = out.poll()).isPresent()) {
                Object[] row = next.get().payload();
                if (sumIndex >= 0) sum.addIfPresent(row[sumIndex]);
                for (int k = 0; k < nonNull.length; k++) {
                    if (row[keyIndex[k]] != null) nonNull[k]++;
                }
            }
        } catch (SourceUnreadableException e) {
            throw new OutputWriteException(ctx.sourceName(), ctx.output(), e);
        }

        long[] expectedNonNull = new long[keys.size()];
        for (int k = 0; k < keys.size(); k++) {
            expectedNonNull[k] = stats.nonNullCounts().get(keys.get(k));
            result.nonNullCount(keys.get(k), expectedNonNull[k], nonNull[k]);
        }
        if (checksumColumn.isPresent()) {
            String col = checksumColumn.get();
            boolean ok = Tolerance.sumsAgree(stats.checksumSum(), sum.value());
            result.checksum(col, stats.checksumSum(), sum.value(), ok);
            if (!ok) {
                log.warn("Checksum mismatch on {}: streamed {}, output {}", col, stats.checksumSum(), sum.value());
                throw new ChecksumMismatchException(ctx.sourceName(), col, stats.checksumSum(), sum.value());
            }
        }
        for (int k = 0; k < keys.size(); k++) {
            if (expectedNonNull[k] != nonNull[k]) {
                log.warn("Non-null count mismatch on {}: streamed {}, output {}", keys.get(k), expectedNonNull[k], nonNull[k]);
                result.checksumValid(false);
                throw new ChecksumMismatchException(ctx.sourceName(), keys.get(k) + " (non-null count)", expectedNonNull[k], nonNull[k]);
            }
        }
        result.checksumValid(true);
    }
}
