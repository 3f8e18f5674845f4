package io.papertrail.validate;

import io.papertrail.error.OutputWriteException;
import io.papertrail.error.RowCountMismatchException;
import io.papertrail.parquet.ParquetFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/** Tier 1: the output footer row count, and the streamed count, equal the source's data row count. */
public class RowCountTier implements ValidationTier {
    private static final Logger log = LoggerFactory.getLogger(RowCountTier.class);

    @Override
    public String name() { return "row count"; }

    @Override
    public void verify(ValidationContext ctx, ValidationResult.Builder result) throws RowCountMismatchException, OutputWriteException {
        long actual;
        try {
            actual = ParquetFiles.rowCount(ctx.output());
        } catch (IOException e) {
            throw new OutputWriteException(ctx.sourceName(), ctx.output(), e);
        }
        long expected = ctx.expectedRowCount();
        result.rowCount(expected, actual);
        if (actual != expected) {
            log.warn("Row count mismatch for {}: expected {}, output footer has {}", ctx.sourceName(), expected, actual);
            throw new RowCountMismatchException(ctx.sourceName(), expected, actual);
        }
        if (ctx.stats().rowCount() != expected) {
            log.warn("Streamed row count {} differs from source count {}", ctx.stats().rowCount(), expected);
            throw new RowCountMismatchException(ctx.sourceName(), expected, ctx.stats().rowCount());
        }
    }
}
