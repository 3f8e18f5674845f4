package io.papertrail.validate;

import io.papertrail.config.SchemaField;
import io.papertrail.core.Record;
import io.papertrail.error.ConversionException;
import io.papertrail.error.OutputWriteException;
import io.papertrail.error.SampleMismatchException;
import io.papertrail.error.SourceUnreadableException;
import io.papertrail.source.CsvRecordSource;
import io.papertrail.source.CsvRow;
import io.papertrail.source.ParquetRowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Tier 3: compares randomly chosen rows of the output with the same rows re-read from the original source.
 * Indices are sorted, so both sides are read in a single forward pass each, interleaved.
 */
public class SampleTier implements ValidationTier {
    private static final Logger log = LoggerFactory.getLogger(SampleTier.class);

    @Override
    public String name() { return "sample"; }

    @Override
    public void verify(ValidationContext ctx, ValidationResult.Builder result) throws ConversionException {
        long population = ctx.stats().rowCount();
        long[] indices = SampleIndices.choose(population, ctx.sampleSize(), ctx.random());
        if (indices.length == 0) {
            result.sample(0, true);
            return;
        }
        log.info("Sampling {} of {} rows", indices.length, population);

        try (CsvRecordSource src = new CsvRecordSource(ctx.source(), ctx.config());
             ParquetRowSource out = openOutput(ctx)) {
            List<SchemaField> outFields = out.fields();
            int[] srcIndex = new int[outFields.size()];
            for (int c = 0; c < srcIndex.length; c++) srcIndex[c] = src.header().indexOf(outFields.get(c).name());

            for (long idx : indices) {
                CsvRow expectedRow = advance(src, idx, ctx);
                out.skipTo(idx);
                Optional<Record<Object[]>> stored = out.poll();
                if (stored.isEmpty()) throw new OutputWriteException(ctx.sourceName(), ctx.output(), new IllegalStateException("output ended before row " + idx));
                Object[] actualRow = stored.get().payload();
                for (int c = 0; c < srcIndex.length; c++) {
                    if (srcIndex[c] < 0) continue;
                    SchemaField f = outFields.get(c);
                    Object expected = ValueNormalizer.fromRaw(expectedRow.get(srcIndex[c]), f.type(), ctx.config());
                    Object actual = ValueNormalizer.fromStored(actualRow[c]);
                    if (!ValueNormalizer.matches(expected, actual)) {
                        result.sample(indices.length, false);
                        log.warn("Sample mismatch at row {} column {}: source {} output {}", idx, f.name(), expected, actual);
                        throw new SampleMismatchException(ctx.sourceName(), idx, f.name(), expected, actual);
                    }
                }
            }
        }
        result.sample(indices.length, true);
    }

    private static ParquetRowSource openOutput(ValidationContext ctx) throws OutputWriteException {
        try {
            return new ParquetRowSource(ctx.output());
        } catch (SourceUnreadableException e) {
            throw new OutputWriteException(ctx.sourceName(), ctx.output(), e);
        }
    }

    private static CsvRow advance(CsvRecordSource src, long idx, ValidationContext ctx) throws ConversionException {
        while (true) {
            Optional<Record<CsvRow>> r = src.poll();
            if (r.isEmpty()) throw new SourceUnreadableException(ctx.sourceName(), "source ended before row " + idx, null);
            if (r.get().seq() == idx) return r.get().payload();
        }
    }
}
