package io.papertrail.filter;

import com.codahale.metrics.Timer;
import io.papertrail.config.SchemaField;
import io.papertrail.core.Record;
import io.papertrail.error.ConversionException;
import io.papertrail.error.FilterValidationException;
import io.papertrail.error.OutputWriteException;
import io.papertrail.error.RowCountMismatchException;
import io.papertrail.error.SampleMismatchException;
import io.papertrail.error.SchemaValidationException;
import io.papertrail.error.SourceUnreadableException;
import io.papertrail.metrics.Metrics;
import io.papertrail.source.ParquetRowSource;
import io.papertrail.validate.SampleIndices;
import io.papertrail.validate.ValueNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.TreeSet;

/**
 * Three tiers for a filtered output, run in order and failing fast:
 * <ol>
 *     <li>row count: the output holds exactly as many rows as the source has rows satisfying the condition;</li>
 *     <li>condition: no output row violates the condition;</li>
 *     <li>sample: sampled output rows equal, field by field, the source row they were copied from.</li>
 * </ol>
 */
public class FilterValidator {
    private static final Logger log = LoggerFactory.getLogger(FilterValidator.class);

    private final Metrics metrics;

    public FilterValidator(Metrics metrics) {
        this.metrics = metrics;
    }

    public FilterValidationResult validate(Path source, Path output, RowCondition keep, int sampleSize, Random random) throws ConversionException {
        String name = source.toString();
        long[] counts;
        try (Timer.Context ignored = timer(1)) {
            counts = checkRowCount(name, source, output, keep);
        }
        log.info("Tier 1 (row count) PASS: {} of {} source rows satisfy {}", counts[1], counts[0], keep);
        if (counts[1] == counts[0]) log.info("  no source row was excluded by {}", keep);

        try (Timer.Context ignored = timer(2)) {
            checkCondition(name, output, keep);
        }
        log.info("Tier 2 (condition) PASS: no row violates {}", keep);

        int sampled;
        try (Timer.Context ignored = timer(3)) {
            sampled = checkSample(name, source, output, keep, sampleSize, random);
        }
        log.info("Tier 3 (sample verification) PASS: {} rows", sampled);
        return new FilterValidationResult(true, counts[0], counts[1], counts[1], true, true, sampled);
    }

    private Timer.Context timer(int tier) {
        return metrics.timer(Metrics.FILTER_VALIDATE_TIME + ".tier" + tier).time();
    }

    /** Returns {source rows, source rows satisfying the condition}. */
    long[] checkRowCount(String name, Path source, Path output, RowCondition keep) throws ConversionException {
        long total = 0;
        long matching = 0;
        try (ParquetRowSource src = new ParquetRowSource(source, List.of(keep.column()))) {
            Optional<Record<Object[]>> next;
            while ((next = src.poll()).isPresent()) {
                total++;
                if (keep.test(next.get().payload()[0])) matching++;
            }
        }
        long actual;
        try (ParquetRowSource out = openOutput(name, output, null)) {
            actual = out.totalRows();
        }
        if (actual != matching) {
            log.warn("Filtered row count mismatch: {} source rows satisfy {}, output has {}", matching, keep, actual);
            throw new RowCountMismatchException(name, matching, actual);
        }
        return new long[]{total, matching};
    }

    void checkCondition(String name, Path output, RowCondition keep) throws ConversionException {
        long violations = 0;
        try (ParquetRowSource out = openOutput(name, output, List.of(keep.column()))) {
            Optional<Record<Object[]>> next;
            while ((next = out.poll()).isPresent()) {
                if (!keep.test(next.get().payload()[0])) violations++;
            }
        }
        if (violations > 0) {
            log.warn("Condition {} violated by {} output rows", keep, violations);
            throw new FilterValidationException(name, keep.toString(), violations);
        }
    }

    /**
     * Walks the source forward, numbering the rows that satisfy the condition; the k-th such row must equal
     * output row k. Sampled indices are ascending, so each side is read once.
     */
    int checkSample(String name, Path source, Path output, RowCondition keep, int sampleSize, Random random) throws ConversionException {
        try (ParquetRowSource src = new ParquetRowSource(source);
             ParquetRowSource out = openOutput(name, output, null)) {
            List<SchemaField> fields = src.fields();
            if (!fields.equals(out.fields())) {
                throw new SchemaValidationException(name, difference(fields, out.fields()), difference(out.fields(), fields));
            }
            int column = RowFilter.columnIndex(source, fields, keep);
            long[] indices = SampleIndices.choose(out.totalRows(), sampleSize, random);
            long keptSeen = -1;
            for (long idx : indices) {
                Object[] expected = null;
                while (keptSeen < idx) {
                    Optional<Record<Object[]>> next = src.poll();
                    if (next.isEmpty()) throw new SampleMismatchException(name, idx, keep.column(), "a source row", "none");
                    if (keep.test(next.get().payload()[column])) {
                        keptSeen++;
                        expected = next.get().payload();
                    }
                }
                out.skipTo(idx);
                Optional<Record<Object[]>> stored = out.poll();
                if (stored.isEmpty()) throw new OutputWriteException(name, output, new IllegalStateException("output ended before row " + idx));
                Object[] actual = stored.get().payload();
                for (int c = 0; c < fields.size(); c++) {
                    Object e = ValueNormalizer.fromStored(expected[c]);
                    Object a = ValueNormalizer.fromStored(actual[c]);
                    if (!ValueNormalizer.matches(e, a)) {
                        log.warn("Sample mismatch at filtered row {} column {}: source {} output {}", idx, fields.get(c).name(), e, a);
                        throw new SampleMismatchException(name, idx, fields.get(c).name(), e, a);
                    }
                }
            }
            return indices.length;
        }
    }

    /** Fields of {@code a} absent from {@code b}, as sorted {@code name:TYPE} labels. */
    private static List<String> difference(List<SchemaField> a, List<SchemaField> b) {
        TreeSet<String> out = new TreeSet<>();
        for (SchemaField f : a) if (!b.contains(f)) out.add(f.name() + ":" + f.type());
        return new ArrayList<>(out);
    }

    private static ParquetRowSource openOutput(String name, Path output, List<String> columns) throws OutputWriteException {
        try {
            return columns == null ? new ParquetRowSource(output) : new ParquetRowSource(output, columns);
        } catch (SourceUnreadableException e) {
            throw new OutputWriteException(name, output, e);
        }
    }
}
