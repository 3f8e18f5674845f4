package io.papertrail.aggregate;

import com.codahale.metrics.Timer;
import io.papertrail.core.Record;
import io.papertrail.error.AggregationException;
import io.papertrail.error.CompletenessException;
import io.papertrail.error.ConversionException;
import io.papertrail.error.OutputWriteException;
import io.papertrail.error.SampleMismatchException;
import io.papertrail.error.SourceUnreadableException;
import io.papertrail.metrics.Metrics;
import io.papertrail.runtime.CompensatedSum;
import io.papertrail.source.ParquetRowSource;
import io.papertrail.validate.SampleIndices;
import io.papertrail.validate.Tolerance;
import io.papertrail.validate.ValueNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

/**
 * Three tiers for an aggregated output, run in order and failing fast:
 * <ol>
 *     <li>completeness: every distinct filtered source key appears in the output exactly once;</li>
 *     <li>integrity: for sampled keys, MIN, MAX, COUNT, SUM, AVG and list lengths are re-derived from the source;</li>
 *     <li>sample: for a second sample, lists must equal the ordered source values and LATEST columns the value
 *     of the last row by ordering column.</li>
 * </ol>
 * Expected values are recomputed directly from the sampled keys' source rows, not through {@link GroupState}.
 */
public class AggregationValidator {
    private static final Logger log = LoggerFactory.getLogger(AggregationValidator.class);

    private record SourceRow(long seq, Object order, Object[] values) {}

    private static final Comparator<SourceRow> BY_ORDER = (a, b) -> {
        int c = OrderedValues.compare(a.order(), b.order());
        return c != 0 ? c : Long.compare(a.seq(), b.seq());
    };

    private final Metrics metrics;

    public AggregationValidator(Metrics metrics) {
        this.metrics = metrics;
    }

    public AggregationValidationResult validate(Path source, Path output, AggregationSpec spec,
                                                int aggregationSampleSize, int deepSampleSize, Random random) throws ConversionException {
        String name = source.toString();
        long[] completeness;
        try (Timer.Context ignored = timer(1)) {
            completeness = checkCompleteness(name, source, output, spec);
        }
        log.info("Tier 1 (completeness) PASS: {} keys", completeness[1]);

        int checks;
        try (Timer.Context ignored = timer(2)) {
            checks = checkAggregates(name, source, output, spec, aggregationSampleSize, random);
        }
        log.info("Tier 2 (aggregation integrity) PASS: {} checks", checks);

        int deep;
        try (Timer.Context ignored = timer(3)) {
            deep = checkSamples(name, source, output, spec, deepSampleSize, random);
        }
        log.info("Tier 3 (sample verification) PASS: {} keys", deep);
        return new AggregationValidationResult(true, completeness[0], completeness[1], true, checks, true, deep);
    }

    private Timer.Context timer(int tier) {
        return metrics.timer(Metrics.AGGREGATE_VALIDATE_TIME + ".tier" + tier).time();
    }

    /** Returns {distinct source keys, output rows}. */
    long[] checkCompleteness(String name, Path source, Path output, AggregationSpec spec) throws ConversionException {
        Set<Object> sourceKeys = new HashSet<>();
        List<String> filterColumns = List.of(spec.keyColumn(), spec.orderColumn());
        if (spec.keyColumn().equals(spec.orderColumn())) filterColumns = List.of(spec.keyColumn());
        try (ParquetRowSource src = new ParquetRowSource(source, filterColumns)) {
            Optional<Record<Object[]>> next;
            while ((next = src.poll()).isPresent()) {
                Object[] row = next.get().payload();
                Object order = row[row.length - 1];
                if (spec.includes(row[0], order)) sourceKeys.add(row[0]);
            }
        }

        Set<Object> outputKeys = new HashSet<>();
        long outputRows = 0;
        long duplicates = 0;
        TreeSet<String> extra = new TreeSet<>();
        try (ParquetRowSource out = openOutput(name, output, List.of(spec.keyOutputColumn()))) {
            Optional<Record<Object[]>> next;
            while ((next = out.poll()).isPresent()) {
                Object key = next.get().payload()[0];
                outputRows++;
                if (!outputKeys.add(key)) duplicates++;
                if (!sourceKeys.contains(key)) extra.add(String.valueOf(key));
            }
        }
        TreeSet<String> missing = new TreeSet<>();
        for (Object k : sourceKeys) if (!outputKeys.contains(k)) missing.add(String.valueOf(k));

        if (duplicates > 0 || !missing.isEmpty() || !extra.isEmpty()) {
            log.warn("Completeness FAILED: source {} keys, output {} rows, {} duplicate, {} missing, {} extra",
                    sourceKeys.size(), outputRows, duplicates, missing.size(), extra.size());
            throw new CompletenessException(name, sourceKeys.size(), outputRows, duplicates,
                    examples(missing), examples(extra));
        }
        return new long[]{sourceKeys.size(), outputRows};
    }

    int checkAggregates(String name, Path source, Path output, AggregationSpec spec, int sampleSize, Random random) throws ConversionException {
        Map<Object, Object[]> sampled = sampleOutput(name, output, spec, sampleSize, random);
        Map<Object, List<SourceRow>> rows = collectSource(source, spec, sampled.keySet());
        int passed = 0;
        for (Map.Entry<Object, Object[]> e : sampled.entrySet()) {
            Object key = e.getKey();
            List<SourceRow> group = rows.get(key);
            if (group == null) throw new AggregationException(name, key, spec.keyColumn(), "present in source", "absent");
            for (int c = 0; c < spec.columns().size(); c++) {
                OutputColumn col = spec.columns().get(c);
                Object actual = e.getValue()[c];
                Object expected;
                boolean ok;
                switch (col.reduction()) {
                    case MIN, MAX -> {
                        expected = extreme(group, c, col.reduction() == Reduction.MAX ? 1 : -1);
                        ok = ValueNormalizer.matches(ValueNormalizer.fromStored(expected), ValueNormalizer.fromStored(actual));
                    }
                    case COUNT -> {
                        long n = 0;
                        for (SourceRow r : group) if (r.values()[c] != null) n++;
                        expected = n;
                        ok = actual instanceof Number a && a.longValue() == n;
                    }
                    case SUM -> {
                        CompensatedSum sum = new CompensatedSum();
                        for (SourceRow r : group) sum.addIfPresent(r.values()[c]);
                        expected = sum.count() == 0 ? (col.conditional() ? Double.valueOf(0.0) : null) : Double.valueOf(sum.value());
                        ok = expected == null ? actual == null
                                : actual instanceof Number a && Tolerance.sumsAgree((Double) expected, a.doubleValue());
                    }
                    case AVG -> {
                        CompensatedSum sum = new CompensatedSum();
                        for (SourceRow r : group) sum.addIfPresent(r.values()[c]);
                        expected = sum.count() == 0 ? null : Double.valueOf(sum.value() / sum.count());
                        ok = expected == null ? actual == null
                                : actual instanceof Number a && Tolerance.valuesAgree((Double) expected, a.doubleValue());
                    }
                    case LIST -> {
                        expected = group.size();
                        ok = actual instanceof List<?> l && l.size() == group.size();
                        if (actual instanceof List<?> l) actual = l.size();
                    }
                    default -> {
                        continue;
                    }
                }
                if (!ok) {
                    log.warn("Aggregation mismatch for key {} field {}: expected {}, actual {}", key, col.name(), expected, actual);
                    throw new AggregationException(name, key, col.name(), expected, actual);
                }
                passed++;
            }
        }
        return passed;
    }

    int checkSamples(String name, Path source, Path output, AggregationSpec spec, int sampleSize, Random random) throws ConversionException {
        Map<Object, Object[]> sampled = sampleOutput(name, output, spec, sampleSize, random);
        Map<Object, List<SourceRow>> rows = collectSource(source, spec, sampled.keySet());
        for (Map.Entry<Object, Object[]> e : sampled.entrySet()) {
            Object key = e.getKey();
            List<SourceRow> group = new ArrayList<>(rows.getOrDefault(key, List.of()));
            group.sort(BY_ORDER);
            for (int c = 0; c < spec.columns().size(); c++) {
                OutputColumn col = spec.columns().get(c);
                Object actual = e.getValue()[c];
                Object expected;
                boolean ok;
                switch (col.reduction()) {
                    case LIST -> {
                        List<Object> values = new ArrayList<>(group.size());
                        for (SourceRow r : group) values.add(r.values()[c]);
                        expected = values;
                        ok = values.equals(actual);
                    }
                    case LATEST -> {
                        expected = group.isEmpty() ? null : group.get(group.size() - 1).values()[c];
                        ok = ValueNormalizer.matches(ValueNormalizer.fromStored(expected), ValueNormalizer.fromStored(actual));
                    }
                    default -> {
                        continue;
                    }
                }
                if (!ok) {
                    log.warn("Sample mismatch for key {} column {}: expected {}, actual {}", key, col.name(), expected, actual);
                    throw new SampleMismatchException(name, key, col.name(), expected, actual);
                }
            }
        }
        return sampled.size();
    }

    private static Object extreme(List<SourceRow> group, int column, int sign) {
        Object best = null;
        for (SourceRow r : group) {
            Object v = r.values()[column];
            if (v != null && (best == null || sign * OrderedValues.compare(v, best) > 0)) best = v;
        }
        return best;
    }

    /** Output rows at uniformly chosen positions, keyed by their key, values in spec column order. */
    private Map<Object, Object[]> sampleOutput(String name, Path output, AggregationSpec spec, int sampleSize, Random random) throws ConversionException {
        List<String> names = new ArrayList<>();
        for (OutputColumn c : spec.columns()) names.add(c.name());
        int keyPos = names.indexOf(spec.keyOutputColumn());
        Map<Object, Object[]> out = new LinkedHashMap<>();
        try (ParquetRowSource rows = openOutput(name, output, names)) {
            for (long idx : SampleIndices.choose(rows.totalRows(), sampleSize, random)) {
                rows.skipTo(idx);
                Optional<Record<Object[]>> r = rows.poll();
                if (r.isEmpty()) break;
                out.put(r.get().payload()[keyPos], r.get().payload());
            }
        }
        return out;
    }

    /** Filtered source rows of the given keys, in source order, values in spec column order. */
    private Map<Object, List<SourceRow>> collectSource(Path source, AggregationSpec spec, Set<Object> keys) throws ConversionException {
        Map<Object, List<SourceRow>> out = new HashMap<>();
        if (keys.isEmpty()) return out;
        int orderIndex = spec.sourceColumns().indexOf(spec.orderColumn());
        try (ParquetRowSource src = new ParquetRowSource(source, spec.sourceColumns())) {
            Optional<Record<Object[]>> next;
            while ((next = src.poll()).isPresent()) {
                Object[] row = next.get().payload();
                if (!keys.contains(row[0]) || !spec.includes(row[0], row[orderIndex])) continue;
                out.computeIfAbsent(row[0], k -> new ArrayList<>()).add(new SourceRow(next.get().seq(), row[orderIndex], spec.columnValues(row)));
            }
        }
        return out;
    }

    private static ParquetRowSource openOutput(String name, Path output, List<String> columns) throws OutputWriteException {
        try {
            return new ParquetRowSource(output, columns);
        } catch (SourceUnreadableException e) {
            throw new OutputWriteException(name, output, e);
        }
    }

    private static List<String> examples(TreeSet<String> keys) {
        List<String> out = new ArrayList<>();
        for (String k : keys) {
            if (out.size() >= CompletenessException.MAX_EXAMPLES) break;
            out.add(k);
        }
        return out;
    }
}
