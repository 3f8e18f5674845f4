package io.papertrail.finance;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.inject.Injector;
import io.papertrail.aggregate.AggregationResult;
import io.papertrail.aggregate.AggregationValidationResult;
import io.papertrail.filter.FilterResult;
import io.papertrail.filter.FilterValidationResult;
import io.papertrail.metrics.Metrics;
import io.papertrail.runtime.ConversionResult;
import io.papertrail.validate.ValidationResult;

import java.io.PrintWriter;
import java.time.Instant;
import java.util.Map;

/** User-facing run summaries. */
final class Reports {
    private Reports() {}

    static void printConversion(PrintWriter out, ConversionResult r) {
        out.println("[" + Instant.now() + "] SUCCESS: " + String.format("%,d", r.rowCount()) + " rows -> " + r.output());
        r.stats().checksumColumn().ifPresent(c -> out.println("  checksum(" + c + ") = " + r.stats().checksumSum()));
        if (!r.validated()) {
            out.println("  validation: skipped");
            return;
        }
        ValidationResult v = r.validation();
        out.println("  tier 1 row count: " + pass(v.rowCountValid()) + " (" + v.rowCountExpected() + " expected, " + v.rowCountActual() + " written)");
        out.println("  tier 2 checksum:  " + pass(v.checksumValid()) + (v.checksumColumn() != null
                ? " (" + v.checksumColumn() + " " + v.checksumExpected() + " vs " + v.checksumActual() + ")" : ""));
        for (Map.Entry<String, ValidationResult.CountPair> e : v.nonNullCounts().entrySet()) {
            out.println("    non-null " + e.getKey() + ": " + e.getValue().expected() + " / " + e.getValue().actual());
        }
        out.println("  tier 3 sample:    " + pass(v.sampleValid()) + " (" + v.sampleSize() + " rows)");
    }

    static void printAggregation(PrintWriter out, AggregationResult r) {
        out.println("[" + Instant.now() + "] SUCCESS: " + String.format("%,d", r.outputKeyCount()) + " keys from "
                + String.format("%,d", r.sourceRowCount()) + " rows -> " + r.output());
        if (!r.validated()) {
            out.println("  validation: skipped");
            return;
        }
        AggregationValidationResult v = r.validation();
        out.println("  tier 1 completeness: " + pass(v.completenessValid()) + " (" + v.sourceDistinctCount() + " source keys, " + v.outputCount() + " output rows)");
        out.println("  tier 2 aggregation:  " + pass(v.aggregationValid()) + " (" + v.aggregationChecksPassed() + " checks)");
        out.println("  tier 3 sample:       " + pass(v.sampleValid()) + " (" + v.sampleSize() + " keys)");
    }

    static void printFilter(PrintWriter out, FilterResult r) {
        out.println("[" + Instant.now() + "] SUCCESS: " + String.format("%,d", r.keptRowCount()) + " of "
                + String.format("%,d", r.sourceRowCount()) + " rows kept (" + r.keep() + ") -> " + r.output());
        if (!r.validated()) {
            out.println("  validation: skipped");
            return;
        }
        FilterValidationResult v = r.validation();
        out.println("  tier 1 row count: " + pass(v.rowCountValid()) + " (" + v.expectedRows() + " expected, " + v.outputRows() + " written)");
        out.println("  tier 2 condition: " + pass(v.conditionValid()));
        out.println("  tier 3 sample:    " + pass(v.sampleValid()) + " (" + v.sampleSize() + " rows)");
    }

    static void printMetrics(PrintWriter out, Injector injector) {
        MetricRegistry r = injector.getInstance(MetricRegistry.class);
        Meter rows = r.meter(Metrics.CONVERT_ROWS);
        Timer batch = r.timer(Metrics.CONVERT_BATCH_TIME);
        out.println("metrics: rows=" + rows.getCount() + " meanRate=" + fmt(rows.getMeanRate()) + "/s"
                + " | batches=" + r.counter(Metrics.CONVERT_BATCHES).getCount()
                + " batch.p50(ms)=" + nsToMs(batch.getSnapshot().getMedian())
                + " | rowcount(ms)=" + nsToMs(total(r.timer(Metrics.ROWCOUNT_TIME)))
                + " | tiers(ms)=" + nsToMs(total(r.timer(Metrics.VALIDATE_TIER_PREFIX + "1.time"))) + "/"
                + nsToMs(total(r.timer(Metrics.VALIDATE_TIER_PREFIX + "2.time"))) + "/"
                + nsToMs(total(r.timer(Metrics.VALIDATE_TIER_PREFIX + "3.time")))
                + " | aggregate(ms)=" + nsToMs(total(r.timer(Metrics.AGGREGATE_TIME)))
                + " | filter(ms)=" + nsToMs(total(r.timer(Metrics.FILTER_TIME))));
    }

    private static String pass(boolean ok) { return ok ? "PASS" : "FAIL"; }

    private static double total(Timer t) { return t.getSnapshot().getMean() * t.getCount(); }

    private static String fmt(double v) { return String.format("%.3f", v); }
    private static String nsToMs(double nanos) { return String.format("%.3f", nanos / 1_000_000.0); }
}
