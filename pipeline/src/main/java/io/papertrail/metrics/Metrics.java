package io.papertrail.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin facade over a shared {@link MetricRegistry} with the metric names the engine reports under.
 */
public class Metrics {
    public static final String CONVERT_ROWS = "convert.rows";
    public static final String CONVERT_BATCHES = "convert.batches";
    public static final String CONVERT_BATCH_TIME = "convert.batch.time";
    public static final String ROWCOUNT_TIME = "rowcount.time";
    public static final String VALIDATE_TIER_PREFIX = "validate.tier";
    public static final String AGGREGATE_TIME = "aggregate.time";
    public static final String AGGREGATE_VALIDATE_TIME = "aggregate.validate.time";
    public static final String FILTER_ROWS_KEPT = "filter.rows.kept";
    public static final String FILTER_ROWS_DROPPED = "filter.rows.dropped";
    public static final String FILTER_TIME = "filter.time";
    public static final String FILTER_VALIDATE_TIME = "filter.validate.time";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    public Timer tierTimer(int tier) { return registry.timer(VALIDATE_TIER_PREFIX + tier + ".time"); }
}
