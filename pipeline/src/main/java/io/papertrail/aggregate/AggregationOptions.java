package io.papertrail.aggregate;

/**
 * @param aggregationSampleSize keys re-derived by the integrity tier
 * @param deepSampleSize        keys whose lists and latest values are checked by the sample tier
 * @param seed                  seed for key sampling; null draws a fresh one
 */
public record AggregationOptions(boolean validate, int aggregationSampleSize, int deepSampleSize, Long seed) {
    public static final int DEFAULT_AGGREGATION_SAMPLE = 100;
    public static final int DEFAULT_DEEP_SAMPLE = 50;

    public AggregationOptions {
        if (aggregationSampleSize < 0 || deepSampleSize < 0) throw new IllegalArgumentException("sample sizes must be >= 0");
    }

    public static AggregationOptions defaults() {
        return new AggregationOptions(true, DEFAULT_AGGREGATION_SAMPLE, DEFAULT_DEEP_SAMPLE, null);
    }

    public AggregationOptions withValidate(boolean v) { return new AggregationOptions(v, aggregationSampleSize, deepSampleSize, seed); }
    public AggregationOptions withSeed(Long s) { return new AggregationOptions(validate, aggregationSampleSize, deepSampleSize, s); }
}
