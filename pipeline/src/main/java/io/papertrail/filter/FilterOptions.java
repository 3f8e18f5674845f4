package io.papertrail.filter;

/**
 * @param sampleSize output rows compared field by field with their source rows
 * @param seed       seed for row sampling; null draws a fresh one
 */
public record FilterOptions(boolean validate, int sampleSize, Long seed) {
    public static final int DEFAULT_SAMPLE = 100;

    public FilterOptions {
        if (sampleSize < 0) throw new IllegalArgumentException("sampleSize must be >= 0");
    }

    public static FilterOptions defaults() {
        return new FilterOptions(true, DEFAULT_SAMPLE, null);
    }

    public FilterOptions withValidate(boolean v) { return new FilterOptions(v, sampleSize, seed); }
    public FilterOptions withSeed(Long s) { return new FilterOptions(validate, sampleSize, s); }
}
