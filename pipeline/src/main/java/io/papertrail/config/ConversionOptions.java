package io.papertrail.config;

/**
 * Per-run options for a conversion.
 *
 * @param sampleSize rows checked by the sample tier; null selects the dataset's default
 * @param batchSize  rows per batch; null selects the engine default
 * @param seed       seed for sample selection; null draws a fresh one
 */
public record ConversionOptions(boolean validate, Integer sampleSize, Integer batchSize, Long seed) {
    public ConversionOptions {
        if (sampleSize != null && sampleSize < 0) throw new IllegalArgumentException("sampleSize must be >= 0");
        if (batchSize != null && batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
    }

    public static ConversionOptions defaults() { return new ConversionOptions(true, null, null, null); }

    public ConversionOptions withValidate(boolean v) { return new ConversionOptions(v, sampleSize, batchSize, seed); }
    public ConversionOptions withSampleSize(Integer n) { return new ConversionOptions(validate, n, batchSize, seed); }
    public ConversionOptions withBatchSize(Integer n) { return new ConversionOptions(validate, sampleSize, n, seed); }
    public ConversionOptions withSeed(Long s) { return new ConversionOptions(validate, sampleSize, batchSize, s); }

    public int sampleSizeOr(int fallback) { return sampleSize != null ? sampleSize : fallback; }
    public int batchSizeOr(int fallback) { return batchSize != null ? batchSize : fallback; }
}
