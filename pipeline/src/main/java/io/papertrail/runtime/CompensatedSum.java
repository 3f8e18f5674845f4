package io.papertrail.runtime;

/**
 * Neumaier-compensated running sum. The result does not depend on how the inputs are split into batches,
 * which keeps streamed and recomputed checksums comparable.
 */
public final class CompensatedSum {
    private double sum;
    private double compensation;
    private long count;

    public void add(double v) {
        double t = sum + v;
        if (Math.abs(sum) >= Math.abs(v)) {
            compensation += (sum - t) + v;
        } else {
            compensation += (v - t) + sum;
        }
        sum = t;
        count++;
    }

    /** Adds a value unless it is null or NaN. */
    public void addIfPresent(Object v) {
        if (v instanceof Number n) {
            double d = n.doubleValue();
            if (!Double.isNaN(d)) add(d);
        }
    }

    public double value() {
        return Double.isInfinite(sum) ? sum : sum + compensation;
    }

    public long count() { return count; }
}
