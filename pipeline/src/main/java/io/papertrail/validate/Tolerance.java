package io.papertrail.validate;

/** Numeric agreement rules shared by the checksum and sample checks. */
public final class Tolerance {
    static final double SUM_ABSOLUTE = 0.01;
    static final double SUM_RELATIVE = 1e-9;
    static final double VALUE_RELATIVE = 1e-6;

    private Tolerance() {}

    /** Column sums agree within 0.01 or one part in 10^9 of the larger magnitude, whichever is looser.
     * Identical non-finite sums (both NaN, or the same infinity) agree. */
    public static boolean sumsAgree(double expected, double actual) {
        if (Double.compare(expected, actual) == 0) return true;
        double allowed = Math.max(SUM_ABSOLUTE, SUM_RELATIVE * Math.max(Math.abs(expected), Math.abs(actual)));
        return Math.abs(expected - actual) <= allowed;
    }

    /** Single values agree within one part in 10^6, measured against at least 1. */
    public static boolean valuesAgree(double a, double b) {
        if (a == b) return true;
        double scale = Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
        return Math.abs(a - b) <= VALUE_RELATIVE * scale;
    }
}
