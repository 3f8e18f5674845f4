package io.papertrail.error;

public class RowCountMismatchException extends ConversionException {
    private final long expected;
    private final long actual;

    public RowCountMismatchException(String sourceName, long expected, long actual) {
        super(sourceName, "row count mismatch: expected " + expected + ", output has " + actual + " (diff " + (actual - expected) + ")");
        this.expected = expected;
        this.actual = actual;
    }

    public long expected() { return expected; }
    public long actual() { return actual; }
    public long diff() { return actual - expected; }
}
