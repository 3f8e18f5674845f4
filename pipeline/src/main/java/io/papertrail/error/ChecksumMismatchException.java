package io.papertrail.error;

/**
 * A column sum or non-null count recomputed from the output disagrees with the streamed value.
 * For non-null count failures the column is reported as {@code nonnull(<name>)}.
 */
public class ChecksumMismatchException extends ConversionException {
    private final String column;
    private final double expected;
    private final double actual;

    public ChecksumMismatchException(String sourceName, String column, double expected, double actual) {
        super(sourceName, "checksum mismatch on '" + column + "': expected " + expected + ", actual " + actual);
        this.column = column;
        this.expected = expected;
        this.actual = actual;
    }

    public String column() { return column; }
    public double expected() { return expected; }
    public double actual() { return actual; }
}
