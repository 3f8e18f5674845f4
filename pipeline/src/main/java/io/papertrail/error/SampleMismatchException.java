package io.papertrail.error;

import java.util.Optional;

/**
 * A sampled value in the output differs from the source. Row-level samples carry the 0-based row index;
 * aggregate samples carry the group key instead and report index -1.
 */
public class SampleMismatchException extends ConversionException {
    private final long rowIndex;
    private final Object key;
    private final String column;
    private final Object expected;
    private final Object actual;

    public SampleMismatchException(String sourceName, long rowIndex, String column, Object expected, Object actual) {
        super(sourceName, "sample mismatch at row " + rowIndex + ", column '" + column + "': expected " + expected + ", actual " + actual);
        this.rowIndex = rowIndex;
        this.key = null;
        this.column = column;
        this.expected = expected;
        this.actual = actual;
    }

    public SampleMismatchException(String sourceName, Object key, String column, Object expected, Object actual) {
        super(sourceName, "sample mismatch for key " + key + ", column '" + column + "': expected " + expected + ", actual " + actual);
        this.rowIndex = -1;
        this.key = key;
        this.column = column;
        this.expected = expected;
        this.actual = actual;
    }

    public long rowIndex() { return rowIndex; }
    public Optional<Object> key() { return Optional.ofNullable(key); }
    public String column() { return column; }
    public Object expected() { return expected; }
    public Object actual() { return actual; }
}
