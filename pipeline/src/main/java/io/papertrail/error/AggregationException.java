package io.papertrail.error;

/** A recomputed aggregate for a sampled key disagrees with the stored value. */
public class AggregationException extends ConversionException {
    private final Object key;
    private final String field;
    private final Object expected;
    private final Object actual;

    public AggregationException(String sourceName, Object key, String field, Object expected, Object actual) {
        super(sourceName, "aggregation mismatch for key " + key + ", field '" + field + "': expected " + expected + ", actual " + actual);
        this.key = key;
        this.field = field;
        this.expected = expected;
        this.actual = actual;
    }

    public Object key() { return key; }
    public String field() { return field; }
    public Object expected() { return expected; }
    public Object actual() { return actual; }
}
