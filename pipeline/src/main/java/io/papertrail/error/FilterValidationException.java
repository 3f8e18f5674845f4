package io.papertrail.error;

/** Rows in a filtered output fail the condition the filter was meant to enforce. */
public class FilterValidationException extends ConversionException {
    private final String condition;
    private final long violations;

    public FilterValidationException(String sourceName, String condition, long violations) {
        super(sourceName, "filtered output has " + violations + " rows violating " + condition);
        this.condition = condition;
        this.violations = violations;
    }

    public String condition() { return condition; }
    public long violations() { return violations; }
}
