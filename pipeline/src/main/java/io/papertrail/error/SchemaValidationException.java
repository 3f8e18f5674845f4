package io.papertrail.error;

import java.util.List;

/** Observed column names differ from the expected set. Both lists are sorted. */
public class SchemaValidationException extends ConversionException {
    private final List<String> missing;
    private final List<String> extra;

    public SchemaValidationException(String sourceName, List<String> missing, List<String> extra) {
        super(sourceName, "schema mismatch: missing=" + missing + " extra=" + extra);
        this.missing = List.copyOf(missing);
        this.extra = List.copyOf(extra);
    }

    public List<String> missing() { return missing; }
    public List<String> extra() { return extra; }
}
