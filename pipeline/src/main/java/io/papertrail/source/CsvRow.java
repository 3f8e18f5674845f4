package io.papertrail.source;

import java.util.List;

/** Raw field values of one logical data row, before any type coercion. */
public record CsvRow(List<String> values) {
    public int size() { return values.size(); }

    public String get(int i) { return values.get(i); }

    /** Approximate source text, for diagnostics. */
    public String raw(char delimiter) { return String.join(String.valueOf(delimiter), values); }
}
