package io.papertrail.aggregate;

import io.papertrail.filter.RowCondition;

import java.util.Objects;

/**
 * @param when rows failing this condition contribute nothing to the column; null means every row counts
 */
public record OutputColumn(String name, Reduction reduction, String sourceColumn, RowCondition when) {
    public OutputColumn {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(reduction, "reduction");
        Objects.requireNonNull(sourceColumn, "sourceColumn");
        if (when != null && !reduction.acceptsCondition()) {
            throw new IllegalArgumentException(reduction + " cannot be conditional: " + name);
        }
    }

    public OutputColumn(String name, Reduction reduction, String sourceColumn) {
        this(name, reduction, sourceColumn, null);
    }

    public boolean conditional() { return when != null; }
}
