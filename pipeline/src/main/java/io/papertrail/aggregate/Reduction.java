package io.papertrail.aggregate;

import io.papertrail.config.ColumnType;

/** How an output column is derived from the rows of one group. */
public enum Reduction {
    /** The group key itself. */
    KEY,
    /** Smallest non-null value. */
    MIN,
    /** Largest non-null value. */
    MAX,
    /** Number of non-null values. */
    COUNT,
    /** Sum of non-null, non-NaN values; null when there are none, or 0 for a conditional sum. */
    SUM,
    /** Mean of non-null, non-NaN values; null when there are none. */
    AVG,
    /** All values, ordered by the ordering column then source order. */
    LIST,
    /** Value from the row with the greatest ordering value; ties go to the last such row in source order. */
    LATEST;

    ColumnType outputType(ColumnType source) {
        return switch (this) {
            case KEY, MIN, MAX, LATEST -> source;
            case COUNT -> ColumnType.INTEGER;
            case SUM, AVG -> ColumnType.FLOAT;
            case LIST -> {
                if (source != ColumnType.INTEGER) throw new IllegalArgumentException("LIST needs an integer source column, got " + source);
                yield ColumnType.INTEGER_LIST;
            }
        };
    }

    boolean acceptsCondition() {
        return this == COUNT || this == SUM || this == AVG;
    }
}
