package io.papertrail.config;

/** Logical column types and the values they carry in memory. */
public enum ColumnType {
    /** 64-bit signed integer, carried as {@link Long}. */
    INTEGER,
    /** IEEE double, carried as {@link Double}. */
    FLOAT,
    /** UTF-8 text, carried as {@link String}. Never coerced to a number. */
    STRING,
    /** Ordered list of integers, carried as {@code List<Long>}. Produced only by aggregation. */
    INTEGER_LIST;

    public boolean isNumeric() { return this == INTEGER || this == FLOAT; }
}
