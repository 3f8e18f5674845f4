package io.papertrail.filter;

import java.util.Objects;

/**
 * A test on one column of a row, compared as text. A null value satisfies neither operator, so
 * {@code notEqualTo("contributor.type", "I")} also rejects rows with no contributor type.
 */
public record RowCondition(String column, Operator operator, String value) {
    public enum Operator { EQUALS, NOT_EQUALS }

    public RowCondition {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
    }

    public static RowCondition equalTo(String column, String value) {
        return new RowCondition(column, Operator.EQUALS, value);
    }

    public static RowCondition notEqualTo(String column, String value) {
        return new RowCondition(column, Operator.NOT_EQUALS, value);
    }

    public boolean test(Object columnValue) {
        if (columnValue == null) return false;
        boolean equal = value.equals(columnValue.toString());
        return operator == Operator.EQUALS ? equal : !equal;
    }

    @Override
    public String toString() {
        return column + (operator == Operator.EQUALS ? " = '" : " != '") + value + "'";
    }
}
