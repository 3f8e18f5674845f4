package io.papertrail.validate;

import io.papertrail.config.ColumnType;
import io.papertrail.config.TypeConfig;
import io.papertrail.transform.ValueParsers;

import java.util.List;
import java.util.Objects;

/**
 * Puts raw source text and stored output values into one comparable form: null tokens, empty text and
 * {@code nan} become null, numbers become doubles, other text is trimmed.
 */
public final class ValueNormalizer {
    private ValueNormalizer() {}

    public static Object fromRaw(String raw, ColumnType type, TypeConfig config) {
        if (config.isNullToken(raw)) return null;
        String s = raw.trim();
        if (s.isEmpty() || s.equalsIgnoreCase("nan")) return null;
        if (type.isNumeric()) {
            try {
                return fromStored(ValueParsers.parseFloat(s));
            } catch (NumberFormatException e) {
                return s;
            }
        }
        return s;
    }

    public static Object fromStored(Object v) {
        if (v == null) return null;
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        if (v instanceof List<?>) return v;
        String s = v.toString().trim();
        return s.isEmpty() || s.equalsIgnoreCase("nan") ? null : s;
    }

    public static boolean matches(Object expected, Object actual) {
        if (expected == null || actual == null) return expected == actual;
        if (expected instanceof Double a && actual instanceof Double b) return Tolerance.valuesAgree(a, b);
        return Objects.equals(expected, actual);
    }
}
