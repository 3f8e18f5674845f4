package io.papertrail.transform;

import java.util.regex.Pattern;

/**
 * Strict text-to-number parsing. Accepts what a spreadsheet export or a SQL dump writes, and rejects Java
 * literal forms such as hex floats or a trailing {@code d}.
 */
public final class ValueParsers {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private ValueParsers() {}

    public static long parseInteger(String raw) {
        String s = raw.trim();
        if (!INTEGER.matcher(s).matches()) throw new NumberFormatException("not an integer: '" + raw + "'");
        return Long.parseLong(s.startsWith("+") ? s.substring(1) : s);
    }

    public static double parseFloat(String raw) {
        String s = raw.trim();
        if (DECIMAL.matcher(s).matches()) return Double.parseDouble(s);
        return switch (s.toLowerCase()) {
            case "nan" -> Double.NaN;
            case "inf", "+inf", "infinity", "+infinity" -> Double.POSITIVE_INFINITY;
            case "-inf", "-infinity" -> Double.NEGATIVE_INFINITY;
            default -> throw new NumberFormatException("not a number: '" + raw + "'");
        };
    }
}
