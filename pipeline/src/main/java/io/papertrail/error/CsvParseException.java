package io.papertrail.error;

/**
 * A data row could not be parsed or coerced to its declared types.
 */
public class CsvParseException extends ConversionException {
    static final int MAX_RAW_CHARS = 500;

    private final long rowNumber;
    private final long lineNumber;
    private final String column;
    private final String rawRow;

    /**
     * @param rowNumber  1-based data row number, header excluded
     * @param lineNumber 1-based physical line where the row starts, header included
     * @param column     offending column, or null when the row as a whole is malformed
     */
    public CsvParseException(String sourceName, long rowNumber, long lineNumber, String column, String rawRow, String reason) {
        this(sourceName, rowNumber, lineNumber, column, rawRow, reason, null);
    }

    public CsvParseException(String sourceName, long rowNumber, long lineNumber, String column, String rawRow, String reason, Throwable cause) {
        super(sourceName, describe(rowNumber, lineNumber, column, truncate(rawRow), reason), cause);
        this.rowNumber = rowNumber;
        this.lineNumber = lineNumber;
        this.column = column;
        this.rawRow = truncate(rawRow);
    }

    public long rowNumber() { return rowNumber; }
    public long lineNumber() { return lineNumber; }
    public String column() { return column; }
    public String rawRow() { return rawRow; }

    static String truncate(String raw) {
        if (raw == null || raw.length() <= MAX_RAW_CHARS) return raw;
        return raw.substring(0, MAX_RAW_CHARS);
    }

    private static String describe(long row, long line, String column, String raw, String reason) {
        StringBuilder sb = new StringBuilder("parse error at row ").append(row).append(" (line ").append(line).append(")");
        if (column != null) sb.append(", column '").append(column).append("'");
        sb.append(": ").append(reason);
        if (raw != null) sb.append(" | raw: ").append(raw);
        return sb.toString();
    }
}
