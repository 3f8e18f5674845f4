package io.papertrail.source;

import io.papertrail.config.TypeConfig;
import io.papertrail.error.ConversionException;
import io.papertrail.error.CsvParseException;
import io.papertrail.error.SourceUnreadableException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;

/**
 * The delimited-text dialect shared by every pass over a source, so the row counter, the converter and the
 * sample tier agree on what a logical row is: RFC 4180 quoting and a header line. Blank lines are kept as
 * rows, so a blank line inside the data fails the field-count check instead of vanishing from the count.
 */
final class CsvDialect {
    private CsvDialect() {}

    static CSVFormat format(TypeConfig config) {
        return CSVFormat.DEFAULT.builder()
                .setDelimiter(config.delimiter())
                .setHeader()
                .setSkipHeaderRecord(true)
                .setAllowMissingColumnNames(true)
                .setIgnoreEmptyLines(false)
                .build();
    }

    static CSVParser open(SourceHandle source, TypeConfig config) throws SourceUnreadableException {
        InputStream in;
        try {
            in = source.open();
        } catch (IOException e) {
            throw new SourceUnreadableException(source.name(), "cannot open source: " + e.getMessage(), e);
        }
        try {
            return CSVParser.parse(new InputStreamReader(in, config.charset()), format(config));
        } catch (IOException | UncheckedIOException e) {
            try { in.close(); } catch (IOException suppressed) { e.addSuppressed(suppressed); }
            throw new SourceUnreadableException(source.name(), "cannot read header: " + e.getMessage(), e);
        }
    }

    /**
     * Maps a failure surfaced by the parser's record iterator. The lexer reports malformed quoting as an
     * IOException whose message starts with the offending line; anything else is a failing read.
     */
    static ConversionException readFailure(String sourceName, RuntimeException e, long rowNumber, long lineNumber) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        String msg = String.valueOf(cause.getMessage());
        if (msg.startsWith("(line") || msg.startsWith("(startline")) {
            return new CsvParseException(sourceName, rowNumber, lineNumber, null, null, "malformed quoting: " + msg, e);
        }
        return new SourceUnreadableException(sourceName, "read failed near row " + rowNumber + ": " + msg, e);
    }
}
