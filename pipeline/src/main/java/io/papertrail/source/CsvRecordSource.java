package io.papertrail.source;

import io.papertrail.config.TypeConfig;
import io.papertrail.core.Record;
import io.papertrail.core.Source;
import io.papertrail.error.ConversionException;
import io.papertrail.error.CsvParseException;
import io.papertrail.error.SourceUnreadableException;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Streams the data rows of a delimited text source in order. A row whose field count differs from the
 * header is rejected with its row and line number.
 */
public class CsvRecordSource implements Source<CsvRow> {
    private final String name;
    private final TypeConfig config;
    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private final List<String> header;
    private long nextSeq = 0;
    private long lastLine;
    private boolean finished = false;

    public CsvRecordSource(SourceHandle source, TypeConfig config) throws SourceUnreadableException {
        this.name = source.name();
        this.config = config;
        this.parser = CsvDialect.open(source, config);
        this.header = List.copyOf(parser.getHeaderNames());
        this.records = parser.iterator();
        this.lastLine = parser.getCurrentLineNumber();
    }

    public String name() { return name; }

    /** Column names from the header line, in file order. Empty for an empty source. */
    public List<String> header() { return header; }

    @Override
    public Optional<Record<CsvRow>> poll() throws ConversionException {
        if (finished) return Optional.empty();
        long line = lastLine + 1;
        CSVRecord rec;
        try {
            if (!records.hasNext()) {
                finished = true;
                return Optional.empty();
            }
            rec = records.next();
        } catch (UncheckedIOException | IllegalStateException e) {
            finished = true;
            throw CsvDialect.readFailure(name, e, nextSeq + 1, line);
        }
        lastLine = parser.getCurrentLineNumber();
        long seq = nextSeq++;
        CsvRow row = new CsvRow(rec.toList());
        if (row.size() != header.size()) {
            throw new CsvParseException(name, seq + 1, line, null, row.raw(config.delimiter()),
                    "expected " + header.size() + " fields, found " + row.size());
        }
        return Optional.of(new Record<>(seq, line, row));
    }

    @Override
    public boolean isFinished() { return finished; }

    @Override
    public void close() throws SourceUnreadableException {
        finished = true;
        try {
            parser.close();
        } catch (IOException e) {
            throw new SourceUnreadableException(name, "close failed: " + e.getMessage(), e);
        }
    }
}
