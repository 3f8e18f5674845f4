package io.papertrail.source;

import com.codahale.metrics.Timer;
import io.papertrail.config.TypeConfig;
import io.papertrail.error.ConversionException;
import io.papertrail.error.SourceUnreadableException;
import io.papertrail.metrics.Metrics;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;

/**
 * Counts the logical data rows of a delimited source in one streaming pass. Quoted fields that embed line
 * breaks count as part of a single row, which a plain line count would get wrong.
 */
public class RowCounter {
    private static final Logger log = LoggerFactory.getLogger(RowCounter.class);
    static final long PROGRESS_EVERY_ROWS = 10_000_000L;

    private final Metrics metrics;

    public RowCounter(Metrics metrics) {
        this.metrics = metrics;
    }

    public long count(SourceHandle source, TypeConfig config) throws ConversionException {
        log.info("Counting rows in {}", source.name());
        long rows = 0;
        try (Timer.Context ignored = metrics.timer(Metrics.ROWCOUNT_TIME).time();
             CSVParser parser = CsvDialect.open(source, config)) {
            Iterator<CSVRecord> it = parser.iterator();
            try {
                while (it.hasNext()) {
                    it.next();
                    rows++;
                    if (rows % PROGRESS_EVERY_ROWS == 0) log.info("  counted {} rows so far", rows);
                }
            } catch (UncheckedIOException | IllegalStateException e) {
                throw CsvDialect.readFailure(source.name(), e, rows + 1, parser.getCurrentLineNumber() + 1);
            }
        } catch (IOException e) {
            throw new SourceUnreadableException(source.name(), "close failed: " + e.getMessage(), e);
        }
        log.info("Counted {} data rows in {}", rows, source.name());
        return rows;
    }
}
