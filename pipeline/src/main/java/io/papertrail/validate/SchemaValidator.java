package io.papertrail.validate;

import io.papertrail.config.SchemaField;
import io.papertrail.config.TypeConfig;
import io.papertrail.error.SchemaValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** Checks that the realized column names are exactly the expected set. Order is not significant. */
public class SchemaValidator {
    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    public void validate(String sourceName, List<SchemaField> observed, TypeConfig config) throws SchemaValidationException {
        Set<String> actual = new TreeSet<>();
        for (SchemaField f : observed) actual.add(f.name());
        Set<String> expected = new TreeSet<>(config.expectedColumns());

        Set<String> missing = new TreeSet<>(expected);
        missing.removeAll(actual);
        Set<String> extra = new TreeSet<>(actual);
        extra.removeAll(expected);
        if (!missing.isEmpty() || !extra.isEmpty()) {
            log.warn("Schema of {} does not match {}: missing={} extra={}", sourceName, config.name(), missing, extra);
            throw new SchemaValidationException(sourceName, List.copyOf(missing), List.copyOf(extra));
        }
        log.info("Schema OK: {} columns", actual.size());
    }
}
