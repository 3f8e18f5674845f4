package io.papertrail.aggregate;

import java.nio.file.Path;

/**
 * @param sourceRowCount rows of the source that passed the filter
 * @param validation     null when validation was not requested
 */
public record AggregationResult(
        Path source,
        Path output,
        long sourceRowCount,
        long outputKeyCount,
        AggregationValidationResult validation
) {
    public boolean validated() { return validation != null; }
}
