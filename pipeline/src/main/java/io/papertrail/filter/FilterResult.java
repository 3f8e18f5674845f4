package io.papertrail.filter;

import java.nio.file.Path;

/**
 * @param validation null when validation was not requested
 */
public record FilterResult(
        Path source,
        Path output,
        RowCondition keep,
        long sourceRowCount,
        long keptRowCount,
        FilterValidationResult validation
) {
    public long droppedRowCount() { return sourceRowCount - keptRowCount; }

    public boolean validated() { return validation != null; }
}
