package io.papertrail.runtime;

import io.papertrail.validate.ValidationResult;

import java.nio.file.Path;

/**
 * @param validation null when validation was not requested
 * @param stats      frozen statistics of the streaming pass
 */
public record ConversionResult(
        String source,
        Path output,
        long rowCount,
        ValidationResult validation,
        StreamingStats stats
) {
    public boolean validated() { return validation != null; }
}
