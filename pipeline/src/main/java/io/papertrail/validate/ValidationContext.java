package io.papertrail.validate;

import io.papertrail.config.TypeConfig;
import io.papertrail.runtime.StreamingStats;
import io.papertrail.source.SourceHandle;

import java.nio.file.Path;
import java.util.Random;

/**
 * Inputs shared by the validation tiers of one run.
 *
 * @param expectedRowCount data rows in the source as established by the row counter
 */
public record ValidationContext(
        SourceHandle source,
        Path output,
        StreamingStats stats,
        TypeConfig config,
        long expectedRowCount,
        int sampleSize,
        Random random
) {
    public String sourceName() { return source.name(); }
}
