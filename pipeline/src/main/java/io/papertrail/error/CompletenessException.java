package io.papertrail.error;

import java.util.List;

/** The aggregated output does not hold every distinct source key exactly once. */
public class CompletenessException extends ConversionException {
    public static final int MAX_EXAMPLES = 10;

    private final long sourceDistinct;
    private final long outputCount;
    private final long duplicates;
    private final List<String> missingExamples;
    private final List<String> extraExamples;

    public CompletenessException(String sourceName, long sourceDistinct, long outputCount, long duplicates,
                                 List<String> missingExamples, List<String> extraExamples) {
        super(sourceName, "completeness check failed: source has " + sourceDistinct + " distinct keys, output has "
                + outputCount + " rows (" + duplicates + " duplicate); missing e.g. " + missingExamples
                + ", extra e.g. " + extraExamples);
        this.sourceDistinct = sourceDistinct;
        this.outputCount = outputCount;
        this.duplicates = duplicates;
        this.missingExamples = List.copyOf(missingExamples);
        this.extraExamples = List.copyOf(extraExamples);
    }

    public long sourceDistinct() { return sourceDistinct; }
    public long outputCount() { return outputCount; }
    public long duplicates() { return duplicates; }
    public List<String> missingExamples() { return missingExamples; }
    public List<String> extraExamples() { return extraExamples; }
}
