package io.papertrail.aggregate;

/**
 * Outcome of the aggregation tiers.
 *
 * @param aggregationChecksPassed individual field comparisons made by the integrity tier
 * @param sampleSize              keys examined by the sample tier
 */
public record AggregationValidationResult(
        boolean completenessValid,
        long sourceDistinctCount,
        long outputCount,
        boolean aggregationValid,
        int aggregationChecksPassed,
        boolean sampleValid,
        int sampleSize
) {
    public boolean allValid() { return completenessValid && aggregationValid && sampleValid; }
}
