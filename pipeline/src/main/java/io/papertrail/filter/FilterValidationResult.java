package io.papertrail.filter;

/**
 * Outcome of the filter tiers.
 *
 * @param expectedRows source rows satisfying the condition, counted independently of the filter run
 * @param sampleSize   output rows compared with their source rows
 */
public record FilterValidationResult(
        boolean rowCountValid,
        long sourceRows,
        long expectedRows,
        long outputRows,
        boolean conditionValid,
        boolean sampleValid,
        int sampleSize
) {
    public boolean allValid() { return rowCountValid && conditionValid && sampleValid; }
}
