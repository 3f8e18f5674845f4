package io.papertrail.validate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of the validation tiers for one conversion. Flags of tiers that did not run stay false.
 */
public record ValidationResult(
        boolean rowCountValid,
        long rowCountExpected,
        long rowCountActual,
        boolean checksumValid,
        String checksumColumn,
        Double checksumExpected,
        Double checksumActual,
        Map<String, CountPair> nonNullCounts,
        boolean sampleValid,
        int sampleSize
) {
    public record CountPair(long expected, long actual) {
        public boolean matches() { return expected == actual; }
    }

    public ValidationResult {
        nonNullCounts = Collections.unmodifiableMap(new LinkedHashMap<>(nonNullCounts));
    }

    public boolean allValid() { return rowCountValid && checksumValid && sampleValid; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private boolean rowCountValid;
        private long rowCountExpected;
        private long rowCountActual;
        private boolean checksumValid;
        private String checksumColumn;
        private Double checksumExpected;
        private Double checksumActual;
        private final Map<String, CountPair> nonNullCounts = new LinkedHashMap<>();
        private boolean sampleValid;
        private int sampleSize;

        public Builder rowCount(long expected, long actual) {
            this.rowCountExpected = expected;
            this.rowCountActual = actual;
            this.rowCountValid = expected == actual;
            return this;
        }

        public Builder checksum(String column, double expected, double actual, boolean valid) {
            this.checksumColumn = column;
            this.checksumExpected = expected;
            this.checksumActual = actual;
            this.checksumValid = valid;
            return this;
        }

        public Builder checksumValid(boolean valid) { this.checksumValid = valid; return this; }

        public Builder nonNullCount(String column, long expected, long actual) {
            nonNullCounts.put(column, new CountPair(expected, actual));
            return this;
        }

        public Builder sample(int size, boolean valid) {
            this.sampleSize = size;
            this.sampleValid = valid;
            return this;
        }

        public ValidationResult build() {
            return new ValidationResult(rowCountValid, rowCountExpected, rowCountActual, checksumValid, checksumColumn,
                    checksumExpected, checksumActual, nonNullCounts, sampleValid, sampleSize);
        }
    }
}
