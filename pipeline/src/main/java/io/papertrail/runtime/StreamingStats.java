package io.papertrail.runtime;

import io.papertrail.config.SchemaField;
import io.papertrail.config.TypeConfig;
import io.papertrail.core.Record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Statistics accumulated while a source streams through the converter: row count, the checksum column's
 * compensated sum (nulls and NaN excluded) and non-null counts of the key columns present in the source.
 * Owned by one run; {@link #freeze()} at the end makes it read-only.
 */
public final class StreamingStats {
    private final String configuredChecksumColumn;
    private final List<String> keyColumns;
    private final CompensatedSum checksum = new CompensatedSum();
    private final Map<String, Long> nonNullCounts = new LinkedHashMap<>();
    private List<SchemaField> observedSchema = List.of();
    private long rowCount = 0;
    private int checksumIndex = -1;
    private int[] keyIndexes = new int[0];
    private String[] keyNames = new String[0];
    private boolean schemaObserved = false;
    private boolean frozen = false;

    public StreamingStats(TypeConfig config) {
        this.configuredChecksumColumn = config.checksumColumn().orElse(null);
        this.keyColumns = config.keyColumns();
    }

    /** Fixes the realized schema and resolves which tracked columns it contains. Called once per run. */
    public void observeSchema(List<SchemaField> schema) {
        checkOpen();
        if (schemaObserved) throw new IllegalStateException("schema already observed");
        this.observedSchema = List.copyOf(schema);
        this.schemaObserved = true;
        List<Integer> idx = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (String k : keyColumns) {
            int i = indexOf(k);
            if (i < 0) continue;
            idx.add(i);
            names.add(k);
            nonNullCounts.put(k, 0L);
        }
        this.keyIndexes = idx.stream().mapToInt(Integer::intValue).toArray();
        this.keyNames = names.toArray(new String[0]);
        this.checksumIndex = configuredChecksumColumn == null ? -1 : indexOf(configuredChecksumColumn);
    }

    public void addBatch(List<Record<Object[]>> batch) {
        checkOpen();
        if (!schemaObserved) throw new IllegalStateException("schema not observed yet");
        long[] counts = new long[keyIndexes.length];
        for (Record<Object[]> r : batch) {
            Object[] row = r.payload();
            if (checksumIndex >= 0) checksum.addIfPresent(row[checksumIndex]);
            for (int k = 0; k < keyIndexes.length; k++) {
                if (row[keyIndexes[k]] != null) counts[k]++;
            }
        }
        for (int k = 0; k < keyNames.length; k++) nonNullCounts.merge(keyNames[k], counts[k], Long::sum);
        rowCount += batch.size();
    }

    public void freeze() { frozen = true; }

    public boolean isFrozen() { return frozen; }

    public long rowCount() { return rowCount; }

    /** The checksum column, when configured and present in the source. */
    public Optional<String> checksumColumn() {
        return checksumIndex >= 0 ? Optional.of(configuredChecksumColumn) : Optional.empty();
    }

    public double checksumSum() { return checksum.value(); }

    public Map<String, Long> nonNullCounts() { return Collections.unmodifiableMap(nonNullCounts); }

    public List<SchemaField> observedSchema() { return observedSchema; }

    private int indexOf(String column) {
        for (int i = 0; i < observedSchema.size(); i++) {
            if (observedSchema.get(i).name().equals(column)) return i;
        }
        return -1;
    }

    private void checkOpen() {
        if (frozen) throw new IllegalStateException("stats are frozen");
    }

    @Override
    public String toString() {
        return "StreamingStats{rows=" + rowCount + ", checksum=" + checksumColumn().map(c -> c + "=" + checksumSum()).orElse("n/a")
                + ", nonNull=" + nonNullCounts + "}";
    }
}
