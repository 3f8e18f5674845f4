package io.papertrail.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Describes one dataset kind: the columns it must have, how each is typed, which raw values mean null,
 * which columns are tracked for non-null counts and which one is summed for the checksum tier. Also
 * carries the text dialect the source is written in. Immutable; build with {@link #builder(String)}.
 */
public final class TypeConfig {
    public static final int DEFAULT_SAMPLE_SIZE = 1000;

    private final String name;
    private final List<String> expectedColumns;
    private final Map<String, ColumnType> columnTypes;
    private final Set<String> nullTokens;
    private final List<String> keyColumns;
    private final String checksumColumn;
    private final int defaultSampleSize;
    private final Charset charset;
    private final char delimiter;

    private TypeConfig(Builder b) {
        this.name = b.name;
        this.expectedColumns = List.copyOf(b.expectedColumns);
        this.columnTypes = Collections.unmodifiableMap(new LinkedHashMap<>(b.columnTypes));
        this.nullTokens = Collections.unmodifiableSet(new LinkedHashSet<>(b.nullTokens));
        this.keyColumns = List.copyOf(b.keyColumns);
        this.checksumColumn = b.checksumColumn;
        this.defaultSampleSize = b.defaultSampleSize;
        this.charset = b.charset;
        this.delimiter = b.delimiter;
    }

    public static Builder builder(String name) { return new Builder(name); }

    public String name() { return name; }
    public List<String> expectedColumns() { return expectedColumns; }
    public Map<String, ColumnType> columnTypes() { return columnTypes; }
    public Set<String> nullTokens() { return nullTokens; }
    public List<String> keyColumns() { return keyColumns; }
    public Optional<String> checksumColumn() { return Optional.ofNullable(checksumColumn); }
    public int defaultSampleSize() { return defaultSampleSize; }
    public Charset charset() { return charset; }
    public char delimiter() { return delimiter; }

    /** Declared type of a column; undeclared columns are read as text. */
    public ColumnType typeOf(String column) {
        return columnTypes.getOrDefault(column, ColumnType.STRING);
    }

    public boolean isNullToken(String raw) {
        return raw == null || nullTokens.contains(raw);
    }

    /** The expected columns with their declared types, in declared order. */
    public List<SchemaField> expectedSchema() {
        List<SchemaField> out = new ArrayList<>(expectedColumns.size());
        for (String c : expectedColumns) out.add(new SchemaField(c, typeOf(c)));
        return out;
    }

    @Override
    public String toString() {
        return "TypeConfig{" + name + ", columns=" + expectedColumns.size() + ", checksum=" + checksumColumn + "}";
    }

    public static final class Builder {
        private final String name;
        private final List<String> expectedColumns = new ArrayList<>();
        private final Map<String, ColumnType> columnTypes = new LinkedHashMap<>();
        private final Set<String> nullTokens = new LinkedHashSet<>();
        private final List<String> keyColumns = new ArrayList<>();
        private String checksumColumn;
        private int defaultSampleSize = DEFAULT_SAMPLE_SIZE;
        private Charset charset = StandardCharsets.UTF_8;
        private char delimiter = ',';

        private Builder(String name) { this.name = Objects.requireNonNull(name, "name"); }

        public Builder column(String column, ColumnType type) {
            if (columnTypes.containsKey(column)) throw new IllegalArgumentException("duplicate column: " + column);
            expectedColumns.add(column);
            columnTypes.put(column, type);
            return this;
        }

        public Builder integers(String... columns) { for (String c : columns) column(c, ColumnType.INTEGER); return this; }
        public Builder floats(String... columns) { for (String c : columns) column(c, ColumnType.FLOAT); return this; }
        public Builder strings(String... columns) { for (String c : columns) column(c, ColumnType.STRING); return this; }

        public Builder nullTokens(String... tokens) { nullTokens.addAll(List.of(tokens)); return this; }
        public Builder keyColumns(String... columns) { keyColumns.addAll(List.of(columns)); return this; }
        public Builder checksumColumn(String column) { this.checksumColumn = column; return this; }
        public Builder defaultSampleSize(int n) { this.defaultSampleSize = n; return this; }
        public Builder charset(Charset cs) { this.charset = Objects.requireNonNull(cs); return this; }
        public Builder delimiter(char d) { this.delimiter = d; return this; }

        public TypeConfig build() {
            if (expectedColumns.isEmpty()) throw new IllegalStateException("no columns declared for " + name);
            for (String k : keyColumns) {
                if (!columnTypes.containsKey(k)) throw new IllegalStateException("key column not declared: " + k);
            }
            if (checksumColumn != null) {
                ColumnType t = columnTypes.get(checksumColumn);
                if (t == null || !t.isNumeric()) throw new IllegalStateException("checksum column must be a declared numeric column: " + checksumColumn);
            }
            if (columnTypes.containsValue(ColumnType.INTEGER_LIST)) throw new IllegalStateException("list columns cannot be read from text");
            if (defaultSampleSize < 0) throw new IllegalStateException("defaultSampleSize must be >= 0");
            return new TypeConfig(this);
        }
    }
}
