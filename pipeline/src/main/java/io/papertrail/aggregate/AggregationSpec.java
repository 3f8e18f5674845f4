package io.papertrail.aggregate;

import io.papertrail.config.ColumnType;
import io.papertrail.config.SchemaField;
import io.papertrail.filter.RowCondition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes a group-by over a columnar source: the key column, the column that orders rows inside a group,
 * an optional lower bound on that ordering value, and the output columns with their reductions. COUNT, SUM
 * and AVG columns may carry a {@link RowCondition}; rows failing it are left out of that column only. Rows
 * with a null key are always dropped. Build with {@link #builder(String)}.
 */
public final class AggregationSpec {
    private final String name;
    private final String keyColumn;
    private final String orderColumn;
    private final Long minOrder;
    private final List<OutputColumn> columns;
    private final List<String> sourceColumns;
    private final int[] valueIndex;
    private final int[] conditionIndex;

    private AggregationSpec(Builder b) {
        this.name = b.name;
        this.keyColumn = b.keyColumn;
        this.orderColumn = b.orderColumn;
        this.minOrder = b.minOrder;
        this.columns = List.copyOf(b.columns);

        List<String> src = new ArrayList<>();
        src.add(keyColumn);
        if (!src.contains(orderColumn)) src.add(orderColumn);
        for (OutputColumn c : columns) if (!src.contains(c.sourceColumn())) src.add(c.sourceColumn());
        for (OutputColumn c : columns) if (c.conditional() && !src.contains(c.when().column())) src.add(c.when().column());
        this.sourceColumns = List.copyOf(src);
        this.valueIndex = new int[columns.size()];
        this.conditionIndex = new int[columns.size()];
        for (int i = 0; i < valueIndex.length; i++) {
            OutputColumn c = columns.get(i);
            valueIndex[i] = src.indexOf(c.sourceColumn());
            conditionIndex[i] = c.conditional() ? src.indexOf(c.when().column()) : -1;
        }
    }

    public static Builder builder(String name) { return new Builder(name); }

    public String name() { return name; }
    public String keyColumn() { return keyColumn; }
    public String orderColumn() { return orderColumn; }
    public Optional<Long> minOrder() { return Optional.ofNullable(minOrder); }
    public List<OutputColumn> columns() { return columns; }

    /** Name of the output column carrying the key. */
    public String keyOutputColumn() {
        for (OutputColumn c : columns) if (c.reduction() == Reduction.KEY) return c.name();
        throw new IllegalStateException("no key column");
    }

    /** Source columns to read: key, ordering column, value columns, then condition columns, each once. */
    public List<String> sourceColumns() { return sourceColumns; }

    /**
     * Projects a row read with {@link #sourceColumns()} onto the output columns. A conditional column whose
     * condition fails gets null, which every conditional reduction skips.
     */
    public Object[] columnValues(Object[] sourceRow) {
        Object[] out = new Object[valueIndex.length];
        for (int i = 0; i < out.length; i++) {
            int cond = conditionIndex[i];
            if (cond >= 0 && !columns.get(i).when().test(sourceRow[cond])) continue;
            out[i] = sourceRow[valueIndex[i]];
        }
        return out;
    }

    /** Whether a source row with this key and ordering value takes part in the aggregation. */
    public boolean includes(Object key, Object order) {
        if (key == null) return false;
        if (minOrder == null) return true;
        return order instanceof Number n && n.doubleValue() >= minOrder;
    }

    /** Output schema given the source column types. */
    public List<SchemaField> outputSchema(Map<String, ColumnType> sourceTypes) {
        List<SchemaField> out = new ArrayList<>(columns.size());
        for (OutputColumn c : columns) {
            ColumnType t = sourceTypes.get(c.sourceColumn());
            if (t == null) throw new IllegalArgumentException("source column not present: " + c.sourceColumn());
            out.add(new SchemaField(c.name(), c.reduction().outputType(t)));
        }
        return out;
    }

    @Override
    public String toString() {
        return "AggregationSpec{" + name + ", key=" + keyColumn + ", order=" + orderColumn
                + (minOrder != null ? ", " + orderColumn + ">=" + minOrder : "") + ", columns=" + columns.size() + "}";
    }

    public static final class Builder {
        private final String name;
        private String keyColumn;
        private String orderColumn;
        private Long minOrder;
        private final List<OutputColumn> columns = new ArrayList<>();

        private Builder(String name) { this.name = Objects.requireNonNull(name, "name"); }

        /** Groups by this column and emits it under the same name. */
        public Builder key(String column) {
            if (keyColumn != null) throw new IllegalStateException("key already set");
            this.keyColumn = column;
            return column(column, Reduction.KEY, column);
        }

        public Builder orderBy(String column) { this.orderColumn = column; return this; }
        public Builder minOrder(long min) { this.minOrder = min; return this; }

        public Builder latest(String column) { return column(column, Reduction.LATEST, column); }
        public Builder latest(String output, String source) { return column(output, Reduction.LATEST, source); }
        public Builder list(String output, String source) { return column(output, Reduction.LIST, source); }
        public Builder min(String output, String source) { return column(output, Reduction.MIN, source); }
        public Builder max(String output, String source) { return column(output, Reduction.MAX, source); }
        public Builder sum(String output, String source) { return column(output, Reduction.SUM, source); }
        public Builder count(String output, String source) { return column(output, Reduction.COUNT, source); }
        public Builder avg(String output, String source) { return column(output, Reduction.AVG, source); }
        public Builder sumWhere(String output, String source, RowCondition when) { return column(output, Reduction.SUM, source, when); }
        public Builder countWhere(String output, String source, RowCondition when) { return column(output, Reduction.COUNT, source, when); }

        public Builder column(String output, Reduction reduction, String source) {
            return column(output, reduction, source, null);
        }

        public Builder column(String output, Reduction reduction, String source, RowCondition when) {
            for (OutputColumn c : columns) {
                if (c.name().equals(output)) throw new IllegalArgumentException("duplicate output column: " + output);
            }
            columns.add(new OutputColumn(output, reduction, source, when));
            return this;
        }

        public AggregationSpec build() {
            if (keyColumn == null) throw new IllegalStateException("key column required for " + name);
            if (orderColumn == null) throw new IllegalStateException("ordering column required for " + name);
            return new AggregationSpec(this);
        }
    }
}
