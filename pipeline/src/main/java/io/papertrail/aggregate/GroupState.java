package io.papertrail.aggregate;

import io.papertrail.runtime.CompensatedSum;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Running reductions for one key. Each output column keeps only what its reduction needs, so memory grows
 * with the number of keys, plus the list entries of LIST columns.
 */
final class GroupState {
    private final Object key;
    private final Accumulator[] accumulators;

    GroupState(Object key, List<OutputColumn> columns) {
        this.key = key;
        this.accumulators = new Accumulator[columns.size()];
        for (int i = 0; i < accumulators.length; i++) accumulators[i] = newAccumulator(columns.get(i));
    }

    /**
     * @param values source value for each output column, in output column order
     */
    void accept(Object[] values, Object order, long seq) {
        for (int i = 0; i < accumulators.length; i++) accumulators[i].accept(values[i], order, seq);
    }

    Object[] result() {
        Object[] out = new Object[accumulators.length];
        for (int i = 0; i < out.length; i++) out[i] = accumulators[i].result(key);
        return out;
    }

    private static Accumulator newAccumulator(OutputColumn column) {
        return switch (column.reduction()) {
            case KEY -> new KeyAcc();
            case MIN -> new ExtremeAcc(-1);
            case MAX -> new ExtremeAcc(1);
            case COUNT -> new CountAcc();
            case SUM -> new SumAcc(column.conditional());
            case AVG -> new AvgAcc();
            case LIST -> new ListAcc();
            case LATEST -> new LatestAcc();
        };
    }

    private interface Accumulator {
        void accept(Object value, Object order, long seq);

        Object result(Object key);
    }

    private static final class KeyAcc implements Accumulator {
        public void accept(Object value, Object order, long seq) {}
        public Object result(Object key) { return key; }
    }

    private static final class ExtremeAcc implements Accumulator {
        private final int sign;
        private Object best;

        ExtremeAcc(int sign) { this.sign = sign; }

        public void accept(Object value, Object order, long seq) {
            if (value == null) return;
            if (best == null || sign * OrderedValues.compare(value, best) > 0) best = value;
        }

        public Object result(Object key) { return best; }
    }

    private static final class CountAcc implements Accumulator {
        private long n;

        public void accept(Object value, Object order, long seq) { if (value != null) n++; }
        public Object result(Object key) { return n; }
    }

    private static final class SumAcc implements Accumulator {
        private final CompensatedSum sum = new CompensatedSum();
        private final boolean zeroWhenEmpty;

        SumAcc(boolean zeroWhenEmpty) { this.zeroWhenEmpty = zeroWhenEmpty; }

        public void accept(Object value, Object order, long seq) { sum.addIfPresent(value); }
        public Object result(Object key) {
            if (sum.count() == 0) return zeroWhenEmpty ? 0.0 : null;
            return sum.value();
        }
    }

    private static final class AvgAcc implements Accumulator {
        private final CompensatedSum sum = new CompensatedSum();

        public void accept(Object value, Object order, long seq) { sum.addIfPresent(value); }
        public Object result(Object key) { return sum.count() == 0 ? null : sum.value() / sum.count(); }
    }

    private static final class ListAcc implements Accumulator {
        private record Entry(Object order, long seq, Object value) {}

        private static final Comparator<Entry> ORDER = (a, b) -> {
            int c = OrderedValues.compare(a.order(), b.order());
            return c != 0 ? c : Long.compare(a.seq(), b.seq());
        };

        private final List<Entry> entries = new ArrayList<>();

        public void accept(Object value, Object order, long seq) { entries.add(new Entry(order, seq, value)); }

        public Object result(Object key) {
            entries.sort(ORDER);
            List<Object> out = new ArrayList<>(entries.size());
            for (Entry e : entries) out.add(e.value());
            return out;
        }
    }

    private static final class LatestAcc implements Accumulator {
        private boolean seen;
        private Object order;
        private Object value;

        public void accept(Object value, Object order, long seq) {
            // rows arrive in source order, so >= hands ties to the later row
            if (!seen || OrderedValues.compare(order, this.order) >= 0) {
                this.seen = true;
                this.order = order;
                this.value = value;
            }
        }

        public Object result(Object key) { return value; }
    }
}
