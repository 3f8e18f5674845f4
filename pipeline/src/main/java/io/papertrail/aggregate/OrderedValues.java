package io.papertrail.aggregate;

/** Total order over the values a column can hold: nulls first, numbers numerically, text lexically. */
final class OrderedValues {
    private OrderedValues() {}

    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compare(Object a, Object b) {
        if (a == null || b == null) return a == null ? (b == null ? 0 : -1) : 1;
        if (a instanceof Long x && b instanceof Long y) return Long.compare(x, y);
        if (a instanceof Number x && b instanceof Number y) return Double.compare(x.doubleValue(), y.doubleValue());
        return ((Comparable) a).compareTo(b);
    }
}
