package io.papertrail.core;

import java.util.Objects;

/**
 * A payload tagged with its position in the source: the 0-based data row index and the 1-based physical
 * line the row starts on. Rows that embed line breaks in quoted fields span several lines, so the two
 * numbers diverge as a file is read.
 */
public final class Record<T> {
    private final long seq; // 0-based data row index
    private final long line; // 1-based physical line, header included
    private final T payload;

    public Record(long seq, long line, T payload) {
        this.seq = seq;
        this.line = line;
        this.payload = payload;
    }

    public long seq() { return seq; }
    public long rowNumber() { return seq + 1; }
    public long line() { return line; }
    public T payload() { return payload; }

    public <O> Record<O> withPayload(O other) { return new Record<>(seq, line, other); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record<?> that)) return false;
        return seq == that.seq && line == that.line && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seq, line, payload);
    }

    @Override
    public String toString() {
        return "Record{" +
                "seq=" + seq +
                ", line=" + line +
                ", payload=" + payload +
                '}';
    }
}
