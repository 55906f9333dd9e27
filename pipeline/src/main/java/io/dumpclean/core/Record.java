package io.dumpclean.core;

import java.util.Objects;

/**
 * A generic record wrapper that carries a payload and its position in the source.
 */
public final class Record<T> {
    private final long seq; // monotonically increasing across the source
    private final T payload;

    public Record(long seq, T payload) {
        this.seq = seq;
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public long seq() { return seq; }
    public T payload() { return payload; }

    /** Same position, new payload. Used by transforms that rewrite a record. */
    public <R> Record<R> withPayload(R newPayload) {
        return new Record<>(seq, newPayload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record<?> that)) return false;
        return seq == that.seq && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seq, payload);
    }

    @Override
    public String toString() {
        return "Record{" +
                "seq=" + seq +
                ", payload=" + payload +
                '}';
    }
}
