package io.seriesfetch.core;

import java.util.Objects;

/**
 * A payload tagged with its position in a plan, so results completing out of order can be put back in order.
 */
public final class Sequenced<T> implements Comparable<Sequenced<?>> {
    private final long seq;
    private final T payload;

    public Sequenced(long seq, T payload) {
        this.seq = seq;
        this.payload = payload;
    }

    public long seq() { return seq; }
    public T payload() { return payload; }

    @Override
    public int compareTo(Sequenced<?> o) {
        return Long.compare(this.seq, o.seq);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sequenced<?> that)) return false;
        return seq == that.seq && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seq, payload);
    }

    @Override
    public String toString() {
        return "Sequenced{seq=" + seq + ", payload=" + payload + '}';
    }
}
