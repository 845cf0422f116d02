package io.seriesfetch.runtime;

import io.seriesfetch.core.Sequenced;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Buffers out-of-order results and releases them in increasing seq order, starting at a given seq.
 * A seq may be added only once. Not thread-safe; callers confine it to one thread.
 */
public class OrderedBuffer<T> {
    private long nextSeq;
    private final TreeMap<Long, Sequenced<T>> buffer = new TreeMap<>();

    public OrderedBuffer(long startingSeq) {
        this.nextSeq = startingSeq;
    }

    public void add(Sequenced<T> item) {
        if (item.seq() < nextSeq || buffer.containsKey(item.seq())) {
            throw new IllegalStateException("seq " + item.seq() + " already added");
        }
        buffer.put(item.seq(), item);
    }

    /**
     * Pop the next item in order, or null if it has not arrived yet.
     */
    public Sequenced<T> pollNext() {
        Map.Entry<Long, Sequenced<T>> first = buffer.firstEntry();
        if (first == null || first.getKey() != nextSeq) return null;
        buffer.pollFirstEntry();
        nextSeq++;
        return first.getValue();
    }

    /** Pops every item that is ready, in order. */
    public List<T> drainReady() {
        List<T> out = new ArrayList<>();
        Sequenced<T> next;
        while ((next = pollNext()) != null) {
            out.add(next.payload());
        }
        return out;
    }

    public long nextSeq() { return nextSeq; }
    public int pending() { return buffer.size(); }
}
