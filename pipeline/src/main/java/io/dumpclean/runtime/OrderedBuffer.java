package io.dumpclean.runtime;

import java.util.TreeMap;

/**
 * Buffers out-of-order items and releases them in increasing seq order with no gaps.
 * Every seq from the starting one onward must eventually be added, otherwise everything
 * behind the gap stays buffered.
 */
public class OrderedBuffer<T> {
    private long nextSeq;
    private final TreeMap<Long, T> buffer = new TreeMap<>();

    public OrderedBuffer(long startingSeq) {
        this.nextSeq = startingSeq;
    }

    public void add(long seq, T item) {
        if (seq < nextSeq || buffer.containsKey(seq)) {
            throw new IllegalArgumentException("seq " + seq + " already released or buffered");
        }
        buffer.put(seq, item);
    }

    /**
     * Try to pop the next item in order, or null if not ready.
     */
    public T pollNext() {
        T item = buffer.remove(nextSeq);
        if (item != null) nextSeq++;
        return item;
    }

    public int pending() { return buffer.size(); }

    public long nextSeq() { return nextSeq; }
}
