package io.textimport.runtime;

import io.textimport.core.ConversionOutcome;

import java.util.Map;
import java.util.TreeMap;

/**
 * Buffers out-of-order outcomes and releases them in increasing index order. Owned by one thread.
 */
public class OrderedBuffer<D> {
    private long nextIndex;
    private final TreeMap<Long, ConversionOutcome<D>> buffer = new TreeMap<>();

    public OrderedBuffer(long startingIndex) {
        this.nextIndex = startingIndex;
    }

    public void add(ConversionOutcome<D> outcome) {
        if (outcome.index() < nextIndex || buffer.putIfAbsent(outcome.index(), outcome) != null) {
            throw new IllegalStateException("duplicate outcome for index " + outcome.index());
        }
    }

    /**
     * Pop the outcome at the cursor and advance it, or null if that index has not arrived yet.
     */
    public ConversionOutcome<D> pollNext() {
        Map.Entry<Long, ConversionOutcome<D>> first = buffer.firstEntry();
        if (first == null || first.getKey() != nextIndex) return null;
        buffer.pollFirstEntry();
        nextIndex++;
        return first.getValue();
    }

    public long nextIndex() { return nextIndex; }
    public int size() { return buffer.size(); }
    public boolean isEmpty() { return buffer.isEmpty(); }

    /** Drop everything still buffered; returns how many outcomes were dropped. */
    public int clear() {
        int n = buffer.size();
        buffer.clear();
        return n;
    }
}
