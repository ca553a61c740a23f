package io.textimport.source;

import java.util.concurrent.atomic.LongAdder;

/** Running total of bytes consumed, readable from any thread. */
public class ByteCounter implements ByteCountObserver {
    private final LongAdder total = new LongAdder();

    @Override
    public void bytesConsumed(long count) { total.add(count); }

    public long size() { return total.sum(); }
}
