package io.textimport.runtime;

import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity FIFO that can be closed. Once closed, sends are refused while receivers still
 * drain whatever is queued; a receive on a closed, empty channel returns empty.
 */
public class BoundedChannel<T> {
    private final ArrayDeque<T> items;
    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private boolean closed = false;

    public BoundedChannel(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Enqueue, blocking while the channel is full.
     *
     * @return false if the channel was closed before the item could be added
     */
    public boolean send(T item) throws InterruptedException {
        if (item == null) throw new NullPointerException("item");
        lock.lockInterruptibly();
        try {
            while (items.size() >= capacity && !closed) notFull.await();
            if (closed) return false;
            items.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dequeue, blocking while the channel is empty and open.
     *
     * @return the next item, or empty once the channel is closed and drained
     */
    public Optional<T> receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) notEmpty.await();
            T item = items.pollFirst();
            if (item != null) notFull.signal();
            return Optional.ofNullable(item);
        } finally {
            lock.unlock();
        }
    }

    /** Idempotent. Wakes every blocked sender and receiver. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try { return closed; } finally { lock.unlock(); }
    }
}
