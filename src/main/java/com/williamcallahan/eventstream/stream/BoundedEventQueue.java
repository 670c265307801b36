package com.williamcallahan.eventstream.stream;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO with blocking put/take and explicit end-of-stream signals.
 *
 * <p>{@link #close()} is graceful: producers are refused but consumers drain what is
 * already queued before {@link #take()} reports the end. {@link #abort()} is abrupt: the
 * queue is emptied and every blocked producer and consumer returns at once.</p>
 *
 * @param <T> element type
 */
public final class BoundedEventQueue<T> {

    private final int capacity;
    private final ArrayDeque<T> elements;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition notEmpty = lock.newCondition();
    private boolean closed;

    public BoundedEventQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.elements = new ArrayDeque<>(capacity);
    }

    /**
     * Appends an element, waiting while the queue is full.
     *
     * @return true if the element was queued, false if the queue was closed or aborted
     * @throws InterruptedException if interrupted while waiting for space
     */
    public boolean put(T element) throws InterruptedException {
        Objects.requireNonNull(element, "element");
        lock.lockInterruptibly();
        try {
            while (!closed && elements.size() >= capacity) {
                notFull.await();
            }
            if (closed) {
                return false;
            }
            elements.addLast(element);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest element, waiting while the queue is empty and open.
     *
     * @return the element, or empty once the queue is closed and drained
     * @throws InterruptedException if interrupted while waiting for an element
     */
    public Optional<T> take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (elements.isEmpty() && !closed) {
                notEmpty.await();
            }
            T head = elements.pollFirst();
            if (head != null) {
                notFull.signal();
            }
            return Optional.ofNullable(head);
        } finally {
            lock.unlock();
        }
    }

    /** Refuses further elements; queued elements remain available to consumers. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notFull.signalAll();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Discards queued elements and releases every waiter. */
    public void abort() {
        lock.lock();
        try {
            closed = true;
            elements.clear();
            notFull.signalAll();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return elements.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
