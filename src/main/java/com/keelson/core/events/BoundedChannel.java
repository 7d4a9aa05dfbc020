package com.keelson.core.events;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-consumer queue with a fixed capacity whose producers never block.
 * <p>
 * When an offer finds the queue full, every queued item is dropped and the channel is
 * marked lagged; the consumer's next {@link #take} reports {@link Delivery#lagged()} once
 * and it is then expected to resynchronize from a full snapshot.
 *
 * @param <T> item type
 */
public class BoundedChannel<T> {

    private final int capacity;
    private final ArrayDeque<T> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private boolean lagged;
    private boolean closed;

    public BoundedChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(capacity);
    }

    /**
     * Enqueues an item without blocking.
     *
     * @return false when the channel is closed or overflowed
     */
    public boolean offer(T item) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (lagged) {
                // consumer has not yet observed the overflow; it will resync anyway
                return false;
            }
            if (queue.size() >= capacity) {
                queue.clear();
                lagged = true;
                notEmpty.signalAll();
                return false;
            }
            queue.addLast(item);
            notEmpty.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next delivery.
     *
     * @return the next delivery, or {@code null} on timeout
     */
    public Delivery<T> poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (queue.isEmpty() && !lagged && !closed) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return next();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the next delivery.
     */
    public Delivery<T> take() throws InterruptedException {
        lock.lock();
        try {
            while (queue.isEmpty() && !lagged && !closed) {
                notEmpty.await();
            }
            return next();
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            queue.clear();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private Delivery<T> next() {
        if (closed) {
            return Delivery.closedChannel();
        }
        if (lagged) {
            lagged = false;
            return Delivery.lag();
        }
        return Delivery.of(queue.pollFirst());
    }

    /**
     * Result of a take: an item, a lag notice or the end of the channel.
     */
    public record Delivery<T>(T item, boolean lagged, boolean closed) {

        static <T> Delivery<T> of(T item) {
            return new Delivery<>(item, false, false);
        }

        static <T> Delivery<T> lag() {
            return new Delivery<>(null, true, false);
        }

        static <T> Delivery<T> closedChannel() {
            return new Delivery<>(null, false, true);
        }
    }
}
