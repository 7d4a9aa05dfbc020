package com.keelson.core.pty;

import java.util.ArrayList;
import java.util.List;

/**
 * Ring buffer holding the most recent output bytes of a terminal session, plus the
 * listeners tailing it.
 * <p>
 * {@link #attach} takes the replay snapshot and registers the listener under the same
 * lock that {@link #write} holds, so a listener sees every byte exactly once: either in
 * the snapshot or as a live chunk.
 */
public class PtyReplayBuffer {

    private final byte[] ring;
    private int start;
    private int size;
    private final List<PtyListener> listeners = new ArrayList<>();
    private boolean exited;
    private Integer exitCode;

    public PtyReplayBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.ring = new byte[capacity];
    }

    /**
     * Appends output and forwards it to live listeners. Listeners that refuse the chunk are
     * detached and told so after the lock is released.
     */
    public void write(byte[] chunk) {
        if (chunk.length == 0) {
            return;
        }
        List<PtyListener> dropped = new ArrayList<>();
        synchronized (this) {
            appendToRing(chunk);
            for (PtyListener listener : List.copyOf(listeners)) {
                if (!listener.offer(chunk)) {
                    listeners.remove(listener);
                    dropped.add(listener);
                }
            }
        }
        for (PtyListener listener : dropped) {
            listener.onOverflow();
        }
    }

    /**
     * Registers a listener and returns the bytes it must replay first. When the program has
     * already exited the attachment says so, since {@link PtyListener#onExit} will not fire.
     */
    public synchronized Attachment attach(PtyListener listener) {
        byte[] replay = snapshot();
        listeners.add(listener);
        return new Attachment(replay, exited, exitCode);
    }

    public synchronized void detach(PtyListener listener) {
        listeners.remove(listener);
    }

    public synchronized byte[] snapshot() {
        return copyLast(size);
    }

    /**
     * The last {@code maxBytes} bytes of output.
     */
    public synchronized byte[] tail(int maxBytes) {
        return copyLast(Math.min(Math.max(0, maxBytes), size));
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return ring.length;
    }

    public synchronized int listenerCount() {
        return listeners.size();
    }

    synchronized void markRunning() {
        exited = false;
        exitCode = null;
    }

    void notifyExit(Integer code) {
        List<PtyListener> current;
        synchronized (this) {
            exited = true;
            exitCode = code;
            current = List.copyOf(listeners);
        }
        for (PtyListener listener : current) {
            listener.onExit(code);
        }
    }

    private void appendToRing(byte[] chunk) {
        int capacity = ring.length;
        int offset = 0;
        int length = chunk.length;
        if (length >= capacity) {
            offset = length - capacity;
            length = capacity;
            start = 0;
            size = 0;
        }
        for (int i = 0; i < length; ) {
            int writePos = (start + size) % capacity;
            int n = Math.min(length - i, capacity - writePos);
            System.arraycopy(chunk, offset + i, ring, writePos, n);
            i += n;
            int overflow = size + n - capacity;
            if (overflow > 0) {
                start = (start + overflow) % capacity;
                size = capacity;
            } else {
                size += n;
            }
        }
    }

    private byte[] copyLast(int n) {
        byte[] out = new byte[n];
        int capacity = ring.length;
        int from = (start + size - n) % capacity;
        int first = Math.min(n, capacity - from);
        System.arraycopy(ring, from, out, 0, first);
        if (first < n) {
            System.arraycopy(ring, 0, out, first, n - first);
        }
        return out;
    }

    /**
     * @param replay   history to send before live output
     * @param exited   whether the program had already exited at attach time
     * @param exitCode its exit status when it had
     */
    public record Attachment(byte[] replay, boolean exited, Integer exitCode) {}
}
