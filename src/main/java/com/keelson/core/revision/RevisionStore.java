package com.keelson.core.revision;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide revision counter.
 * <p>
 * Every committed mutation that changes a client-visible snapshot advances the revision
 * by exactly one. Clients compare their last seen revision against {@link #current()} to
 * decide whether they need a full resync. The only caller of {@link #bump()} is the
 * {@link com.keelson.core.engine.CommandDispatcher}.
 */
@Component
public class RevisionStore {

    private final AtomicLong rev = new AtomicLong();

    public long current() {
        return rev.get();
    }

    /**
     * Advances the revision by one and returns the new value.
     */
    public long bump() {
        return rev.incrementAndGet();
    }
}
