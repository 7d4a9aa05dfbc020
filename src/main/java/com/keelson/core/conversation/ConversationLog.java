package com.keelson.core.conversation;

import com.keelson.core.model.AgentItem;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only event log of a single task.
 * <p>
 * Entries are never edited or removed, so a page cut for a given {@code before} cursor is
 * stable under concurrent appends. Writers are serialized by the owning task's lock; the
 * read/write lock here only protects readers that do not hold it (HTTP reads).
 */
public class ConversationLog {

    private final int maxPageSize;
    private final List<ConversationEntry> entries = new ArrayList<>();
    private final Map<String, AgentItem> latestItems = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public ConversationLog(int maxPageSize) {
        if (maxPageSize < 1) {
            throw new IllegalArgumentException("maxPageSize must be positive");
        }
        this.maxPageSize = maxPageSize;
    }

    /**
     * Appends an event and returns the new entry. Entry ids are {@code e_<n>}, n being the
     * 1-based position in the log.
     */
    public ConversationEntry append(ConversationEvent event, long createdAtUnixMs) {
        lock.writeLock().lock();
        try {
            ConversationEntry entry = event.toEntry("e_" + (entries.size() + 1), createdAtUnixMs);
            entries.add(entry);
            if (event instanceof AgentEvent.Item item) {
                latestItems.put(item.item().id(), item.item());
            }
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Appends an agent item unless it is identical to the latest recorded state of the item
     * with the same id.
     *
     * @return the new entry, or empty when the item was a duplicate
     */
    public Optional<ConversationEntry> appendItem(AgentItem item, long createdAtUnixMs) {
        lock.writeLock().lock();
        try {
            AgentItem previous = latestItems.get(item.id());
            if (item.equals(previous)) {
                return Optional.empty();
            }
            return Optional.of(append(new AgentEvent.Item(item), createdAtUnixMs));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the page ending just before position {@code before}.
     *
     * @param before position cursor; {@code null} means the end of the log, values above the
     *               total are clamped to it
     * @param limit  page size; {@code null} means everything from position 0, otherwise clamped
     *               to {@code [1, maxPageSize]}
     */
    public ConversationPage page(Integer before, Integer limit) {
        lock.readLock().lock();
        try {
            int total = entries.size();
            int end = before == null ? total : Math.max(0, Math.min(before, total));
            int start = 0;
            if (limit != null) {
                int bounded = Math.max(1, Math.min(limit, maxPageSize));
                start = Math.max(0, end - bounded);
            }
            return new ConversationPage(new ArrayList<>(entries.subList(start, end)), total, start);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
