package com.keelson.core.events;

import com.keelson.core.model.TaskKey;

import java.time.Instant;

/**
 * Envelope published on the {@link EventBus}.
 *
 * @param rev       revision the event was committed at
 * @param task      task the event belongs to; {@code null} for app-wide events
 * @param event     the client-visible event
 * @param timestamp when the event was published
 */
public record KeelsonEvent(
    long rev,
    TaskKey task,
    ServerEvent event,
    Instant timestamp
) {
    public static KeelsonEvent global(long rev, ServerEvent event) {
        return new KeelsonEvent(rev, null, event, Instant.now());
    }

    public static KeelsonEvent forTask(long rev, TaskKey task, ServerEvent event) {
        return new KeelsonEvent(rev, task, event, Instant.now());
    }

    public String eventType() {
        return event.getClass().getSimpleName();
    }
}
