package com.keelson.core.events;

import com.keelson.core.model.TaskKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for committed state changes.
 * <p>
 * Supports per-task subscriptions (conversation SSE streams) and global subscriptions
 * (WebSocket connections). Publishing runs subscribers on the caller's thread, so
 * subscribers must not block; connections hand events to a {@link BoundedChannel}.
 * Events are published in revision order, so every subscriber sees them in commit order.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-task subscribers. */
    private final ConcurrentHashMap<TaskKey, CopyOnWriteArrayList<Consumer<KeelsonEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<KeelsonEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (task-specific and global).
     */
    public void publish(KeelsonEvent event) {
        log.debug("Publishing {} at rev {} for task {}", event.eventType(), event.rev(), event.task());

        if (event.task() != null) {
            List<Consumer<KeelsonEvent>> subs = taskSubscribers.get(event.task());
            if (subs != null) {
                for (Consumer<KeelsonEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<KeelsonEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of a single task.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(TaskKey task, Consumer<KeelsonEvent> consumer) {
        taskSubscribers.compute(task, (k, subs) -> {
            CopyOnWriteArrayList<Consumer<KeelsonEvent>> list = subs == null ? new CopyOnWriteArrayList<>() : subs;
            list.add(consumer);
            return list;
        });
        log.debug("Subscribed to task {}", task);
        // the last subscriber of a task takes its entry with it
        return () -> taskSubscribers.computeIfPresent(task, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Subscribe to every event.
     */
    public Subscription subscribeAll(Consumer<KeelsonEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    public int globalSubscriberCount() {
        return globalSubscribers.size();
    }

    /** Number of tasks that currently have at least one subscriber. */
    public int subscribedTaskCount() {
        return taskSubscribers.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<KeelsonEvent> subscriber, KeelsonEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
