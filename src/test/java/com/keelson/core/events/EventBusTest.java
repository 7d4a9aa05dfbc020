package com.keelson.core.events;

import com.keelson.core.model.TaskKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private static final TaskKey TASK_A = new TaskKey(1, 1);
    private static final TaskKey TASK_B = new TaskKey(1, 2);

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static KeelsonEvent toast(long rev, TaskKey task) {
        return KeelsonEvent.forTask(rev, task, new ServerEvent.Toast("info", "rev " + rev));
    }

    @Nested
    @DisplayName("KeelsonEvent")
    class KeelsonEventTests {

        @Test
        @DisplayName("global events carry no task")
        void globalHasNoTask() {
            var event = KeelsonEvent.global(3, new ServerEvent.Toast("info", "hello"));
            assertNull(event.task());
            assertEquals(3, event.rev());
            assertEquals("Toast", event.eventType());
        }
    }

    @Nested
    @DisplayName("subscribe")
    class Subscribe {

        @Test
        @DisplayName("task subscribers only receive their task's events")
        void taskScoped() {
            List<KeelsonEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe(TASK_A, received::add);

            eventBus.publish(toast(1, TASK_A));
            eventBus.publish(toast(2, TASK_B));
            eventBus.publish(KeelsonEvent.global(3, new ServerEvent.Toast("info", "app")));

            assertEquals(1, received.size());
            assertEquals(1, received.get(0).rev());
        }

        @Test
        @DisplayName("global subscribers receive everything in publish order")
        void globalReceivesAll() {
            List<Long> revs = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(event -> revs.add(event.rev()));

            eventBus.publish(toast(1, TASK_A));
            eventBus.publish(toast(2, TASK_B));
            eventBus.publish(KeelsonEvent.global(3, new ServerEvent.Toast("info", "app")));

            assertEquals(List.of(1L, 2L, 3L), revs);
            assertEquals(1, eventBus.globalSubscriberCount());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<KeelsonEvent> received = new CopyOnWriteArrayList<>();
            EventBus.Subscription task = eventBus.subscribe(TASK_A, received::add);
            EventBus.Subscription all = eventBus.subscribeAll(received::add);

            task.unsubscribe();
            all.unsubscribe();
            eventBus.publish(toast(1, TASK_A));

            assertTrue(received.isEmpty());
            assertEquals(0, eventBus.globalSubscriberCount());
        }

        @Test
        @DisplayName("a task's entry goes away with its last subscriber")
        void dropsEmptyTaskEntries() {
            List<KeelsonEvent> received = new CopyOnWriteArrayList<>();
            EventBus.Subscription first = eventBus.subscribe(TASK_A, received::add);
            EventBus.Subscription second = eventBus.subscribe(TASK_A, received::add);
            EventBus.Subscription other = eventBus.subscribe(TASK_B, received::add);
            assertEquals(2, eventBus.subscribedTaskCount());

            first.unsubscribe();
            assertEquals(2, eventBus.subscribedTaskCount());
            second.unsubscribe();
            other.unsubscribe();
            other.unsubscribe();
            assertEquals(0, eventBus.subscribedTaskCount());

            eventBus.subscribe(TASK_A, received::add);
            eventBus.publish(toast(1, TASK_A));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("a throwing subscriber does not stop the others")
        void isolatesFailures() {
            List<KeelsonEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(event -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribeAll(received::add);

            eventBus.publish(toast(1, TASK_A));

            assertEquals(1, received.size());
        }
    }
}
