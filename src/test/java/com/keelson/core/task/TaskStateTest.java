package com.keelson.core.task;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.keelson.core.conversation.AgentEvent;
import com.keelson.core.conversation.ConversationEntry;
import com.keelson.core.conversation.SystemEvent;
import com.keelson.core.engine.ActionRejectedException;
import com.keelson.core.engine.NotFoundException;
import com.keelson.core.model.AgentItem;
import com.keelson.core.model.AgentItemKind;
import com.keelson.core.model.QueuedPrompt;
import com.keelson.core.model.RunStatus;
import com.keelson.core.model.TaskKey;
import com.keelson.core.model.TaskStatus;
import com.keelson.core.model.TurnResult;
import com.keelson.core.model.TurnStatus;
import com.keelson.core.turn.TurnCompletion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TaskState}.
 */
class TaskStateTest {

    private TaskState task;

    @BeforeEach
    void setUp() {
        task = new TaskState(new TaskKey(1, 1), 100, 1_000);
        task.lock().lock();
    }

    @AfterEach
    void tearDown() {
        task.lock().unlock();
    }

    private TurnStart start(String text) {
        return task.send(text, List.of(), 2_000).orElseThrow();
    }

    private List<ConversationEntry> entries() {
        return task.conversation().page(null, null).entries();
    }

    private List<String> pendingTexts() {
        return task.pendingPrompts().stream().map(QueuedPrompt::text).toList();
    }

    @Test
    @DisplayName("a new task is an idle todo with a default title and a creation entry")
    void newTask() {
        assertEquals("Task 1", task.title());
        assertEquals(TaskStatus.TODO, task.status());
        assertEquals(RunStatus.IDLE, task.runStatus());
        assertEquals(TurnStatus.IDLE, task.turnStatus());
        assertInstanceOf(SystemEvent.TaskCreated.class, entries().get(0).event());
    }

    @Test
    @DisplayName("mutations require the task lock")
    void requiresLock() {
        TaskState other = new TaskState(new TaskKey(1, 2), 100, 0);
        assertThrows(IllegalStateException.class, () -> other.send("hi", List.of(), 1));
    }

    @Nested
    @DisplayName("send")
    class Send {

        @Test
        @DisplayName("starts a turn when idle and moves todo to iterating")
        void startsTurn() {
            TurnStart turn = start("Fix the build\nthen run tests");

            assertEquals("turn_1_1_1", turn.turnId());
            assertEquals(RunStatus.RUNNING, task.runStatus());
            assertEquals(TaskStatus.ITERATING, task.status());
            assertEquals("Fix the build", task.title());

            List<ConversationEntry> entries = entries();
            assertEquals(3, entries.size());
            assertInstanceOf(ConversationEntry.UserEventEntry.class, entries.get(1));
            var change = assertInstanceOf(SystemEvent.TaskStatusChanged.class, entries.get(2).event());
            assertEquals(TaskStatus.TODO, change.from());
            assertEquals(TaskStatus.ITERATING, change.to());
        }

        @Test
        @DisplayName("enqueues while a turn is running")
        void enqueuesWhileRunning() {
            start("first");
            Optional<TurnStart> second = task.send("second", List.of(), 3_000);

            assertTrue(second.isEmpty());
            assertEquals(List.of("second"), pendingTexts());
            assertEquals(1, task.summary().pendingPromptCount());
        }

        @Test
        @DisplayName("rejects an empty message without touching state")
        void rejectsEmpty() {
            int before = task.conversation().size();
            assertThrows(ActionRejectedException.class, () -> task.send("   ", List.of(), 2_000));
            assertEquals(before, task.conversation().size());
            assertEquals(RunStatus.IDLE, task.runStatus());
        }

        @Test
        @DisplayName("long first lines are cut to the title limit")
        void truncatesTitle() {
            start("x".repeat(200));
            assertEquals(TaskState.MAX_TITLE_LENGTH, task.title().length());
        }

        @Test
        @DisplayName("queue starts immediately when idle and not paused")
        void queueWhenIdle() {
            Optional<TurnStart> started = task.queue("now", List.of(), 2_000);
            assertTrue(started.isPresent());
            assertTrue(task.pendingPrompts().isEmpty());
        }
    }

    @Nested
    @DisplayName("finishTurn")
    class FinishTurn {

        @Test
        @DisplayName("success records usage and duration, then dequeues the next prompt")
        void successDequeues() {
            TurnStart first = start("first");
            task.send("second", List.of(), 2_100);
            var usage = JsonNodeFactory.instance.objectNode().put("input_tokens", 3);

            TaskState.Finished finished = task.finishTurn(first.turnId(),
                    TurnCompletion.succeeded(usage, 50), 3_000).orElseThrow();

            assertEquals(TurnResult.COMPLETED, finished.result());
            assertEquals("second", finished.next().orElseThrow().prompt());
            assertTrue(task.pendingPrompts().isEmpty());
            List<ConversationEntry> entries = entries();
            assertTrue(entries.stream().anyMatch(e -> e.event() instanceof AgentEvent.TurnUsage));
            assertTrue(entries.stream().anyMatch(e -> e.event() instanceof AgentEvent.TurnDuration));
        }

        @Test
        @DisplayName("failure records the error and still dequeues")
        void failureDequeues() {
            TurnStart first = start("first");
            task.send("second", List.of(), 2_100);

            TaskState.Finished finished = task.finishTurn(first.turnId(),
                    TurnCompletion.failed("agent crashed", 10), 3_000).orElseThrow();

            assertEquals(TurnResult.FAILED, finished.result());
            assertTrue(finished.next().isPresent());
            assertEquals(TurnResult.FAILED, task.lastTurnResult());
            assertTrue(entries().stream().anyMatch(e -> e.event() instanceof AgentEvent.TurnError err
                    && err.message().equals("agent crashed")));
        }

        @Test
        @DisplayName("completions of an old turn are ignored")
        void staleCompletion() {
            TurnStart first = start("first");
            task.cancel(2_500);
            TurnStart second = start("second");

            assertTrue(task.finishTurn(first.turnId(), TurnCompletion.succeeded(null, 1), 3_000).isEmpty());
            assertEquals(Optional.of(second.turnId()), task.activeTurnId());
        }
    }

    @Nested
    @DisplayName("agent events")
    class AgentEvents {

        @Test
        @DisplayName("messages and new items count as steps, duplicates do not")
        void countsSteps() {
            TurnStart turn = start("go");
            AgentItem item = new AgentItem("i1", AgentItemKind.REASONING, null);

            assertTrue(task.recordAgentEvent(turn.turnId(), new AgentEvent.Item(item), 2_100));
            assertFalse(task.recordAgentEvent(turn.turnId(), new AgentEvent.Item(item), 2_200));
            assertTrue(task.recordAgentEvent(turn.turnId(), new AgentEvent.Message("m1", "done"), 2_300));

            assertEquals(2, task.activeTurnSteps());
        }

        @Test
        @DisplayName("events of an inactive turn are dropped")
        void staleEvents() {
            TurnStart turn = start("go");
            task.cancel(2_100);
            int size = task.conversation().size();

            assertFalse(task.recordAgentEvent(turn.turnId(), new AgentEvent.Message("m", "late"), 2_200));
            assertEquals(size, task.conversation().size());
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("records the step count and pauses a non-empty queue")
        void pausesQueue() {
            TurnStart turn = start("first");
            task.recordAgentEvent(turn.turnId(), new AgentEvent.Message("m", "working"), 2_050);
            task.send("second", List.of(), 2_100);

            task.cancel(2_200);

            assertTrue(turn.token().isCancelled());
            assertEquals(TurnResult.CANCELED, task.lastTurnResult());
            assertEquals(TurnStatus.PAUSED, task.turnStatus());
            assertTrue(task.resumeAvailable());
            var canceled = (AgentEvent.TurnCanceled) entries().get(entries().size() - 1).event();
            assertEquals(1, canceled.steps());
        }

        @Test
        @DisplayName("with an empty queue the task simply goes idle")
        void idleAfterCancel() {
            start("only");
            task.cancel(2_200);
            assertEquals(TurnStatus.IDLE, task.turnStatus());
            assertFalse(task.queuePaused());
        }

        @Test
        @DisplayName("is rejected when no turn is running")
        void rejectsWhenIdle() {
            assertThrows(ActionRejectedException.class, () -> task.cancel(2_000));
        }

        @Test
        @DisplayName("cancel-and-send replaces the running turn and keeps the queue")
        void cancelAndSend() {
            TurnStart first = start("first");
            task.send("queued", List.of(), 2_100);

            TurnStart replacement = task.cancelAndSend("urgent", List.of(), 2_200);

            assertTrue(first.token().isCancelled());
            assertEquals("urgent", replacement.prompt());
            assertEquals(List.of("queued"), pendingTexts());
            assertEquals(RunStatus.RUNNING, task.runStatus());
        }

        @Test
        @DisplayName("resume leaves the paused state and starts the oldest prompt")
        void resume() {
            start("first");
            task.send("second", List.of(), 2_100);
            task.send("third", List.of(), 2_150);
            task.cancel(2_200);

            TurnStart next = task.resume(2_300).orElseThrow();

            assertEquals("second", next.prompt());
            assertFalse(task.queuePaused());
            assertEquals(List.of("third"), pendingTexts());
        }

        @Test
        @DisplayName("resume is rejected when the queue is not paused")
        void resumeRejected() {
            assertThrows(ActionRejectedException.class, () -> task.resume(2_000));
        }
    }

    @Nested
    @DisplayName("queue editing")
    class QueueEditing {

        private TurnStart running;

        @BeforeEach
        void fillQueue() {
            running = start("running");
            task.send("a", List.of(), 2_100);
            task.send("b", List.of(), 2_200);
            task.send("c", List.of(), 2_300);
        }

        private long idOf(String text) {
            return task.pendingPrompts().stream().filter(p -> p.text().equals(text)).findFirst().orElseThrow().id();
        }

        @Test
        @DisplayName("reorder moves a prompt to the position of another")
        void reorder() {
            task.reorderPrompt(idOf("c"), idOf("a"));
            assertEquals(List.of("c", "a", "b"), pendingTexts());

            task.reorderPrompt(idOf("c"), idOf("b"));
            assertEquals(List.of("a", "b", "c"), pendingTexts());
        }

        @Test
        @DisplayName("the reordered queue is consumed in its new order")
        void reorderedQueueRunsInOrder() {
            task.reorderPrompt(idOf("c"), idOf("a"));

            TurnStart next = task.finishTurn(running.turnId(), TurnCompletion.succeeded(null, 5), 3_000)
                    .orElseThrow().next().orElseThrow();
            assertEquals("c", next.prompt());
            assertEquals(List.of("a", "b"), pendingTexts());

            next = task.finishTurn(next.turnId(), TurnCompletion.succeeded(null, 5), 3_100)
                    .orElseThrow().next().orElseThrow();
            assertEquals("a", next.prompt());
            assertEquals(List.of("b"), pendingTexts());
        }

        @Test
        @DisplayName("update replaces the text and keeps the id")
        void update() {
            long id = idOf("b");
            task.updatePrompt(id, "b2");
            assertEquals(List.of("a", "b2", "c"), pendingTexts());
            assertEquals(id, idOf("b2"));
            assertThrows(ActionRejectedException.class, () -> task.updatePrompt(id, " "));
        }

        @Test
        @DisplayName("unknown prompt ids are not found")
        void unknownPrompt() {
            assertThrows(NotFoundException.class, () -> task.removePrompt(999));
            assertThrows(NotFoundException.class, () -> task.reorderPrompt(999, idOf("a")));
        }

        @Test
        @DisplayName("prompt ids are never reused")
        void idsNotReused() {
            long removed = idOf("c");
            task.removePrompt(removed);
            task.send("d", List.of(), 2_400);
            assertTrue(idOf("d") > removed);
        }

        @Test
        @DisplayName("removing the last held prompt leaves the paused state")
        void removeLastUnpauses() {
            task.cancel(2_500);
            task.removePrompt(idOf("a"));
            task.removePrompt(idOf("b"));
            assertTrue(task.queuePaused());
            task.removePrompt(idOf("c"));
            assertFalse(task.queuePaused());
            assertEquals(TurnStatus.IDLE, task.turnStatus());
        }

        @Test
        @DisplayName("clearing empties the queue and is rejected once nothing is left")
        void clear() {
            task.cancel(2_500);
            task.clearQueue();
            assertFalse(task.queuePaused());
            assertThrows(ActionRejectedException.class, () -> task.clearQueue());
        }
    }

    @Nested
    @DisplayName("metadata")
    class Metadata {

        @Test
        @DisplayName("setting the same status reports no change and appends nothing")
        void sameStatus() {
            int size = task.conversation().size();
            assertFalse(task.setStatus(TaskStatus.TODO, 2_000));
            assertEquals(size, task.conversation().size());
            assertTrue(task.setStatus(TaskStatus.DONE, 2_000));
            assertEquals(size + 1, task.conversation().size());
        }

        @Test
        @DisplayName("star flag shows up in the summary")
        void star() {
            task.setStarred(true, 2_000);
            assertTrue(task.summary().starred());
            assertEquals(2_000, task.summary().updatedAtUnixMs());
        }

        @Test
        @DisplayName("snapshot reports the page and the run state together")
        void snapshot() {
            start("go");
            var snapshot = task.snapshot(7, null, 2);
            assertEquals(7, snapshot.rev());
            assertEquals(RunStatus.RUNNING, snapshot.runStatus());
            assertEquals(2, snapshot.entries().size());
            assertTrue(snapshot.entriesTruncated());
            assertEquals(2_000L, snapshot.runStartedAtUnixMs());
        }
    }
}
