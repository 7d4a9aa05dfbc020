package com.keelson.core.turn;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.keelson.core.conversation.AgentEvent;
import com.keelson.core.model.TaskKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TurnRunnerTest {

    private static final TaskKey TASK = new TaskKey(1, 2);

    private TurnRunner runner;

    @AfterEach
    void tearDown() {
        if (runner != null) {
            runner.shutdown();
        }
    }

    private static class RecordingCallbacks implements TurnCallbacks {
        final List<AgentEvent> events = new CopyOnWriteArrayList<>();
        final CompletableFuture<TurnCompletion> finished = new CompletableFuture<>();

        @Override
        public void onAgentEvent(TaskKey task, String turnId, AgentEvent event) {
            events.add(event);
        }

        @Override
        public void onTurnFinished(TaskKey task, String turnId, TurnCompletion completion) {
            finished.complete(completion);
        }
    }

    private static TurnExecutor executor(Execution body) {
        return new TurnExecutor() {
            @Override
            public String id() {
                return "test";
            }

            @Override
            public TurnOutcome execute(TurnRequest request, TurnSink sink, CancellationToken token)
                    throws TurnExecutionException, InterruptedException {
                return body.run(sink, token);
            }
        };
    }

    @FunctionalInterface
    private interface Execution {
        TurnOutcome run(TurnSink sink, CancellationToken token) throws TurnExecutionException, InterruptedException;
    }

    private RecordingCallbacks launch(TurnExecutor executor, CancellationToken token) {
        runner = new TurnRunner(executor, 2);
        RecordingCallbacks callbacks = new RecordingCallbacks();
        runner.launch(new TurnRequest(TASK, "t1", "go", null, null), token, callbacks);
        return callbacks;
    }

    @Test
    @DisplayName("forwards events and reports success with usage")
    void success() throws Exception {
        RecordingCallbacks callbacks = launch(executor((sink, token) -> {
            sink.emit(new AgentEvent.Message("m1", "done"));
            return new TurnOutcome(JsonNodeFactory.instance.objectNode().put("output_tokens", 4));
        }), new CancellationToken());

        TurnCompletion completion = callbacks.finished.get(5, TimeUnit.SECONDS);
        assertTrue(completion.success());
        assertEquals(4, completion.usage().get("output_tokens").asInt());
        assertEquals(1, callbacks.events.size());
    }

    @Test
    @DisplayName("executor failures become failed completions")
    void failure() throws Exception {
        RecordingCallbacks callbacks = launch(executor((sink, token) -> {
            throw new TurnExecutionException("agent exited with status 2");
        }), new CancellationToken());

        TurnCompletion completion = callbacks.finished.get(5, TimeUnit.SECONDS);
        assertFalse(completion.success());
        assertEquals("agent exited with status 2", completion.error());
    }

    @Test
    @DisplayName("unexpected exceptions are reported too")
    void unexpected() throws Exception {
        RecordingCallbacks callbacks = launch(executor((sink, token) -> {
            throw new IllegalStateException();
        }), new CancellationToken());

        assertEquals("IllegalStateException", callbacks.finished.get(5, TimeUnit.SECONDS).error());
    }

    @Test
    @DisplayName("cancelling interrupts the turn and drops its later events")
    void cancel() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CancellationToken token = new CancellationToken();
        RecordingCallbacks callbacks = launch(executor((sink, t) -> {
            started.countDown();
            Thread.sleep(10_000);
            sink.emit(new AgentEvent.Message("late", "never"));
            return TurnOutcome.completed();
        }), token);

        assertTrue(started.await(5, TimeUnit.SECONDS));
        token.cancel();

        TurnCompletion completion = callbacks.finished.get(5, TimeUnit.SECONDS);
        assertFalse(completion.success());
        assertTrue(callbacks.events.isEmpty());
    }
}
