package com.keelson.dispatch.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keelson.core.config.KeelsonProperties;
import com.keelson.core.engine.ActionRejectedException;
import com.keelson.core.engine.ActionResult;
import com.keelson.core.engine.ClientAction;
import com.keelson.core.engine.CommandDispatcher;
import com.keelson.core.engine.SnapshotService;
import com.keelson.core.events.EventBus;
import com.keelson.core.events.KeelsonEvent;
import com.keelson.core.events.ServerEvent;
import com.keelson.core.metrics.KeelsonMetrics;
import com.keelson.core.model.AppSnapshot;
import com.keelson.core.model.TaskKey;
import com.keelson.core.revision.RevisionStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link EventsWebSocketHandler} against a mocked {@link WebSocketSession}.
 */
class EventsWebSocketHandlerTest {

    private WebSocketSession session;
    private CommandDispatcher dispatcher;
    private SnapshotService snapshots;
    private RevisionStore revisions;
    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private EventsWebSocketHandler handler;
    private final List<String> sent = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);
        doAnswer(invocation -> {
            sent.add(((TextMessage) invocation.getArgument(0)).getPayload());
            return null;
        }).when(session).sendMessage(any());

        dispatcher = mock(CommandDispatcher.class);
        snapshots = mock(SnapshotService.class);
        revisions = new RevisionStore();
        eventBus = new EventBus();
        meterRegistry = new SimpleMeterRegistry();
        when(snapshots.app()).thenAnswer(invocation -> new AppSnapshot(revisions.current(), List.of()));

        handler = new EventsWebSocketHandler(dispatcher, snapshots, revisions, eventBus,
                new ProtocolCodec(new ObjectMapper()), new KeelsonMetrics(meterRegistry), new KeelsonProperties());
        handler.afterConnectionEstablished(session);
    }

    @AfterEach
    void tearDown() {
        handler.shutdown();
    }

    private void receive(String json) throws Exception {
        handler.handleTextMessage(session, new TextMessage(json));
    }

    private void hello(Long lastSeenRev) throws Exception {
        receive("{\"type\":\"hello\",\"protocol_version\":1"
                + (lastSeenRev == null ? "" : ",\"last_seen_rev\":" + lastSeenRev) + "}");
    }

    private void awaitSent(String fragment) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            if (sent.stream().anyMatch(s -> s.contains(fragment))) {
                return;
            }
            Thread.sleep(10);
        }
        fail("nothing sent containing " + fragment + ", got " + sent);
    }

    @Nested
    @DisplayName("handshake")
    class Handshake {

        @Test
        @DisplayName("a client without a revision gets hello and a full snapshot")
        void freshClient() throws Exception {
            revisions.bump();
            hello(null);

            assertEquals("{\"type\":\"hello\",\"protocol_version\":1,\"rev\":1}", sent.get(0));
            assertTrue(sent.get(1).contains("\"type\":\"app_changed\""), sent.get(1));
            assertEquals(1.0, meterRegistry.get("keelson.resync.total").tag("reason", "handshake").counter().count());
        }

        @Test
        @DisplayName("a client already at the current revision gets no snapshot")
        void upToDate() throws Exception {
            revisions.bump();
            revisions.bump();
            hello(2L);

            assertEquals(1, sent.size());
            verify(snapshots, never()).app();
        }

        @Test
        @DisplayName("a stale revision triggers a resync")
        void staleClient() throws Exception {
            revisions.bump();
            hello(0L);
            assertEquals(2, sent.size());
        }

        @Test
        @DisplayName("a protocol version mismatch is an error followed by a policy close")
        void versionMismatch() throws Exception {
            receive("{\"type\":\"hello\",\"protocol_version\":99}");

            assertTrue(sent.get(0).contains("unsupported protocol version 99"), sent.get(0));
            verify(session).close(CloseStatus.POLICY_VIOLATION);
            assertEquals(0, eventBus.globalSubscriberCount());
        }
    }

    @Nested
    @DisplayName("actions")
    class Actions {

        private static final String STAR = """
                {"type":"action","request_id":"r1",
                 "action":{"type":"task_star_set","workdir_id":1,"task_id":1,"starred":true}}
                """;

        @Test
        @DisplayName("are refused before the handshake")
        void beforeHandshake() throws Exception {
            receive(STAR);

            assertEquals("{\"type\":\"error\",\"request_id\":\"r1\",\"message\":\"handshake required\"}", sent.get(0));
            verifyNoInteractions(dispatcher);
        }

        @Test
        @DisplayName("an accepted action is acknowledged with its revision")
        void ack() throws Exception {
            hello(0L);
            when(dispatcher.dispatch(eq("r1"), any(ClientAction.class))).thenReturn(new ActionResult(5, new TaskKey(1, 1)));

            receive(STAR);

            assertEquals("{\"type\":\"ack\",\"request_id\":\"r1\",\"rev\":5}", sent.get(sent.size() - 1));
        }

        @Test
        @DisplayName("a rejected action yields exactly one error with the request id")
        void rejected() throws Exception {
            hello(0L);
            when(dispatcher.dispatch(anyString(), any())).thenThrow(new ActionRejectedException("no turn is running"));
            int before = sent.size();

            receive(STAR);

            assertEquals(before + 1, sent.size());
            assertEquals("{\"type\":\"error\",\"request_id\":\"r1\",\"message\":\"no turn is running\"}",
                    sent.get(sent.size() - 1));
        }

        @Test
        @DisplayName("an action that fails unexpectedly still gets one error reply")
        void failed() throws Exception {
            hello(0L);
            when(dispatcher.dispatch(anyString(), any()))
                    .thenThrow(new IllegalStateException("terminal session busy: 1/1/cmd_1"));
            int before = sent.size();

            receive(STAR);

            assertEquals(before + 1, sent.size());
            String last = sent.get(sent.size() - 1);
            assertTrue(last.contains("\"type\":\"error\""), last);
            assertTrue(last.contains("\"request_id\":\"r1\""), last);
            assertTrue(last.contains("action failed: terminal session busy"), last);

            receive("{\"type\":\"ping\"}");
            assertEquals("{\"type\":\"pong\"}", sent.get(sent.size() - 1));
        }

        @Test
        @DisplayName("an unknown action type is reported without reaching the dispatcher")
        void unknownAction() throws Exception {
            hello(0L);
            receive("{\"type\":\"action\",\"request_id\":\"r9\",\"action\":{\"type\":\"nope\"}}");

            String last = sent.get(sent.size() - 1);
            assertTrue(last.contains("\"request_id\":\"r9\""), last);
            assertTrue(last.contains("unknown action type: nope"), last);
            verifyNoInteractions(dispatcher);
        }

        @Test
        @DisplayName("ping is answered with pong")
        void ping() throws Exception {
            receive("{\"type\":\"ping\"}");
            assertEquals("{\"type\":\"pong\"}", sent.get(0));
        }
    }

    @Nested
    @DisplayName("fan-out")
    class FanOut {

        @Test
        @DisplayName("committed events are forwarded after the handshake")
        void forwardsEvents() throws Exception {
            hello(0L);
            eventBus.publish(KeelsonEvent.forTask(7, new TaskKey(1, 1), new ServerEvent.Toast("info", "done")));

            awaitSent("\"rev\":7");
            awaitSent("\"type\":\"toast\"");
        }

        @Test
        @DisplayName("closing the socket releases the subscription")
        void closeUnsubscribes() throws Exception {
            hello(0L);
            assertEquals(1, eventBus.globalSubscriberCount());

            handler.afterConnectionClosed(session, CloseStatus.NORMAL);

            assertEquals(0, eventBus.globalSubscriberCount());
            assertEquals(0, handler.connectionCount());
        }
    }
}
