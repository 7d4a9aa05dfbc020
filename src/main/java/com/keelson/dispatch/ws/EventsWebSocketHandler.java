package com.keelson.dispatch.ws;

import com.keelson.core.config.KeelsonProperties;
import com.keelson.core.engine.ActionRejectedException;
import com.keelson.core.engine.ActionResult;
import com.keelson.core.engine.CommandDispatcher;
import com.keelson.core.engine.ProtocolException;
import com.keelson.core.engine.SnapshotService;
import com.keelson.core.events.BoundedChannel;
import com.keelson.core.events.EventBus;
import com.keelson.core.events.KeelsonEvent;
import com.keelson.core.events.ServerEvent;
import com.keelson.core.logging.MdcContext;
import com.keelson.core.metrics.KeelsonMetrics;
import com.keelson.core.model.AppSnapshot;
import com.keelson.core.revision.RevisionStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The events socket ({@code /api/events}): handshake, action/ack/error and event fan-out.
 * <p>
 * A client opens with {@code hello{protocol_version, last_seen_rev}}. The server replies
 * {@code hello{protocol_version, rev}} and, when the client's revision differs, a full
 * {@code app_changed} snapshot. From then on every committed event is forwarded through a
 * bounded per-connection channel; a connection that falls behind gets a fresh snapshot
 * instead of the events it missed.
 */
@Component
public class EventsWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(EventsWebSocketHandler.class);

    private final CommandDispatcher dispatcher;
    private final SnapshotService snapshots;
    private final RevisionStore revisions;
    private final EventBus eventBus;
    private final ProtocolCodec codec;
    private final KeelsonMetrics metrics;
    private final KeelsonProperties.Events config;

    private final Map<String, EventsConnection> connections = new ConcurrentHashMap<>();
    private final AtomicInteger pumpCounter = new AtomicInteger();
    private final ExecutorService pumps = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "ws-events-" + pumpCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public EventsWebSocketHandler(CommandDispatcher dispatcher, SnapshotService snapshots, RevisionStore revisions,
                                  EventBus eventBus, ProtocolCodec codec, KeelsonMetrics metrics,
                                  KeelsonProperties properties) {
        this.dispatcher = dispatcher;
        this.snapshots = snapshots;
        this.revisions = revisions;
        this.eventBus = eventBus;
        this.codec = codec;
        this.metrics = metrics;
        this.config = properties.getEvents();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(
                session, config.getSendTimeLimitMs(), config.getSendBufferSizeBytes());
        EventsConnection connection = new EventsConnection(session.getId(), safe, config.getChannelCapacity());
        connection.state(ConnectionState.HANDSHAKING);
        connections.put(session.getId(), connection);
        log.info("Events socket opened: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        EventsConnection connection = connections.get(session.getId());
        if (connection == null) {
            return;
        }
        MdcContext.setConnection(connection.id());
        try {
            WsClientMessage decoded = codec.decode(message.getPayload());
            decoded.accept(new MessageHandler(connection));
        } catch (ProtocolException e) {
            log.debug("Protocol error on {}: {}", connection.id(), e.getMessage());
            send(connection, new WsServerMessage.Error(e.requestId(), e.getMessage()));
        } finally {
            MdcContext.clear();
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        EventsConnection connection = connections.remove(session.getId());
        if (connection != null) {
            connection.close();
        }
        log.info("Events socket closed: {} ({})", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Events socket transport error on {}: {}", session.getId(), exception.getMessage());
    }

    public int connectionCount() {
        return connections.size();
    }

    private void handshake(EventsConnection connection, WsClientMessage.Hello hello) throws IOException {
        if (connection.state() != ConnectionState.HANDSHAKING) {
            send(connection, new WsServerMessage.Error(null, "handshake already completed"));
            return;
        }
        if (hello.protocolVersion() != ProtocolCodec.PROTOCOL_VERSION) {
            send(connection, new WsServerMessage.Error(null,
                    "unsupported protocol version " + hello.protocolVersion()
                            + ", expected " + ProtocolCodec.PROTOCOL_VERSION));
            connection.close();
            connection.session().close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        // subscribe before reading rev so nothing committed after the snapshot is missed
        BoundedChannel<KeelsonEvent> channel = connection.channel();
        connection.subscription(eventBus.subscribeAll(channel::offer));
        long rev = revisions.current();
        send(connection, new WsServerMessage.Hello(ProtocolCodec.PROTOCOL_VERSION, rev));
        if (hello.lastSeenRev() == null || hello.lastSeenRev() != rev) {
            AppSnapshot snapshot = snapshots.app();
            send(connection, new WsServerMessage.Event(snapshot.rev(), new ServerEvent.AppChanged(snapshot)));
            metrics.recordResync("handshake");
        }
        connection.state(ConnectionState.SYNCED);
        pumps.submit(() -> pump(connection));
        log.debug("Handshake complete on {} at rev {} (client had {})", connection.id(), rev, hello.lastSeenRev());
    }

    private void pump(EventsConnection connection) {
        MdcContext.setConnection(connection.id());
        try {
            while (connection.isOpen()) {
                BoundedChannel.Delivery<KeelsonEvent> delivery = connection.channel().take();
                if (delivery.closed()) {
                    break;
                }
                if (delivery.lagged()) {
                    connection.state(ConnectionState.LAGGING);
                    log.info("Connection {} lagged, sending full snapshot", connection.id());
                    AppSnapshot snapshot = snapshots.app();
                    send(connection, new WsServerMessage.Event(snapshot.rev(), new ServerEvent.AppChanged(snapshot)));
                    metrics.recordResync("lagged");
                    connection.state(ConnectionState.SYNCED);
                    continue;
                }
                KeelsonEvent event = delivery.item();
                send(connection, new WsServerMessage.Event(event.rev(), event.event()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | IllegalStateException | SessionLimitExceededException e) {
            log.debug("Events pump for {} stopped: {}", connection.id(), e.getMessage());
            closeQuietly(connection, CloseStatus.SESSION_NOT_RELIABLE);
        } finally {
            MdcContext.clear();
        }
    }

    private void send(EventsConnection connection, WsServerMessage message) throws IOException {
        connection.send(codec.encode(message));
    }

    private void closeQuietly(EventsConnection connection, CloseStatus status) {
        connection.close();
        try {
            connection.session().close(status);
        } catch (IOException e) {
            log.debug("Close of {} failed: {}", connection.id(), e.getMessage());
        }
    }

    @PreDestroy
    void shutdown() {
        connections.values().forEach(EventsConnection::close);
        pumps.shutdownNow();
    }

    private final class MessageHandler implements WsClientMessage.Visitor<Void> {

        private final EventsConnection connection;

        private MessageHandler(EventsConnection connection) {
            this.connection = connection;
        }

        @Override
        public Void visit(WsClientMessage.Hello hello) {
            try {
                handshake(connection, hello);
            } catch (IOException e) {
                log.debug("Handshake send failed on {}: {}", connection.id(), e.getMessage());
                closeQuietly(connection, CloseStatus.SESSION_NOT_RELIABLE);
            }
            return null;
        }

        @Override
        public Void visit(WsClientMessage.Action action) {
            String requestId = action.requestId();
            MdcContext.setRequest(connection.id(), requestId);
            WsServerMessage reply;
            if (connection.state() != ConnectionState.SYNCED && connection.state() != ConnectionState.LAGGING) {
                reply = new WsServerMessage.Error(requestId, "handshake required");
            } else if (requestId == null || requestId.isBlank()) {
                reply = new WsServerMessage.Error(null, "request_id is required");
            } else if (action.action() == null) {
                reply = new WsServerMessage.Error(requestId, "action is required");
            } else {
                try {
                    ActionResult result = dispatcher.dispatch(requestId, action.action());
                    reply = new WsServerMessage.Ack(requestId, result.rev());
                } catch (ActionRejectedException e) {
                    reply = new WsServerMessage.Error(requestId, e.getMessage());
                } catch (RuntimeException e) {
                    log.warn("Action {} on {} failed: {}", requestId, connection.id(), e.getMessage(), e);
                    reply = new WsServerMessage.Error(requestId, "action failed: "
                            + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
                }
            }
            try {
                send(connection, reply);
            } catch (IOException e) {
                log.debug("Reply to {} on {} failed: {}", requestId, connection.id(), e.getMessage());
                closeQuietly(connection, CloseStatus.SESSION_NOT_RELIABLE);
            }
            return null;
        }

        @Override
        public Void visit(WsClientMessage.Ping ping) {
            try {
                send(connection, new WsServerMessage.Pong());
            } catch (IOException e) {
                closeQuietly(connection, CloseStatus.SESSION_NOT_RELIABLE);
            }
            return null;
        }
    }
}
