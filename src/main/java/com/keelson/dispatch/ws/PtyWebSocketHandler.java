package com.keelson.dispatch.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keelson.core.config.KeelsonProperties;
import com.keelson.core.events.BoundedChannel;
import com.keelson.core.metrics.KeelsonMetrics;
import com.keelson.core.pty.PtyKey;
import com.keelson.core.pty.PtyManager;
import com.keelson.core.pty.PtyReplayBuffer;
import com.keelson.core.pty.PtySession;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The terminal socket ({@code /api/pty/{workdir_id}/{task_id}}).
 * <p>
 * On attach the client first receives the session's bounded history as binary frames, then
 * live output. Input arrives as binary frames or as {@code {"type":"input","data":..}};
 * {@code {"type":"resize","cols":..,"rows":..}} resizes. A client that falls behind is
 * disconnected so it reconnects and replays. When the program exits the client receives
 * {@code {"type":"exited"}} and the socket closes.
 */
@Component
public class PtyWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(PtyWebSocketHandler.class);

    private final PtyManager ptyManager;
    private final ObjectMapper objectMapper;
    private final KeelsonMetrics metrics;
    private final KeelsonProperties properties;

    private final Map<String, PtyConnection> connections = new ConcurrentHashMap<>();
    private final AtomicInteger pumpCounter = new AtomicInteger();
    private final ExecutorService pumps = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "ws-pty-" + pumpCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public PtyWebSocketHandler(PtyManager ptyManager, ObjectMapper objectMapper, KeelsonMetrics metrics,
                               KeelsonProperties properties) {
        this.ptyManager = ptyManager;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        PtyKey key = (PtyKey) session.getAttributes().get(PtyHandshakeInterceptor.PTY_KEY);
        String workdirPath = (String) session.getAttributes().get(PtyHandshakeInterceptor.WORKDIR_PATH);
        if (key == null) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(session,
                properties.getEvents().getSendTimeLimitMs(), properties.getEvents().getSendBufferSizeBytes());
        PtySession pty = ptyManager.attachOrStart(key, workdirPath == null ? null : Path.of(workdirPath));
        PtyConnection connection = new PtyConnection(pty, properties.getPty().getLiveQueueCapacity(),
                overflowed -> onOverflow(session.getId(), safe));
        PtyReplayBuffer.Attachment attachment = pty.buffer().attach(connection);
        connections.put(session.getId(), connection);
        metrics.recordPtyAttach();
        log.debug("Terminal {} attached ({} bytes replay)", key, attachment.replay().length);
        pumps.submit(() -> pump(safe, connection, attachment));
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) throws IOException {
        PtyConnection connection = connections.get(session.getId());
        if (connection == null) {
            return;
        }
        byte[] bytes = new byte[message.getPayloadLength()];
        message.getPayload().get(bytes);
        connection.session().writeInput(bytes);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        PtyConnection connection = connections.get(session.getId());
        if (connection == null) {
            return;
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.debug("Bad terminal message on {}: {}", session.getId(), e.getOriginalMessage());
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        String type = node.path("type").asText("");
        switch (type) {
            case "input" -> connection.session().writeInput(
                    node.path("data").asText("").getBytes(StandardCharsets.UTF_8));
            case "resize" -> connection.session().resize(node.path("cols").asInt(80), node.path("rows").asInt(24));
            default -> {
                log.debug("Unknown terminal message type '{}' on {}", type, session.getId());
                session.close(CloseStatus.BAD_DATA);
            }
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        PtyConnection connection = connections.remove(session.getId());
        if (connection != null) {
            connection.detach();
        }
    }

    private void pump(WebSocketSession socket, PtyConnection connection, PtyReplayBuffer.Attachment attachment) {
        try {
            if (attachment.replay().length > 0) {
                socket.sendMessage(new BinaryMessage(attachment.replay()));
            }
            if (attachment.exited()) {
                sendExited(socket);
                return;
            }
            while (socket.isOpen()) {
                BoundedChannel.Delivery<byte[]> delivery = connection.channel().take();
                if (delivery.closed() || delivery.lagged()) {
                    break;
                }
                if (delivery.item() == PtyConnection.EXITED) {
                    sendExited(socket);
                    break;
                }
                socket.sendMessage(new BinaryMessage(delivery.item()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | RuntimeException e) {
            log.debug("Terminal pump for {} stopped: {}", socket.getId(), e.getMessage());
            closeQuietly(socket, CloseStatus.SESSION_NOT_RELIABLE);
        }
    }

    private void sendExited(WebSocketSession socket) throws IOException {
        socket.sendMessage(new TextMessage("{\"type\":\"exited\"}"));
        socket.close(CloseStatus.NORMAL);
    }

    private void onOverflow(String sessionId, WebSocketSession socket) {
        metrics.recordPtyOverflow();
        log.info("Terminal client {} fell behind, disconnecting", sessionId);
        closeQuietly(socket, CloseStatus.SESSION_NOT_RELIABLE);
    }

    private void closeQuietly(WebSocketSession socket, CloseStatus status) {
        try {
            socket.close(status);
        } catch (IOException e) {
            log.debug("Close of {} failed: {}", socket.getId(), e.getMessage());
        }
    }

    @PreDestroy
    void shutdown() {
        connections.values().forEach(PtyConnection::detach);
        pumps.shutdownNow();
    }
}
