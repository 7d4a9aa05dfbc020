package com.keelson.dispatch.ws;

import com.keelson.core.events.BoundedChannel;
import com.keelson.core.events.EventBus;
import com.keelson.core.events.KeelsonEvent;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Per-connection state of the events socket: handshake state, the bounded fan-out channel
 * and the bus subscription feeding it.
 */
class EventsConnection {

    private final String id;
    private final WebSocketSession session;
    private final BoundedChannel<KeelsonEvent> channel;
    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile EventBus.Subscription subscription;

    EventsConnection(String id, WebSocketSession session, int channelCapacity) {
        this.id = id;
        this.session = session;
        this.channel = new BoundedChannel<>(channelCapacity);
    }

    String id() {
        return id;
    }

    ConnectionState state() {
        return state;
    }

    void state(ConnectionState state) {
        this.state = state;
    }

    BoundedChannel<KeelsonEvent> channel() {
        return channel;
    }

    void subscription(EventBus.Subscription subscription) {
        this.subscription = subscription;
    }

    boolean isOpen() {
        return state != ConnectionState.CLOSED && session.isOpen();
    }

    void send(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    WebSocketSession session() {
        return session;
    }

    /**
     * Releases the subscription and wakes the pump; safe to call more than once.
     */
    void close() {
        state = ConnectionState.CLOSED;
        EventBus.Subscription current = subscription;
        if (current != null) {
            current.unsubscribe();
        }
        channel.close();
    }
}
