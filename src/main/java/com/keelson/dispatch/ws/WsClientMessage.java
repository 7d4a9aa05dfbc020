package com.keelson.dispatch.ws;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.keelson.core.engine.ClientAction;

/**
 * Messages a client sends on the events socket.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = WsClientMessage.Hello.class, name = "hello"),
    @JsonSubTypes.Type(value = WsClientMessage.Action.class, name = "action"),
    @JsonSubTypes.Type(value = WsClientMessage.Ping.class, name = "ping")
})
public interface WsClientMessage {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visit(Hello hello);
        R visit(Action action);
        R visit(Ping ping);
    }

    /**
     * @param lastSeenRev revision of the client's cached state, {@code null} when it has none
     */
    record Hello(
        @JsonProperty("protocol_version") int protocolVersion,
        @JsonProperty("last_seen_rev") Long lastSeenRev
    ) implements WsClientMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record Action(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("action") ClientAction action
    ) implements WsClientMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record Ping() implements WsClientMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }
}
