package com.keelson.dispatch.ws;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.keelson.core.events.ServerEvent;

/**
 * Messages the server sends on the events socket.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = WsServerMessage.Hello.class, name = "hello"),
    @JsonSubTypes.Type(value = WsServerMessage.Ack.class, name = "ack"),
    @JsonSubTypes.Type(value = WsServerMessage.Event.class, name = "event"),
    @JsonSubTypes.Type(value = WsServerMessage.Error.class, name = "error"),
    @JsonSubTypes.Type(value = WsServerMessage.Pong.class, name = "pong")
})
public interface WsServerMessage {

    record Hello(
        @JsonProperty("protocol_version") int protocolVersion,
        @JsonProperty("rev") long rev
    ) implements WsServerMessage {}

    record Ack(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("rev") long rev
    ) implements WsServerMessage {}

    record Event(
        @JsonProperty("rev") long rev,
        @JsonProperty("event") ServerEvent event
    ) implements WsServerMessage {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Error(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("message") String message
    ) implements WsServerMessage {}

    record Pong() implements WsServerMessage {}
}
