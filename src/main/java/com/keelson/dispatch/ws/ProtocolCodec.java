package com.keelson.dispatch.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.keelson.core.engine.ClientAction;
import com.keelson.core.engine.ProtocolException;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of the events socket protocol.
 */
@Component
public class ProtocolCodec {

    public static final int PROTOCOL_VERSION = 1;

    private final ObjectMapper objectMapper;

    public ProtocolCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decodes a client message.
     *
     * @throws ProtocolException for malformed JSON, unknown tags or missing fields; carries the
     *                           request id when one could be read
     */
    public WsClientMessage decode(String text) {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("invalid json: " + e.getOriginalMessage(), null, e);
        }
        if (tree == null || !tree.isObject()) {
            throw new ProtocolException("message must be a json object");
        }
        String requestId = tree.hasNonNull("request_id") ? tree.get("request_id").asText() : null;
        try {
            return objectMapper.treeToValue(tree, WsClientMessage.class);
        } catch (InvalidTypeIdException e) {
            String kind = e.getBaseType() != null && e.getBaseType().getRawClass() == ClientAction.class
                    ? "action" : "message";
            if (e.getTypeId() == null) {
                throw new ProtocolException("missing " + kind + " type", requestId, e);
            }
            throw new ProtocolException("unknown " + kind + " type: " + e.getTypeId(), requestId, e);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("invalid message: " + e.getOriginalMessage(), requestId, e);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("invalid message: " + e.getMessage(), requestId, e);
        }
    }

    public String encode(WsServerMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message.getClass().getSimpleName(), e);
        }
    }
}
