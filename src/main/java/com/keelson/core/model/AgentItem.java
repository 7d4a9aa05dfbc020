package com.keelson.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * A structured item produced by the agent during a turn (command run, file change, ...).
 * Items with the same id may be re-emitted as they progress; {@code payload} holds the
 * latest state.
 *
 * @param id      executor-assigned item id
 * @param kind    item kind
 * @param payload kind-specific body
 */
public record AgentItem(
    @JsonProperty("id") String id,
    @JsonProperty("kind") AgentItemKind kind,
    @JsonProperty("payload") JsonNode payload
) {
    public AgentItem {
        if (payload == null) {
            payload = JsonNodeFactory.instance.objectNode();
        }
    }
}
