package com.keelson.core.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.keelson.core.model.AgentItem;

/**
 * Events produced by a turn executor, plus the turn bookkeeping recorded when a turn ends.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AgentEvent.Message.class, name = "message"),
    @JsonSubTypes.Type(value = AgentEvent.Item.class, name = "item"),
    @JsonSubTypes.Type(value = AgentEvent.TurnUsage.class, name = "turn_usage"),
    @JsonSubTypes.Type(value = AgentEvent.TurnDuration.class, name = "turn_duration"),
    @JsonSubTypes.Type(value = AgentEvent.TurnCanceled.class, name = "turn_canceled"),
    @JsonSubTypes.Type(value = AgentEvent.TurnError.class, name = "turn_error")
})
public interface AgentEvent extends ConversationEvent {

    @Override
    default ConversationEntry toEntry(String entryId, long createdAtUnixMs) {
        return new ConversationEntry.AgentEventEntry(entryId, createdAtUnixMs, this);
    }

    /**
     * Whether this event counts as a step of the running turn.
     */
    default boolean countsAsStep() {
        return false;
    }

    record Message(
        @JsonProperty("id") String id,
        @JsonProperty("text") String text
    ) implements AgentEvent {
        @Override
        public boolean countsAsStep() {
            return true;
        }
    }

    record Item(
        @JsonProperty("item") AgentItem item
    ) implements AgentEvent {
        @Override
        public boolean countsAsStep() {
            return true;
        }
    }

    record TurnUsage(
        @JsonProperty("usage") JsonNode usage
    ) implements AgentEvent {}

    record TurnDuration(
        @JsonProperty("duration_ms") long durationMs
    ) implements AgentEvent {}

    record TurnCanceled(
        @JsonProperty("steps") int steps
    ) implements AgentEvent {

        /** Human readable form, e.g. "Cancelled after 3 steps". */
        public String summary() {
            return "Cancelled after " + steps + (steps == 1 ? " step" : " steps");
        }
    }

    record TurnError(
        @JsonProperty("message") String message
    ) implements AgentEvent {}
}
