package com.keelson.core.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One immutable record in a task's conversation log.
 * <p>
 * Serialized as {@code {type, entry_id, created_at_unix_ms, event}} where {@code type}
 * names the origin of the event.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ConversationEntry.SystemEventEntry.class, name = "system_event"),
    @JsonSubTypes.Type(value = ConversationEntry.UserEventEntry.class, name = "user_event"),
    @JsonSubTypes.Type(value = ConversationEntry.AgentEventEntry.class, name = "agent_event")
})
public interface ConversationEntry {

    String entryId();

    long createdAtUnixMs();

    ConversationEvent event();

    record SystemEventEntry(
        @JsonProperty("entry_id") String entryId,
        @JsonProperty("created_at_unix_ms") long createdAtUnixMs,
        @JsonProperty("event") SystemEvent event
    ) implements ConversationEntry {}

    record UserEventEntry(
        @JsonProperty("entry_id") String entryId,
        @JsonProperty("created_at_unix_ms") long createdAtUnixMs,
        @JsonProperty("event") UserEvent event
    ) implements ConversationEntry {}

    record AgentEventEntry(
        @JsonProperty("entry_id") String entryId,
        @JsonProperty("created_at_unix_ms") long createdAtUnixMs,
        @JsonProperty("event") AgentEvent event
    ) implements ConversationEntry {}
}
