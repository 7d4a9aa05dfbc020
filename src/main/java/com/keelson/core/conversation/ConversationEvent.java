package com.keelson.core.conversation;

/**
 * Anything that can be recorded in a task's conversation log.
 * Implemented by {@link SystemEvent}, {@link UserEvent} and {@link AgentEvent}.
 */
public interface ConversationEvent {

    /**
     * Wraps this event in the entry type matching its origin.
     */
    ConversationEntry toEntry(String entryId, long createdAtUnixMs);
}
