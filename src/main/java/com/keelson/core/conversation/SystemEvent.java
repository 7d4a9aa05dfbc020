package com.keelson.core.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.keelson.core.model.TaskStatus;

/**
 * Events recorded by Keelson itself rather than the user or the agent.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SystemEvent.TaskCreated.class, name = "task_created"),
    @JsonSubTypes.Type(value = SystemEvent.TaskStatusChanged.class, name = "task_status_changed"),
    @JsonSubTypes.Type(value = SystemEvent.TerminalCommandStarted.class, name = "terminal_command_started"),
    @JsonSubTypes.Type(value = SystemEvent.TerminalCommandFinished.class, name = "terminal_command_finished")
})
public interface SystemEvent extends ConversationEvent {

    @Override
    default ConversationEntry toEntry(String entryId, long createdAtUnixMs) {
        return new ConversationEntry.SystemEventEntry(entryId, createdAtUnixMs, this);
    }

    record TaskCreated(
        @JsonProperty("title") String title
    ) implements SystemEvent {}

    record TaskStatusChanged(
        @JsonProperty("from") TaskStatus from,
        @JsonProperty("to") TaskStatus to
    ) implements SystemEvent {}

    record TerminalCommandStarted(
        @JsonProperty("command_id") String commandId,
        @JsonProperty("command") String command,
        @JsonProperty("reconnect") String reconnect
    ) implements SystemEvent {}

    record TerminalCommandFinished(
        @JsonProperty("command_id") String commandId,
        @JsonProperty("command") String command,
        @JsonProperty("exit_code") Integer exitCode,
        @JsonProperty("output_tail") String outputTail
    ) implements SystemEvent {}
}
