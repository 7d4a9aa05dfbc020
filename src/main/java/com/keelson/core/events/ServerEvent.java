package com.keelson.core.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.keelson.core.conversation.ConversationSnapshot;
import com.keelson.core.model.AppSnapshot;
import com.keelson.core.model.TaskSummary;

import java.util.List;

/**
 * Events pushed to connected clients, each stamped with the revision it was committed at.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ServerEvent.AppChanged.class, name = "app_changed"),
    @JsonSubTypes.Type(value = ServerEvent.TaskSummariesChanged.class, name = "task_summaries_changed"),
    @JsonSubTypes.Type(value = ServerEvent.WorkdirTasksChanged.class, name = "workdir_tasks_changed"),
    @JsonSubTypes.Type(value = ServerEvent.ConversationChanged.class, name = "conversation_changed"),
    @JsonSubTypes.Type(value = ServerEvent.Toast.class, name = "toast"),
    @JsonSubTypes.Type(value = ServerEvent.TaskCreated.class, name = "task_created")
})
public interface ServerEvent {

    /** Full application snapshot; the client replaces its state. */
    record AppChanged(
        @JsonProperty("snapshot") AppSnapshot snapshot
    ) implements ServerEvent {}

    /** Summaries of tasks that changed, across all workdirs. */
    record TaskSummariesChanged(
        @JsonProperty("tasks") List<TaskSummary> tasks
    ) implements ServerEvent {}

    /** Complete task list of one workdir. */
    record WorkdirTasksChanged(
        @JsonProperty("workdir_id") long workdirId,
        @JsonProperty("tasks") List<TaskSummary> tasks
    ) implements ServerEvent {}

    /** Tail of a task's conversation after a change. */
    record ConversationChanged(
        @JsonProperty("snapshot") ConversationSnapshot snapshot
    ) implements ServerEvent {}

    record Toast(
        @JsonProperty("kind") String kind,
        @JsonProperty("message") String message
    ) implements ServerEvent {}

    /** A task was created implicitly by a send without a task id. */
    record TaskCreated(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("workdir_id") long workdirId,
        @JsonProperty("task_id") long taskId
    ) implements ServerEvent {}
}
