package com.keelson.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable, cross-task view of a task used by task lists and the app snapshot.
 * Refreshed at the end of every mutation of the task.
 */
public record TaskSummary(
    @JsonProperty("workdir_id") long workdirId,
    @JsonProperty("task_id") long taskId,
    @JsonProperty("title") String title,
    @JsonProperty("task_status") TaskStatus taskStatus,
    @JsonProperty("is_starred") boolean starred,
    @JsonProperty("run_status") RunStatus runStatus,
    @JsonProperty("turn_status") TurnStatus turnStatus,
    @JsonProperty("last_turn_result") TurnResult lastTurnResult,
    @JsonProperty("queue_paused") boolean queuePaused,
    @JsonProperty("pending_prompt_count") int pendingPromptCount,
    @JsonProperty("created_at_unix_ms") long createdAtUnixMs,
    @JsonProperty("updated_at_unix_ms") long updatedAtUnixMs
) {
    public TaskKey key() {
        return new TaskKey(workdirId, taskId);
    }
}
