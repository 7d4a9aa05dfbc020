package com.keelson.core.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keelson.core.model.QueuedPrompt;
import com.keelson.core.model.RunStatus;
import com.keelson.core.model.TaskStatus;
import com.keelson.core.model.TurnResult;
import com.keelson.core.model.TurnStatus;

import java.util.List;

/**
 * A page of a task's conversation together with the task's run and queue state,
 * all taken at the same revision.
 */
public record ConversationSnapshot(
    @JsonProperty("rev") long rev,
    @JsonProperty("workdir_id") long workdirId,
    @JsonProperty("task_id") long taskId,
    @JsonProperty("title") String title,
    @JsonProperty("task_status") TaskStatus taskStatus,
    @JsonProperty("run_status") RunStatus runStatus,
    @JsonProperty("turn_status") TurnStatus turnStatus,
    @JsonProperty("last_turn_result") TurnResult lastTurnResult,
    @JsonProperty("queue_paused") boolean queuePaused,
    @JsonProperty("resume_available") boolean resumeAvailable,
    @JsonProperty("pending_prompts") List<QueuedPrompt> pendingPrompts,
    @JsonProperty("entries") List<ConversationEntry> entries,
    @JsonProperty("entries_total") int entriesTotal,
    @JsonProperty("entries_start") int entriesStart,
    @JsonProperty("entries_truncated") boolean entriesTruncated,
    @JsonProperty("run_started_at_unix_ms") Long runStartedAtUnixMs,
    @JsonProperty("run_finished_at_unix_ms") Long runFinishedAtUnixMs
) {
    public ConversationSnapshot {
        pendingPrompts = List.copyOf(pendingPrompts);
        entries = List.copyOf(entries);
    }
}
