package com.keelson.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity of a task: task ids are allocated per workdir starting at 1.
 *
 * @param workdirId owning workdir
 * @param taskId    task id within the workdir
 */
public record TaskKey(
    @JsonProperty("workdir_id") long workdirId,
    @JsonProperty("task_id") long taskId
) {
    @Override
    public String toString() {
        return workdirId + "/" + taskId;
    }
}
