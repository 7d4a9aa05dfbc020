package com.keelson.core.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.keelson.core.model.TaskSummary;

import java.util.List;

/**
 * A list of task summaries read at {@code rev}; {@code workdir_id} is set for per-workdir lists.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskList(
    @JsonProperty("rev") long rev,
    @JsonProperty("workdir_id") Long workdirId,
    @JsonProperty("tasks") List<TaskSummary> tasks
) {
    public TaskList {
        tasks = List.copyOf(tasks);
    }
}
