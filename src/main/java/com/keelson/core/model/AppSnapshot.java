package com.keelson.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Full application state a client needs to rebuild its project/workdir tree.
 * Sent on connect when the client is behind and whenever it lagged.
 */
public record AppSnapshot(
    @JsonProperty("rev") long rev,
    @JsonProperty("projects") List<ProjectSnapshot> projects
) {
    public AppSnapshot {
        projects = List.copyOf(projects);
    }

    public record ProjectSnapshot(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("path") String path,
        @JsonProperty("workdirs") List<WorkdirSnapshot> workdirs
    ) {
        public ProjectSnapshot {
            workdirs = List.copyOf(workdirs);
        }
    }

    public record WorkdirSnapshot(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("path") String path,
        @JsonProperty("status") WorkdirStatus status,
        @JsonProperty("agent_run_status") RunStatus agentRunStatus,
        @JsonProperty("task_count") int taskCount
    ) {}
}
