package com.keelson.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A working copy belonging to a project. Tasks live inside a workdir.
 *
 * @param id        numeric id, unique across projects
 * @param projectId owning project slug
 * @param name      display name ("main" for the primary checkout)
 * @param path      absolute path on disk
 * @param status    active or archived; archived workdirs accept no new turns
 */
public record Workdir(
    @JsonProperty("id") long id,
    @JsonProperty("project_id") String projectId,
    @JsonProperty("name") String name,
    @JsonProperty("path") String path,
    @JsonProperty("status") WorkdirStatus status
) {
    public Workdir withStatus(WorkdirStatus newStatus) {
        return new Workdir(id, projectId, name, path, newStatus);
    }

    public boolean isArchived() {
        return status == WorkdirStatus.ARCHIVED;
    }
}
