package com.keelson.core.workdir;

import com.keelson.core.config.KeelsonProperties;
import com.keelson.core.engine.ActionRejectedException;
import com.keelson.core.engine.NotFoundException;
import com.keelson.core.model.Project;
import com.keelson.core.model.Workdir;
import com.keelson.core.model.WorkdirStatus;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Projects and their workdirs. Checkouts are created outside Keelson; this registry only
 * records where they are.
 */
@Service
public class WorkdirRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkdirRegistry.class);

    private final KeelsonProperties properties;
    private final Map<String, Project> projects = new LinkedHashMap<>();
    private final Map<Long, Workdir> workdirs = new LinkedHashMap<>();
    private long nextWorkdirId = 1;

    public WorkdirRegistry(KeelsonProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    void seed() {
        for (KeelsonProperties.WorkdirSeed seed : properties.getWorkdirs()) {
            try {
                AddedProject added = addProject(seed.getPath(), seed.getName());
                log.info("Registered project {} at {}", added.project().id(), added.project().path());
            } catch (ActionRejectedException e) {
                log.warn("Skipping configured workdir {}: {}", seed.getPath(), e.getMessage());
            }
        }
    }

    /**
     * Registers a project checkout and its primary ("main") workdir.
     *
     * @param path directory of the checkout; must exist and not be registered yet
     * @param name display name, defaults to the directory name
     */
    public synchronized AddedProject addProject(String path, String name) {
        if (path == null || path.isBlank()) {
            throw new ActionRejectedException("project path is required");
        }
        Path dir;
        try {
            dir = Path.of(path.trim()).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new ActionRejectedException("invalid project path: " + e.getReason());
        }
        if (!Files.isDirectory(dir)) {
            throw new ActionRejectedException("not a directory: " + dir);
        }
        String normalized = dir.toString();
        for (Project existing : projects.values()) {
            if (existing.path().equals(normalized)) {
                throw new ActionRejectedException("project already added: " + normalized);
            }
        }
        String displayName = name == null || name.isBlank()
                ? (dir.getFileName() == null ? normalized : dir.getFileName().toString())
                : name.trim();
        Project project = new Project(uniqueSlug(displayName), displayName, normalized);
        projects.put(project.id(), project);

        Workdir workdir = new Workdir(nextWorkdirId++, project.id(), "main", normalized, WorkdirStatus.ACTIVE);
        workdirs.put(workdir.id(), workdir);
        return new AddedProject(project, workdir);
    }

    /**
     * Marks a workdir archived. Archived workdirs keep their tasks but accept no new turns.
     */
    public synchronized Workdir archive(long workdirId) {
        Workdir workdir = require(workdirId);
        if (workdir.isArchived()) {
            throw new ActionRejectedException("workdir already archived: " + workdirId);
        }
        Workdir archived = workdir.withStatus(WorkdirStatus.ARCHIVED);
        workdirs.put(workdirId, archived);
        return archived;
    }

    public synchronized Optional<Workdir> find(long workdirId) {
        return Optional.ofNullable(workdirs.get(workdirId));
    }

    public Workdir require(long workdirId) {
        return find(workdirId).orElseThrow(() -> NotFoundException.workdir(workdirId));
    }

    public synchronized List<Project> projects() {
        return List.copyOf(projects.values());
    }

    public synchronized List<Workdir> workdirsOf(String projectId) {
        List<Workdir> result = new ArrayList<>();
        for (Workdir workdir : workdirs.values()) {
            if (workdir.projectId().equals(projectId)) {
                result.add(workdir);
            }
        }
        return result;
    }

    public synchronized List<Workdir> workdirs() {
        return List.copyOf(workdirs.values());
    }

    private String uniqueSlug(String name) {
        String base = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-+|-+$)", "");
        if (base.isEmpty()) {
            base = "project";
        }
        String slug = base;
        int n = 2;
        while (projects.containsKey(slug)) {
            slug = base + "-" + n++;
        }
        return slug;
    }

    public record AddedProject(Project project, Workdir workdir) {}
}
