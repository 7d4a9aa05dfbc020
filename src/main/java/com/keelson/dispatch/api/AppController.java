package com.keelson.dispatch.api;

import com.keelson.core.engine.NotFoundException;
import com.keelson.core.engine.SnapshotService;
import com.keelson.core.engine.TaskList;
import com.keelson.core.model.AppSnapshot;
import com.keelson.core.model.TaskStatus;
import com.keelson.core.model.WorkdirStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST reads for the app snapshot and task lists.
 */
@RestController
@RequestMapping("/api")
public class AppController {

    private static final Logger log = LoggerFactory.getLogger(AppController.class);

    private final SnapshotService snapshots;

    public AppController(SnapshotService snapshots) {
        this.snapshots = snapshots;
    }

    @GetMapping("/app")
    public ResponseEntity<AppSnapshot> app() {
        return ResponseEntity.ok(snapshots.app());
    }

    /**
     * GET /api/tasks. Every filter is optional; unknown status names are a 400.
     */
    @GetMapping("/tasks")
    public ResponseEntity<?> tasks(@RequestParam(name = "project_id", required = false) String projectId,
                                   @RequestParam(name = "workdir_status", required = false) String workdirStatus,
                                   @RequestParam(name = "task_status", required = false) String taskStatus) {
        WorkdirStatus workdirFilter = null;
        if (workdirStatus != null && !workdirStatus.isBlank()) {
            try {
                workdirFilter = WorkdirStatus.fromWire(workdirStatus);
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", "Invalid workdir_status: " + workdirStatus));
            }
        }
        TaskStatus taskFilter = null;
        if (taskStatus != null && !taskStatus.isBlank()) {
            var parsed = TaskStatus.parse(taskStatus);
            if (parsed.isEmpty()) {
                return ResponseEntity.badRequest().body(Map.of("error", "Invalid task_status: " + taskStatus));
            }
            taskFilter = parsed.get();
        }
        String projectFilter = projectId == null || projectId.isBlank() ? null : projectId;
        return ResponseEntity.ok(snapshots.tasks(projectFilter, workdirFilter, taskFilter));
    }

    @GetMapping({"/workdirs/{workdirId}/tasks", "/workspaces/{workdirId}/threads"})
    public ResponseEntity<TaskList> workdirTasks(@PathVariable long workdirId) {
        try {
            return ResponseEntity.ok(snapshots.workdirTasks(workdirId));
        } catch (NotFoundException e) {
            log.debug("Task list for unknown workdir {}", workdirId);
            return ResponseEntity.notFound().build();
        }
    }
}
