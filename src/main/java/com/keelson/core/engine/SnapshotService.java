package com.keelson.core.engine;

import com.keelson.core.conversation.ConversationSnapshot;
import com.keelson.core.model.AppSnapshot;
import com.keelson.core.model.Project;
import com.keelson.core.model.TaskKey;
import com.keelson.core.model.TaskStatus;
import com.keelson.core.model.TaskSummary;
import com.keelson.core.model.Workdir;
import com.keelson.core.model.WorkdirStatus;
import com.keelson.core.revision.RevisionStore;
import com.keelson.core.task.TaskRegistry;
import com.keelson.core.task.TaskState;
import com.keelson.core.workdir.WorkdirRegistry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read side: builds the snapshots served over HTTP and pushed on resync.
 */
@Service
public class SnapshotService {

    private final RevisionStore revisions;
    private final TaskRegistry tasks;
    private final WorkdirRegistry workdirs;

    public SnapshotService(RevisionStore revisions, TaskRegistry tasks, WorkdirRegistry workdirs) {
        this.revisions = revisions;
        this.tasks = tasks;
        this.workdirs = workdirs;
    }

    public AppSnapshot app() {
        return app(revisions.current());
    }

    public AppSnapshot app(long rev) {
        List<AppSnapshot.ProjectSnapshot> projects = new ArrayList<>();
        for (Project project : workdirs.projects()) {
            List<AppSnapshot.WorkdirSnapshot> workdirSnapshots = new ArrayList<>();
            for (Workdir workdir : workdirs.workdirsOf(project.id())) {
                workdirSnapshots.add(new AppSnapshot.WorkdirSnapshot(workdir.id(), workdir.name(), workdir.path(),
                        workdir.status(), tasks.workdirRunStatus(workdir.id()),
                        tasks.summariesOf(workdir.id()).size()));
            }
            projects.add(new AppSnapshot.ProjectSnapshot(project.id(), project.name(), project.path(), workdirSnapshots));
        }
        return new AppSnapshot(rev, projects);
    }

    /**
     * All tasks, optionally filtered. A {@code null} filter matches everything.
     */
    public TaskList tasks(String projectId, WorkdirStatus workdirStatus, TaskStatus taskStatus) {
        long rev = revisions.current();
        List<TaskSummary> result = new ArrayList<>();
        for (TaskSummary summary : tasks.summaries()) {
            Optional<Workdir> workdir = workdirs.find(summary.workdirId());
            if (workdir.isEmpty()) {
                continue;
            }
            if (projectId != null && !projectId.equals(workdir.get().projectId())) {
                continue;
            }
            if (workdirStatus != null && workdir.get().status() != workdirStatus) {
                continue;
            }
            if (taskStatus != null && summary.taskStatus() != taskStatus) {
                continue;
            }
            result.add(summary);
        }
        return new TaskList(rev, null, result);
    }

    public TaskList workdirTasks(long workdirId) {
        workdirs.require(workdirId);
        long rev = revisions.current();
        return new TaskList(rev, workdirId, tasks.summariesOf(workdirId));
    }

    /**
     * A page of a task's conversation. Read under the task lock, so {@code rev}, the page and
     * the run state all belong to the same commit.
     */
    public ConversationSnapshot conversation(TaskKey key, Integer before, Integer limit) {
        TaskState task = tasks.require(key);
        task.lock().lock();
        try {
            return task.snapshot(revisions.current(), before, limit);
        } finally {
            task.lock().unlock();
        }
    }
}
