package com.keelson.core.task;

import com.keelson.core.config.KeelsonProperties;
import com.keelson.core.engine.NotFoundException;
import com.keelson.core.model.RunStatus;
import com.keelson.core.model.TaskKey;
import com.keelson.core.model.TaskSummary;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * All tasks, plus an immutable summary per task for cross-task reads.
 * <p>
 * Summaries are refreshed by the dispatcher at the end of every task mutation, so task
 * lists never take task locks.
 */
@Service
public class TaskRegistry {

    private final int maxPageSize;
    private final ConcurrentHashMap<TaskKey, TaskState> tasks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<TaskKey, TaskSummary> summaries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, AtomicLong> nextTaskIds = new ConcurrentHashMap<>();

    @Autowired
    public TaskRegistry(KeelsonProperties properties) {
        this(properties.getConversation().getMaxPageSize());
    }

    TaskRegistry(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    /**
     * Creates a task in a workdir, allocating the next task id of that workdir.
     */
    public TaskState create(long workdirId, long now) {
        long taskId = nextTaskIds.computeIfAbsent(workdirId, k -> new AtomicLong()).incrementAndGet();
        TaskState task = new TaskState(new TaskKey(workdirId, taskId), maxPageSize, now);
        tasks.put(task.key(), task);
        summaries.put(task.key(), task.summary());
        return task;
    }

    public Optional<TaskState> find(TaskKey key) {
        return Optional.ofNullable(tasks.get(key));
    }

    public TaskState require(TaskKey key) {
        TaskState task = tasks.get(key);
        if (task == null) {
            throw NotFoundException.task(key.workdirId(), key.taskId());
        }
        return task;
    }

    /**
     * Publishes the current state of a task to cross-task readers. Caller holds the task lock.
     */
    public TaskSummary refresh(TaskState task) {
        TaskSummary summary = task.summary();
        summaries.put(task.key(), summary);
        return summary;
    }

    public List<TaskSummary> summaries() {
        return summaries.values().stream()
                .sorted(Comparator.comparingLong(TaskSummary::workdirId).thenComparingLong(TaskSummary::taskId))
                .toList();
    }

    /**
     * Tasks of one workdir ordered by task id.
     */
    public List<TaskSummary> summariesOf(long workdirId) {
        return summaries.values().stream()
                .filter(s -> s.workdirId() == workdirId)
                .sorted(Comparator.comparingLong(TaskSummary::taskId))
                .toList();
    }

    public RunStatus workdirRunStatus(long workdirId) {
        return summaries.values().stream()
                .anyMatch(s -> s.workdirId() == workdirId && s.runStatus() == RunStatus.RUNNING)
                ? RunStatus.RUNNING : RunStatus.IDLE;
    }
}
