package com.keelson.core.engine;

import com.keelson.core.attachment.AttachmentStore;
import com.keelson.core.config.KeelsonProperties;
import com.keelson.core.conversation.AgentEvent;
import com.keelson.core.conversation.SystemEvent;
import com.keelson.core.events.EventBus;
import com.keelson.core.events.KeelsonEvent;
import com.keelson.core.events.ServerEvent;
import com.keelson.core.logging.MdcContext;
import com.keelson.core.metrics.KeelsonMetrics;
import com.keelson.core.model.AttachmentRef;
import com.keelson.core.model.TaskKey;
import com.keelson.core.model.TaskSummary;
import com.keelson.core.model.Workdir;
import com.keelson.core.pty.PtyKey;
import com.keelson.core.pty.PtyManager;
import com.keelson.core.revision.RevisionStore;
import com.keelson.core.task.TaskRegistry;
import com.keelson.core.task.TaskState;
import com.keelson.core.task.TurnStart;
import com.keelson.core.turn.TurnCallbacks;
import com.keelson.core.turn.TurnCompletion;
import com.keelson.core.turn.TurnRequest;
import com.keelson.core.turn.TurnRunner;
import com.keelson.core.workdir.WorkdirRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.LongConsumer;
import java.util.function.LongSupplier;

/**
 * Single entry point for every state change: client actions, turn events and turn
 * completions.
 * <p>
 * The dispatcher is the only caller of {@link RevisionStore#bump()}. Each accepted action
 * and each recorded executor event advances the revision by exactly one; a rejected
 * action throws before anything is mutated and leaves the revision alone. Task mutations
 * run under the task's lock. Taking a revision and publishing its events happen together
 * under one publish lock, so every subscriber receives events in increasing revision
 * order across all tasks. Turns are launched after the task lock is released.
 */
@Service
public class CommandDispatcher implements TurnCallbacks {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final RevisionStore revisions;
    private final TaskRegistry tasks;
    private final WorkdirRegistry workdirs;
    private final AttachmentStore attachments;
    private final TurnRunner turnRunner;
    private final PtyManager ptyManager;
    private final EventBus eventBus;
    private final SnapshotService snapshots;
    private final KeelsonMetrics metrics;
    private final int eventPageSize;
    private final int outputTailBytes;
    private final LongSupplier clock;

    private final Object appLock = new Object();
    private final Object publishLock = new Object();
    private final AtomicLong commandSeq = new AtomicLong();

    @Autowired
    public CommandDispatcher(RevisionStore revisions, TaskRegistry tasks, WorkdirRegistry workdirs,
                             AttachmentStore attachments, TurnRunner turnRunner, PtyManager ptyManager,
                             EventBus eventBus, SnapshotService snapshots, KeelsonMetrics metrics,
                             KeelsonProperties properties) {
        this(revisions, tasks, workdirs, attachments, turnRunner, ptyManager, eventBus, snapshots, metrics,
                properties.getConversation().getEventPageSize(), properties.getPty().getOutputTailBytes(),
                System::currentTimeMillis);
    }

    CommandDispatcher(RevisionStore revisions, TaskRegistry tasks, WorkdirRegistry workdirs,
                      AttachmentStore attachments, TurnRunner turnRunner, PtyManager ptyManager,
                      EventBus eventBus, SnapshotService snapshots, KeelsonMetrics metrics,
                      int eventPageSize, int outputTailBytes, LongSupplier clock) {
        this.revisions = revisions;
        this.tasks = tasks;
        this.workdirs = workdirs;
        this.attachments = attachments;
        this.turnRunner = turnRunner;
        this.ptyManager = ptyManager;
        this.eventBus = eventBus;
        this.snapshots = snapshots;
        this.metrics = metrics;
        this.eventPageSize = eventPageSize;
        this.outputTailBytes = outputTailBytes;
        this.clock = clock;
    }

    /**
     * Validates and applies an action.
     *
     * @param requestId client request id, echoed in {@code task_created} events
     * @throws ActionRejectedException when the action is not valid in the current state
     */
    public ActionResult dispatch(String requestId, ClientAction action) {
        String type = ClientAction.typeName(action);
        try {
            ActionResult result = action.accept(new Handler(requestId));
            metrics.recordAction(type, "ok");
            log.debug("Applied {} at rev {}", type, result.rev());
            return result;
        } catch (ActionRejectedException e) {
            metrics.recordAction(type, "rejected");
            log.debug("Rejected {}: {}", type, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordAction(type, "failed");
            throw e;
        }
    }

    // -- turn callbacks --

    @Override
    public void onAgentEvent(TaskKey key, String turnId, AgentEvent event) {
        Optional<TaskState> found = tasks.find(key);
        if (found.isEmpty()) {
            return;
        }
        TaskState task = found.get();
        task.lock().lock();
        try {
            if (task.recordAgentEvent(turnId, event, clock.getAsLong())) {
                commitTaskChange(task);
            }
        } finally {
            task.lock().unlock();
        }
    }

    @Override
    public void onTurnFinished(TaskKey key, String turnId, TurnCompletion completion) {
        Optional<TaskState> found = tasks.find(key);
        if (found.isEmpty()) {
            return;
        }
        TaskState task = found.get();
        Optional<TurnStart> next = Optional.empty();
        task.lock().lock();
        try {
            Optional<TaskState.Finished> finished = task.finishTurn(turnId, completion, clock.getAsLong());
            if (finished.isEmpty()) {
                log.debug("Ignoring completion of stale turn {}", turnId);
                return;
            }
            metrics.recordTurn(finished.get().result().wireName(), completion.durationMs());
            next = finished.get().next();
            commitTaskChange(task);
        } finally {
            task.lock().unlock();
        }
        next.ifPresent(start -> launch(task, start));
    }

    void onTerminalCommandExited(TaskKey key, String commandId, String command, PtyKey ptyKey, int exitCode) {
        String tail = ptyManager.find(ptyKey)
                .map(session -> new String(session.buffer().tail(outputTailBytes), StandardCharsets.UTF_8))
                .orElse("");
        Optional<TaskState> found = tasks.find(key);
        if (found.isEmpty()) {
            return;
        }
        TaskState task = found.get();
        task.lock().lock();
        try {
            task.recordTerminalEvent(new SystemEvent.TerminalCommandFinished(commandId, command, exitCode, tail),
                    clock.getAsLong());
            commitTaskChange(task);
        } finally {
            task.lock().unlock();
        }
    }

    // -- internals --

    private ActionResult mutateTask(TaskKey key, Function<TaskState, Optional<TurnStart>> mutation) {
        TaskState task = tasks.require(key);
        Optional<TurnStart> start;
        long rev;
        task.lock().lock();
        try {
            MdcContext.setTask(key);
            start = mutation.apply(task);
            rev = commitTaskChange(task);
        } finally {
            task.lock().unlock();
            MdcContext.clearTask();
        }
        start.ifPresent(s -> launch(task, s));
        return new ActionResult(rev, key);
    }

    /**
     * Creates a task for a send without a task id and applies the send to it under one revision.
     */
    private ActionResult createAndMutate(String requestId, long workdirId,
                                         Function<TaskState, Optional<TurnStart>> mutation) {
        TaskState task = tasks.create(workdirId, clock.getAsLong());
        Optional<TurnStart> start;
        long rev;
        task.lock().lock();
        try {
            MdcContext.setTask(task.key());
            start = mutation.apply(task);
            rev = commit(r -> {
                publishTaskChanged(task, r);
                eventBus.publish(KeelsonEvent.forTask(r, task.key(),
                        new ServerEvent.TaskCreated(requestId, workdirId, task.key().taskId())));
            });
        } finally {
            task.lock().unlock();
            MdcContext.clearTask();
        }
        start.ifPresent(s -> launch(task, s));
        return new ActionResult(rev, task.key());
    }

    /**
     * Takes the next revision and publishes its events before any other revision is taken.
     */
    private long commit(LongConsumer publisher) {
        synchronized (publishLock) {
            long rev = revisions.bump();
            publisher.accept(rev);
            return rev;
        }
    }

    private long commitTaskChange(TaskState task) {
        return commit(rev -> publishTaskChanged(task, rev));
    }

    private void publishTaskChanged(TaskState task, long rev) {
        TaskSummary summary = tasks.refresh(task);
        TaskKey key = task.key();
        eventBus.publish(KeelsonEvent.forTask(rev, key,
                new ServerEvent.ConversationChanged(task.snapshot(rev, null, eventPageSize))));
        eventBus.publish(KeelsonEvent.forTask(rev, key,
                new ServerEvent.TaskSummariesChanged(List.of(summary))));
        eventBus.publish(KeelsonEvent.global(rev,
                new ServerEvent.WorkdirTasksChanged(key.workdirId(), tasks.summariesOf(key.workdirId()))));
    }

    private void launch(TaskState task, TurnStart start) {
        Path dir = workdirs.find(task.key().workdirId()).map(w -> Path.of(w.path())).orElse(null);
        log.info("Starting turn {} for task {}", start.turnId(), task.key());
        turnRunner.launch(new TurnRequest(task.key(), start.turnId(), start.prompt(), start.attachments(), dir),
                start.token(), this);
    }

    private Workdir requireActiveWorkdir(long workdirId) {
        Workdir workdir = workdirs.require(workdirId);
        if (workdir.isArchived()) {
            throw new ActionRejectedException("workdir is archived: " + workdirId);
        }
        return workdir;
    }

    private List<AttachmentRef> resolveAttachments(long workdirId, List<AttachmentRef> refs) {
        if (refs == null || refs.isEmpty()) {
            return List.of();
        }
        List<AttachmentRef> resolved = new ArrayList<>(refs.size());
        for (AttachmentRef ref : refs) {
            if (ref == null || ref.id() == null) {
                throw new ActionRejectedException("attachment id is required");
            }
            resolved.add(attachments.find(workdirId, ref.id())
                    .orElseThrow(() -> new NotFoundException("attachment not found: " + ref.id())));
        }
        return resolved;
    }

    private static void requireMessage(String text, List<AttachmentRef> refs) {
        if ((text == null || text.isBlank()) && (refs == null || refs.isEmpty())) {
            throw new ActionRejectedException("message must not be empty");
        }
    }

    private final class Handler implements ClientAction.Visitor<ActionResult> {

        private final String requestId;

        private Handler(String requestId) {
            this.requestId = requestId;
        }

        @Override
        public ActionResult visit(ClientAction.AddProject action) {
            synchronized (appLock) {
                WorkdirRegistry.AddedProject added = workdirs.addProject(action.path(), action.name());
                log.info("Added project {} at {}", added.project().id(), added.project().path());
                long rev = commit(r -> eventBus.publish(
                        KeelsonEvent.global(r, new ServerEvent.AppChanged(snapshots.app(r)))));
                return new ActionResult(rev, null);
            }
        }

        @Override
        public ActionResult visit(ClientAction.ArchiveWorkdir action) {
            synchronized (appLock) {
                workdirs.archive(action.workdirId());
                log.info("Archived workdir {}", action.workdirId());
                long rev = commit(r -> eventBus.publish(
                        KeelsonEvent.global(r, new ServerEvent.AppChanged(snapshots.app(r)))));
                return new ActionResult(rev, null);
            }
        }

        @Override
        public ActionResult visit(ClientAction.CreateTask action) {
            requireActiveWorkdir(action.workdirId());
            return createAndMutate(requestId, action.workdirId(), task -> Optional.empty());
        }

        @Override
        public ActionResult visit(ClientAction.SendAgentMessage action) {
            requireActiveWorkdir(action.workdirId());
            requireMessage(action.text(), action.attachments());
            List<AttachmentRef> refs = resolveAttachments(action.workdirId(), action.attachments());
            Function<TaskState, Optional<TurnStart>> send = task -> task.send(action.text(), refs, clock.getAsLong());
            if (action.taskId() == null) {
                return createAndMutate(requestId, action.workdirId(), send);
            }
            return mutateTask(new TaskKey(action.workdirId(), action.taskId()), send);
        }

        @Override
        public ActionResult visit(ClientAction.QueueAgentMessage action) {
            requireActiveWorkdir(action.workdirId());
            requireMessage(action.text(), action.attachments());
            List<AttachmentRef> refs = resolveAttachments(action.workdirId(), action.attachments());
            Function<TaskState, Optional<TurnStart>> queue = task -> task.queue(action.text(), refs, clock.getAsLong());
            if (action.taskId() == null) {
                return createAndMutate(requestId, action.workdirId(), queue);
            }
            return mutateTask(new TaskKey(action.workdirId(), action.taskId()), queue);
        }

        @Override
        public ActionResult visit(ClientAction.CancelAgentTurn action) {
            ActionResult result = mutateTask(action.key(), task -> {
                task.cancel(clock.getAsLong());
                return Optional.empty();
            });
            metrics.recordTurnCanceled();
            return result;
        }

        @Override
        public ActionResult visit(ClientAction.CancelAndSendAgentMessage action) {
            requireActiveWorkdir(action.workdirId());
            requireMessage(action.text(), action.attachments());
            List<AttachmentRef> refs = resolveAttachments(action.workdirId(), action.attachments());
            return mutateTask(action.key(),
                    task -> Optional.of(task.cancelAndSend(action.text(), refs, clock.getAsLong())));
        }

        @Override
        public ActionResult visit(ClientAction.RemoveQueuedPrompt action) {
            return mutateTask(action.key(), task -> {
                task.removePrompt(action.promptId());
                return Optional.empty();
            });
        }

        @Override
        public ActionResult visit(ClientAction.ReorderQueuedPrompt action) {
            return mutateTask(action.key(), task -> {
                task.reorderPrompt(action.activeId(), action.overId());
                return Optional.empty();
            });
        }

        @Override
        public ActionResult visit(ClientAction.UpdateQueuedPrompt action) {
            return mutateTask(action.key(), task -> {
                task.updatePrompt(action.promptId(), action.text());
                return Optional.empty();
            });
        }

        @Override
        public ActionResult visit(ClientAction.ClearQueuedPrompts action) {
            return mutateTask(action.key(), task -> {
                task.clearQueue();
                return Optional.empty();
            });
        }

        @Override
        public ActionResult visit(ClientAction.ResumeQueuedPrompts action) {
            requireActiveWorkdir(action.workdirId());
            return mutateTask(action.key(), task -> task.resume(clock.getAsLong()));
        }

        @Override
        public ActionResult visit(ClientAction.TaskStatusSet action) {
            return mutateTask(action.key(), task -> {
                task.setStatus(action.taskStatus(), clock.getAsLong());
                return Optional.empty();
            });
        }

        @Override
        public ActionResult visit(ClientAction.TaskStarSet action) {
            return mutateTask(action.key(), task -> {
                task.setStarred(action.starred(), clock.getAsLong());
                return Optional.empty();
            });
        }

        @Override
        public ActionResult visit(ClientAction.RunTerminalCommand action) {
            Workdir workdir = requireActiveWorkdir(action.workdirId());
            if (action.command() == null || action.command().isBlank()) {
                throw new ActionRejectedException("command must not be empty");
            }
            TaskKey key = action.key();
            return mutateTask(key, task -> {
                String commandId;
                PtyKey ptyKey;
                // a client may already hold a terminal under the next token
                do {
                    commandId = "cmd_" + commandSeq.incrementAndGet();
                    ptyKey = new PtyKey(key.workdirId(), key.taskId(), commandId);
                } while (ptyManager.find(ptyKey).isPresent());
                String startedId = commandId;
                PtyKey startedKey = ptyKey;
                try {
                    ptyManager.spawnCommand(ptyKey, Path.of(workdir.path()), action.command(),
                            code -> onTerminalCommandExited(key, startedId, action.command(), startedKey, code));
                } catch (IOException | IllegalStateException e) {
                    throw new ActionRejectedException("failed to start command: " + e.getMessage());
                }
                task.recordTerminalEvent(new SystemEvent.TerminalCommandStarted(startedId, action.command(), startedId),
                        clock.getAsLong());
                return Optional.empty();
            });
        }
    }
}
