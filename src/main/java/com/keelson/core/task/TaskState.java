package com.keelson.core.task;

import com.keelson.core.conversation.AgentEvent;
import com.keelson.core.conversation.ConversationLog;
import com.keelson.core.conversation.ConversationPage;
import com.keelson.core.conversation.ConversationSnapshot;
import com.keelson.core.conversation.SystemEvent;
import com.keelson.core.conversation.UserEvent;
import com.keelson.core.engine.ActionRejectedException;
import com.keelson.core.engine.NotFoundException;
import com.keelson.core.model.AttachmentRef;
import com.keelson.core.model.QueuedPrompt;
import com.keelson.core.model.RunStatus;
import com.keelson.core.model.TaskKey;
import com.keelson.core.model.TaskStatus;
import com.keelson.core.model.TaskSummary;
import com.keelson.core.model.TurnResult;
import com.keelson.core.model.TurnStatus;
import com.keelson.core.turn.CancellationToken;
import com.keelson.core.turn.TurnCompletion;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one task: lifecycle status, conversation log, active turn and the
 * queue of pending prompts.
 * <p>
 * Every mutating method requires the caller to hold {@link #lock()}. Validation happens
 * before any field is touched, so a method that throws {@link ActionRejectedException}
 * leaves the task unchanged. Methods that start a turn return a {@link TurnStart} which
 * the caller launches after releasing the lock.
 */
public class TaskState {

    static final int MAX_TITLE_LENGTH = 80;

    private final TaskKey key;
    private final ReentrantLock lock = new ReentrantLock();
    private final ConversationLog log;
    private final long createdAtUnixMs;

    private String title;
    private boolean titleDerived;
    private TaskStatus status = TaskStatus.TODO;
    private boolean starred;
    private long updatedAtUnixMs;

    private final List<QueuedPrompt> pending = new ArrayList<>();
    private long nextPromptId = 1;
    private boolean queuePaused;

    private ActiveTurn activeTurn;
    private long nextTurnSeq = 1;
    private TurnResult lastTurnResult;
    private Long runStartedAtUnixMs;
    private Long runFinishedAtUnixMs;

    public TaskState(TaskKey key, int maxPageSize, long nowUnixMs) {
        this.key = key;
        this.log = new ConversationLog(maxPageSize);
        this.createdAtUnixMs = nowUnixMs;
        this.updatedAtUnixMs = nowUnixMs;
        this.title = "Task " + key.taskId();
        this.log.append(new SystemEvent.TaskCreated(title), nowUnixMs);
    }

    public TaskKey key() {
        return key;
    }

    public ReentrantLock lock() {
        return lock;
    }

    // -- turns --

    /**
     * Handles a user message: starts a turn when idle, enqueues it while a turn is running.
     * A message sent while the queue is paused starts immediately and leaves the held
     * prompts queued.
     */
    public Optional<TurnStart> send(String text, List<AttachmentRef> attachments, long now) {
        requireLocked();
        requireInput(text, attachments);
        if (activeTurn != null) {
            enqueue(text, attachments, now);
            return Optional.empty();
        }
        return Optional.of(beginTurn(text, attachments, now));
    }

    /**
     * Always enqueues; the prompt starts right away if the task is idle and not paused.
     */
    public Optional<TurnStart> queue(String text, List<AttachmentRef> attachments, long now) {
        requireLocked();
        requireInput(text, attachments);
        enqueue(text, attachments, now);
        return startNextIfIdle(now);
    }

    /**
     * Cancels the running turn. With prompts still queued the queue is paused so they do
     * not start until resumed.
     */
    public void cancel(long now) {
        requireLocked();
        if (activeTurn == null) {
            throw new ActionRejectedException("no turn is running");
        }
        cancelActive(now);
    }

    /**
     * Cancels the running turn, if any, and starts a new one with the given input, skipping
     * the queue.
     */
    public TurnStart cancelAndSend(String text, List<AttachmentRef> attachments, long now) {
        requireLocked();
        requireInput(text, attachments);
        if (activeTurn != null) {
            cancelActive(now);
        }
        return beginTurn(text, attachments, now);
    }

    /**
     * Records an event produced by a turn.
     *
     * @return false when the event was ignored (stale turn or duplicate item)
     */
    public boolean recordAgentEvent(String turnId, AgentEvent event, long now) {
        requireLocked();
        if (!isActiveTurn(turnId)) {
            return false;
        }
        boolean appended;
        if (event instanceof AgentEvent.Item item) {
            appended = log.appendItem(item.item(), now).isPresent();
        } else {
            log.append(event, now);
            appended = true;
        }
        if (appended) {
            if (event.countsAsStep()) {
                activeTurn.steps++;
            }
            updatedAtUnixMs = now;
        }
        return appended;
    }

    /**
     * Records the end of a turn and dequeues the next prompt unless the queue is paused.
     *
     * @return empty when the completion belongs to a turn that is no longer active
     */
    public Optional<Finished> finishTurn(String turnId, TurnCompletion completion, long now) {
        requireLocked();
        if (!isActiveTurn(turnId)) {
            return Optional.empty();
        }
        if (completion.success()) {
            if (completion.usage() != null && !completion.usage().isNull()) {
                log.append(new AgentEvent.TurnUsage(completion.usage()), now);
            }
            log.append(new AgentEvent.TurnDuration(completion.durationMs()), now);
            lastTurnResult = TurnResult.COMPLETED;
        } else {
            log.append(new AgentEvent.TurnError(completion.error() == null ? "turn failed" : completion.error()), now);
            log.append(new AgentEvent.TurnDuration(completion.durationMs()), now);
            lastTurnResult = TurnResult.FAILED;
        }
        activeTurn = null;
        runFinishedAtUnixMs = now;
        updatedAtUnixMs = now;
        return Optional.of(new Finished(lastTurnResult, startNextIfIdle(now)));
    }

    // -- queue --

    public void removePrompt(long promptId) {
        requireLocked();
        int index = indexOf(promptId);
        pending.remove(index);
        if (pending.isEmpty()) {
            queuePaused = false;
        }
    }

    /**
     * Moves the prompt {@code activeId} to the position currently held by {@code overId}.
     */
    public void reorderPrompt(long activeId, long overId) {
        requireLocked();
        int from = indexOf(activeId);
        int to = indexOf(overId);
        if (from == to) {
            return;
        }
        QueuedPrompt moved = pending.remove(from);
        pending.add(to, moved);
    }

    public void updatePrompt(long promptId, String text) {
        requireLocked();
        int index = indexOf(promptId);
        if (text == null || text.isBlank()) {
            throw new ActionRejectedException("prompt text must not be empty");
        }
        pending.set(index, pending.get(index).withText(text));
    }

    public void clearQueue() {
        requireLocked();
        if (pending.isEmpty() && !queuePaused) {
            throw new ActionRejectedException("queue is empty");
        }
        pending.clear();
        queuePaused = false;
    }

    /**
     * Leaves the paused state and starts the oldest queued prompt if idle.
     */
    public Optional<TurnStart> resume(long now) {
        requireLocked();
        if (!queuePaused) {
            throw new ActionRejectedException("queue is not paused");
        }
        queuePaused = false;
        return startNextIfIdle(now);
    }

    // -- task metadata --

    /**
     * @return true when the status actually changed
     */
    public boolean setStatus(TaskStatus newStatus, long now) {
        requireLocked();
        if (newStatus == null) {
            throw new ActionRejectedException("task status is required");
        }
        if (newStatus == status) {
            return false;
        }
        changeStatus(newStatus, now);
        return true;
    }

    public void setStarred(boolean starred, long now) {
        requireLocked();
        this.starred = starred;
        this.updatedAtUnixMs = now;
    }

    /**
     * Appends the lifecycle entries of a terminal command run from this task.
     */
    public void recordTerminalEvent(SystemEvent event, long now) {
        requireLocked();
        log.append(event, now);
        updatedAtUnixMs = now;
    }

    // -- reads --

    public RunStatus runStatus() {
        return activeTurn != null ? RunStatus.RUNNING : RunStatus.IDLE;
    }

    public TurnStatus turnStatus() {
        if (activeTurn != null) {
            return TurnStatus.RUNNING;
        }
        return resumeAvailable() ? TurnStatus.PAUSED : TurnStatus.IDLE;
    }

    public boolean resumeAvailable() {
        return queuePaused && !pending.isEmpty();
    }

    public boolean queuePaused() {
        return queuePaused;
    }

    public List<QueuedPrompt> pendingPrompts() {
        return List.copyOf(pending);
    }

    public String title() {
        return title;
    }

    public TaskStatus status() {
        return status;
    }

    public TurnResult lastTurnResult() {
        return lastTurnResult;
    }

    public Optional<String> activeTurnId() {
        return activeTurn == null ? Optional.empty() : Optional.of(activeTurn.turnId);
    }

    public int activeTurnSteps() {
        return activeTurn == null ? 0 : activeTurn.steps;
    }

    public ConversationLog conversation() {
        return log;
    }

    public TaskSummary summary() {
        return new TaskSummary(key.workdirId(), key.taskId(), title, status, starred, runStatus(),
                turnStatus(), lastTurnResult, queuePaused, pending.size(), createdAtUnixMs, updatedAtUnixMs);
    }

    /**
     * Builds a conversation snapshot. Callers hold the lock so that the page, the run state
     * and {@code rev} agree.
     */
    public ConversationSnapshot snapshot(long rev, Integer before, Integer limit) {
        ConversationPage page = log.page(before, limit);
        return new ConversationSnapshot(rev, key.workdirId(), key.taskId(), title, status, runStatus(),
                turnStatus(), lastTurnResult, queuePaused, resumeAvailable(), pending,
                page.entries(), page.entriesTotal(), page.entriesStart(), page.truncated(),
                runStartedAtUnixMs, runFinishedAtUnixMs);
    }

    // -- internals --

    private TurnStart beginTurn(String text, List<AttachmentRef> attachments, long now) {
        if (activeTurn != null) {
            throw new ActionRejectedException("a turn is already running");
        }
        List<AttachmentRef> refs = attachments == null ? List.of() : attachments;
        log.append(new UserEvent.Message(text == null ? "" : text, refs), now);
        if (status == TaskStatus.TODO) {
            changeStatus(TaskStatus.ITERATING, now);
        }
        if (!titleDerived) {
            deriveTitle(text);
        }
        String turnId = "turn_" + key.workdirId() + "_" + key.taskId() + "_" + nextTurnSeq++;
        CancellationToken token = new CancellationToken();
        activeTurn = new ActiveTurn(turnId, token);
        runStartedAtUnixMs = now;
        runFinishedAtUnixMs = null;
        updatedAtUnixMs = now;
        return new TurnStart(turnId, text == null ? "" : text, refs, token);
    }

    private Optional<TurnStart> startNextIfIdle(long now) {
        if (activeTurn != null || queuePaused || pending.isEmpty()) {
            return Optional.empty();
        }
        QueuedPrompt next = pending.remove(0);
        return Optional.of(beginTurn(next.text(), next.attachments(), now));
    }

    private void cancelActive(long now) {
        ActiveTurn turn = activeTurn;
        activeTurn = null;
        turn.token.cancel();
        log.append(new AgentEvent.TurnCanceled(turn.steps), now);
        lastTurnResult = TurnResult.CANCELED;
        queuePaused = !pending.isEmpty();
        runFinishedAtUnixMs = now;
        updatedAtUnixMs = now;
    }

    private void enqueue(String text, List<AttachmentRef> attachments, long now) {
        pending.add(new QueuedPrompt(nextPromptId++, text == null ? "" : text, attachments));
        updatedAtUnixMs = now;
    }

    private void changeStatus(TaskStatus to, long now) {
        TaskStatus from = status;
        status = to;
        log.append(new SystemEvent.TaskStatusChanged(from, to), now);
        updatedAtUnixMs = now;
    }

    private void deriveTitle(String text) {
        if (text == null) {
            return;
        }
        for (String line : text.split("\\R")) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty()) {
                title = trimmed.length() > MAX_TITLE_LENGTH ? trimmed.substring(0, MAX_TITLE_LENGTH) : trimmed;
                titleDerived = true;
                return;
            }
        }
    }

    private int indexOf(long promptId) {
        Iterator<QueuedPrompt> it = pending.iterator();
        for (int i = 0; it.hasNext(); i++) {
            if (it.next().id() == promptId) {
                return i;
            }
        }
        throw new NotFoundException("queued prompt not found: " + promptId);
    }

    private boolean isActiveTurn(String turnId) {
        return activeTurn != null && activeTurn.turnId.equals(turnId);
    }

    private static void requireInput(String text, List<AttachmentRef> attachments) {
        boolean noText = text == null || text.isBlank();
        boolean noAttachments = attachments == null || attachments.isEmpty();
        if (noText && noAttachments) {
            throw new ActionRejectedException("message must not be empty");
        }
    }

    private void requireLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("task lock not held for " + key);
        }
    }

    /**
     * Outcome of an applied turn completion.
     *
     * @param result how the turn ended
     * @param next   the queued prompt that started as a result, if any
     */
    public record Finished(TurnResult result, Optional<TurnStart> next) {}

    private static final class ActiveTurn {
        private final String turnId;
        private final CancellationToken token;
        private int steps;

        private ActiveTurn(String turnId, CancellationToken token) {
            this.turnId = turnId;
            this.token = token;
        }
    }
}
