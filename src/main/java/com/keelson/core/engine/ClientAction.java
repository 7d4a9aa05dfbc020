package com.keelson.core.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.keelson.core.model.AttachmentRef;
import com.keelson.core.model.TaskKey;
import com.keelson.core.model.TaskStatus;

import java.util.List;

/**
 * The closed set of actions a client can send. Decoded from JSON by its {@code type} tag;
 * handled exhaustively through {@link Visitor}, so adding an action means adding a visit
 * method every handler must implement.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClientAction.AddProject.class, name = "add_project"),
    @JsonSubTypes.Type(value = ClientAction.ArchiveWorkdir.class, name = "archive_workdir"),
    @JsonSubTypes.Type(value = ClientAction.CreateTask.class, name = "create_task"),
    @JsonSubTypes.Type(value = ClientAction.SendAgentMessage.class, name = "send_agent_message"),
    @JsonSubTypes.Type(value = ClientAction.QueueAgentMessage.class, name = "queue_agent_message"),
    @JsonSubTypes.Type(value = ClientAction.CancelAgentTurn.class, name = "cancel_agent_turn"),
    @JsonSubTypes.Type(value = ClientAction.CancelAndSendAgentMessage.class, name = "cancel_and_send_agent_message"),
    @JsonSubTypes.Type(value = ClientAction.RemoveQueuedPrompt.class, name = "remove_queued_prompt"),
    @JsonSubTypes.Type(value = ClientAction.ReorderQueuedPrompt.class, name = "reorder_queued_prompt"),
    @JsonSubTypes.Type(value = ClientAction.UpdateQueuedPrompt.class, name = "update_queued_prompt"),
    @JsonSubTypes.Type(value = ClientAction.ClearQueuedPrompts.class, name = "clear_queued_prompts"),
    @JsonSubTypes.Type(value = ClientAction.ResumeQueuedPrompts.class, name = "resume_queued_prompts"),
    @JsonSubTypes.Type(value = ClientAction.TaskStatusSet.class, name = "task_status_set"),
    @JsonSubTypes.Type(value = ClientAction.TaskStarSet.class, name = "task_star_set"),
    @JsonSubTypes.Type(value = ClientAction.RunTerminalCommand.class, name = "run_terminal_command")
})
public interface ClientAction {

    <R> R accept(Visitor<R> visitor);

    /**
     * Wire name of an action, as declared in {@link JsonSubTypes}.
     */
    static String typeName(ClientAction action) {
        for (JsonSubTypes.Type type : ClientAction.class.getAnnotation(JsonSubTypes.class).value()) {
            if (type.value() == action.getClass()) {
                return type.name();
            }
        }
        return action.getClass().getSimpleName();
    }

    interface Visitor<R> {
        R visit(AddProject action);
        R visit(ArchiveWorkdir action);
        R visit(CreateTask action);
        R visit(SendAgentMessage action);
        R visit(QueueAgentMessage action);
        R visit(CancelAgentTurn action);
        R visit(CancelAndSendAgentMessage action);
        R visit(RemoveQueuedPrompt action);
        R visit(ReorderQueuedPrompt action);
        R visit(UpdateQueuedPrompt action);
        R visit(ClearQueuedPrompts action);
        R visit(ResumeQueuedPrompts action);
        R visit(TaskStatusSet action);
        R visit(TaskStarSet action);
        R visit(RunTerminalCommand action);
    }

    /** An action aimed at an existing task. */
    interface TaskAction extends ClientAction {
        long workdirId();

        long taskId();

        default TaskKey key() {
            return new TaskKey(workdirId(), taskId());
        }
    }

    record AddProject(
        @JsonProperty("path") String path,
        @JsonProperty("name") String name
    ) implements ClientAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record ArchiveWorkdir(
        @JsonProperty("workdir_id") long workdirId
    ) implements ClientAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record CreateTask(
        @JsonProperty("workdir_id") long workdirId
    ) implements ClientAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    /**
     * Sends a message; a {@code null} task id creates a new task for it.
     */
    record SendAgentMessage(
        @JsonProperty("workdir_id") long workdirId,
        @JsonProperty("task_id") Long taskId,
        @JsonProperty("text") String text,
        @JsonProperty("attachments") List<AttachmentRef> attachments
    ) implements ClientAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    /**
     * Queues a message behind the running turn; a {@code null} task id creates a new task.
     */
    record QueueAgentMessage(
        @JsonProperty("workdir_id") long workdirId,
        @JsonProperty("task_id") Long taskId,
        @JsonProperty("text") String text,
        @JsonProperty("attachments") List<AttachmentRef> attachments
    ) implements ClientAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record CancelAgentTurn(
        @JsonProperty("workdir_id") long workdirId,
        @JsonProperty("task_id") long taskId
    ) implements TaskAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record CancelAndSendAgentMessage(
        @JsonProperty("workdir_id") long workdirId,
        @JsonProperty("task_id") long taskId,
        @JsonProperty("text") String text,
        @JsonProperty("attachments") List<AttachmentRef> attachments
    ) implements TaskAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record RemoveQueuedPrompt(
        @JsonProperty("workdir_id") long workdirId,
        @JsonProperty("task_id") long taskId,
        @JsonProperty("prompt_id") long promptId
    ) implements TaskAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record ReorderQueuedPrompt(
        @JsonProperty("workdir_id") long workdirId,
        @JsonProperty("task_id") long taskId,
        @JsonProperty("active_id") long activeId,
        @JsonProperty("over_id") long overId
    ) implements TaskAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record UpdateQueuedPrompt(
        @JsonProperty("workdir_id") long workdirId,
        @JsonProperty("task_id") long taskId,
        @JsonProperty("prompt_id") long promptId,
        @JsonProperty("text") String text
    ) implements TaskAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record ClearQueuedPrompts(
        @JsonProperty("workdir_id") long workdirId,
        @JsonProperty("task_id") long taskId
    ) implements TaskAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record ResumeQueuedPrompts(
        @JsonProperty("workdir_id") long workdirId,
        @JsonProperty("task_id") long taskId
    ) implements TaskAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record TaskStatusSet(
        @JsonProperty("workdir_id") long workdirId,
        @JsonProperty("task_id") long taskId,
        @JsonProperty("task_status") TaskStatus taskStatus
    ) implements TaskAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record TaskStarSet(
        @JsonProperty("workdir_id") long workdirId,
        @JsonProperty("task_id") long taskId,
        @JsonProperty("starred") boolean starred
    ) implements TaskAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record RunTerminalCommand(
        @JsonProperty("workdir_id") long workdirId,
        @JsonProperty("task_id") long taskId,
        @JsonProperty("command") String command
    ) implements TaskAction {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }
}
