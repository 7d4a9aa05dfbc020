package com.keelson.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A user message waiting for the task's active turn to finish.
 *
 * @param id          unique within the task, never reused
 * @param text        prompt text
 * @param attachments attachments sent with the prompt
 */
public record QueuedPrompt(
    @JsonProperty("id") long id,
    @JsonProperty("text") String text,
    @JsonProperty("attachments") List<AttachmentRef> attachments
) {
    public QueuedPrompt {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public QueuedPrompt withText(String newText) {
        return new QueuedPrompt(id, newText, attachments);
    }
}
