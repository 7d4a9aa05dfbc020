package com.keelson.core.turn;

import com.keelson.core.model.AttachmentRef;
import com.keelson.core.model.TaskKey;

import java.nio.file.Path;
import java.util.List;

/**
 * Input of one turn.
 *
 * @param task        owning task
 * @param turnId      unique id of this turn, used to discard events from stale turns
 * @param prompt      user message that started the turn
 * @param attachments attachments sent with the prompt
 * @param workdir     working copy the agent operates in
 */
public record TurnRequest(
    TaskKey task,
    String turnId,
    String prompt,
    List<AttachmentRef> attachments,
    Path workdir
) {
    public TurnRequest {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }
}
