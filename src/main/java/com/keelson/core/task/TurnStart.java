package com.keelson.core.task;

import com.keelson.core.model.AttachmentRef;
import com.keelson.core.turn.CancellationToken;

import java.util.List;

/**
 * A turn that was committed to a task's state and must now be handed to the turn runner.
 * Produced under the task lock, launched after it is released.
 */
public record TurnStart(
    String turnId,
    String prompt,
    List<AttachmentRef> attachments,
    CancellationToken token
) {}
