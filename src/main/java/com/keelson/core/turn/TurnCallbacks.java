package com.keelson.core.turn;

import com.keelson.core.conversation.AgentEvent;
import com.keelson.core.model.TaskKey;

/**
 * Where a running turn reports back. Implemented by the command dispatcher, which ignores
 * calls for a turn that is no longer the task's active turn.
 */
public interface TurnCallbacks {

    void onAgentEvent(TaskKey task, String turnId, AgentEvent event);

    void onTurnFinished(TaskKey task, String turnId, TurnCompletion completion);
}
