package com.keelson.core.turn;

import com.keelson.core.conversation.AgentEvent;

/**
 * Receives what a turn executor produces while it runs.
 */
@FunctionalInterface
public interface TurnSink {

    void emit(AgentEvent event);
}
