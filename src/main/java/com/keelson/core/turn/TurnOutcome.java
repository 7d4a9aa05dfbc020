package com.keelson.core.turn;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of a turn that ran to completion.
 *
 * @param usage token usage reported by the executor; may be {@code null}
 */
public record TurnOutcome(JsonNode usage) {

    public static TurnOutcome completed() {
        return new TurnOutcome(null);
    }
}
