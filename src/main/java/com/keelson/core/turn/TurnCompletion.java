package com.keelson.core.turn;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * How a launched turn ended, as reported by the {@link TurnRunner}.
 *
 * @param success    whether the executor returned normally
 * @param usage      usage of a successful turn, may be {@code null}
 * @param error      failure message of an unsuccessful turn
 * @param durationMs wall-clock time of the turn
 */
public record TurnCompletion(
    boolean success,
    JsonNode usage,
    String error,
    long durationMs
) {
    public static TurnCompletion succeeded(JsonNode usage, long durationMs) {
        return new TurnCompletion(true, usage, null, durationMs);
    }

    public static TurnCompletion failed(String error, long durationMs) {
        return new TurnCompletion(false, null, error, durationMs);
    }
}
