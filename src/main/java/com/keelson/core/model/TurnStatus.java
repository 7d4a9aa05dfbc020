package com.keelson.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Derived turn state of a task as shown to clients.
 */
public enum TurnStatus {
    IDLE,
    RUNNING,
    PAUSED;  // idle, queued prompts held back until resumed

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
