package com.keelson.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a turn is currently executing for a task.
 */
public enum RunStatus {
    IDLE,
    RUNNING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
