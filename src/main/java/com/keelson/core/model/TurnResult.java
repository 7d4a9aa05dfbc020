package com.keelson.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the most recent turn of a task ended.
 */
public enum TurnResult {
    COMPLETED,
    FAILED,
    CANCELED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
