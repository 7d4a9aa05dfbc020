package com.keelson.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * User-visible lifecycle status of a task.
 * <p>
 * The legacy names {@code in_progress} and {@code in_review} are accepted on input and
 * normalized to {@link #ITERATING} and {@link #VALIDATING}. Only canonical names are ever
 * written.
 */
public enum TaskStatus {
    BACKLOG("backlog"),
    TODO("todo"),
    ITERATING("iterating"),
    VALIDATING("validating"),
    DONE("done"),
    CANCELED("canceled");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a status name, accepting legacy aliases. Case and surrounding whitespace are ignored.
     */
    public static Optional<TaskStatus> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "backlog" -> Optional.of(BACKLOG);
            case "todo" -> Optional.of(TODO);
            case "iterating", "in_progress" -> Optional.of(ITERATING);
            case "validating", "in_review" -> Optional.of(VALIDATING);
            case "done" -> Optional.of(DONE);
            case "canceled" -> Optional.of(CANCELED);
            default -> Optional.empty();
        };
    }

    @JsonCreator
    public static TaskStatus fromWire(String value) {
        return parse(value).orElseThrow(
                () -> new IllegalArgumentException("Unknown task status: " + value));
    }
}
