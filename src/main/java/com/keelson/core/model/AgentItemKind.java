package com.keelson.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of structured items an agent emits while working.
 */
public enum AgentItemKind {
    AGENT_MESSAGE,
    REASONING,
    COMMAND_EXECUTION,
    FILE_CHANGE,
    MCP_TOOL_CALL,
    WEB_SEARCH,
    TODO_LIST,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AgentItemKind fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
