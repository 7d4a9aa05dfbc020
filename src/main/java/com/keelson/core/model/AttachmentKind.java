package com.keelson.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AttachmentKind {
    IMAGE,
    TEXT,
    FILE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AttachmentKind fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Classifies an upload by its content type.
     */
    public static AttachmentKind fromMime(String mime) {
        if (mime == null || mime.isBlank()) {
            return FILE;
        }
        String lower = mime.toLowerCase(Locale.ROOT);
        if (lower.startsWith("image/")) {
            return IMAGE;
        }
        if (lower.startsWith("text/") || lower.equals("application/json")
                || lower.equals("application/xml") || lower.equals("application/x-yaml")) {
            return TEXT;
        }
        return FILE;
    }
}
