package com.keelson.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reference to an uploaded attachment, carried on user messages and queued prompts.
 *
 * @param id        content hash of the bytes (hex SHA-256)
 * @param kind      image, text or file
 * @param name      original file name
 * @param extension file extension without the dot, may be empty
 * @param mime      content type reported at upload
 * @param byteLen   size in bytes
 */
public record AttachmentRef(
    @JsonProperty("id") String id,
    @JsonProperty("kind") AttachmentKind kind,
    @JsonProperty("name") String name,
    @JsonProperty("extension") String extension,
    @JsonProperty("mime") String mime,
    @JsonProperty("byte_len") long byteLen
) {}
