package com.keelson.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A source repository registered with Keelson. Groups one or more workdirs.
 *
 * @param id   slug derived from the name, unique
 * @param name display name
 * @param path absolute path of the main checkout
 */
public record Project(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("path") String path
) {}
