package com.codeheadsystems.portal.model.directory;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A group held by the identity provider.
 *
 * @param id   the provider's group id
 * @param name the group name
 * @param path the full group path, e.g. {@code /developers}
 */
public record GroupResponse(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("path") String path) {
}
