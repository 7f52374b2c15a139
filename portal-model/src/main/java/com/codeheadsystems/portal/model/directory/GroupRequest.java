package com.codeheadsystems.portal.model.directory;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/v1/groups} and {@code PUT /api/v1/groups/{id}}.
 *
 * @param name the group name, required
 */
public record GroupRequest(
    @JsonProperty("name") String name) {
}
