package com.codeheadsystems.portal.model.directory;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code PUT /api/v1/users/{id}}. Null fields are left unchanged.
 *
 * @param email     the new email address
 * @param firstName the new given name
 * @param lastName  the new family name
 * @param enabled   enable or disable the account
 */
public record UpdateUserRequest(
    @JsonProperty("email") String email,
    @JsonProperty("firstName") String firstName,
    @JsonProperty("lastName") String lastName,
    @JsonProperty("enabled") Boolean enabled) {
}
