package com.codeheadsystems.portal.model.self;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The caller's own directory account.
 * <p>
 * Used by: {@code GET /api/v1/self/profile}
 *
 * @param id            the directory user id
 * @param username      the login name
 * @param email         the email address
 * @param firstName     the given name
 * @param lastName      the family name
 * @param emailVerified whether the email address was verified
 * @param groups        group names; from the directory, or from the token when the directory is unreachable
 * @param role          the role the caller's groups resolve to, or null
 */
public record ProfileResponse(
    @JsonProperty("id") String id,
    @JsonProperty("username") String username,
    @JsonProperty("email") String email,
    @JsonProperty("firstName") String firstName,
    @JsonProperty("lastName") String lastName,
    @JsonProperty("emailVerified") boolean emailVerified,
    @JsonProperty("groups") List<String> groups,
    @JsonProperty("role") String role) {
}
