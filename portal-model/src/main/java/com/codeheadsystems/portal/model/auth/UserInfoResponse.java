package com.codeheadsystems.portal.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The authenticated caller as seen by the portal.
 * <p>
 * Used by: {@code GET /api/v1/auth/userinfo}
 *
 * @param subject   the token subject
 * @param username  the preferred username
 * @param email     the email address, may be null
 * @param groups    the normalised group names, sorted
 * @param role      the resolved role name, or null when no group maps to a role
 * @param admin     whether the caller holds the administrative role
 * @param expiresAt token expiry in epoch seconds
 */
public record UserInfoResponse(
    @JsonProperty("subject") String subject,
    @JsonProperty("username") String username,
    @JsonProperty("email") String email,
    @JsonProperty("groups") List<String> groups,
    @JsonProperty("role") String role,
    @JsonProperty("admin") boolean admin,
    @JsonProperty("expiresAt") long expiresAt) {
}
