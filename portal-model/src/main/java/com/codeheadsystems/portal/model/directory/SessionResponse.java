package com.codeheadsystems.portal.model.directory;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An active identity provider session of a user.
 * <p>
 * Used by: {@code GET /api/v1/users/{id}/sessions}
 *
 * @param id         the session id
 * @param userId     the user's id
 * @param username   the user's login name
 * @param ipAddress  the address the session was opened from
 * @param start      session start in epoch milliseconds
 * @param lastAccess last activity in epoch milliseconds
 */
public record SessionResponse(
    @JsonProperty("id") String id,
    @JsonProperty("userId") String userId,
    @JsonProperty("username") String username,
    @JsonProperty("ipAddress") String ipAddress,
    @JsonProperty("start") long start,
    @JsonProperty("lastAccess") long lastAccess) {
}
