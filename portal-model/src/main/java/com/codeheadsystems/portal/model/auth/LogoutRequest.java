package com.codeheadsystems.portal.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/v1/auth/logout}.
 *
 * @param refreshToken the refresh token of the provider session to end; may be null
 */
public record LogoutRequest(@JsonProperty("refreshToken") String refreshToken) {
}
