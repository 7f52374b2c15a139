package com.codeheadsystems.portal.model.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tokens issued by the identity provider at the end of the authorization code flow.
 * <p>
 * Field names follow the OAuth 2.0 token endpoint response so the same record reads the
 * provider's reply and is returned from {@code GET /api/v1/auth/callback}.
 *
 * @param accessToken  the bearer token used against this API
 * @param idToken      the OIDC id token
 * @param refreshToken the refresh token, needed to end the provider session on logout
 * @param expiresIn    access token lifetime in seconds
 * @param tokenType    always {@code Bearer}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("id_token") String idToken,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("expires_in") long expiresIn,
    @JsonProperty("token_type") String tokenType) {
}
