package com.codeheadsystems.portal.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public OIDC settings the browser front end needs to start a login.
 * <p>
 * Used by: {@code GET /api/v1/config}
 *
 * @param issuerUrl   the OIDC issuer URL
 * @param realm       the identity provider realm
 * @param clientId    the public client id
 * @param loginPath   the portal path that starts the authorization code flow
 */
public record PublicConfigResponse(
    @JsonProperty("issuerUrl") String issuerUrl,
    @JsonProperty("realm") String realm,
    @JsonProperty("clientId") String clientId,
    @JsonProperty("loginPath") String loginPath) {
}
