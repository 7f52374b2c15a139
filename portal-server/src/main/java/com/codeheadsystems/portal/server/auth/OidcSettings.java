package com.codeheadsystems.portal.server.auth;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * Identity provider settings, resolved from configuration.
 *
 * @param issuerUrl          the expected {@code iss} and the base of discovery
 * @param realm              the provider realm
 * @param clientId           the portal's client id
 * @param clientSecret       the portal's client secret
 * @param redirectUri        the callback URI registered with the provider
 * @param audiences          accepted {@code aud} values
 * @param groupsClaim        the claim carrying group names
 * @param scopes             scopes requested at login
 * @param keyCacheTtl        how long fetched signing keys are considered fresh
 * @param maxKeyStaleness    how long stale keys may be served while the provider is unreachable
 * @param minRefreshInterval minimum spacing of on-demand key refreshes
 * @param leeway             clock leeway for time-based claims
 */
public record OidcSettings(URI issuerUrl,
                           String realm,
                           String clientId,
                           String clientSecret,
                           String redirectUri,
                           List<String> audiences,
                           String groupsClaim,
                           List<String> scopes,
                           Duration keyCacheTtl,
                           Duration maxKeyStaleness,
                           Duration minRefreshInterval,
                           Duration leeway) {

  /**
   * Applies defaults for the optional lists.
   */
  public OidcSettings {
    audiences = audiences == null || audiences.isEmpty() ? List.of(clientId) : List.copyOf(audiences);
    scopes = scopes == null || scopes.isEmpty() ? List.of("openid", "profile", "email") : List.copyOf(scopes);
    groupsClaim = groupsClaim == null || groupsClaim.isBlank() ? "groups" : groupsClaim;
  }

  /**
   * The issuer as it appears in tokens, without a trailing slash.
   *
   * @return the issuer string
   */
  public String issuer() {
    String value = issuerUrl.toString();
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }

  @Override
  public String toString() {
    return "OidcSettings[issuer=" + issuer() + ", clientId=" + clientId + "]";
  }
}
