package com.codeheadsystems.portal.server.directory;

import java.net.URI;

/**
 * Where the Keycloak admin API lives and how the portal authenticates to it.
 *
 * @param baseUrl      the Keycloak base URL, e.g. {@code https://sso.example.com}
 * @param realm        the realm being administered
 * @param clientId     the service account client id
 * @param clientSecret the service account client secret
 */
public record KeycloakSettings(URI baseUrl, String realm, String clientId, String clientSecret) {

  /**
   * Absolute URI below the base URL.
   *
   * @param path the path, without a leading slash
   * @return the URI
   */
  public URI resolve(final String path) {
    String base = baseUrl.toString();
    return URI.create((base.endsWith("/") ? base : base + "/") + path);
  }

  /**
   * The realm's token endpoint.
   *
   * @return the URI
   */
  public URI tokenEndpoint() {
    return resolve("realms/" + realm + "/protocol/openid-connect/token");
  }

  /**
   * The realm's admin API root.
   *
   * @return the path prefix, without a trailing slash
   */
  public String adminPath() {
    return "admin/realms/" + realm;
  }

  @Override
  public String toString() {
    return "KeycloakSettings[baseUrl=" + baseUrl + ", realm=" + realm + ", clientId=" + clientId + "]";
  }
}
