package com.codeheadsystems.portal.dropwizard.config;

import com.codeheadsystems.portal.server.auth.OidcSettings;
import com.codeheadsystems.portal.server.directory.KeycloakSettings;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.util.Duration;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * The {@code oidc:} block: the identity provider the portal trusts and logs users in with.
 * <p>
 * The client credentials double as the service account for the directory admin API, which must
 * hold the realm-management {@code manage-users} and {@code view-users} roles.
 */
public class OidcConfiguration {

  /**
   * Issuer URL, e.g. {@code https://sso.example.com/realms/platform}. Must equal the {@code iss}
   * claim of access tokens.
   */
  @NotNull
  private URI issuerUrl;

  @NotEmpty
  private String realm;

  @NotEmpty
  private String clientId;

  private String clientSecret;

  /**
   * The portal's callback URL as registered with the provider.
   */
  @NotEmpty
  private String redirectUri;

  /**
   * Accepted {@code aud} values. Empty means the client id.
   */
  private List<String> audiences = new ArrayList<>();

  @NotEmpty
  private String groupsClaim = "groups";

  private List<String> scopes = new ArrayList<>();

  @NotNull
  private Duration keyCacheTtl = Duration.minutes(5);

  @NotNull
  private Duration maxKeyStaleness = Duration.hours(1);

  @NotNull
  private Duration minRefreshInterval = Duration.seconds(10);

  @NotNull
  private Duration leeway = Duration.seconds(0);

  /**
   * Base URL of the Keycloak server for the admin API. Defaults to the part of the issuer URL
   * before {@code /realms/}.
   */
  private URI adminBaseUrl;

  @JsonProperty
  public URI getIssuerUrl() {
    return issuerUrl;
  }

  @JsonProperty
  public void setIssuerUrl(final URI issuerUrl) {
    this.issuerUrl = issuerUrl;
  }

  @JsonProperty
  public String getRealm() {
    return realm;
  }

  @JsonProperty
  public void setRealm(final String realm) {
    this.realm = realm;
  }

  @JsonProperty
  public String getClientId() {
    return clientId;
  }

  @JsonProperty
  public void setClientId(final String clientId) {
    this.clientId = clientId;
  }

  @JsonProperty
  public String getClientSecret() {
    return clientSecret;
  }

  @JsonProperty
  public void setClientSecret(final String clientSecret) {
    this.clientSecret = clientSecret;
  }

  @JsonProperty
  public String getRedirectUri() {
    return redirectUri;
  }

  @JsonProperty
  public void setRedirectUri(final String redirectUri) {
    this.redirectUri = redirectUri;
  }

  @JsonProperty
  public List<String> getAudiences() {
    return audiences;
  }

  @JsonProperty
  public void setAudiences(final List<String> audiences) {
    this.audiences = audiences;
  }

  @JsonProperty
  public String getGroupsClaim() {
    return groupsClaim;
  }

  @JsonProperty
  public void setGroupsClaim(final String groupsClaim) {
    this.groupsClaim = groupsClaim;
  }

  @JsonProperty
  public List<String> getScopes() {
    return scopes;
  }

  @JsonProperty
  public void setScopes(final List<String> scopes) {
    this.scopes = scopes;
  }

  @JsonProperty
  public Duration getKeyCacheTtl() {
    return keyCacheTtl;
  }

  @JsonProperty
  public void setKeyCacheTtl(final Duration keyCacheTtl) {
    this.keyCacheTtl = keyCacheTtl;
  }

  @JsonProperty
  public Duration getMaxKeyStaleness() {
    return maxKeyStaleness;
  }

  @JsonProperty
  public void setMaxKeyStaleness(final Duration maxKeyStaleness) {
    this.maxKeyStaleness = maxKeyStaleness;
  }

  @JsonProperty
  public Duration getMinRefreshInterval() {
    return minRefreshInterval;
  }

  @JsonProperty
  public void setMinRefreshInterval(final Duration minRefreshInterval) {
    this.minRefreshInterval = minRefreshInterval;
  }

  @JsonProperty
  public Duration getLeeway() {
    return leeway;
  }

  @JsonProperty
  public void setLeeway(final Duration leeway) {
    this.leeway = leeway;
  }

  @JsonProperty
  public URI getAdminBaseUrl() {
    return adminBaseUrl;
  }

  @JsonProperty
  public void setAdminBaseUrl(final URI adminBaseUrl) {
    this.adminBaseUrl = adminBaseUrl;
  }

  /**
   * The settings the token validator and login flow use.
   *
   * @return the settings
   */
  public OidcSettings toSettings() {
    return new OidcSettings(issuerUrl, realm, clientId, clientSecret, redirectUri, audiences, groupsClaim, scopes,
        Durations.toJava(keyCacheTtl), Durations.toJava(maxKeyStaleness), Durations.toJava(minRefreshInterval),
        Durations.toJava(leeway));
  }

  /**
   * The settings for the directory admin API.
   *
   * @return the settings
   */
  public KeycloakSettings toKeycloakSettings() {
    URI base = adminBaseUrl;
    if (base == null) {
      String issuer = issuerUrl.toString();
      int realms = issuer.indexOf("/realms/");
      if (realms < 0) {
        throw new IllegalStateException("oidc.adminBaseUrl is required when the issuer URL has no /realms/ path");
      }
      base = URI.create(issuer.substring(0, realms));
    }
    return new KeycloakSettings(base, realm, clientId, clientSecret);
  }
}
