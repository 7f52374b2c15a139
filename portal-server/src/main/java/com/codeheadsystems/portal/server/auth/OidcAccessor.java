package com.codeheadsystems.portal.server.auth;

import static com.codeheadsystems.portal.server.http.HttpExchanges.form;
import static com.codeheadsystems.portal.server.http.HttpExchanges.isSuccess;
import static com.codeheadsystems.portal.server.http.HttpExchanges.send;

import com.codeheadsystems.portal.model.auth.TokenResponse;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.interfaces.RSAPublicKey;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the OIDC provider: discovery, JWKS, the token endpoint and logout.
 * <p>
 * The discovery document is fetched on first use and kept for the life of the process.
 */
@Singleton
public class OidcAccessor implements IdentityProviderAccessor {

  private static final Logger log = LoggerFactory.getLogger(OidcAccessor.class);
  private static final String UPSTREAM = "identity provider";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final OidcSettings settings;
  private final Duration timeout;
  private volatile Discovery discovery;

  /**
   * Instantiates a new Oidc accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param settings     the settings
   * @param timeout      the per-request timeout
   */
  @Inject
  public OidcAccessor(final HttpClient httpClient,
                      final ObjectMapper objectMapper,
                      final OidcSettings settings,
                      final Duration timeout) {
    log.info("OidcAccessor({})", settings);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.settings = settings;
    this.timeout = timeout;
  }

  @Override
  public Map<String, RSAPublicKey> fetchSigningKeys() {
    URI jwksUri = URI.create(discovery().jwksUri());
    HttpResponse<String> response = send(httpClient, get(jwksUri), UPSTREAM);
    if (!isSuccess(response.statusCode())) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE,
          "JWKS fetch failed with status " + response.statusCode());
    }
    return JsonWebKeys.rsaSigningKeys(response.body());
  }

  @Override
  public URI authorizationEndpoint() {
    return URI.create(discovery().authorizationEndpoint());
  }

  @Override
  public TokenResponse exchangeCode(final String code, final String redirectUri, final String codeVerifier) {
    log.debug("exchangeCode(redirectUri={})", redirectUri);
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("grant_type", "authorization_code");
    fields.put("code", code);
    fields.put("redirect_uri", redirectUri);
    fields.put("code_verifier", codeVerifier);
    fields.put("client_id", settings.clientId());
    fields.put("client_secret", settings.clientSecret());
    HttpResponse<String> response = send(httpClient,
        postForm(URI.create(discovery().tokenEndpoint()), form(fields)), UPSTREAM);
    int status = response.statusCode();
    if (status == 400 || status == 401) {
      throw new PortalException(ErrorCode.UNAUTHENTICATED, "authorization code was rejected");
    }
    if (!isSuccess(status)) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "token endpoint returned " + status);
    }
    return read(response.body(), TokenResponse.class);
  }

  @Override
  public void endSession(final String refreshToken) {
    String endpoint = discovery().endSessionEndpoint();
    if (endpoint == null) {
      log.warn("Provider advertises no end_session_endpoint; skipping provider logout");
      return;
    }
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("client_id", settings.clientId());
    fields.put("client_secret", settings.clientSecret());
    fields.put("refresh_token", refreshToken);
    HttpResponse<String> response = send(httpClient, postForm(URI.create(endpoint), form(fields)), UPSTREAM);
    int status = response.statusCode();
    if (status == 400) {
      throw new PortalException(ErrorCode.INVALID_REQUEST, "refresh token was rejected");
    }
    if (!isSuccess(status)) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "logout endpoint returned " + status);
    }
  }

  private Discovery discovery() {
    Discovery current = discovery;
    if (current != null) {
      return current;
    }
    URI uri = URI.create(settings.issuer() + "/.well-known/openid-configuration");
    HttpResponse<String> response = send(httpClient, get(uri), UPSTREAM);
    if (!isSuccess(response.statusCode())) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE,
          "discovery failed with status " + response.statusCode());
    }
    Discovery fetched = read(response.body(), Discovery.class);
    if (!settings.issuer().equals(fetched.issuer())) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE,
          "discovery issuer " + fetched.issuer() + " does not match " + settings.issuer());
    }
    discovery = fetched;
    return fetched;
  }

  private HttpRequest get(final URI uri) {
    return HttpRequest.newBuilder(uri).timeout(timeout).header("Accept", "application/json").GET().build();
  }

  private HttpRequest postForm(final URI uri, final String body) {
    return HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("Content-Type", "application/x-www-form-urlencoded")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body))
        .build();
  }

  private <T> T read(final String body, final Class<T> type) {
    try {
      return objectMapper.readValue(body, type);
    } catch (JsonProcessingException e) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "unreadable identity provider response", e);
    }
  }

  /**
   * The fields of the discovery document the portal uses.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record Discovery(@JsonProperty("issuer") String issuer,
                   @JsonProperty("authorization_endpoint") String authorizationEndpoint,
                   @JsonProperty("token_endpoint") String tokenEndpoint,
                   @JsonProperty("jwks_uri") String jwksUri,
                   @JsonProperty("end_session_endpoint") String endSessionEndpoint) {
  }
}
