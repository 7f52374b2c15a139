package com.codeheadsystems.portal.server.vault;

import static com.codeheadsystems.portal.server.http.HttpExchanges.isSuccess;
import static com.codeheadsystems.portal.server.http.HttpExchanges.send;

import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the Vault endpoints the portal uses. Stateless: the caller passes the token.
 * <p>
 * Status mapping: 503 or a "sealed" error is {@code UPSTREAM_UNAVAILABLE} and is logged as needing
 * an operator; other 5xx and transport failures are {@code UPSTREAM_UNAVAILABLE}; 400 and 403 are
 * {@code FORBIDDEN}.
 */
@Singleton
public class VaultAccessor {

  private static final Logger log = LoggerFactory.getLogger(VaultAccessor.class);
  private static final String UPSTREAM = "credential store";
  private static final String TOKEN_HEADER = "X-Vault-Token";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final VaultSettings settings;
  private final Duration timeout;
  private final Clock clock;

  /**
   * Instantiates a new Vault accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param settings     the settings
   * @param timeout      the per-request timeout
   * @param clock        the clock stamping acquired credentials
   */
  @Inject
  public VaultAccessor(final HttpClient httpClient,
                       final ObjectMapper objectMapper,
                       final VaultSettings settings,
                       final Duration timeout,
                       final Clock clock) {
    log.info("VaultAccessor(address={})", settings.address());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.settings = settings;
    this.timeout = timeout;
    this.clock = clock;
  }

  // ── Token lifecycle ───────────────────────────────────────────────────────

  /**
   * Logs in with the platform identity token.
   *
   * @param platformToken the workload identity JWT
   * @return the credential
   */
  public ServiceCredential login(final String platformToken) {
    log.debug("login(path={}, role={})", settings.authPath(), settings.authRole());
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("role", settings.authRole());
    body.put("jwt", platformToken);
    JsonNode json = exchange(post(settings.api("auth/" + settings.authPath() + "/login"), null, body), "login");
    return credential(json.path("auth"));
  }

  /**
   * Renews the token's lease.
   *
   * @param token the token
   * @return the credential with its new lease
   */
  public ServiceCredential renewSelf(final String token) {
    log.debug("renewSelf()");
    JsonNode json = exchange(post(settings.api("auth/token/renew-self"), token, Map.of()), "renew");
    return credential(json.path("auth"));
  }

  /**
   * Revokes the token.
   *
   * @param token the token
   */
  public void revokeSelf(final String token) {
    log.debug("revokeSelf()");
    exchange(post(settings.api("auth/token/revoke-self"), token, Map.of()), "revoke");
  }

  // ── SSH engine ────────────────────────────────────────────────────────────

  /**
   * Signs a public key under a signing role.
   *
   * @param token           the token
   * @param signingRole     the signing role
   * @param publicKey       the OpenSSH public key line
   * @param validPrincipals the principals
   * @param ttl             the validity
   * @param keyId           the key id
   * @return the certificate
   */
  public SignedCertificate sign(final String token,
                                final String signingRole,
                                final String publicKey,
                                final List<String> validPrincipals,
                                final Duration ttl,
                                final String keyId) {
    log.debug("sign(signingRole={}, principals={}, ttl={}, keyId={})", signingRole, validPrincipals, ttl, keyId);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("public_key", publicKey);
    body.put("valid_principals", String.join(",", validPrincipals));
    body.put("ttl", ttl.toSeconds() + "s");
    body.put("cert_type", "user");
    body.put("key_id", keyId);
    JsonNode data = exchange(post(settings.api(settings.sshMount() + "/sign/" + signingRole), token, body), "sign")
        .path("data");
    String signedKey = data.path("signed_key").asText(null);
    if (signedKey == null || signedKey.isBlank()) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "credential store returned no certificate");
    }
    return new SignedCertificate(signedKey.trim(), data.path("serial_number").asText(null));
  }

  /**
   * Reads the SSH CA public key. The endpoint is unauthenticated.
   *
   * @return the OpenSSH public key line
   */
  public String caPublicKey() {
    HttpRequest request = HttpRequest.newBuilder(settings.api(settings.sshMount() + "/public_key"))
        .timeout(timeout)
        .GET()
        .build();
    HttpResponse<String> response = send(httpClient, request, UPSTREAM);
    checkStatus("ca-public-key", response);
    return response.body().trim();
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private HttpRequest post(final URI uri, final String token, final Object body) {
    String json;
    try {
      json = objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new PortalException(ErrorCode.INTERNAL, "could not encode credential store request", e);
    }
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json));
    if (token != null) {
      builder.header(TOKEN_HEADER, token);
    }
    return builder.build();
  }

  private JsonNode exchange(final HttpRequest request, final String operation) {
    HttpResponse<String> response = send(httpClient, request, UPSTREAM);
    checkStatus(operation, response);
    String body = response.body();
    if (body == null || body.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "unreadable credential store response", e);
    }
  }

  private void checkStatus(final String operation, final HttpResponse<String> response) {
    int status = response.statusCode();
    if (isSuccess(status)) {
      return;
    }
    String body = response.body() == null ? "" : response.body();
    if (status == 503 || body.contains("sealed")) {
      log.error("Credential store is sealed or in standby during {}; operator intervention required", operation);
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "credential store is sealed");
    }
    if (status >= 500) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "credential store " + operation + " failed: " + status);
    }
    log.warn("Credential store refused {} with {}: {}", operation, status, errors(body));
    throw new PortalException(ErrorCode.FORBIDDEN, "credential store refused " + operation);
  }

  private String errors(final String body) {
    try {
      return objectMapper.readTree(body).path("errors").toString();
    } catch (JsonProcessingException e) {
      return "<unreadable>";
    }
  }

  private ServiceCredential credential(final JsonNode auth) {
    String token = auth.path("client_token").asText(null);
    if (token == null || token.isBlank()) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "credential store returned no token");
    }
    return new ServiceCredential(token, Duration.ofSeconds(auth.path("lease_duration").asLong()),
        clock.instant(), auth.path("renewable").asBoolean());
  }
}
