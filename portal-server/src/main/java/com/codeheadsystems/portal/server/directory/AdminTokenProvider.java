package com.codeheadsystems.portal.server.directory;

import static com.codeheadsystems.portal.server.http.HttpExchanges.form;
import static com.codeheadsystems.portal.server.http.HttpExchanges.isSuccess;
import static com.codeheadsystems.portal.server.http.HttpExchanges.send;

import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client-credentials token for the admin API, fetched lazily and refreshed 30 seconds before it
 * expires. Concurrent callers share one fetch.
 */
public class AdminTokenProvider {

  /** How long before expiry the token is treated as expired. */
  static final Duration REFRESH_MARGIN = Duration.ofSeconds(30);

  private static final Logger log = LoggerFactory.getLogger(AdminTokenProvider.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final KeycloakSettings settings;
  private final Duration timeout;
  private final Clock clock;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  private String token;
  private Instant refreshAt = Instant.EPOCH;

  /**
   * Instantiates a new Admin token provider.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param settings     the settings
   * @param timeout      the per-request timeout
   * @param clock        the clock
   */
  public AdminTokenProvider(final HttpClient httpClient,
                            final ObjectMapper objectMapper,
                            final KeycloakSettings settings,
                            final Duration timeout,
                            final Clock clock) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.settings = settings;
    this.timeout = timeout;
    this.clock = clock;
  }

  /**
   * A currently valid admin token.
   *
   * @return the token
   */
  public String token() {
    lock.readLock().lock();
    try {
      if (token != null && clock.instant().isBefore(refreshAt)) {
        return token;
      }
    } finally {
      lock.readLock().unlock();
    }
    lock.writeLock().lock();
    try {
      if (token == null || !clock.instant().isBefore(refreshAt)) {
        fetch();
      }
      return token;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Forgets the token, e.g. after the admin API rejected it.
   */
  public void invalidate() {
    lock.writeLock().lock();
    try {
      token = null;
      refreshAt = Instant.EPOCH;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void fetch() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("grant_type", "client_credentials");
    fields.put("client_id", settings.clientId());
    fields.put("client_secret", settings.clientSecret());
    HttpRequest request = HttpRequest.newBuilder(settings.tokenEndpoint())
        .timeout(timeout)
        .header("Content-Type", "application/x-www-form-urlencoded")
        .POST(HttpRequest.BodyPublishers.ofString(form(fields)))
        .build();
    HttpResponse<String> response = send(httpClient, request, "directory");
    if (!isSuccess(response.statusCode())) {
      log.warn("Admin token request failed with {}", response.statusCode());
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "directory admin token unavailable");
    }
    JsonNode json;
    try {
      json = objectMapper.readTree(response.body());
    } catch (JsonProcessingException e) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "unreadable directory token response", e);
    }
    String accessToken = json.path("access_token").asText(null);
    if (accessToken == null) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "directory token response has no access_token");
    }
    token = accessToken;
    refreshAt = clock.instant().plusSeconds(json.path("expires_in").asLong(60)).minus(REFRESH_MARGIN);
    log.debug("fetch() admin token refreshAt={}", refreshAt);
  }
}
