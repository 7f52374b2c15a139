package com.codeheadsystems.portal.server.directory;

import static com.codeheadsystems.portal.server.http.HttpExchanges.encode;
import static com.codeheadsystems.portal.server.http.HttpExchanges.isSuccess;
import static com.codeheadsystems.portal.server.http.HttpExchanges.send;

import com.codeheadsystems.portal.model.directory.CreateUserRequest;
import com.codeheadsystems.portal.model.directory.GroupResponse;
import com.codeheadsystems.portal.model.directory.ResetPasswordRequest;
import com.codeheadsystems.portal.model.directory.SessionResponse;
import com.codeheadsystems.portal.model.directory.UpdateUserRequest;
import com.codeheadsystems.portal.model.directory.UserResponse;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DirectoryAccessor} over the Keycloak admin REST API.
 * <p>
 * Requests carry the service account token from {@link AdminTokenProvider}; a 401 drops that token
 * and the request is retried once with a fresh one.
 */
@Singleton
public class KeycloakDirectoryAccessor implements DirectoryAccessor {

  private static final Logger log = LoggerFactory.getLogger(KeycloakDirectoryAccessor.class);
  private static final String UPSTREAM = "directory";
  private static final Pattern PATH_SEGMENT = Pattern.compile("^[A-Za-z0-9-]{1,64}$");

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final KeycloakSettings settings;
  private final AdminTokenProvider tokenProvider;
  private final Duration timeout;

  /**
   * Instantiates a new Keycloak directory accessor.
   *
   * @param httpClient    the http client
   * @param objectMapper  the object mapper
   * @param settings      the settings
   * @param tokenProvider the admin token provider
   * @param timeout       the per-request timeout
   */
  @Inject
  public KeycloakDirectoryAccessor(final HttpClient httpClient,
                                   final ObjectMapper objectMapper,
                                   final KeycloakSettings settings,
                                   final AdminTokenProvider tokenProvider,
                                   final Duration timeout) {
    log.info("KeycloakDirectoryAccessor({})", settings);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.settings = settings;
    this.tokenProvider = tokenProvider;
    this.timeout = timeout;
  }

  // ── Users ─────────────────────────────────────────────────────────────────

  @Override
  public List<UserResponse> listUsers(final int first, final int max, final String search) {
    String query = "?first=" + first + "&max=" + max
        + (search == null || search.isBlank() ? "" : "&search=" + encode(search));
    JsonNode json = read(exchange("GET", "/users" + query, null));
    List<UserResponse> users = new ArrayList<>();
    json.forEach(node -> users.add(user(node)));
    return users;
  }

  @Override
  public UserResponse getUser(final String userId) {
    return user(read(exchange("GET", "/users/" + segment(userId), null)));
  }

  @Override
  public String createUser(final CreateUserRequest request) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("username", request.username());
    body.put("email", request.email());
    body.put("firstName", request.firstName());
    body.put("lastName", request.lastName());
    body.put("enabled", request.enabled() == null || request.enabled());
    if (request.password() != null && !request.password().isEmpty()) {
      body.put("credentials", List.of(password(request.password(), true)));
    }
    return createdId(exchange("POST", "/users", body), "user");
  }

  @Override
  public void updateUser(final String userId, final UpdateUserRequest request) {
    Map<String, Object> body = new LinkedHashMap<>();
    putIfPresent(body, "email", request.email());
    putIfPresent(body, "firstName", request.firstName());
    putIfPresent(body, "lastName", request.lastName());
    putIfPresent(body, "enabled", request.enabled());
    exchange("PUT", "/users/" + segment(userId), body);
  }

  @Override
  public void deleteUser(final String userId) {
    exchange("DELETE", "/users/" + segment(userId), null);
  }

  @Override
  public void resetPassword(final String userId, final ResetPasswordRequest request) {
    exchange("PUT", "/users/" + segment(userId) + "/reset-password",
        password(request.password(), request.temporary()));
  }

  // ── Groups ────────────────────────────────────────────────────────────────

  @Override
  public List<GroupResponse> userGroups(final String userId) {
    return groups(read(exchange("GET", "/users/" + segment(userId) + "/groups", null)));
  }

  @Override
  public void addUserToGroup(final String userId, final String groupId) {
    exchange("PUT", "/users/" + segment(userId) + "/groups/" + segment(groupId), null);
  }

  @Override
  public void removeUserFromGroup(final String userId, final String groupId) {
    exchange("DELETE", "/users/" + segment(userId) + "/groups/" + segment(groupId), null);
  }

  @Override
  public List<GroupResponse> listGroups() {
    return groups(read(exchange("GET", "/groups", null)));
  }

  @Override
  public GroupResponse getGroup(final String groupId) {
    return group(read(exchange("GET", "/groups/" + segment(groupId), null)));
  }

  @Override
  public String createGroup(final String name) {
    HttpResponse<String> response = exchange("POST", "/groups", Map.of("name", name));
    return createdId(response, "group");
  }

  @Override
  public void renameGroup(final String groupId, final String name) {
    String path = "/groups/" + segment(groupId);
    ObjectNode representation = (ObjectNode) read(exchange("GET", path, null));
    representation.put("name", name);
    exchange("PUT", path, representation);
  }

  @Override
  public void deleteGroup(final String groupId) {
    exchange("DELETE", "/groups/" + segment(groupId), null);
  }

  // ── Sessions ──────────────────────────────────────────────────────────────

  @Override
  public List<SessionResponse> userSessions(final String userId) {
    JsonNode json = read(exchange("GET", "/users/" + segment(userId) + "/sessions", null));
    List<SessionResponse> sessions = new ArrayList<>();
    json.forEach(node -> sessions.add(new SessionResponse(
        node.path("id").asText(null),
        node.path("userId").asText(null),
        node.path("username").asText(null),
        node.path("ipAddress").asText(null),
        node.path("start").asLong(0),
        node.path("lastAccess").asLong(0))));
    return sessions;
  }

  @Override
  public void logoutUser(final String userId) {
    exchange("POST", "/users/" + segment(userId) + "/logout", null);
  }

  // ── Lookup and attributes ─────────────────────────────────────────────────

  @Override
  public Optional<UserResponse> findUserByUsername(final String username) {
    JsonNode json = read(exchange("GET", "/users?exact=true&username=" + encode(username), null));
    for (JsonNode node : json) {
      if (username.equals(node.path("username").asText(null))) {
        return Optional.of(user(node));
      }
    }
    return Optional.empty();
  }

  @Override
  public Map<String, String> userAttributes(final String userId) {
    JsonNode attributes = read(exchange("GET", "/users/" + segment(userId), null)).path("attributes");
    Map<String, String> values = new LinkedHashMap<>();
    attributes.fields().forEachRemaining(entry -> {
      if (entry.getValue().isArray() && entry.getValue().size() > 0) {
        values.put(entry.getKey(), entry.getValue().get(0).asText());
      }
    });
    return values;
  }

  /**
   * Keycloak replaces the whole attribute map on update, so the current map is read, merged and
   * written back together with the profile fields the update would otherwise clear.
   */
  @Override
  public void updateUserAttributes(final String userId, final Map<String, String> changes) {
    String path = "/users/" + segment(userId);
    JsonNode current = read(exchange("GET", path, null));
    ObjectNode attributes = current.path("attributes").isObject()
        ? ((ObjectNode) current.path("attributes")).deepCopy()
        : objectMapper.createObjectNode();
    changes.forEach((name, value) -> {
      if (value == null) {
        attributes.remove(name);
      } else {
        attributes.set(name, objectMapper.createArrayNode().add(value));
      }
    });
    ObjectNode body = objectMapper.createObjectNode();
    for (String field : List.of("username", "email", "firstName", "lastName")) {
      if (current.hasNonNull(field)) {
        body.set(field, current.get(field));
      }
    }
    body.set("attributes", attributes);
    exchange("PUT", path, body);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  /**
   * Rejects ids that could escape the intended admin API path.
   *
   * @param value the id
   * @return the id
   */
  static String segment(final String value) {
    if (value == null || !PATH_SEGMENT.matcher(value).matches()) {
      throw new PortalException(ErrorCode.INVALID_REQUEST, "invalid id");
    }
    return value;
  }

  private static String createdId(final HttpResponse<String> response, final String kind) {
    String location = response.headers().firstValue("Location").orElseThrow(() ->
        new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "directory did not return the new " + kind + "'s location"));
    return location.substring(location.lastIndexOf('/') + 1);
  }

  private HttpResponse<String> exchange(final String method, final String path, final Object body) {
    URI uri = settings.resolve(settings.adminPath() + path);
    HttpResponse<String> response = send(httpClient, request(method, uri, body, tokenProvider.token()), UPSTREAM);
    if (response.statusCode() == 401) {
      log.debug("Admin token rejected, refreshing and retrying {} {}", method, path);
      tokenProvider.invalidate();
      response = send(httpClient, request(method, uri, body, tokenProvider.token()), UPSTREAM);
    }
    checkStatus(method, path, response.statusCode());
    return response;
  }

  private HttpRequest request(final String method, final URI uri, final Object body, final String token) {
    HttpRequest.BodyPublisher publisher = HttpRequest.BodyPublishers.noBody();
    if (body != null) {
      try {
        publisher = HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
      } catch (JsonProcessingException e) {
        throw new PortalException(ErrorCode.INTERNAL, "could not encode directory request", e);
      }
    }
    return HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("Authorization", "Bearer " + token)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .method(method, publisher)
        .build();
  }

  private static void checkStatus(final String method, final String path, final int status) {
    if (isSuccess(status)) {
      return;
    }
    switch (status) {
      case 400 -> throw new PortalException(ErrorCode.INVALID_REQUEST, "directory rejected the request");
      case 404 -> throw new PortalException(ErrorCode.NOT_FOUND, "not found");
      case 409 -> throw new PortalException(ErrorCode.CONFLICT, "already exists");
      case 401, 403 -> {
        log.error("Directory refused {} {} with {}; check the service account's realm-management roles",
            method, path, status);
        throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "directory refused the portal's credentials");
      }
      default -> throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "directory returned " + status);
    }
  }

  private JsonNode read(final HttpResponse<String> response) {
    try {
      return objectMapper.readTree(response.body());
    } catch (JsonProcessingException e) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "unreadable directory response", e);
    }
  }

  private static UserResponse user(final JsonNode node) {
    return new UserResponse(
        node.path("id").asText(null),
        node.path("username").asText(null),
        node.path("email").asText(null),
        node.path("firstName").asText(null),
        node.path("lastName").asText(null),
        node.path("enabled").asBoolean(false),
        node.path("emailVerified").asBoolean(false),
        node.path("createdTimestamp").asLong(0));
  }

  private static List<GroupResponse> groups(final JsonNode json) {
    List<GroupResponse> groups = new ArrayList<>();
    json.forEach(node -> groups.add(group(node)));
    return groups;
  }

  private static GroupResponse group(final JsonNode node) {
    return new GroupResponse(
        node.path("id").asText(null), node.path("name").asText(null), node.path("path").asText(null));
  }

  private static Map<String, Object> password(final String value, final boolean temporary) {
    Map<String, Object> credential = new LinkedHashMap<>();
    credential.put("type", "password");
    credential.put("value", value);
    credential.put("temporary", temporary);
    return credential;
  }

  private static void putIfPresent(final Map<String, Object> body, final String field, final Object value) {
    if (value != null) {
      body.put(field, value);
    }
  }
}
