package com.codeheadsystems.portal.server.auth;

import static com.codeheadsystems.portal.server.http.HttpExchanges.encode;

import com.codeheadsystems.portal.model.auth.TokenResponse;
import com.codeheadsystems.portal.server.audit.AuditAction;
import com.codeheadsystems.portal.server.audit.AuditEmitter;
import com.codeheadsystems.portal.server.audit.AuditEvent;
import com.codeheadsystems.portal.server.audit.AuditResult;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the OIDC authorization code flow with PKCE (S256) on behalf of the browser front end.
 * <p>
 * Each login gets a random {@code state}; its PKCE verifier waits in a bounded in-memory map until
 * the callback arrives or a reaper drops it. When the map is full the oldest pending login is
 * evicted.
 */
public class LoginManager {

  private static final Logger log = LoggerFactory.getLogger(LoginManager.class);
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  /**
   * How long a login may take between redirect and callback.
   */
  static final Duration PENDING_TTL = Duration.ofMinutes(5);

  /**
   * Maximum outstanding logins, so unfinished redirects cannot exhaust memory.
   */
  static final int MAX_PENDING_LOGINS = 10_000;

  private final IdentityProviderAccessor identityProvider;
  private final TokenValidator tokenValidator;
  private final AuditEmitter auditEmitter;
  private final OidcSettings settings;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();
  // Insertion order is creation order; guarded by itself.
  private final Map<String, PendingLogin> pendingLogins = Collections.synchronizedMap(
      new LinkedHashMap<>(16, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(final Map.Entry<String, PendingLogin> eldest) {
          if (size() > MAX_PENDING_LOGINS) {
            log.debug("Pending logins at capacity, evicting the oldest");
            return true;
          }
          return false;
        }
      });

  private final ScheduledExecutorService loginReaper =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "login-state-reaper");
        t.setDaemon(true);
        return t;
      });

  /**
   * Instantiates a new Login manager.
   *
   * @param identityProvider the identity provider
   * @param tokenValidator   the token validator
   * @param auditEmitter     the audit emitter
   * @param settings         the settings
   * @param clock            the clock
   */
  public LoginManager(final IdentityProviderAccessor identityProvider,
                      final TokenValidator tokenValidator,
                      final AuditEmitter auditEmitter,
                      final OidcSettings settings,
                      final Clock clock) {
    this.identityProvider = identityProvider;
    this.tokenValidator = tokenValidator;
    this.auditEmitter = auditEmitter;
    this.settings = settings;
    this.clock = clock;
    long period = PENDING_TTL.toSeconds() / 4;
    loginReaper.scheduleAtFixedRate(this::reapExpired, period, period, TimeUnit.SECONDS);
  }

  /**
   * Stops the reaper thread.
   */
  public void shutdown() {
    loginReaper.shutdownNow();
  }

  /**
   * Starts a login.
   *
   * @return the provider authorization URI to redirect the browser to
   */
  public URI beginLogin() {
    String state = randomToken();
    String verifier = randomToken();
    pendingLogins.put(state, new PendingLogin(verifier, clock.instant()));
    String query = "response_type=code"
        + "&client_id=" + encode(settings.clientId())
        + "&redirect_uri=" + encode(settings.redirectUri())
        + "&scope=" + encode(String.join(" ", settings.scopes()))
        + "&state=" + state
        + "&code_challenge=" + challenge(verifier)
        + "&code_challenge_method=S256";
    URI endpoint = identityProvider.authorizationEndpoint();
    String separator = endpoint.getRawQuery() == null ? "?" : "&";
    log.debug("beginLogin() pending={}", pendingLogins.size());
    return URI.create(endpoint + separator + query);
  }

  /**
   * Completes a login: checks the state, exchanges the code and validates the issued access token.
   *
   * @param code  the authorization code
   * @param state the state returned by the provider
   * @return the tokens
   * @throws PortalException {@code UNAUTHENTICATED} for an unknown, reused or expired state
   */
  public TokenResponse completeLogin(final String code, final String state) {
    if (code == null || code.isBlank() || state == null || state.isBlank()) {
      throw new PortalException(ErrorCode.INVALID_REQUEST, "code and state are required");
    }
    PendingLogin pending = pendingLogins.remove(state);
    if (pending == null || pending.isExpired(clock.instant())) {
      throw new PortalException(ErrorCode.UNAUTHENTICATED, "login state is unknown or expired");
    }
    TokenResponse tokens = identityProvider.exchangeCode(code, settings.redirectUri(), pending.codeVerifier());
    PortalPrincipal principal;
    try {
      principal = tokenValidator.validate(tokens.accessToken());
    } catch (PortalException e) {
      auditEmitter.appendBestEffort(AuditEvent.of(null, AuditAction.LOGIN, settings.clientId(),
          clock.instant(), AuditResult.FAILURE, e.code().name()));
      throw e;
    }
    auditEmitter.appendBestEffort(AuditEvent.of(principal.username(), AuditAction.LOGIN, settings.clientId(),
        clock.instant(), AuditResult.SUCCESS, null));
    log.info("Login completed for {}", principal.username());
    return tokens;
  }

  /**
   * Ends the provider session, then records the logout.
   *
   * @param principal    the caller
   * @param refreshToken the refresh token, may be null when only local state is dropped
   */
  public void logout(final PortalPrincipal principal, final String refreshToken) {
    boolean providerSession = refreshToken != null && !refreshToken.isBlank();
    if (providerSession) {
      identityProvider.endSession(refreshToken);
    }
    auditEmitter.append(AuditEvent.of(principal.username(), AuditAction.LOGOUT, settings.clientId(),
        clock.instant(), AuditResult.SUCCESS, providerSession ? "provider session ended" : "local"));
  }

  int pendingCount() {
    return pendingLogins.size();
  }

  void reapExpired() {
    Instant now = clock.instant();
    synchronized (pendingLogins) {
      pendingLogins.values().removeIf(pending -> pending.isExpired(now));
    }
  }

  private String randomToken() {
    byte[] bytes = new byte[32];
    random.nextBytes(bytes);
    return B64URL.encodeToString(bytes);
  }

  /**
   * PKCE S256 challenge of the verifier.
   *
   * @param verifier the verifier
   * @return base64url(sha256(verifier))
   */
  static String challenge(final String verifier) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(verifier.getBytes(StandardCharsets.US_ASCII));
      return B64URL.encodeToString(digest);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }

  private record PendingLogin(String codeVerifier, Instant createdAt) {

    boolean isExpired(final Instant now) {
      return createdAt.plus(PENDING_TTL).isBefore(now);
    }
  }
}
