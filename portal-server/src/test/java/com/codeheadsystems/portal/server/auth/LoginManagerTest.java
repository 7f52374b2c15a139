package com.codeheadsystems.portal.server.auth;

import static com.codeheadsystems.portal.server.testing.PortalAssertions.assertCode;
import static org.assertj.core.api.Assertions.assertThat;

import com.codahale.metrics.MetricRegistry;
import com.codeheadsystems.portal.model.auth.TokenResponse;
import com.codeheadsystems.portal.server.audit.AuditAction;
import com.codeheadsystems.portal.server.audit.AuditEmitter;
import com.codeheadsystems.portal.server.audit.AuditEvent;
import com.codeheadsystems.portal.server.audit.AuditResult;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.testing.FakeIdentityProvider;
import com.codeheadsystems.portal.server.testing.InMemoryAuditSink;
import com.codeheadsystems.portal.server.testing.MutableClock;
import com.codeheadsystems.portal.server.testing.TestTokens;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoginManagerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final TestTokens tokens = new TestTokens();
  private final InMemoryAuditSink auditSink = new InMemoryAuditSink();
  private MutableClock clock;
  private FakeIdentityProvider identityProvider;
  private LoginManager loginManager;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    identityProvider = new FakeIdentityProvider(tokens, clock);
    OidcSettings settings = TestTokens.oidcSettings(Duration.ZERO);
    SigningKeyCache cache = new SigningKeyCache(identityProvider, clock, Duration.ofMinutes(5),
        Duration.ofHours(1), Duration.ofSeconds(10));
    loginManager = new LoginManager(identityProvider, new TokenValidator(cache, settings, clock),
        new AuditEmitter(List.of(auditSink), new MetricRegistry()), settings, clock);
  }

  @AfterEach
  void tearDown() {
    loginManager.shutdown();
  }

  @Test
  void beginLogin_redirectsWithStateAndS256Challenge() {
    URI uri = loginManager.beginLogin();

    assertThat(uri.toString()).startsWith(FakeIdentityProvider.AUTHORIZATION_ENDPOINT + "?");
    Map<String, String> query = query(uri);
    assertThat(query)
        .containsEntry("response_type", "code")
        .containsEntry("client_id", TestTokens.CLIENT_ID)
        .containsEntry("redirect_uri", "http://localhost/api/v1/auth/callback")
        .containsEntry("scope", "openid profile email")
        .containsEntry("code_challenge_method", "S256")
        .containsKeys("state", "code_challenge");
    assertThat(loginManager.pendingCount()).isEqualTo(1);
  }

  @Test
  void beginLogin_statesAreUnique() {
    String first = query(loginManager.beginLogin()).get("state");
    String second = query(loginManager.beginLogin()).get("state");

    assertThat(first).isNotEqualTo(second);
  }

  @Test
  void completeLogin_returnsTokensAndAuditsLogin() {
    identityProvider.registerCode("code-1", "alice", List.of("developers"));
    String state = query(loginManager.beginLogin()).get("state");

    TokenResponse response = loginManager.completeLogin("code-1", state);

    assertThat(response.accessToken()).isNotBlank();
    assertThat(response.refreshToken()).isEqualTo("refresh-alice");
    assertThat(loginManager.pendingCount()).isZero();
    assertThat(auditSink.events()).singleElement().satisfies(event -> {
      assertThat(event.actor()).isEqualTo("alice");
      assertThat(event.action()).isEqualTo(AuditAction.LOGIN);
      assertThat(event.result()).isEqualTo(AuditResult.SUCCESS);
    });
  }

  @Test
  void completeLogin_stateCannotBeReused() {
    identityProvider.registerCode("code-1", "alice", List.of("developers"));
    identityProvider.registerCode("code-2", "alice", List.of("developers"));
    String state = query(loginManager.beginLogin()).get("state");
    loginManager.completeLogin("code-1", state);

    assertCode(() -> loginManager.completeLogin("code-2", state), ErrorCode.UNAUTHENTICATED);
  }

  @Test
  void completeLogin_unknownState_isUnauthenticated() {
    identityProvider.registerCode("code-1", "alice", List.of("developers"));

    assertCode(() -> loginManager.completeLogin("code-1", "made-up-state"), ErrorCode.UNAUTHENTICATED);
  }

  @Test
  void completeLogin_expiredState_isUnauthenticated() {
    identityProvider.registerCode("code-1", "alice", List.of("developers"));
    String state = query(loginManager.beginLogin()).get("state");
    clock.advance(LoginManager.PENDING_TTL.plusSeconds(1));

    assertCode(() -> loginManager.completeLogin("code-1", state), ErrorCode.UNAUTHENTICATED);
  }

  @Test
  void completeLogin_missingCode_isInvalidRequest() {
    String state = query(loginManager.beginLogin()).get("state");

    assertCode(() -> loginManager.completeLogin(" ", state), ErrorCode.INVALID_REQUEST);
    assertThat(loginManager.pendingCount()).isEqualTo(1);
  }

  @Test
  void completeLogin_auditFailure_doesNotFailLogin() {
    identityProvider.registerCode("code-1", "alice", List.of("developers"));
    String state = query(loginManager.beginLogin()).get("state");
    auditSink.setFailing(true);

    assertThat(loginManager.completeLogin("code-1", state).accessToken()).isNotBlank();
  }

  @Test
  void reapExpired_dropsOnlyExpiredLogins() {
    loginManager.beginLogin();
    clock.advance(Duration.ofMinutes(4));
    loginManager.beginLogin();
    clock.advance(Duration.ofMinutes(2));

    loginManager.reapExpired();

    assertThat(loginManager.pendingCount()).isEqualTo(1);
  }

  @Test
  void logout_endsProviderSessionAndAudits() {
    loginManager.logout(principal("alice"), "refresh-alice");

    assertThat(identityProvider.endedSessions()).containsExactly("refresh-alice");
    AuditEvent event = auditSink.events().get(0);
    assertThat(event.action()).isEqualTo(AuditAction.LOGOUT);
    assertThat(event.actor()).isEqualTo("alice");
    assertThat(event.detail()).isEqualTo("provider session ended");
  }

  @Test
  void beginLogin_atCapacity_evictsTheOldestInsteadOfRefusing() {
    String oldest = query(loginManager.beginLogin()).get("state");
    for (int i = 1; i < LoginManager.MAX_PENDING_LOGINS; i++) {
      loginManager.beginLogin();
    }
    clock.advance(Duration.ofMinutes(4));
    identityProvider.registerCode("code-1", "alice", List.of("developers"));

    String state = query(loginManager.beginLogin()).get("state");

    assertThat(loginManager.pendingCount()).isEqualTo(LoginManager.MAX_PENDING_LOGINS);
    assertThat(loginManager.completeLogin("code-1", state).accessToken()).isNotBlank();
    identityProvider.registerCode("code-2", "bob", List.of("developers"));
    assertCode(() -> loginManager.completeLogin("code-2", oldest), ErrorCode.UNAUTHENTICATED);
  }

  @Test
  void logout_blankRefreshToken_skipsProviderAndRecordsLocalLogout() {
    loginManager.logout(principal("alice"), " ");

    assertThat(identityProvider.endedSessions()).isEmpty();
    assertThat(auditSink.events()).singleElement()
        .satisfies(event -> assertThat(event.detail()).isEqualTo("local"));
  }

  @Test
  void logout_auditFailure_isReported() {
    auditSink.setFailing(true);

    assertCode(() -> loginManager.logout(principal("alice"), null), ErrorCode.AUDIT_WRITE_FAILED);
  }

  @Test
  void challenge_matchesRfc7636Example() {
    assertThat(LoginManager.challenge("dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk"))
        .isEqualTo("E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM");
  }

  private static PortalPrincipal principal(final String username) {
    return new PortalPrincipal("sub-" + username, username, username + "@example.test",
        new TreeSet<>(List.of("developers")), NOW.plusSeconds(300));
  }

  private static Map<String, String> query(final URI uri) {
    Map<String, String> result = new LinkedHashMap<>();
    for (String pair : uri.getRawQuery().split("&")) {
      int eq = pair.indexOf('=');
      result.put(pair.substring(0, eq), URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
    }
    return result;
  }
}
