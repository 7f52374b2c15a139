package com.codeheadsystems.portal.server.vault;

import static com.codeheadsystems.portal.server.testing.PortalAssertions.assertCode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import com.codeheadsystems.portal.server.testing.DefaultRoles;
import com.codeheadsystems.portal.server.testing.MutableClock;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VaultCredentialStoreClientTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final Duration LEASE = Duration.ofMinutes(10);
  private static final String KEY = "ssh-ed25519 AAAA test";

  @Mock private VaultAccessor accessor;

  private final Map<String, ServiceCredential> issued = new ConcurrentHashMap<>();
  private final AtomicInteger sequence = new AtomicInteger();
  private MutableClock clock;
  private VaultCredentialStoreClient client;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    client = new VaultCredentialStoreClient(accessor, settings(), () -> "platform-jwt", clock);
  }

  // Backoff is long enough that no retry fires on its own during a test.
  private static VaultSettings settings() {
    return new VaultSettings(URI.create("https://vault.example.test:8200"), "ssh-client-signer",
        "kubernetes", "identity-portal", 0.5, Duration.ofHours(1), Duration.ofHours(2), 3, Duration.ofSeconds(5));
  }

  @AfterEach
  void tearDown() {
    client.stop();
  }

  @Test
  void start_logsInAndSigns() {
    when(accessor.login("platform-jwt")).thenAnswer(inv -> newCredential());
    when(accessor.sign(any(), any(), any(), any(), any(), any())).thenReturn(new SignedCertificate("cert", "1"));

    client.start();
    SignedCertificate certificate = client.sign(DefaultRoles.DEVELOPER, KEY, List.of("rocky"),
        Duration.ofHours(1), "alice-1");

    assertThat(certificate.signedKey()).isEqualTo("cert");
    assertThat(client.isAvailable()).isTrue();
    verify(accessor).sign("token-1", "developer-role", KEY, List.of("rocky"), Duration.ofHours(1), "alice-1");
  }

  @Test
  void sign_concurrentWithRenewal_neverPresentsAnExpiredOrPartialCredential() throws Exception {
    RecordingClock recordingClock = new RecordingClock(NOW);
    clock = recordingClock;
    client.stop();
    client = new VaultCredentialStoreClient(accessor, settings(), () -> "platform-jwt", recordingClock);
    when(accessor.login(any())).thenAnswer(inv -> newCredential());
    when(accessor.renewSelf(anyString())).thenAnswer(inv -> newCredential());
    when(accessor.sign(any(), any(), any(), any(), any(), any())).thenAnswer(inv -> {
      String token = inv.getArgument(0);
      ServiceCredential presented = issued.get(token);
      assertThat(presented).as("credential %s was issued", token).isNotNull();
      assertThat(presented.isValidAt(recordingClock.lastReadOnThisThread()))
          .as("credential %s valid when presented", token).isTrue();
      return new SignedCertificate("cert-" + token, "1");
    });
    client.start();

    AtomicInteger degraded = new AtomicInteger();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    List<Future<?>> signers = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      signers.add(pool.submit(() -> {
        for (int j = 0; j < 20; j++) {
          try {
            client.sign(DefaultRoles.DEVELOPER, KEY, List.of("rocky"), Duration.ofHours(1), "k");
          } catch (PortalException e) {
            assertThat(e.code()).isEqualTo(ErrorCode.UPSTREAM_UNAVAILABLE);
            degraded.incrementAndGet();
          }
        }
      }));
    }
    Duration pastRenewalDeadline = LEASE.dividedBy(2).plusSeconds(1);
    for (int i = 1; i <= 50; i++) {
      // Every fifth step lets the lease run out before the loop catches up.
      clock.advance(i % 5 == 0 ? LEASE.plusSeconds(1) : pastRenewalDeadline);
      client.renewNow();
    }
    for (Future<?> signer : signers) {
      signer.get(30, TimeUnit.SECONDS);
    }
    pool.shutdown();

    assertThat(issued).hasSize(51);
    assertThat(client.currentCredential().token()).isEqualTo("token-51");
    verify(accessor, times(11)).login("platform-jwt");
  }

  @Test
  void expiredCredential_isNeverPresented_andLoginRecovers() {
    when(accessor.login(any())).thenAnswer(inv -> newCredential());
    client.start();
    clock.advance(LEASE.plusMinutes(1));

    assertThat(client.isAvailable()).isFalse();
    assertCode(() -> client.sign(DefaultRoles.DEVELOPER, KEY, List.of("rocky"), Duration.ofHours(1), "k"),
        ErrorCode.UPSTREAM_UNAVAILABLE);
    verify(accessor, never()).sign(any(), any(), any(), any(), any(), any());

    client.renewNow();

    assertThat(client.isAvailable()).isTrue();
    assertThat(client.currentCredential().token()).isEqualTo("token-2");
    verify(accessor, never()).renewSelf(anyString());
  }

  @Test
  void failedStartupLogin_isDegradedThenRecoversWithoutRestart() {
    when(accessor.login(any()))
        .thenThrow(new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "credential store is sealed"))
        .thenAnswer(inv -> newCredential());

    client.start();

    assertThat(client.isAvailable()).isFalse();
    assertThat(client.credentialExpiry()).isNull();
    assertCode(() -> client.currentCredential(), ErrorCode.UPSTREAM_UNAVAILABLE);

    client.renewNow();

    assertThat(client.isAvailable()).isTrue();
    assertThat(client.credentialExpiry()).isEqualTo(NOW.plus(LEASE));
  }

  @Test
  void repeatedRenewalFailures_fallBackToLogin() {
    when(accessor.login(any())).thenAnswer(inv -> newCredential());
    when(accessor.renewSelf(anyString()))
        .thenThrow(new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "credential store renew failed: 500"));
    client.start();

    client.renewNow();
    client.renewNow();
    assertThat(client.currentCredential().token()).isEqualTo("token-1");

    client.renewNow();

    verify(accessor, times(3)).renewSelf("token-1");
    verify(accessor, times(2)).login(any());
    assertThat(client.currentCredential().token()).isEqualTo("token-2");
  }

  @Test
  void nonRenewableCredential_isReplacedByLogin() {
    when(accessor.login(any())).thenAnswer(inv -> {
      String token = "token-" + sequence.incrementAndGet();
      ServiceCredential credential = new ServiceCredential(token, LEASE, clock.instant(), false);
      issued.put(token, credential);
      return credential;
    });
    client.start();

    client.renewNow();

    verify(accessor, never()).renewSelf(anyString());
    assertThat(client.currentCredential().token()).isEqualTo("token-2");
  }

  @Test
  void stop_revokesTheToken() {
    when(accessor.login(any())).thenAnswer(inv -> newCredential());
    client.start();

    client.stop();

    verify(accessor).revokeSelf("token-1");
    assertThat(client.isAvailable()).isFalse();
  }

  /**
   * Remembers, per thread, the last instant handed out, which is the instant the client judged
   * credential validity against.
   */
  private static final class RecordingClock extends MutableClock {

    private final ThreadLocal<Instant> lastRead = new ThreadLocal<>();

    private RecordingClock(final Instant start) {
      super(start);
    }

    @Override
    public Instant instant() {
      Instant now = super.instant();
      lastRead.set(now);
      return now;
    }

    Instant lastReadOnThisThread() {
      return lastRead.get();
    }
  }

  private ServiceCredential newCredential() {
    String token = "token-" + sequence.incrementAndGet();
    ServiceCredential credential = new ServiceCredential(token, LEASE, clock.instant(), true);
    issued.put(token, credential);
    return credential;
  }
}
