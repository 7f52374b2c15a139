package com.codeheadsystems.portal.server.ssh;

import static com.codeheadsystems.portal.server.testing.PortalAssertions.assertCode;
import static org.assertj.core.api.Assertions.assertThat;

import com.codahale.metrics.MetricRegistry;
import com.codeheadsystems.portal.model.directory.CreateUserRequest;
import com.codeheadsystems.portal.model.ssh.RegisteredSshKeyResponse;
import com.codeheadsystems.portal.server.audit.AuditAction;
import com.codeheadsystems.portal.server.audit.AuditEmitter;
import com.codeheadsystems.portal.server.audit.AuditEvent;
import com.codeheadsystems.portal.server.audit.AuditResult;
import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.testing.InMemoryAuditSink;
import com.codeheadsystems.portal.server.testing.InMemoryDirectoryAccessor;
import com.codeheadsystems.portal.server.testing.MutableClock;
import com.codeheadsystems.portal.server.testing.SshFixtures;
import java.time.Instant;
import java.util.List;
import java.util.TreeSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SshKeyRegistryTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final PortalPrincipal ALICE = new PortalPrincipal("sub-alice", "alice", "alice@example.test",
      new TreeSet<>(List.of("developers")), NOW.plusSeconds(300));

  private final InMemoryAuditSink auditSink = new InMemoryAuditSink();
  private InMemoryDirectoryAccessor directory;
  private SshKeyRegistry registry;
  private String aliceId;

  @BeforeEach
  void setUp() {
    directory = new InMemoryDirectoryAccessor();
    registry = new SshKeyRegistry(directory, new AuditEmitter(List.of(auditSink), new MetricRegistry()),
        new MutableClock(NOW));
    aliceId = directory.createUser(new CreateUserRequest("alice", "alice@example.test", null, null, true, null));
  }

  @Test
  void registeredKey_noneRegistered_isEmpty() {
    assertThat(registry.registeredKey(ALICE)).isEqualTo(RegisteredSshKeyResponse.none());
  }

  @Test
  void register_storesKeyAndTimeThenReadsBack() {
    String line = SshFixtures.ed25519PublicKey("alice@laptop");

    RegisteredSshKeyResponse registered = registry.register(ALICE, "  " + line + "\n");

    assertThat(registered.publicKey()).isEqualTo(line);
    assertThat(registered.fingerprint()).isEqualTo(SshPublicKeys.parse(line).fingerprint());
    assertThat(registered.registeredAt()).isEqualTo("2026-03-01T12:00:00Z");
    assertThat(registry.registeredKey(ALICE)).isEqualTo(registered);
    assertThat(auditSink.events()).singleElement().satisfies(event -> {
      assertThat(event.action()).isEqualTo(AuditAction.SSH_KEY_REGISTERED);
      assertThat(event.actor()).isEqualTo("alice");
      assertThat(event.target()).isEqualTo(registered.fingerprint());
      assertThat(event.result()).isEqualTo(AuditResult.SUCCESS);
    });
  }

  @Test
  void register_weakOrUnsupportedKey_isRejectedAndNothingStored() {
    assertCode(() -> registry.register(ALICE, SshFixtures.rsaPublicKey(2048)), ErrorCode.INVALID_PUBLIC_KEY);
    assertCode(() -> registry.register(ALICE, "ecdsa-sha2-nistp256 AAAA x"), ErrorCode.INVALID_PUBLIC_KEY);
    assertCode(() -> registry.register(ALICE, null), ErrorCode.INVALID_PUBLIC_KEY);

    assertThat(directory.userAttributes(aliceId)).isEmpty();
    assertThat(auditSink.events()).isEmpty();
  }

  @Test
  void register_withoutDirectoryAccount_isNotFound() {
    PortalPrincipal stranger = new PortalPrincipal("sub-bob", "bob", null, new TreeSet<>(), NOW.plusSeconds(300));

    assertCode(() -> registry.register(stranger, SshFixtures.ed25519PublicKey("bob")), ErrorCode.NOT_FOUND);
    assertCode(() -> registry.registeredKey(stranger), ErrorCode.NOT_FOUND);
  }

  @Test
  void register_auditFailure_isReportedButKeyStands() {
    auditSink.setFailing(true);

    assertCode(() -> registry.register(ALICE, SshFixtures.ed25519PublicKey("alice")), ErrorCode.AUDIT_WRITE_FAILED);
    assertThat(directory.userAttributes(aliceId)).containsKey(SshKeyRegistry.KEY_ATTRIBUTE);
  }

  @Test
  void remove_clearsBothAttributesAndAudits() {
    registry.register(ALICE, SshFixtures.ed25519PublicKey("alice"));

    registry.remove(ALICE);
    registry.remove(ALICE);

    assertThat(directory.userAttributes(aliceId)).isEmpty();
    assertThat(registry.registeredKey(ALICE)).isEqualTo(RegisteredSshKeyResponse.none());
    assertThat(auditSink.events()).extracting(AuditEvent::action).containsExactly(
        AuditAction.SSH_KEY_REGISTERED, AuditAction.SSH_KEY_REMOVED, AuditAction.SSH_KEY_REMOVED);
  }

  @Test
  void checkMatches_comparesKeyMaterialOnly() {
    String line = SshFixtures.ed25519PublicKey("alice@laptop");
    registry.register(ALICE, line);
    String sameKeyOtherComment = line.substring(0, line.lastIndexOf(' ')) + " renamed";

    registry.checkMatches(ALICE, SshPublicKeys.parse(sameKeyOtherComment));
    assertCode(() -> registry.checkMatches(ALICE, SshPublicKeys.parse(SshFixtures.ed25519PublicKey("other"))),
        ErrorCode.KEY_MISMATCH);
  }

  @Test
  void checkMatches_withoutAccountOrRegistration_allowsAnyKey() {
    PortalPrincipal stranger = new PortalPrincipal("sub-bob", "bob", null, new TreeSet<>(), NOW.plusSeconds(300));
    SshPublicKey key = SshPublicKeys.parse(SshFixtures.ed25519PublicKey("any"));

    registry.checkMatches(stranger, key);
    registry.checkMatches(ALICE, key);
  }

  @Test
  void checkMatches_directoryUnreachable_isUpstreamUnavailable() {
    directory.setReachable(false);

    assertCode(() -> registry.checkMatches(ALICE, SshPublicKeys.parse(SshFixtures.ed25519PublicKey("a"))),
        ErrorCode.UPSTREAM_UNAVAILABLE);
  }
}
