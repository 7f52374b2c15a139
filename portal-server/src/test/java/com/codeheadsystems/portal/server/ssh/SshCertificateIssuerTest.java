package com.codeheadsystems.portal.server.ssh;

import static com.codeheadsystems.portal.server.testing.PortalAssertions.assertCode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

import com.codahale.metrics.MetricRegistry;
import com.codeheadsystems.portal.model.directory.CreateUserRequest;
import com.codeheadsystems.portal.server.audit.AuditAction;
import com.codeheadsystems.portal.server.audit.AuditEmitter;
import com.codeheadsystems.portal.server.audit.AuditEvent;
import com.codeheadsystems.portal.server.audit.AuditResult;
import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.role.GroupResolver;
import com.codeheadsystems.portal.server.role.Role;
import com.codeheadsystems.portal.server.testing.DefaultRoles;
import com.codeheadsystems.portal.server.testing.FakeCertificateSigner;
import com.codeheadsystems.portal.server.testing.InMemoryAuditSink;
import com.codeheadsystems.portal.server.testing.InMemoryDirectoryAccessor;
import com.codeheadsystems.portal.server.testing.MutableClock;
import com.codeheadsystems.portal.server.testing.SshFixtures;
import com.codeheadsystems.portal.server.vault.CertificateSigner;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SshCertificateIssuerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private CertificateSigner mockSigner;

  private final InMemoryAuditSink auditSink = new InMemoryAuditSink();
  private final MetricRegistry metricRegistry = new MetricRegistry();
  private final GroupResolver groupResolver = new GroupResolver(DefaultRoles.table());
  private MutableClock clock;
  private FakeCertificateSigner signer;
  private InMemoryDirectoryAccessor directory;
  private SshKeyRegistry keyRegistry;
  private SshCertificateIssuer issuer;
  private String publicKey;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    signer = new FakeCertificateSigner(clock);
    directory = new InMemoryDirectoryAccessor();
    AuditEmitter auditEmitter = new AuditEmitter(List.of(auditSink), metricRegistry);
    keyRegistry = new SshKeyRegistry(directory, auditEmitter, clock);
    issuer = new SshCertificateIssuer(groupResolver, signer, keyRegistry, auditEmitter);
    publicKey = SshFixtures.ed25519PublicKey("alice@laptop");
  }

  @Test
  void issue_developer_getsDeveloperCertificate() {
    IssuedCertificate issued = issuer.issue(request("alice", List.of("developers"), null, null));

    assertThat(issued.roleName()).isEqualTo("developer");
    assertThat(issued.certificate().principals()).containsExactly("rocky");
    assertThat(issued.certificate().validBefore()).isEqualTo(NOW.plus(DefaultRoles.DEVELOPER.maxTtl()));
    assertThat(issued.certificate().keyId()).matches("alice-" + NOW.getEpochSecond() + "-[0-9a-f]{8}");
    assertThat(signer.calls()).singleElement().satisfies(call -> {
      assertThat(call.signingRole()).isEqualTo("developer-role");
      assertThat(call.publicKey()).doesNotContain("alice@laptop");
    });
    assertThat(metricRegistry.counter("portal.ssh.certificates-issued.developer").getCount()).isEqualTo(1);
  }

  @Test
  void issue_admin_getsAdminPrincipals() {
    IssuedCertificate issued = issuer.issue(request("root-user", List.of("platform-admins", "developers"), null, null));

    assertThat(issued.roleName()).isEqualTo("admin");
    assertThat(issued.certificate().principals()).containsExactly("root", "rocky");
  }

  @Test
  void issue_validityNeverExceedsRoleMaximum() {
    for (Role role : List.of(DefaultRoles.ADMIN, DefaultRoles.INFRA, DefaultRoles.DEVELOPER)) {
      IssuedCertificate issued = issuer.issue(request("u", List.of("platform-admins"), role.name(),
          role.maxTtl().plusHours(5)));

      assertThat(issued.certificate().validBefore()).isBeforeOrEqualTo(issued.issuedAt().plus(role.maxTtl()));
    }
  }

  @Test
  void issue_shorterTtl_isHonoured() {
    IssuedCertificate issued = issuer.issue(request("alice", List.of("developers"), null, Duration.ofMinutes(15)));

    assertThat(issued.certificate().validBefore()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
    assertThat(signer.calls().get(0).ttl()).isEqualTo(Duration.ofMinutes(15));
  }

  @Test
  void issue_nonPositiveTtl_isInvalidRequest() {
    assertCode(() -> issuer.issue(request("alice", List.of("developers"), null, Duration.ZERO)),
        ErrorCode.INVALID_REQUEST);
    assertThat(signer.calls()).isEmpty();
  }

  @Test
  void issue_everyCallGetsAFreshSerial() {
    Set<String> serials = IntStream.range(0, 20)
        .mapToObj(i -> issuer.issue(request("alice", List.of("developers"), null, null)).certificate().serialString())
        .collect(Collectors.toSet());

    assertThat(serials).hasSize(20);
  }

  @Test
  void issue_developerRequestingAdmin_isForbidden() {
    assertCode(() -> issuer.issue(request("alice", List.of("developers"), "admin", null)), ErrorCode.FORBIDDEN);
    assertThat(signer.calls()).isEmpty();
  }

  @Test
  void issue_adminRequestingDeveloper_isDowngraded() {
    IssuedCertificate issued = issuer.issue(request("root-user", List.of("platform-admins"), "developer", null));

    assertThat(issued.roleName()).isEqualTo("developer");
    assertThat(signer.calls().get(0).signingRole()).isEqualTo("developer-role");
  }

  @Test
  void issue_noMappedGroup_isNoEligibleRole() {
    assertCode(() -> issuer.issue(request("mallory", List.of(), null, null)), ErrorCode.NO_ELIGIBLE_ROLE);
    assertCode(() -> issuer.issue(request("mallory", List.of("marketing"), null, null)), ErrorCode.NO_ELIGIBLE_ROLE);
  }

  @Test
  void issue_malformedKey_neverReachesSigner() {
    SshCertificateIssuer guarded = new SshCertificateIssuer(groupResolver, mockSigner, keyRegistry,
        new AuditEmitter(List.of(auditSink), metricRegistry));
    SigningRequest bad = new SigningRequest("ssh-ed25519 AAAA", null, principal("alice", List.of("developers")),
        NOW, null, "req-1");

    assertCode(() -> guarded.issue(bad), ErrorCode.INVALID_PUBLIC_KEY);
    verifyNoInteractions(mockSigner);
  }

  @Test
  void issue_signerReturnsOverlongCertificate_isWithheld() {
    signer.setExtraValidity(Duration.ofHours(1));

    assertCode(() -> issuer.issue(request("alice", List.of("developers"), null, null)), ErrorCode.INTERNAL);
    assertThat(auditSink.events()).noneMatch(e -> e.result() == AuditResult.SUCCESS);
  }

  @Test
  void issue_signerDown_isUpstreamUnavailableThenRecovers() {
    signer.setAvailable(false);

    assertCode(() -> issuer.issue(request("alice", List.of("developers"), null, null)),
        ErrorCode.UPSTREAM_UNAVAILABLE);
    AuditEvent failure = auditSink.events().get(0);
    assertThat(failure.result()).isEqualTo(AuditResult.FAILURE);
    assertThat(failure.detail()).isEqualTo("UPSTREAM_UNAVAILABLE");

    signer.setAvailable(true);

    assertThat(issuer.issue(request("alice", List.of("developers"), null, null)).roleName()).isEqualTo("developer");
  }

  @Test
  void issue_auditsSuccessWithSerialAndFingerprint() {
    IssuedCertificate issued = issuer.issue(request("alice", List.of("developers"), null, null));

    AuditEvent event = auditSink.events().get(0);
    assertThat(event.action()).isEqualTo(AuditAction.SSH_CERTIFICATE_ISSUED);
    assertThat(event.actor()).isEqualTo("alice");
    assertThat(event.target()).isEqualTo("developer/" + issued.certificate().serialString());
    assertThat(event.detail()).contains("keyId=" + issued.certificate().keyId()).contains("fingerprint=SHA256:");
  }

  @Test
  void issue_auditFailure_withholdsCertificate() {
    auditSink.setFailing(true);

    assertCode(() -> issuer.issue(request("alice", List.of("developers"), null, null)),
        ErrorCode.AUDIT_WRITE_FAILED);
  }

  @Test
  void issue_issueTimeIsTheRequestArrival() {
    Instant arrived = NOW.minusSeconds(7);
    SigningRequest request = new SigningRequest(publicKey, null, principal("alice", List.of("developers")),
        arrived, null, "req-42");

    IssuedCertificate issued = issuer.issue(request);

    assertThat(issued.issuedAt()).isEqualTo(arrived);
    assertThat(issued.certificate().keyId()).startsWith("alice-" + arrived.getEpochSecond() + "-");
    assertThat(auditSink.events()).singleElement().satisfies(event -> {
      assertThat(event.timestamp()).isEqualTo(arrived);
      assertThat(event.result()).isEqualTo(AuditResult.SUCCESS);
    });
  }

  @Test
  void issue_keyDifferentFromRegisteredKey_isKeyMismatchAndDenied() {
    String userId = registerKey("alice", SshFixtures.ed25519PublicKey("alice@desktop"));

    assertCode(() -> issuer.issue(request("alice", List.of("developers"), null, null)), ErrorCode.KEY_MISMATCH);

    assertThat(signer.calls()).isEmpty();
    assertThat(auditSink.events()).last().satisfies(event -> {
      assertThat(event.action()).isEqualTo(AuditAction.SSH_CERTIFICATE_ISSUED);
      assertThat(event.result()).isEqualTo(AuditResult.DENIED);
      assertThat(event.detail()).startsWith("KEY_MISMATCH");
    });
    assertThat(directory.userAttributes(userId)).containsKey(SshKeyRegistry.KEY_ATTRIBUTE);
  }

  @Test
  void issue_registeredKeyWithDifferentComment_isIssued() {
    String blob = publicKey.split(" ")[1];
    registerKey("alice", "ssh-ed25519 " + blob + " alice@old-laptop");

    assertThat(issuer.issue(request("alice", List.of("developers"), null, null)).roleName()).isEqualTo("developer");
  }

  @Test
  void issue_unusableRegisteredKey_isNotEnforced() {
    String userId = directory.createUser(new CreateUserRequest("alice", null, null, null, true, null));
    directory.updateUserAttributes(userId, Map.of(SshKeyRegistry.KEY_ATTRIBUTE, "ssh-dss AAAA legacy"));

    assertThat(issuer.issue(request("alice", List.of("developers"), null, null)).roleName()).isEqualTo("developer");
  }

  @Test
  void issue_directoryUnreachable_failsClosedBeforeSigning() {
    directory.setReachable(false);

    assertCode(() -> issuer.issue(request("alice", List.of("developers"), null, null)),
        ErrorCode.UPSTREAM_UNAVAILABLE);
    assertThat(signer.calls()).isEmpty();
  }

  @Test
  void effectiveTtl_nullMeansRoleMaximum() {
    assertThat(SshCertificateIssuer.effectiveTtl(DefaultRoles.INFRA, null)).isEqualTo(Duration.ofHours(8));
    assertThat(SshCertificateIssuer.effectiveTtl(DefaultRoles.INFRA, Duration.ofHours(9))).isEqualTo(Duration.ofHours(8));
  }

  @Test
  void caPublicKey_comesFromSigner() {
    assertThat(issuer.caPublicKey()).isEqualTo(FakeCertificateSigner.CA_PUBLIC_KEY);
  }

  private SigningRequest request(final String username, final List<String> groups, final String role,
                                 final Duration ttl) {
    return new SigningRequest(publicKey, role, principal(username, groups), clock.instant(), ttl, "req-1");
  }

  private String registerKey(final String username, final String line) {
    String userId = directory.createUser(new CreateUserRequest(username, null, null, null, true, null));
    keyRegistry.register(principal(username, List.of("developers")), line);
    return userId;
  }

  private static PortalPrincipal principal(final String username, final List<String> groups) {
    return new PortalPrincipal("sub-" + username, username, username + "@example.test", new TreeSet<>(groups),
        NOW.plusSeconds(300));
  }
}
