package com.codeheadsystems.portal.server.ssh;

import com.codeheadsystems.portal.server.audit.AuditAction;
import com.codeheadsystems.portal.server.audit.AuditEmitter;
import com.codeheadsystems.portal.server.audit.AuditEvent;
import com.codeheadsystems.portal.server.audit.AuditResult;
import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import com.codeheadsystems.portal.server.role.GroupResolver;
import com.codeheadsystems.portal.server.role.Role;
import com.codeheadsystems.portal.server.vault.CertificateSigner;
import com.codeheadsystems.portal.server.vault.SignedCertificate;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues SSH user certificates.
 * <p>
 * Order of work: resolve the role (and honour a downgrade request), vet the public key, clamp the
 * lifetime, sign, decode and re-check the returned certificate, audit, return. A bad key never
 * reaches the signer. Every call is a new grant with its own serial.
 */
@Singleton
public class SshCertificateIssuer {

  /**
   * How far the signer may back-date {@code valid_after} and how far its clock may run ahead.
   */
  public static final Duration SIGNER_CLOCK_ALLOWANCE = Duration.ofSeconds(30);

  private static final Logger log = LoggerFactory.getLogger(SshCertificateIssuer.class);

  private final GroupResolver groupResolver;
  private final CertificateSigner signer;
  private final SshKeyRegistry keyRegistry;
  private final AuditEmitter auditEmitter;
  private final SecureRandom random = new SecureRandom();

  /**
   * Instantiates a new Ssh certificate issuer.
   *
   * @param groupResolver the group resolver
   * @param signer        the signer
   * @param keyRegistry   the registered keys
   * @param auditEmitter  the audit emitter
   */
  @Inject
  public SshCertificateIssuer(final GroupResolver groupResolver,
                              final CertificateSigner signer,
                              final SshKeyRegistry keyRegistry,
                              final AuditEmitter auditEmitter) {
    this.groupResolver = groupResolver;
    this.signer = signer;
    this.keyRegistry = keyRegistry;
    this.auditEmitter = auditEmitter;
  }

  /**
   * Issues a certificate. The request's arrival time is the issue time.
   *
   * @param request the signing request
   * @return the certificate
   * @throws PortalException {@code NO_ELIGIBLE_ROLE}, {@code FORBIDDEN}, {@code INVALID_PUBLIC_KEY},
   *                         {@code KEY_MISMATCH}, {@code INVALID_REQUEST}, {@code UPSTREAM_UNAVAILABLE}, {@code INTERNAL}
   *                         or {@code AUDIT_WRITE_FAILED}
   */
  public IssuedCertificate issue(final SigningRequest request) {
    PortalPrincipal principal = request.requester();
    log.debug("issue(user={}, role={}, ttl={})", principal.username(), request.requestedRole(), request.requestedTtl());
    Role role = groupResolver.resolveRequested(principal.groups(), request.requestedRole());
    SshPublicKey key = SshPublicKeys.parse(request.publicKey());
    Duration ttl = effectiveTtl(role, request.requestedTtl());
    Instant issuedAt = request.requestedAt();
    try {
      keyRegistry.checkMatches(principal, key);
    } catch (PortalException e) {
      if (e.code() == ErrorCode.KEY_MISMATCH) {
        auditEmitter.appendBestEffort(AuditEvent.of(principal.username(), AuditAction.SSH_CERTIFICATE_ISSUED,
            role.name(), issuedAt, AuditResult.DENIED, "KEY_MISMATCH fingerprint=" + key.fingerprint()));
      }
      throw e;
    }
    String keyId = keyId(principal.username(), issuedAt);

    SignedCertificate signed;
    try {
      signed = signer.sign(role, key.authorizedKeyLine(), role.principals(), ttl, keyId);
    } catch (PortalException e) {
      auditEmitter.appendBestEffort(AuditEvent.of(principal.username(), AuditAction.SSH_CERTIFICATE_ISSUED,
          role.name(), issuedAt, AuditResult.FAILURE, e.code().name()));
      throw e;
    }

    SshCertificate certificate = decode(signed);
    checkValidity(role, issuedAt, certificate);

    auditEmitter.append(AuditEvent.of(principal.username(), AuditAction.SSH_CERTIFICATE_ISSUED,
        role.name() + "/" + certificate.serialString(), issuedAt, AuditResult.SUCCESS,
        "keyId=" + keyId + " fingerprint=" + key.fingerprint()));
    auditEmitter.certificateIssued(role.name());
    log.info("Issued SSH certificate serial={} keyId={} role={} validBefore={} requestId={}",
        certificate.serialString(), keyId, role.name(), certificate.validBefore(), request.requestId());
    return new IssuedCertificate(signed.signedKey(), certificate, role.name(), issuedAt);
  }

  /**
   * Roles the caller may request, most privileged first.
   *
   * @param principal the caller
   * @return the roles
   */
  public List<Role> eligibleRoles(final PortalPrincipal principal) {
    return groupResolver.eligibleRoles(principal.groups());
  }

  /**
   * The CA public key.
   *
   * @return the OpenSSH public key line
   */
  public String caPublicKey() {
    return signer.caPublicKey();
  }

  /**
   * The requested lifetime clamped to the role's maximum; the maximum when none was requested.
   *
   * @param role      the role
   * @param requested the requested lifetime, may be null
   * @return the lifetime to sign for
   */
  static Duration effectiveTtl(final Role role, final Duration requested) {
    if (requested == null) {
      return role.maxTtl();
    }
    if (requested.isNegative() || requested.isZero()) {
      throw new PortalException(ErrorCode.INVALID_REQUEST, "ttl must be positive");
    }
    return requested.compareTo(role.maxTtl()) > 0 ? role.maxTtl() : requested;
  }

  private String keyId(final String username, final Instant issuedAt) {
    byte[] suffix = new byte[4];
    random.nextBytes(suffix);
    return username + "-" + issuedAt.getEpochSecond() + "-" + HexFormat.of().formatHex(suffix);
  }

  private static SshCertificate decode(final SignedCertificate signed) {
    try {
      return SshCertificateReader.read(signed.signedKey());
    } catch (IllegalArgumentException e) {
      log.error("Signer returned an unreadable certificate", e);
      throw new PortalException(ErrorCode.INTERNAL, "issued certificate could not be verified", e);
    }
  }

  private static void checkValidity(final Role role, final Instant issuedAt, final SshCertificate certificate) {
    Instant latestEnd = issuedAt.plus(role.maxTtl()).plus(SIGNER_CLOCK_ALLOWANCE);
    Duration window = Duration.between(certificate.validAfter(), certificate.validBefore());
    boolean tooLong = certificate.validBefore().isAfter(latestEnd)
        || window.compareTo(role.maxTtl().plus(SIGNER_CLOCK_ALLOWANCE)) > 0;
    if (tooLong || !certificate.userCertificate()) {
      log.error("Withholding certificate serial={} for role {}: validity {} to {}, user={}",
          certificate.serialString(), role.name(), certificate.validAfter(), certificate.validBefore(),
          certificate.userCertificate());
      throw new PortalException(ErrorCode.INTERNAL, "issued certificate violates role policy");
    }
  }
}
