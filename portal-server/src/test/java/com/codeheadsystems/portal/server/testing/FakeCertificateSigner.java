package com.codeheadsystems.portal.server.testing;

import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import com.codeheadsystems.portal.server.role.Role;
import com.codeheadsystems.portal.server.vault.CertificateSigner;
import com.codeheadsystems.portal.server.vault.SignedCertificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Signs like the credential store would: back-dates validity by 30 seconds and hands out a new
 * serial per call. Can be switched off to simulate an outage.
 */
public class FakeCertificateSigner implements CertificateSigner {

  public static final String CA_PUBLIC_KEY = "ssh-ed25519 AAAAC3NzaC1lZDI1NTE5AAAAIFakeCaKeyForTests ca@test";

  private final Clock clock;
  private final AtomicLong serials = new AtomicLong(1000);
  private final List<Call> calls = new CopyOnWriteArrayList<>();
  private volatile boolean available = true;
  private volatile Duration extraValidity = Duration.ZERO;

  public FakeCertificateSigner(final Clock clock) {
    this.clock = clock;
  }

  @Override
  public SignedCertificate sign(final Role role, final String publicKey, final List<String> validPrincipals,
                                final Duration ttl, final String keyId) {
    if (!available) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "credential store is unreachable");
    }
    calls.add(new Call(role.signingRole(), publicKey, validPrincipals, ttl, keyId));
    long serial = serials.incrementAndGet();
    Instant now = clock.instant();
    String certificate = SshFixtures.certificate(serial, keyId, validPrincipals, now.minusSeconds(30),
        now.plus(ttl).plus(extraValidity), List.of("permit-pty", "permit-port-forwarding"));
    return new SignedCertificate(certificate.trim(), Long.toString(serial));
  }

  @Override
  public String caPublicKey() {
    if (!available) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "credential store is unreachable");
    }
    return CA_PUBLIC_KEY;
  }

  @Override
  public boolean isAvailable() {
    return available;
  }

  public void setAvailable(final boolean available) {
    this.available = available;
  }

  /**
   * Makes issued certificates outlive the requested ttl, as a misconfigured signing role would.
   */
  public void setExtraValidity(final Duration extraValidity) {
    this.extraValidity = extraValidity;
  }

  public List<Call> calls() {
    return calls;
  }

  public record Call(String signingRole, String publicKey, List<String> principals, Duration ttl, String keyId) {
  }
}
