package com.codeheadsystems.portal.server.vault;

import java.time.Duration;
import java.time.Instant;

/**
 * The portal's own credential-store token with its lease. Replaced as a whole, never mutated.
 *
 * @param token         the client token
 * @param leaseDuration the lease granted at acquisition
 * @param acquiredAt    when it was acquired or last renewed
 * @param renewable     whether the lease may be renewed
 */
public record ServiceCredential(String token, Duration leaseDuration, Instant acquiredAt, boolean renewable) {

  /**
   * End of the lease.
   *
   * @return the expiry
   */
  public Instant expiresAt() {
    return acquiredAt.plus(leaseDuration);
  }

  /**
   * Whether the credential may still be presented.
   *
   * @param now the current time
   * @return true before expiry
   */
  public boolean isValidAt(final Instant now) {
    return now.isBefore(expiresAt());
  }

  /**
   * When renewal should start.
   *
   * @param fraction the fraction of the lease
   * @return the renewal deadline
   */
  public Instant renewalDeadline(final double fraction) {
    return acquiredAt.plusMillis((long) (leaseDuration.toMillis() * fraction));
  }

  @Override
  public String toString() {
    return "ServiceCredential[lease=" + leaseDuration + ", acquiredAt=" + acquiredAt
        + ", renewable=" + renewable + "]";
  }
}
