package com.codeheadsystems.portal.server.vault;

import java.net.URI;
import java.time.Duration;

/**
 * Credential store settings, resolved from configuration.
 *
 * @param address          the Vault base address
 * @param sshMount         the SSH secrets engine mount
 * @param authPath         the platform auth method path, e.g. {@code kubernetes}
 * @param authRole         the auth role the portal logs in as
 * @param renewFraction    fraction of the lease after which renewal starts
 * @param initialBackoff   first retry delay
 * @param maxBackoff       retry delay ceiling
 * @param maxRenewAttempts renew attempts before falling back to a fresh login
 * @param stopTimeout      how long shutdown waits for the renewal thread
 */
public record VaultSettings(URI address,
                            String sshMount,
                            String authPath,
                            String authRole,
                            double renewFraction,
                            Duration initialBackoff,
                            Duration maxBackoff,
                            int maxRenewAttempts,
                            Duration stopTimeout) {

  /**
   * Validates ranges.
   */
  public VaultSettings {
    if (renewFraction <= 0 || renewFraction >= 1) {
      throw new IllegalArgumentException("renewFraction must be in (0, 1): " + renewFraction);
    }
    if (maxRenewAttempts < 1) {
      throw new IllegalArgumentException("maxRenewAttempts must be positive");
    }
    if (initialBackoff.compareTo(maxBackoff) > 0) {
      throw new IllegalArgumentException("initialBackoff exceeds maxBackoff");
    }
  }

  /**
   * Absolute URI of a Vault API path.
   *
   * @param path the path below {@code /v1/}
   * @return the URI
   */
  public URI api(final String path) {
    String base = address.toString();
    return URI.create((base.endsWith("/") ? base : base + "/") + "v1/" + path);
  }
}
