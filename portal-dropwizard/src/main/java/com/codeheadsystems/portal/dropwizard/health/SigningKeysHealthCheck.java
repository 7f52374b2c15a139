package com.codeheadsystems.portal.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.portal.server.auth.SigningKeyCache;

/**
 * Health check that reports whether bearer tokens can currently be verified.
 */
public class SigningKeysHealthCheck extends HealthCheck {

  private final SigningKeyCache keyCache;

  /**
   * Instantiates a new Signing keys health check.
   *
   * @param keyCache the key cache
   */
  public SigningKeysHealthCheck(final SigningKeyCache keyCache) {
    this.keyCache = keyCache;
  }

  @Override
  protected Result check() {
    if (!keyCache.isUsable()) {
      return Result.unhealthy("No usable identity provider signing keys");
    }
    return keyCache.lastSuccessfulFetch()
        .map(at -> Result.healthy("keys fetched at %s", at))
        .orElseGet(() -> Result.healthy());
  }
}
