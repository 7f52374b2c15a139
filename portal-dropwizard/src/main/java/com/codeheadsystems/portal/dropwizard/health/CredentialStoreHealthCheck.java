package com.codeheadsystems.portal.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.portal.server.vault.CertificateSigner;

/**
 * Health check that reports whether SSH certificates can currently be signed.
 */
public class CredentialStoreHealthCheck extends HealthCheck {

  private final CertificateSigner signer;

  /**
   * Instantiates a new Credential store health check.
   *
   * @param signer the signer
   */
  public CredentialStoreHealthCheck(final CertificateSigner signer) {
    this.signer = signer;
  }

  @Override
  protected Result check() {
    if (signer.isAvailable()) {
      return Result.healthy();
    }
    return Result.unhealthy("Credential store is degraded; certificate issuance is unavailable");
  }
}
