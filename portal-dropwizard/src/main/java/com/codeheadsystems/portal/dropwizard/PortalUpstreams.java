package com.codeheadsystems.portal.dropwizard;

import com.codeheadsystems.portal.server.audit.AuditSink;
import com.codeheadsystems.portal.server.auth.IdentityProviderAccessor;
import com.codeheadsystems.portal.server.directory.DirectoryAccessor;
import com.codeheadsystems.portal.server.vault.CertificateSigner;
import java.util.List;

/**
 * Replacements for the portal's external systems. A null member means the real client, built
 * from configuration, is used.
 *
 * @param identityProvider  the OIDC provider
 * @param certificateSigner the SSH certificate signer
 * @param directoryAccessor the user directory
 * @param auditSinks        audit sinks added to the configured ones
 */
public record PortalUpstreams(IdentityProviderAccessor identityProvider,
                              CertificateSigner certificateSigner,
                              DirectoryAccessor directoryAccessor,
                              List<AuditSink> auditSinks) {

  /**
   * Copies the sink list.
   */
  public PortalUpstreams {
    auditSinks = auditSinks == null ? List.of() : List.copyOf(auditSinks);
  }

  /**
   * No replacements: every upstream is built from configuration.
   *
   * @return the upstreams
   */
  public static PortalUpstreams fromConfiguration() {
    return new PortalUpstreams(null, null, null, List.of());
  }
}
