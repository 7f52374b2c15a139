package com.codeheadsystems.portal.server.vault;

import com.codeheadsystems.portal.server.role.Role;
import java.time.Duration;
import java.util.List;

/**
 * Signs SSH user certificates. The portal never holds CA key material itself.
 */
public interface CertificateSigner {

  /**
   * Signs the public key.
   *
   * @param role            the role, whose signing role is used
   * @param publicKey       the OpenSSH public key line
   * @param validPrincipals the principals to embed
   * @param ttl             the requested validity
   * @param keyId           the key id to embed
   * @return the certificate
   */
  SignedCertificate sign(Role role, String publicKey, List<String> validPrincipals, Duration ttl, String keyId);

  /**
   * The CA public key hosts should trust.
   *
   * @return the OpenSSH public key line
   */
  String caPublicKey();

  /**
   * Whether signing can currently succeed.
   *
   * @return false while degraded
   */
  default boolean isAvailable() {
    return true;
  }
}
