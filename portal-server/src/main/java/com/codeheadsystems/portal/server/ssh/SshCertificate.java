package com.codeheadsystems.portal.server.ssh;

import java.time.Instant;
import java.util.List;

/**
 * The fields of an OpenSSH certificate the portal reports and checks.
 *
 * @param type            the certificate type, e.g. {@code ssh-ed25519-cert-v01@openssh.com}
 * @param serial          the serial, an unsigned 64-bit value held in a long
 * @param userCertificate whether this is a user (not host) certificate
 * @param keyId           the key id
 * @param principals      the valid principals
 * @param validAfter      start of validity
 * @param validBefore     end of validity; {@link Instant#MAX} for "forever"
 * @param criticalOptions names of the critical options
 * @param extensions      names of the extensions
 */
public record SshCertificate(String type,
                             long serial,
                             boolean userCertificate,
                             String keyId,
                             List<String> principals,
                             Instant validAfter,
                             Instant validBefore,
                             List<String> criticalOptions,
                             List<String> extensions) {

  /**
   * The serial in unsigned decimal, as {@code ssh-keygen -L} prints it.
   *
   * @return the serial
   */
  public String serialString() {
    return Long.toUnsignedString(serial);
  }
}
