package com.codeheadsystems.portal.server.ssh;

import com.codeheadsystems.portal.model.ssh.SshSignResponse;
import java.time.Instant;

/**
 * A certificate handed to a caller.
 *
 * @param signedCertificate the OpenSSH certificate line
 * @param certificate       its decoded fields
 * @param roleName          the role it was issued under
 * @param issuedAt          when the portal issued it
 */
public record IssuedCertificate(String signedCertificate,
                                SshCertificate certificate,
                                String roleName,
                                Instant issuedAt) {

  /**
   * The wire response.
   *
   * @return the response
   */
  public SshSignResponse toResponse() {
    return new SshSignResponse(signedCertificate, certificate.serialString(), certificate.keyId(),
        certificate.principals(), certificate.validAfter().getEpochSecond(),
        certificate.validBefore().getEpochSecond(), roleName, certificate.extensions());
  }
}
