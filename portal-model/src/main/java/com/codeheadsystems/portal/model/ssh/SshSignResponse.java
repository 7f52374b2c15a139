package com.codeheadsystems.portal.model.ssh;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A freshly issued SSH user certificate.
 *
 * @param signedCertificate the OpenSSH certificate line, ready to save as {@code id_*-cert.pub}
 * @param serialNumber      the certificate serial, unsigned decimal
 * @param keyId             the key id embedded in the certificate
 * @param principals        the principals the certificate is valid for
 * @param validAfter        start of validity, epoch seconds
 * @param validBefore       end of validity, epoch seconds
 * @param role              the role the certificate was issued under
 * @param extensions        the certificate extensions, e.g. {@code permit-pty}
 */
public record SshSignResponse(
    @JsonProperty("signedCertificate") String signedCertificate,
    @JsonProperty("serialNumber") String serialNumber,
    @JsonProperty("keyId") String keyId,
    @JsonProperty("principals") List<String> principals,
    @JsonProperty("validAfter") long validAfter,
    @JsonProperty("validBefore") long validBefore,
    @JsonProperty("role") String role,
    @JsonProperty("extensions") List<String> extensions) {
}
