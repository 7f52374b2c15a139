package com.codeheadsystems.portal.server.vault;

/**
 * The credential store's answer to a sign request.
 *
 * @param signedKey    the OpenSSH certificate line
 * @param serialNumber the serial as reported by the store
 */
public record SignedCertificate(String signedKey, String serialNumber) {
}
