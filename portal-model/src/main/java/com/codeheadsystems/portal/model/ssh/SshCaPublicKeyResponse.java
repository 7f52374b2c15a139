package com.codeheadsystems.portal.model.ssh;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The SSH user CA public key, for {@code TrustedUserCAKeys} on hosts.
 *
 * @param publicKey the OpenSSH public key line of the CA
 */
public record SshCaPublicKeyResponse(@JsonProperty("publicKey") String publicKey) {
}
