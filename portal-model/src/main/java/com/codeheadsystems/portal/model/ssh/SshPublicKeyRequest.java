package com.codeheadsystems.portal.model.ssh;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Registers the caller's SSH public key.
 * <p>
 * Used by: {@code PUT /api/v1/self/ssh-key}
 *
 * @param publicKey the OpenSSH public key line
 */
public record SshPublicKeyRequest(
    @JsonProperty("publicKey") String publicKey) {
}
