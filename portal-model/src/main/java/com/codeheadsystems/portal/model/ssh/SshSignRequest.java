package com.codeheadsystems.portal.model.ssh;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request for a signed SSH user certificate.
 * <p>
 * Used by: {@code POST /api/v1/ssh/sign}
 *
 * @param publicKey  the OpenSSH public key line, e.g. {@code ssh-ed25519 AAAA... user@host}
 * @param role       optional role name; only roles at or below the caller's resolved role are allowed
 * @param ttlSeconds optional requested lifetime; clamped to the role's maximum
 */
public record SshSignRequest(
    @JsonProperty("publicKey") String publicKey,
    @JsonProperty("role") String role,
    @JsonProperty("ttlSeconds") Long ttlSeconds) {
}
