package com.codeheadsystems.portal.model.ssh;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The caller's registered SSH public key. All fields are null when no key is registered.
 *
 * @param publicKey    the registered key line
 * @param fingerprint  its {@code SHA256:} fingerprint
 * @param registeredAt when it was registered, ISO-8601
 */
public record RegisteredSshKeyResponse(
    @JsonProperty("publicKey") String publicKey,
    @JsonProperty("fingerprint") String fingerprint,
    @JsonProperty("registeredAt") String registeredAt) {

  /**
   * The response for a caller without a registered key.
   *
   * @return the empty response
   */
  public static RegisteredSshKeyResponse none() {
    return new RegisteredSshKeyResponse(null, null, null);
  }
}
