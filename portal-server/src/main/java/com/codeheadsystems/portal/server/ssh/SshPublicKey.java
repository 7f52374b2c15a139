package com.codeheadsystems.portal.server.ssh;

import java.util.Base64;

/**
 * A validated OpenSSH public key.
 *
 * @param type        the key type, e.g. {@code ssh-ed25519}
 * @param blob        the wire-encoded key
 * @param comment     the trailing comment, may be empty
 * @param fingerprint the {@code SHA256:} fingerprint as {@code ssh-keygen -l} prints it
 */
public record SshPublicKey(String type, byte[] blob, String comment, String fingerprint) {

  /**
   * The key as an authorized_keys line without the comment, which is what gets signed.
   *
   * @return the line
   */
  public String authorizedKeyLine() {
    return type + " " + Base64.getEncoder().encodeToString(blob);
  }
}
