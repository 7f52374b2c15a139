package com.codeheadsystems.portal.server.role;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * A named permission level. Lower {@code precedence} means more privilege.
 *
 * @param name        the role name shown to users
 * @param signingRole the credential store's signing role backing this role
 * @param maxTtl      the longest validity a certificate under this role may carry
 * @param principals  the login principals certificates under this role are valid for
 * @param precedence  the rank; 0 is the most privileged
 */
public record Role(String name, String signingRole, Duration maxTtl, List<String> principals,
                   int precedence) {

  /**
   * Validates and copies.
   */
  public Role {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("role name is required");
    }
    if (signingRole == null || signingRole.isBlank()) {
      throw new IllegalArgumentException("role " + name + " has no signing role");
    }
    Objects.requireNonNull(maxTtl, "maxTtl");
    if (maxTtl.isNegative() || maxTtl.isZero()) {
      throw new IllegalArgumentException("role " + name + " needs a positive max TTL");
    }
    if (principals == null || principals.isEmpty()) {
      throw new IllegalArgumentException("role " + name + " has no principals");
    }
    if (precedence < 0) {
      throw new IllegalArgumentException("role " + name + " has a negative precedence");
    }
    principals = List.copyOf(principals);
  }
}
