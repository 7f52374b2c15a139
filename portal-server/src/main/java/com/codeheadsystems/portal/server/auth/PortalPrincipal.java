package com.codeheadsystems.portal.server.auth;

import java.security.Principal;
import java.time.Instant;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The authenticated caller, rebuilt from the bearer token on every request.
 *
 * @param subject   the token subject
 * @param username  the preferred username
 * @param email     the email address, may be null
 * @param groups    the normalised group names
 * @param expiresAt the token expiry
 */
public record PortalPrincipal(String subject, String username, String email,
                              SortedSet<String> groups, Instant expiresAt) implements Principal {

  /**
   * Copies the groups into an unmodifiable sorted set.
   */
  public PortalPrincipal {
    groups = Collections.unmodifiableSortedSet(new TreeSet<>(groups));
  }

  @Override
  public String getName() {
    return username;
  }
}
