package com.codeheadsystems.portal.server.auth;

import java.security.interfaces.RSAPublicKey;
import java.util.Map;

/**
 * Where token signing keys come from.
 */
@FunctionalInterface
public interface KeySetSource {

  /**
   * Fetches the current signing keys.
   *
   * @return key id to public key
   * @throws com.codeheadsystems.portal.server.exception.PortalException with
   *     {@code UPSTREAM_UNAVAILABLE} when the source cannot be read
   */
  Map<String, RSAPublicKey> fetchSigningKeys();
}
