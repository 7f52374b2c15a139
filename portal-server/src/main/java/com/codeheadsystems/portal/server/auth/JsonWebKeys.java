package com.codeheadsystems.portal.server.auth;

import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import java.security.interfaces.RSAPublicKey;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jwk.Use;
import org.jose4j.lang.JoseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads RSA signature keys out of a JWK set document.
 */
final class JsonWebKeys {

  private static final Logger log = LoggerFactory.getLogger(JsonWebKeys.class);

  private JsonWebKeys() {
  }

  /**
   * Extracts the RSA signing keys. Encryption keys, other key types and keys without a
   * {@code kid} are skipped.
   *
   * @param json the {@code {"keys":[...]}} document
   * @return key id to key, in document order
   * @throws PortalException {@code UPSTREAM_UNAVAILABLE} when the document is not a JWK set
   */
  static Map<String, RSAPublicKey> rsaSigningKeys(final String json) {
    JsonWebKeySet jwks;
    try {
      jwks = new JsonWebKeySet(json);
    } catch (JoseException e) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "JWKS document is unreadable", e);
    }
    Map<String, RSAPublicKey> keys = new LinkedHashMap<>();
    for (JsonWebKey jwk : jwks.getJsonWebKeys()) {
      if (!(jwk instanceof RsaJsonWebKey rsa) || jwk.getKeyId() == null || Use.ENCRYPTION.equals(jwk.getUse())) {
        log.debug("Skipping JWK kid={} kty={} use={}", jwk.getKeyId(), jwk.getKeyType(), jwk.getUse());
        continue;
      }
      keys.put(jwk.getKeyId(), rsa.getRsaPublicKey());
    }
    return keys;
  }
}
