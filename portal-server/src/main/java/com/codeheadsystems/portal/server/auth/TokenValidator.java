package com.codeheadsystems.portal.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.TreeSet;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw bearer token into a {@link PortalPrincipal}.
 * <p>
 * Verifies the RS256/RS384/RS512 signature against the cached provider keys, the expiry (with
 * leeway), the issuer and the audience. Never talks to the credential store.
 */
@Singleton
public class TokenValidator {

  private static final Logger log = LoggerFactory.getLogger(TokenValidator.class);

  private final SigningKeyCache keyCache;
  private final OidcSettings settings;
  private final Clock clock;

  /**
   * Instantiates a new Token validator.
   *
   * @param keyCache the key cache
   * @param settings the settings
   * @param clock    the clock used for expiry checks
   */
  @Inject
  public TokenValidator(final SigningKeyCache keyCache, final OidcSettings settings, final Clock clock) {
    this.keyCache = keyCache;
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * Validates the token.
   *
   * @param rawToken the compact JWT, without the {@code Bearer } prefix
   * @return the principal
   * @throws PortalException {@code UNAUTHENTICATED}, {@code MALFORMED_TOKEN} or
   *                         {@code UPSTREAM_UNAVAILABLE}
   */
  public PortalPrincipal validate(final String rawToken) {
    if (rawToken == null || rawToken.isBlank()) {
      throw new PortalException(ErrorCode.UNAUTHENTICATED, "bearer token required");
    }
    DecodedJWT unverified;
    try {
      unverified = JWT.decode(rawToken);
    } catch (JWTDecodeException e) {
      throw new PortalException(ErrorCode.MALFORMED_TOKEN, "bearer token is not a JWT", e);
    }
    RSAPublicKey key = keyCache.publicKey(unverified.getKeyId());
    Algorithm algorithm = algorithm(unverified.getAlgorithm(), key);
    JWTVerifier verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm)
        .withIssuer(settings.issuer())
        .withAnyOfAudience(settings.audiences().toArray(String[]::new))
        .acceptLeeway(settings.leeway().toSeconds()))
        .build(clock);
    DecodedJWT verified;
    try {
      verified = verifier.verify(unverified);
    } catch (TokenExpiredException e) {
      log.debug("validate() rejected expired token for sub={}", unverified.getSubject());
      throw new PortalException(ErrorCode.UNAUTHENTICATED, "token expired", e);
    } catch (JWTVerificationException e) {
      log.debug("validate() rejected token: {}", e.getMessage());
      throw new PortalException(ErrorCode.UNAUTHENTICATED, "token rejected", e);
    }
    return principal(verified);
  }

  private PortalPrincipal principal(final DecodedJWT jwt) {
    String subject = jwt.getSubject();
    String username = jwt.getClaim("preferred_username").asString();
    Instant expiresAt = jwt.getExpiresAtAsInstant();
    if (subject == null || subject.isBlank() || username == null || username.isBlank()) {
      throw new PortalException(ErrorCode.MALFORMED_TOKEN, "token lacks sub or preferred_username");
    }
    if (expiresAt == null) {
      throw new PortalException(ErrorCode.MALFORMED_TOKEN, "token has no expiry");
    }
    List<String> rawGroups;
    try {
      rawGroups = jwt.getClaim(settings.groupsClaim()).asList(String.class);
    } catch (JWTDecodeException e) {
      throw new PortalException(ErrorCode.MALFORMED_TOKEN, "groups claim is not a list of strings", e);
    }
    TreeSet<String> groups = new TreeSet<>();
    if (rawGroups != null) {
      rawGroups.stream().map(TokenValidator::normaliseGroup).filter(g -> !g.isEmpty()).forEach(groups::add);
    }
    return new PortalPrincipal(subject, username, jwt.getClaim("email").asString(), groups, expiresAt);
  }

  /**
   * Strips the leading slash of Keycloak group paths, so {@code /developers} becomes
   * {@code developers}.
   *
   * @param group the raw group
   * @return the normalised group
   */
  static String normaliseGroup(final String group) {
    if (group == null) {
      return "";
    }
    return group.startsWith("/") ? group.substring(1) : group;
  }

  private static Algorithm algorithm(final String name, final RSAPublicKey key) {
    if (name == null) {
      throw new PortalException(ErrorCode.MALFORMED_TOKEN, "token header has no alg");
    }
    return switch (name) {
      case "RS256" -> Algorithm.RSA256(key, null);
      case "RS384" -> Algorithm.RSA384(key, null);
      case "RS512" -> Algorithm.RSA512(key, null);
      default -> throw new PortalException(ErrorCode.UNAUTHENTICATED, "unsupported token algorithm " + name);
    };
  }
}
