package com.codeheadsystems.portal.dropwizard.auth;

import com.codeheadsystems.portal.server.audit.AuditAction;
import com.codeheadsystems.portal.server.audit.AuditEmitter;
import com.codeheadsystems.portal.server.audit.AuditEvent;
import com.codeheadsystems.portal.server.audit.AuditResult;
import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import com.codeheadsystems.portal.server.auth.TokenValidator;
import com.codeheadsystems.portal.server.exception.PortalException;
import io.dropwizard.auth.Authenticator;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard {@link Authenticator} that validates OIDC bearer tokens using {@link TokenValidator}.
 * <p>
 * Rejections are rethrown rather than mapped to an empty result so the caller sees why the token
 * failed: {@code UNAUTHENTICATED} or {@code MALFORMED_TOKEN} as a 401, or a 503 when the signing
 * keys cannot be had.
 */
public class PortalAuthenticator implements Authenticator<String, PortalPrincipal> {

  private static final Logger log = LoggerFactory.getLogger(PortalAuthenticator.class);

  private final TokenValidator tokenValidator;
  private final AuditEmitter auditEmitter;
  private final Clock clock;

  /**
   * Instantiates a new Portal authenticator.
   *
   * @param tokenValidator the token validator
   * @param auditEmitter   the audit emitter
   * @param clock          the clock
   */
  public PortalAuthenticator(final TokenValidator tokenValidator,
                             final AuditEmitter auditEmitter,
                             final Clock clock) {
    this.tokenValidator = tokenValidator;
    this.auditEmitter = auditEmitter;
    this.clock = clock;
  }

  @Override
  public Optional<PortalPrincipal> authenticate(final String token) {
    try {
      return Optional.of(tokenValidator.validate(token));
    } catch (PortalException e) {
      log.debug("Bearer token rejected: {} {}", e.code(), e.getMessage());
      auditEmitter.authenticationFailed(e.code());
      if (e.code().status() == 401) {
        auditEmitter.appendBestEffort(AuditEvent.of(null, AuditAction.TOKEN_REJECTED, "bearer",
            clock.instant(), AuditResult.DENIED, e.code().name()));
      }
      throw e;
    }
  }
}
