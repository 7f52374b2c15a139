package com.codeheadsystems.portal.server.auth;

import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import jakarta.ws.rs.core.SecurityContext;

/**
 * Authorization role names used with {@code @RolesAllowed}, and access to the current principal.
 */
public final class PortalRoles {

  /** Granted to callers whose groups resolve to the administrative role. */
  public static final String ADMIN = "admin";

  private PortalRoles() {
  }

  /**
   * The authenticated caller of the current request.
   *
   * @param securityContext the request's security context
   * @return the principal
   * @throws PortalException {@link ErrorCode#UNAUTHENTICATED} when no portal principal is present
   */
  public static PortalPrincipal principal(final SecurityContext securityContext) {
    if (securityContext != null && securityContext.getUserPrincipal() instanceof PortalPrincipal principal) {
      return principal;
    }
    throw new PortalException(ErrorCode.UNAUTHENTICATED, "bearer token required");
  }
}
