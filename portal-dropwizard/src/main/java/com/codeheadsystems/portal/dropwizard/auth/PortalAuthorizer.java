package com.codeheadsystems.portal.dropwizard.auth;

import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import com.codeheadsystems.portal.server.auth.PortalRoles;
import com.codeheadsystems.portal.server.role.GroupResolver;
import io.dropwizard.auth.Authorizer;
import jakarta.ws.rs.container.ContainerRequestContext;

/**
 * Grants {@link PortalRoles#ADMIN} to callers whose groups resolve to the administrative role.
 * Group membership is read from the validated token on every request, never cached.
 */
public class PortalAuthorizer implements Authorizer<PortalPrincipal> {

  private final GroupResolver groupResolver;

  /**
   * Instantiates a new Portal authorizer.
   *
   * @param groupResolver the group resolver
   */
  public PortalAuthorizer(final GroupResolver groupResolver) {
    this.groupResolver = groupResolver;
  }

  @Override
  public boolean authorize(final PortalPrincipal principal,
                           final String role,
                           final ContainerRequestContext requestContext) {
    if (PortalRoles.ADMIN.equals(role)) {
      return groupResolver.isAdministrator(principal.groups());
    }
    return false;
  }
}
