package com.codeheadsystems.portal.server.resource;

import com.codeheadsystems.portal.model.auth.LogoutRequest;
import com.codeheadsystems.portal.model.auth.TokenResponse;
import com.codeheadsystems.portal.model.auth.UserInfoResponse;
import com.codeheadsystems.portal.server.auth.LoginManager;
import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import com.codeheadsystems.portal.server.auth.PortalRoles;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import com.codeheadsystems.portal.server.role.GroupResolver;
import com.codeheadsystems.portal.server.role.Role;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for the browser login flow and the caller's identity.
 */
@Path("/api/v1/auth")
@Produces(MediaType.APPLICATION_JSON)
public class AuthResource {

  private static final Logger log = LoggerFactory.getLogger(AuthResource.class);

  private final LoginManager loginManager;
  private final GroupResolver groupResolver;

  /**
   * Instantiates a new Auth resource.
   *
   * @param loginManager  the login manager
   * @param groupResolver the group resolver
   */
  public AuthResource(final LoginManager loginManager, final GroupResolver groupResolver) {
    this.loginManager = loginManager;
    this.groupResolver = groupResolver;
  }

  /**
   * Redirects to the identity provider.
   *
   * @return a 302
   */
  @GET
  @Path("/login")
  public Response login() {
    return Response.status(Response.Status.FOUND).location(loginManager.beginLogin()).build();
  }

  /**
   * Finishes the login.
   *
   * @param code             the authorization code
   * @param state            the state
   * @param error            the provider's error, if the login failed there
   * @param errorDescription the provider's error detail
   * @return the tokens
   */
  @GET
  @Path("/callback")
  public TokenResponse callback(@QueryParam("code") final String code,
                                @QueryParam("state") final String state,
                                @QueryParam("error") final String error,
                                @QueryParam("error_description") final String errorDescription) {
    if (error != null) {
      log.info("Identity provider reported login error {}: {}", error, errorDescription);
      throw new PortalException(ErrorCode.UNAUTHENTICATED, "login failed: " + error);
    }
    return loginManager.completeLogin(code, state);
  }

  /**
   * Ends the caller's provider session.
   *
   * @param securityContext the security context
   * @param request         the body, may be absent
   * @return a 204
   */
  @POST
  @Path("/logout")
  @PermitAll
  @Consumes(MediaType.APPLICATION_JSON)
  public Response logout(@Context final SecurityContext securityContext, final LogoutRequest request) {
    PortalPrincipal principal = PortalRoles.principal(securityContext);
    loginManager.logout(principal, request == null ? null : request.refreshToken());
    return Response.noContent().build();
  }

  /**
   * The caller and the role they act under.
   *
   * @param securityContext the security context
   * @return the user info
   */
  @GET
  @Path("/userinfo")
  @PermitAll
  public UserInfoResponse userinfo(@Context final SecurityContext securityContext) {
    PortalPrincipal principal = PortalRoles.principal(securityContext);
    String role = groupResolver.tryResolve(principal.groups()).map(Role::name).orElse(null);
    return new UserInfoResponse(principal.subject(), principal.username(), principal.email(),
        List.copyOf(principal.groups()), role, groupResolver.isAdministrator(principal.groups()),
        principal.expiresAt().getEpochSecond());
  }
}
