package com.codeheadsystems.portal.server.resource;

import com.codeheadsystems.portal.model.directory.CreateUserRequest;
import com.codeheadsystems.portal.model.directory.CreatedResponse;
import com.codeheadsystems.portal.model.directory.GroupResponse;
import com.codeheadsystems.portal.model.directory.ResetPasswordRequest;
import com.codeheadsystems.portal.model.directory.SessionResponse;
import com.codeheadsystems.portal.model.directory.UpdateUserRequest;
import com.codeheadsystems.portal.model.directory.UserResponse;
import com.codeheadsystems.portal.model.directory.UsersResponse;
import com.codeheadsystems.portal.server.auth.PortalRoles;
import com.codeheadsystems.portal.server.directory.DirectoryAdminGateway;
import jakarta.annotation.security.RolesAllowed;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.net.URI;
import java.util.List;

/**
 * JAX-RS resource for user administration. Administrators only.
 */
@Path("/api/v1/users")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed(PortalRoles.ADMIN)
public class UserResource {

  private final DirectoryAdminGateway gateway;

  /**
   * Instantiates a new User resource.
   *
   * @param gateway the gateway
   */
  public UserResource(final DirectoryAdminGateway gateway) {
    this.gateway = gateway;
  }

  @GET
  public UsersResponse list(@QueryParam("first") @DefaultValue("0") final int first,
                            @QueryParam("max") @DefaultValue("100") final int max,
                            @QueryParam("search") final String search) {
    return new UsersResponse(gateway.listUsers(first, max, search), first, max);
  }

  /**
   * Creates a user.
   *
   * @param securityContext the security context
   * @param request         the request
   * @return 201 with the new id
   */
  @POST
  public Response create(@Context final SecurityContext securityContext, final CreateUserRequest request) {
    String id = gateway.createUser(PortalRoles.principal(securityContext), request);
    return Response.created(URI.create("/api/v1/users/" + id)).entity(new CreatedResponse(id)).build();
  }

  @GET
  @Path("/{id}")
  public UserResponse get(@PathParam("id") final String id) {
    return gateway.getUser(id);
  }

  @PUT
  @Path("/{id}")
  public Response update(@Context final SecurityContext securityContext,
                         @PathParam("id") final String id,
                         final UpdateUserRequest request) {
    gateway.updateUser(PortalRoles.principal(securityContext), id, request);
    return Response.noContent().build();
  }

  @DELETE
  @Path("/{id}")
  public Response delete(@Context final SecurityContext securityContext, @PathParam("id") final String id) {
    gateway.deleteUser(PortalRoles.principal(securityContext), id);
    return Response.noContent().build();
  }

  @POST
  @Path("/{id}/reset-password")
  public Response resetPassword(@Context final SecurityContext securityContext,
                                @PathParam("id") final String id,
                                final ResetPasswordRequest request) {
    gateway.resetPassword(PortalRoles.principal(securityContext), id, request);
    return Response.noContent().build();
  }

  @GET
  @Path("/{id}/sessions")
  public List<SessionResponse> sessions(@PathParam("id") final String id) {
    return gateway.userSessions(id);
  }

  /**
   * Ends all of the user's identity-provider sessions.
   *
   * @param securityContext the security context
   * @param id              the user id
   * @return 204
   */
  @POST
  @Path("/{id}/logout")
  public Response logout(@Context final SecurityContext securityContext, @PathParam("id") final String id) {
    gateway.logoutUser(PortalRoles.principal(securityContext), id);
    return Response.noContent().build();
  }

  @GET
  @Path("/{id}/groups")
  public List<GroupResponse> groups(@PathParam("id") final String id) {
    return gateway.userGroups(id);
  }

  @PUT
  @Path("/{id}/groups/{groupId}")
  public Response addToGroup(@Context final SecurityContext securityContext,
                             @PathParam("id") final String id,
                             @PathParam("groupId") final String groupId) {
    gateway.addUserToGroup(PortalRoles.principal(securityContext), id, groupId);
    return Response.noContent().build();
  }

  @DELETE
  @Path("/{id}/groups/{groupId}")
  public Response removeFromGroup(@Context final SecurityContext securityContext,
                                  @PathParam("id") final String id,
                                  @PathParam("groupId") final String groupId) {
    gateway.removeUserFromGroup(PortalRoles.principal(securityContext), id, groupId);
    return Response.noContent().build();
  }
}
