package com.codeheadsystems.portal.server.resource;

import com.codeheadsystems.portal.model.directory.CreatedResponse;
import com.codeheadsystems.portal.model.directory.GroupRequest;
import com.codeheadsystems.portal.model.directory.GroupResponse;
import com.codeheadsystems.portal.server.auth.PortalRoles;
import com.codeheadsystems.portal.server.directory.DirectoryAdminGateway;
import jakarta.annotation.security.RolesAllowed;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.net.URI;
import java.util.List;

/**
 * JAX-RS resource for directory groups. Administrators only.
 */
@Path("/api/v1/groups")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed(PortalRoles.ADMIN)
public class GroupResource {

  private final DirectoryAdminGateway gateway;

  public GroupResource(final DirectoryAdminGateway gateway) {
    this.gateway = gateway;
  }

  @GET
  public List<GroupResponse> list() {
    return gateway.listGroups();
  }

  /**
   * Creates a group.
   *
   * @param securityContext the security context
   * @param request         the request
   * @return 201 with the new id
   */
  @POST
  public Response create(@Context final SecurityContext securityContext, final GroupRequest request) {
    String id = gateway.createGroup(PortalRoles.principal(securityContext), request);
    return Response.created(URI.create("/api/v1/groups/" + id)).entity(new CreatedResponse(id)).build();
  }

  @GET
  @Path("/{id}")
  public GroupResponse get(@PathParam("id") final String id) {
    return gateway.getGroup(id);
  }

  @PUT
  @Path("/{id}")
  public Response update(@Context final SecurityContext securityContext,
                         @PathParam("id") final String id,
                         final GroupRequest request) {
    gateway.updateGroup(PortalRoles.principal(securityContext), id, request);
    return Response.noContent().build();
  }

  @DELETE
  @Path("/{id}")
  public Response delete(@Context final SecurityContext securityContext, @PathParam("id") final String id) {
    gateway.deleteGroup(PortalRoles.principal(securityContext), id);
    return Response.noContent().build();
  }
}
