package com.codeheadsystems.portal.server.resource;

import com.codeheadsystems.portal.model.self.ProfileResponse;
import com.codeheadsystems.portal.model.ssh.RegisteredSshKeyResponse;
import com.codeheadsystems.portal.model.ssh.SshPublicKeyRequest;
import com.codeheadsystems.portal.server.auth.PortalRoles;
import com.codeheadsystems.portal.server.directory.SelfProfileReader;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import com.codeheadsystems.portal.server.ssh.SshKeyRegistry;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;

/**
 * JAX-RS resource for the caller's own account. Any authenticated caller.
 */
@Path("/api/v1/self")
@Produces(MediaType.APPLICATION_JSON)
@PermitAll
public class SelfResource {

  private final SelfProfileReader profileReader;
  private final SshKeyRegistry keyRegistry;

  /**
   * Instantiates a new Self resource.
   *
   * @param profileReader the profile reader
   * @param keyRegistry   the registered SSH keys
   */
  public SelfResource(final SelfProfileReader profileReader, final SshKeyRegistry keyRegistry) {
    this.profileReader = profileReader;
    this.keyRegistry = keyRegistry;
  }

  @GET
  @Path("/profile")
  public ProfileResponse profile(@Context final SecurityContext securityContext) {
    return profileReader.profile(PortalRoles.principal(securityContext));
  }

  @GET
  @Path("/ssh-key")
  public RegisteredSshKeyResponse sshKey(@Context final SecurityContext securityContext) {
    return keyRegistry.registeredKey(PortalRoles.principal(securityContext));
  }

  /**
   * Registers the caller's SSH public key. Later certificates are only issued for this key.
   *
   * @param securityContext the security context
   * @param request         the request
   * @return the registered key
   */
  @PUT
  @Path("/ssh-key")
  @Consumes(MediaType.APPLICATION_JSON)
  public RegisteredSshKeyResponse registerSshKey(@Context final SecurityContext securityContext,
                                                 final SshPublicKeyRequest request) {
    if (request == null) {
      throw new PortalException(ErrorCode.INVALID_REQUEST, "request body is required");
    }
    return keyRegistry.register(PortalRoles.principal(securityContext), request.publicKey());
  }

  @DELETE
  @Path("/ssh-key")
  public Response removeSshKey(@Context final SecurityContext securityContext) {
    keyRegistry.remove(PortalRoles.principal(securityContext));
    return Response.noContent().build();
  }
}
