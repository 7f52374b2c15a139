package com.codeheadsystems.portal.server.resource;

import com.codeheadsystems.portal.model.ssh.SshCaPublicKeyResponse;
import com.codeheadsystems.portal.model.ssh.SshRoleResponse;
import com.codeheadsystems.portal.model.ssh.SshRolesResponse;
import com.codeheadsystems.portal.model.ssh.SshSignRequest;
import com.codeheadsystems.portal.model.ssh.SshSignResponse;
import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import com.codeheadsystems.portal.server.auth.PortalRoles;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import com.codeheadsystems.portal.server.filter.RequestIdFilter;
import com.codeheadsystems.portal.server.role.Role;
import com.codeheadsystems.portal.server.ssh.SigningRequest;
import com.codeheadsystems.portal.server.ssh.SshCertificateIssuer;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.SecurityContext;
import java.time.Clock;
import java.util.List;

/**
 * JAX-RS resource for SSH certificates.
 */
@Path("/api/v1/ssh")
@Produces(MediaType.APPLICATION_JSON)
public class SshResource {

  private final SshCertificateIssuer issuer;
  private final Clock clock;

  /**
   * Instantiates a new Ssh resource.
   *
   * @param issuer the issuer
   * @param clock  the clock
   */
  public SshResource(final SshCertificateIssuer issuer, final Clock clock) {
    this.issuer = issuer;
    this.clock = clock;
  }

  /**
   * Signs the caller's public key.
   *
   * @param securityContext the security context
   * @param request         the request
   * @return the certificate
   */
  @POST
  @Path("/sign")
  @PermitAll
  @Consumes(MediaType.APPLICATION_JSON)
  public SshSignResponse sign(@Context final SecurityContext securityContext, final SshSignRequest request) {
    PortalPrincipal principal = PortalRoles.principal(securityContext);
    if (request == null) {
      throw new PortalException(ErrorCode.INVALID_REQUEST, "request body is required");
    }
    SigningRequest signingRequest = SigningRequest.from(request, principal, clock.instant(),
        RequestIdFilter.currentRequestId());
    return issuer.issue(signingRequest).toResponse();
  }

  /**
   * Roles the caller may sign under.
   *
   * @param securityContext the security context
   * @return the roles
   */
  @GET
  @Path("/roles")
  @PermitAll
  public SshRolesResponse roles(@Context final SecurityContext securityContext) {
    List<Role> roles = issuer.eligibleRoles(PortalRoles.principal(securityContext));
    List<SshRoleResponse> entries = roles.stream()
        .map(role -> new SshRoleResponse(role.name(), role.maxTtl().toSeconds(), role.principals()))
        .toList();
    return new SshRolesResponse(roles.get(0).name(), entries);
  }

  /**
   * The CA public key; needs no authentication.
   *
   * @return the key
   */
  @GET
  @Path("/ca-public-key")
  public SshCaPublicKeyResponse caPublicKey() {
    return new SshCaPublicKeyResponse(issuer.caPublicKey());
  }
}
