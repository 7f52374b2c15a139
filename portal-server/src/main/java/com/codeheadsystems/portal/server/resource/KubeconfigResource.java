package com.codeheadsystems.portal.server.resource;

import com.codeheadsystems.portal.server.audit.AuditAction;
import com.codeheadsystems.portal.server.audit.AuditEmitter;
import com.codeheadsystems.portal.server.audit.AuditEvent;
import com.codeheadsystems.portal.server.audit.AuditResult;
import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import com.codeheadsystems.portal.server.auth.PortalRoles;
import com.codeheadsystems.portal.server.kubeconfig.ClusterSettings;
import com.codeheadsystems.portal.server.kubeconfig.KubeconfigBuilder;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.time.Clock;

/**
 * JAX-RS resource serving the caller's kubeconfig as a download.
 */
@Path("/api/v1/kubeconfig")
public class KubeconfigResource {

  private final ClusterSettings cluster;
  private final AuditEmitter auditEmitter;
  private final Clock clock;

  /**
   * Instantiates a new Kubeconfig resource.
   *
   * @param cluster      the cluster
   * @param auditEmitter the audit emitter
   * @param clock        the clock
   */
  public KubeconfigResource(final ClusterSettings cluster, final AuditEmitter auditEmitter, final Clock clock) {
    this.cluster = cluster;
    this.auditEmitter = auditEmitter;
    this.clock = clock;
  }

  /**
   * Renders the kubeconfig.
   *
   * @param securityContext the security context
   * @return the YAML, as an attachment
   */
  @GET
  @PermitAll
  @Produces(KubeconfigBuilder.MEDIA_TYPE)
  public Response kubeconfig(@Context final SecurityContext securityContext) {
    PortalPrincipal principal = PortalRoles.principal(securityContext);
    String yaml = KubeconfigBuilder.build(principal, cluster);
    auditEmitter.append(AuditEvent.of(principal.username(), AuditAction.KUBECONFIG_ISSUED, cluster.name(),
        clock.instant(), AuditResult.SUCCESS, null));
    auditEmitter.kubeconfigIssued();
    return Response.ok(yaml, KubeconfigBuilder.MEDIA_TYPE)
        .header("Content-Disposition", "attachment; filename=\"kubeconfig-" + cluster.name() + ".yaml\"")
        .build();
  }
}
