package com.codeheadsystems.portal.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codahale.metrics.health.HealthCheckRegistry;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Liveness and readiness on the application port, for orchestrators that cannot reach the admin
 * port. Needs no authentication.
 * <p>
 * Readiness runs every registered health check: 200 when all pass, 503 with the failing checks
 * marked {@code unavailable} otherwise.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class HealthResource {

  private static final Logger log = LoggerFactory.getLogger(HealthResource.class);

  private final HealthCheckRegistry healthChecks;

  public HealthResource(final HealthCheckRegistry healthChecks) {
    this.healthChecks = healthChecks;
  }

  @GET
  @Path("healthz")
  public Map<String, String> healthz() {
    return Map.of("status", "ok");
  }

  @GET
  @Path("readyz")
  public Response readyz() {
    Map<String, String> status = new LinkedHashMap<>();
    boolean ready = true;
    for (Map.Entry<String, HealthCheck.Result> entry : healthChecks.runHealthChecks().entrySet()) {
      if (entry.getValue().isHealthy()) {
        status.put(entry.getKey(), "ok");
      } else {
        ready = false;
        status.put(entry.getKey(), "unavailable");
        log.warn("Readiness check {} failed: {}", entry.getKey(), entry.getValue().getMessage());
      }
    }
    status.put("status", ready ? "ok" : "degraded");
    return Response.status(ready ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE)
        .entity(status)
        .build();
  }
}
