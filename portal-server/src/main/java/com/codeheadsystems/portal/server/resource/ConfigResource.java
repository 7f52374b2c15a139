package com.codeheadsystems.portal.server.resource;

import com.codeheadsystems.portal.model.PublicConfigResponse;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Public settings for the front end.
 */
@Path("/api/v1/config")
@Produces(MediaType.APPLICATION_JSON)
public class ConfigResource {

  private final PublicConfigResponse config;

  public ConfigResource(final PublicConfigResponse config) {
    this.config = config;
  }

  @GET
  public PublicConfigResponse config() {
    return config;
  }
}
