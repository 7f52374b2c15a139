package com.codeheadsystems.portal.dropwizard.auth;

import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.ErrorResponses;
import io.dropwizard.auth.UnauthorizedHandler;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

/**
 * Renders a missing bearer token in the portal's JSON error shape.
 */
public class JsonUnauthorizedHandler implements UnauthorizedHandler {

  @Override
  public Response buildResponse(final String prefix, final String realm) {
    Response error = ErrorResponses.of(ErrorCode.UNAUTHENTICATED, "bearer token required");
    return Response.fromResponse(error)
        .header(HttpHeaders.WWW_AUTHENTICATE, String.format("%s realm=\"%s\"", prefix, realm))
        .build();
  }
}
