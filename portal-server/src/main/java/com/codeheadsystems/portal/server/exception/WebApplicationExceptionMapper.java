package com.codeheadsystems.portal.server.exception;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Locale;

/**
 * Gives the container's own errors (unknown route, wrong method, {@code @RolesAllowed} denial)
 * the same JSON shape as portal errors.
 */
@Provider
public class WebApplicationExceptionMapper implements ExceptionMapper<WebApplicationException> {

  @Override
  public Response toResponse(final WebApplicationException exception) {
    int status = exception.getResponse() == null ? 500 : exception.getResponse().getStatus();
    return ErrorResponses.of(status, codeFor(status), messageFor(status, exception), status == 503);
  }

  static String codeFor(final int status) {
    return switch (status) {
      case 400, 405, 406, 415 -> ErrorCode.INVALID_REQUEST.name();
      case 401 -> ErrorCode.UNAUTHENTICATED.name();
      case 403 -> ErrorCode.FORBIDDEN.name();
      case 404 -> ErrorCode.NOT_FOUND.name();
      case 409 -> ErrorCode.CONFLICT.name();
      case 503 -> ErrorCode.UPSTREAM_UNAVAILABLE.name();
      default -> status >= 500 ? ErrorCode.INTERNAL.name() : ErrorCode.INVALID_REQUEST.name();
    };
  }

  private static String messageFor(final int status, final WebApplicationException exception) {
    if (status >= 500) {
      return "internal error";
    }
    Response.StatusType type = Response.Status.fromStatusCode(status);
    return type == null ? exception.getMessage() : type.getReasonPhrase().toLowerCase(Locale.ROOT);
  }
}
