package com.codeheadsystems.portal.server.exception;

import com.codeheadsystems.portal.model.ErrorResponse;
import com.codeheadsystems.portal.server.filter.RequestIdFilter;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Builds the JSON error responses shared by the exception mappers and the auth layer.
 */
public final class ErrorResponses {

  /** Seconds a client should wait before retrying after an upstream outage. */
  public static final int RETRY_AFTER_SECONDS = 30;

  private ErrorResponses() {
  }

  /**
   * Response for the given code and message.
   *
   * @param code    the code
   * @param message the message
   * @return the response
   */
  public static Response of(final ErrorCode code, final String message) {
    return of(code.status(), code.name(), message, code.retryable());
  }

  /**
   * Response with an explicit status, used for errors raised by the container itself.
   *
   * @param status    the HTTP status
   * @param code      the code name
   * @param message   the message
   * @param retryable whether to add {@code Retry-After}
   * @return the response
   */
  public static Response of(final int status, final String code, final String message,
                            final boolean retryable) {
    Response.ResponseBuilder builder = Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(code, message, RequestIdFilter.currentRequestId()));
    if (retryable) {
      builder.header("Retry-After", RETRY_AFTER_SECONDS);
    }
    return builder.build();
  }
}
