package com.codeheadsystems.portal.server.exception;

import com.codeheadsystems.portal.server.filter.RequestIdFilter;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last line of defence: any other runtime failure becomes {@code INTERNAL}, with the stack trace
 * logged against the request id and never returned to the caller.
 */
@Provider
public class UnexpectedExceptionMapper implements ExceptionMapper<RuntimeException> {

  private static final Logger log = LoggerFactory.getLogger(UnexpectedExceptionMapper.class);

  @Override
  public Response toResponse(final RuntimeException exception) {
    log.error("Unhandled failure for request {}", RequestIdFilter.currentRequestId(), exception);
    return ErrorResponses.of(ErrorCode.INTERNAL, "internal error");
  }
}
