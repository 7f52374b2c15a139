package com.codeheadsystems.portal.server.exception;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders {@link PortalException} as {@code {"code","error","requestId"}}.
 */
@Provider
public class PortalExceptionMapper implements ExceptionMapper<PortalException> {

  private static final Logger log = LoggerFactory.getLogger(PortalExceptionMapper.class);

  @Override
  public Response toResponse(final PortalException exception) {
    ErrorCode code = exception.code();
    if (code.status() >= 500) {
      log.warn("{}: {}", code, exception.getMessage(), exception);
    } else {
      log.debug("{}: {}", code, exception.getMessage());
    }
    return ErrorResponses.of(code, exception.getMessage());
  }
}
