package com.codeheadsystems.portal.server.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request bodies that are not valid JSON for their type are {@code INVALID_REQUEST}.
 */
@Provider
public class JsonProcessingExceptionMapper implements ExceptionMapper<JsonProcessingException> {

  private static final Logger log = LoggerFactory.getLogger(JsonProcessingExceptionMapper.class);

  @Override
  public Response toResponse(final JsonProcessingException exception) {
    log.debug("Unreadable request body: {}", exception.getOriginalMessage());
    return ErrorResponses.of(ErrorCode.INVALID_REQUEST, "request body is not valid JSON");
  }
}
