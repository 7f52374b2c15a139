package com.codeheadsystems.portal.server.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each event as one JSON object to the {@code audit} logger, so the logging configuration
 * decides where audit lines go.
 */
public class Slf4jAuditSink implements AuditSink {

  /** Name of the dedicated audit logger. */
  public static final String LOGGER_NAME = "audit";

  private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Slf4j audit sink.
   *
   * @param objectMapper the object mapper
   */
  public Slf4jAuditSink(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void write(final AuditEvent event) throws IOException {
    audit.info(objectMapper.writeValueAsString(event.fields()));
  }
}
