package com.codeheadsystems.portal.server.audit;

import java.io.IOException;

/**
 * Destination for audit events.
 */
public interface AuditSink {

  /**
   * Durably writes the event before returning.
   *
   * @param event the event
   * @throws IOException when the event could not be written
   */
  void write(AuditEvent event) throws IOException;
}
