package com.codeheadsystems.portal.server.testing;

import com.codeheadsystems.portal.server.audit.AuditEvent;
import com.codeheadsystems.portal.server.audit.AuditSink;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps audit events in memory; can be made to fail.
 */
public class InMemoryAuditSink implements AuditSink {

  private final List<AuditEvent> events = new CopyOnWriteArrayList<>();
  private volatile boolean failing;

  @Override
  public void write(final AuditEvent event) throws IOException {
    if (failing) {
      throw new IOException("audit disk full");
    }
    events.add(event);
  }

  public List<AuditEvent> events() {
    return events;
  }

  public void setFailing(final boolean failing) {
    this.failing = failing;
  }

  public void clear() {
    events.clear();
  }
}
