package com.codeheadsystems.portal.server.audit;

import com.codahale.metrics.MetricRegistry;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events to every configured sink and keeps the portal's business counters.
 * <p>
 * {@link #append(AuditEvent)} is for mutations and issuance: it returns only once every sink has
 * the event, and fails with {@link ErrorCode#AUDIT_WRITE_FAILED} otherwise.
 * {@link #appendBestEffort(AuditEvent)} is for events whose loss must not change the response.
 */
@Singleton
public class AuditEmitter {

  private static final Logger log = LoggerFactory.getLogger(AuditEmitter.class);

  private final List<AuditSink> sinks;
  private final MetricRegistry metricRegistry;

  /**
   * Instantiates a new Audit emitter.
   *
   * @param sinks          the sinks, written in order
   * @param metricRegistry the metric registry
   */
  @Inject
  public AuditEmitter(final List<AuditSink> sinks, final MetricRegistry metricRegistry) {
    this.sinks = List.copyOf(sinks);
    this.metricRegistry = metricRegistry;
  }

  /**
   * Writes the event to every sink.
   *
   * @param event the event
   * @throws PortalException {@link ErrorCode#AUDIT_WRITE_FAILED} when a sink fails
   */
  public void append(final AuditEvent event) {
    for (AuditSink sink : sinks) {
      try {
        sink.write(event);
      } catch (IOException | RuntimeException e) {
        metricRegistry.counter(MetricRegistry.name("portal", "audit", "write-failures")).inc();
        log.error("Audit write to {} failed for {} {} by {}", sink, event.action(), event.target(), event.actor(), e);
        throw new PortalException(ErrorCode.AUDIT_WRITE_FAILED, "audit record could not be written", e);
      }
    }
    metricRegistry.counter(MetricRegistry.name("portal", "audit", "events", event.action().name().toLowerCase(Locale.ROOT))).inc();
  }

  /**
   * Writes the event, logging rather than propagating a failure.
   *
   * @param event the event
   * @return true when every sink accepted it
   */
  public boolean appendBestEffort(final AuditEvent event) {
    try {
      append(event);
      return true;
    } catch (PortalException e) {
      log.warn("Best-effort audit of {} dropped", event.action());
      return false;
    }
  }

  // ── Counters ──────────────────────────────────────────────────────────────

  /**
   * Counts an issued certificate.
   *
   * @param roleName the role
   */
  public void certificateIssued(final String roleName) {
    metricRegistry.counter(MetricRegistry.name("portal", "ssh", "certificates-issued", roleName)).inc();
  }

  /**
   * Counts a generated kubeconfig.
   */
  public void kubeconfigIssued() {
    metricRegistry.counter(MetricRegistry.name("portal", "kubeconfig", "issued")).inc();
  }

  /**
   * Counts a rejected bearer token.
   *
   * @param code why it was rejected
   */
  public void authenticationFailed(final ErrorCode code) {
    metricRegistry.counter(MetricRegistry.name("portal", "auth", "failures", code.name().toLowerCase(Locale.ROOT))).inc();
  }
}
