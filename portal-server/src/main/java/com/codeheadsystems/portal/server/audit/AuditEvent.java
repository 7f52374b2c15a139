package com.codeheadsystems.portal.server.audit;

import com.codeheadsystems.portal.server.filter.RequestIdFilter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One append-only audit record.
 *
 * @param actor     who acted, usually a username
 * @param action    what was done
 * @param target    what it was done to
 * @param timestamp when
 * @param result    the outcome
 * @param requestId the request the action belongs to
 * @param detail    free-form detail, never secrets
 */
public record AuditEvent(String actor,
                         AuditAction action,
                         String target,
                         Instant timestamp,
                         AuditResult result,
                         String requestId,
                         String detail) {

  /**
   * Validates required fields.
   */
  public AuditEvent {
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(result, "result");
    actor = actor == null ? "anonymous" : actor;
  }

  /**
   * Event for the request running on this thread.
   *
   * @param actor     the actor
   * @param action    the action
   * @param target    the target
   * @param timestamp the timestamp
   * @param result    the result
   * @param detail    the detail
   * @return the event
   */
  public static AuditEvent of(final String actor, final AuditAction action, final String target,
                              final Instant timestamp, final AuditResult result, final String detail) {
    return new AuditEvent(actor, action, target, timestamp, result, RequestIdFilter.currentRequestId(), detail);
  }

  /**
   * The event as an ordered field map, the shape every sink writes.
   *
   * @return the fields
   */
  public Map<String, Object> fields() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("timestamp", timestamp.toString());
    fields.put("actor", actor);
    fields.put("action", action.name());
    fields.put("target", target);
    fields.put("result", result.name());
    fields.put("requestId", requestId);
    fields.put("detail", detail);
    return fields;
  }
}
