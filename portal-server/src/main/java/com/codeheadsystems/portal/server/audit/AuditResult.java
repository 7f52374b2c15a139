package com.codeheadsystems.portal.server.audit;

/**
 * Outcome of an audited action.
 */
public enum AuditResult {
  SUCCESS,
  FAILURE,
  DENIED
}
