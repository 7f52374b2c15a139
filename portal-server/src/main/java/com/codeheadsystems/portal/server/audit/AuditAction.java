package com.codeheadsystems.portal.server.audit;

/**
 * What an audit event records.
 */
public enum AuditAction {
  LOGIN,
  LOGOUT,
  TOKEN_REJECTED,
  SSH_CERTIFICATE_ISSUED,
  KUBECONFIG_ISSUED,
  USER_CREATED,
  USER_UPDATED,
  USER_DELETED,
  USER_PASSWORD_RESET,
  USER_LOGGED_OUT,
  GROUP_CREATED,
  GROUP_UPDATED,
  GROUP_DELETED,
  GROUP_MEMBER_ADDED,
  GROUP_MEMBER_REMOVED,
  SSH_KEY_REGISTERED,
  SSH_KEY_REMOVED
}
