package com.codeheadsystems.portal.server.exception;

/**
 * Failure taxonomy of the portal. Each code carries the HTTP status it is rendered with.
 */
public enum ErrorCode {

  /** Missing, expired, wrongly signed or wrongly addressed bearer token. */
  UNAUTHENTICATED(401),
  /** The bearer token is not a JWT or lacks a required claim. */
  MALFORMED_TOKEN(401),
  /** The caller is authenticated but may not do this. */
  FORBIDDEN(403),
  /** None of the caller's groups maps to a role. */
  NO_ELIGIBLE_ROLE(403),
  /** The submitted SSH public key is not the one the caller registered. */
  KEY_MISMATCH(403),
  /** The submitted SSH public key was rejected. */
  INVALID_PUBLIC_KEY(400),
  /** Malformed request body or parameter. */
  INVALID_REQUEST(400),
  /** A collaborator (identity provider, credential store) is unreachable or degraded. */
  UPSTREAM_UNAVAILABLE(503),
  /** The directory object already exists. */
  CONFLICT(409),
  /** The directory object does not exist. */
  NOT_FOUND(404),
  /** The operation happened but its audit record could not be written. */
  AUDIT_WRITE_FAILED(500),
  /** Anything else. */
  INTERNAL(500);

  private final int status;

  ErrorCode(final int status) {
    this.status = status;
  }

  /**
   * HTTP status for this code.
   *
   * @return the status
   */
  public int status() {
    return status;
  }

  /**
   * Whether the caller may usefully retry later.
   *
   * @return true for upstream outages
   */
  public boolean retryable() {
    return this == UPSTREAM_UNAVAILABLE;
  }
}
