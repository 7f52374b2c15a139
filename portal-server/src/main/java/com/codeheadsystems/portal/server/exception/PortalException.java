package com.codeheadsystems.portal.server.exception;

/**
 * The single exception type raised by portal components. The {@link ErrorCode} decides how it is
 * rendered; the message is returned to the caller, so it must not contain secrets.
 */
public class PortalException extends RuntimeException {

  private final ErrorCode code;

  /**
   * Instantiates a new Portal exception.
   *
   * @param code    the code
   * @param message the message
   */
  public PortalException(final ErrorCode code, final String message) {
    super(message);
    this.code = code;
  }

  /**
   * Instantiates a new Portal exception.
   *
   * @param code    the code
   * @param message the message
   * @param cause   the cause
   */
  public PortalException(final ErrorCode code, final String message, final Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  /**
   * Code error code.
   *
   * @return the error code
   */
  public ErrorCode code() {
    return code;
  }
}
