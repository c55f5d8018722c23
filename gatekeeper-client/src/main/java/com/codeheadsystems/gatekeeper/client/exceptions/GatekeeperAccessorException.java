package com.codeheadsystems.gatekeeper.client.exceptions;

/**
 * Raised when a gatekeeper server call fails for a reason other than an authentication rejection.
 */
public class GatekeeperAccessorException extends RuntimeException {

  /**
   * Status code used when no HTTP response was received.
   */
  public static final int NO_STATUS = -1;

  private final int statusCode;

  /**
   * Instantiates a new Gatekeeper accessor exception for a transport failure.
   *
   * @param message the message
   * @param cause   the cause
   */
  public GatekeeperAccessorException(final String message, final Throwable cause) {
    this(message, NO_STATUS, cause);
  }

  /**
   * Instantiates a new Gatekeeper accessor exception.
   *
   * @param message    the message
   * @param statusCode the HTTP status, or {@link #NO_STATUS}
   * @param cause      the cause
   */
  public GatekeeperAccessorException(final String message, final int statusCode, final Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /**
   * Gets status code.
   *
   * @return the HTTP status, or {@link #NO_STATUS}
   */
  public int getStatusCode() {
    return statusCode;
  }
}
