package com.codeheadsystems.gatekeeper.server.auth;

/**
 * Why the bearer gate turned a request away. Every reason maps to HTTP 401 with
 * {@link #message()} as the error body.
 */
public enum RejectReason {

  AUTH_HEADER_REQUIRED("Authorization header is required"),
  SCHEME_MISMATCH("Authorization header must start with 'Bearer'"),
  CREDENTIAL_REQUIRED("Token is required"),
  TOKEN_EXPIRED("Token has expired"),
  TOKEN_INVALID("Invalid token");

  private final String message;

  RejectReason(String message) {
    this.message = message;
  }

  /**
   * Client-facing message.
   *
   * @return the message
   */
  public String message() {
    return message;
  }
}
