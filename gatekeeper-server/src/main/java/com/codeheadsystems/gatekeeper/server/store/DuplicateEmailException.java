package com.codeheadsystems.gatekeeper.server.store;

/**
 * Thrown by a {@link UserStore} when an email is already registered.
 */
public class DuplicateEmailException extends RuntimeException {

  /**
   * Instantiates a new Duplicate email exception.
   *
   * @param message the message
   */
  public DuplicateEmailException(final String message) {
    super(message);
  }
}
