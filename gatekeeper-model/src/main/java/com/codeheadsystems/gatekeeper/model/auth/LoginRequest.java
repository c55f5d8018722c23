package com.codeheadsystems.gatekeeper.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a login attempt.
 * <p>
 * Shape checks are the same as for registration, so a request that could never have been
 * registered is rejected with HTTP 400 before any lookup.
 * <p>
 * Used by: {@code POST /auth/login}
 *
 * @param email    the account email
 * @param password the plaintext password
 */
public record LoginRequest(
    @JsonProperty("email") String email,
    @JsonProperty("password") String password) {

  /**
   * Validated email.
   *
   * @return the email
   * @throws IllegalArgumentException if the email is missing or not syntactically valid
   */
  public String validatedEmail() {
    return CredentialFields.email(email);
  }

  /**
   * Validated password.
   *
   * @return the password
   * @throws IllegalArgumentException if the password is missing or too short
   */
  public String validatedPassword() {
    return CredentialFields.password(password);
  }

  @Override
  public String toString() {
    return "LoginRequest[email=" + email + ", password=<redacted>]";
  }
}
