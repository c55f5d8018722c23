package com.codeheadsystems.gatekeeper.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for creating a new account.
 * <p>
 * The raw fields are kept as sent so that the request can be deserialized even when invalid;
 * callers go through {@link #validatedEmail()} and {@link #validatedPassword()}, which reject
 * a missing or malformed email and a password shorter than six characters.
 * <p>
 * Used by: {@code POST /auth/register}
 *
 * @param email    the account email, unique across users
 * @param password the plaintext password; hashed by the server before storage
 */
public record RegisterRequest(
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
    return "RegisterRequest[email=" + email + ", password=<redacted>]";
  }
}
