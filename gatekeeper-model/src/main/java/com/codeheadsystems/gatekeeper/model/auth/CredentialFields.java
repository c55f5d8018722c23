package com.codeheadsystems.gatekeeper.model.auth;

import java.util.regex.Pattern;

/**
 * Field checks shared by the register and login requests.
 * <p>
 * Failures are reported as {@link IllegalArgumentException} so that server adapters can map
 * them to HTTP 400 without inspecting the message.
 */
final class CredentialFields {

  /**
   * Minimum password length, in code points, accepted at registration and login.
   */
  static final int MIN_PASSWORD_LENGTH = 6;

  // local@domain.tld, no whitespace, exactly one '@', no empty domain labels.
  private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s.]+(\\.[^@\\s.]+)+$");

  private CredentialFields() {
  }

  static String email(String email) {
    if (email == null || email.isBlank()) {
      throw new IllegalArgumentException("Missing required field: email");
    }
    if (!EMAIL.matcher(email).matches()) {
      throw new IllegalArgumentException("Invalid email address");
    }
    return email;
  }

  static String password(String password) {
    if (password == null || password.isEmpty()) {
      throw new IllegalArgumentException("Missing required field: password");
    }
    if (password.codePointCount(0, password.length()) < MIN_PASSWORD_LENGTH) {
      throw new IllegalArgumentException(
          "Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
    }
    return password;
  }
}
