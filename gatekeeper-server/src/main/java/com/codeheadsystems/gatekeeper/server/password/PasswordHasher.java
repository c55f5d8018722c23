package com.codeheadsystems.gatekeeper.server.password;

/**
 * One-way password hashing primitive.
 */
public interface PasswordHasher {

  /**
   * Hashes a plaintext password, salting it with fresh randomness.
   *
   * @param password the plaintext password
   * @return a self-describing hash string suitable for storage
   */
  String hash(String password);

  /**
   * Checks a plaintext password against a stored hash.
   *
   * @param password   the plaintext password
   * @param storedHash a value previously produced by {@link #hash(String)}
   * @return true if the password matches
   */
  boolean matches(String password, String storedHash);
}
