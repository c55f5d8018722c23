package com.codeheadsystems.gatekeeper.server.auth;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The process-wide HMAC key used to sign and verify bearer tokens.
 * <p>
 * Immutable: the bytes are copied in and out. {@link #toString()} never reveals the key, so
 * the secret is safe to pass through code that logs its arguments.
 */
public final class SigningSecret {

  private final byte[] key;

  private SigningSecret(byte[] key) {
    this.key = key;
  }

  /**
   * Wraps raw key bytes.
   *
   * @param key the key bytes, not empty
   * @return the signing secret
   */
  public static SigningSecret of(byte[] key) {
    if (key == null || key.length == 0) {
      throw new IllegalArgumentException("Signing secret must not be empty");
    }
    return new SigningSecret(key.clone());
  }

  /**
   * Uses the UTF-8 bytes of a configured string as the key.
   *
   * @param secret the secret string, not empty
   * @return the signing secret
   */
  public static SigningSecret fromString(String secret) {
    if (secret == null || secret.isEmpty()) {
      throw new IllegalArgumentException("Signing secret must not be empty");
    }
    return new SigningSecret(secret.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Copy of the key bytes.
   *
   * @return the bytes
   */
  public byte[] bytes() {
    return key.clone();
  }

  /**
   * Length of the key in bytes.
   *
   * @return the length
   */
  public int length() {
    return key.length;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SigningSecret other && Arrays.equals(key, other.key);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(key);
  }

  @Override
  public String toString() {
    return "SigningSecret[<redacted>]";
  }
}
