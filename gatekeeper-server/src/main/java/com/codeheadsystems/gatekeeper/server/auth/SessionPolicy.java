package com.codeheadsystems.gatekeeper.server.auth;

import java.time.Duration;

/**
 * Tunables for issued sessions.
 *
 * @param issuer               value of the {@code iss} claim
 * @param ttl                  lifetime of an issued token
 * @param requireActiveSession when true a token is only accepted while its session row is live,
 *                             so logout revokes tokens issued before it
 */
public record SessionPolicy(String issuer, Duration ttl, boolean requireActiveSession) {

  /**
   * Default issuer.
   */
  public static final String DEFAULT_ISSUER = "gatekeeper";

  /**
   * Default token lifetime.
   */
  public static final Duration DEFAULT_TTL = Duration.ofHours(24);

  /**
   * Longest accepted token lifetime.
   */
  public static final Duration MAX_TTL = Duration.ofDays(3650);

  public SessionPolicy {
    if (issuer == null || issuer.isBlank()) {
      throw new IllegalArgumentException("Issuer must not be blank");
    }
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("Session TTL must be positive");
    }
    if (ttl.compareTo(MAX_TTL) > 0) {
      throw new IllegalArgumentException("Session TTL must not exceed " + MAX_TTL.toDays() + " days");
    }
  }

  /**
   * The defaults: {@value #DEFAULT_ISSUER} issuer, 24 hour tokens, logout revokes.
   *
   * @return the session policy
   */
  public static SessionPolicy defaults() {
    return new SessionPolicy(DEFAULT_ISSUER, DEFAULT_TTL, true);
  }
}
