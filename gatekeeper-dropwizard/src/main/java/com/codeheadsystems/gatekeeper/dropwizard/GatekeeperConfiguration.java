package com.codeheadsystems.gatekeeper.dropwizard;

import com.codeheadsystems.gatekeeper.server.auth.SessionPolicy;
import com.codeheadsystems.gatekeeper.server.password.BCryptPasswordHasher;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for gatekeeper sessions.
 * <p>
 * {@code jwtSecret} has no default. Every token is signed with it, so changing it logs out
 * every user. Supply it from the environment, e.g. {@code jwtSecret: ${JWT_SECRET_KEY}}, and use
 * at least 32 random bytes: {@code openssl rand -base64 32}.
 */
public class GatekeeperConfiguration extends Configuration {

  /**
   * HMAC-SHA256 signing secret for bearer tokens. The UTF-8 bytes of the string are the key.
   */
  @NotEmpty
  private String jwtSecret;

  /**
   * JWT issuer claim, written on issue and required on verification.
   */
  @NotEmpty
  private String jwtIssuer = SessionPolicy.DEFAULT_ISSUER;

  /**
   * Session and token time-to-live in seconds, at most ten years.
   */
  @Min(1)
  @Max(315_360_000L)
  private long sessionTtlSeconds = SessionPolicy.DEFAULT_TTL.toSeconds();

  /**
   * When true a token is only accepted while its session exists, so logout revokes tokens.
   * When false tokens stay valid until they expire.
   */
  private boolean requireActiveSession = true;

  /**
   * bcrypt cost for stored passwords.
   */
  @Min(4)
  @Max(31)
  private int bcryptCost = BCryptPasswordHasher.DEFAULT_COST;

  /**
   * Gets jwt secret.
   *
   * @return the jwt secret
   */
  @JsonProperty
  public String getJwtSecret() {
    return jwtSecret;
  }

  /**
   * Sets jwt secret.
   *
   * @param jwtSecret the jwt secret
   */
  @JsonProperty
  public void setJwtSecret(String jwtSecret) {
    this.jwtSecret = jwtSecret;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets session ttl seconds.
   *
   * @return the session ttl seconds
   */
  @JsonProperty
  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  /**
   * Sets session ttl seconds.
   *
   * @param sessionTtlSeconds the session ttl seconds
   */
  @JsonProperty
  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  /**
   * Is require active session.
   *
   * @return true if logout revokes tokens
   */
  @JsonProperty
  public boolean isRequireActiveSession() {
    return requireActiveSession;
  }

  /**
   * Sets require active session.
   *
   * @param requireActiveSession the require active session
   */
  @JsonProperty
  public void setRequireActiveSession(boolean requireActiveSession) {
    this.requireActiveSession = requireActiveSession;
  }

  /**
   * Gets bcrypt cost.
   *
   * @return the bcrypt cost
   */
  @JsonProperty
  public int getBcryptCost() {
    return bcryptCost;
  }

  /**
   * Sets bcrypt cost.
   *
   * @param bcryptCost the bcrypt cost
   */
  @JsonProperty
  public void setBcryptCost(int bcryptCost) {
    this.bcryptCost = bcryptCost;
  }
}
