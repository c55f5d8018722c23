package com.codeheadsystems.gatekeeper.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.gatekeeper.server.auth.EncodedToken;
import com.codeheadsystems.gatekeeper.server.auth.SigningSecret;
import com.codeheadsystems.gatekeeper.server.auth.TokenCodec;
import com.codeheadsystems.gatekeeper.server.auth.TokenVerification;
import java.time.Duration;

/**
 * Health check that signs a probe token with the configured secret and verifies it again.
 */
public class TokenCodecHealthCheck extends HealthCheck {

  private static final long PROBE_USER_ID = Long.MAX_VALUE;
  private static final Duration PROBE_TTL = Duration.ofMinutes(1);

  private final TokenCodec codec;
  private final SigningSecret secret;

  /**
   * Instantiates a new Token codec health check.
   *
   * @param codec  the codec
   * @param secret the secret
   */
  public TokenCodecHealthCheck(TokenCodec codec, SigningSecret secret) {
    this.codec = codec;
    this.secret = secret;
  }

  @Override
  protected Result check() {
    EncodedToken probe = codec.encode(PROBE_USER_ID, secret, PROBE_TTL);
    TokenVerification verification = codec.decode(probe.token(), secret);
    if (!verification.isValid()) {
      return Result.unhealthy("Probe token failed verification: %s", verification.failure());
    }
    if (verification.claims().userId() != PROBE_USER_ID) {
      return Result.unhealthy("Probe token decoded to the wrong user");
    }
    return Result.healthy("secret length=%d", secret.length());
  }
}
