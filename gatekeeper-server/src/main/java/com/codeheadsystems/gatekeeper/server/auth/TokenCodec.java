package com.codeheadsystems.gatekeeper.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTCreationException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes and decodes HMAC-SHA256 signed bearer tokens.
 * <p>
 * Pure apart from the clock: no storage, no shared mutable state. Verification is pinned to
 * HS256, so tokens whose header names any other algorithm (including {@code none}) are
 * rejected before their signature is looked at.
 * <p>
 * JWT timestamps have second precision, so the issue instant is truncated to the second
 * before anything is derived from it; the {@code expiresAt} handed back to the caller is
 * therefore identical to the {@code exp} claim.
 */
public class TokenCodec {

  private static final Logger log = LoggerFactory.getLogger(TokenCodec.class);

  /**
   * Name of the custom claim holding the owning user's id.
   */
  public static final String USER_ID_CLAIM = "user_id";

  private final String issuer;
  private final Clock clock;

  /**
   * Instantiates a new Token codec.
   *
   * @param issuer value of the {@code iss} claim written and required
   * @param clock  source of "now" for issuing and for expiry checks
   */
  public TokenCodec(String issuer, Clock clock) {
    this.issuer = issuer;
    this.clock = clock;
  }

  /**
   * Signs a token for {@code userId} valid from now for {@code ttl}.
   *
   * @param userId the owning user
   * @param secret the signing secret
   * @param ttl    time to live, positive
   * @return the encoded token
   * @throws IllegalArgumentException if {@code ttl} is not positive
   * @throws IllegalStateException    if signing fails
   */
  public EncodedToken encode(long userId, SigningSecret secret, Duration ttl) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("Token TTL must be positive");
    }
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plus(ttl).truncatedTo(ChronoUnit.SECONDS);
    String tokenId = UUID.randomUUID().toString();
    try {
      String token = JWT.create()
          .withIssuer(issuer)
          .withJWTId(tokenId)
          .withClaim(USER_ID_CLAIM, userId)
          .withIssuedAt(now)
          .withNotBefore(now)
          .withExpiresAt(expiresAt)
          .sign(Algorithm.HMAC256(secret.bytes()));
      return new EncodedToken(token, tokenId, now, expiresAt);
    } catch (JWTCreationException e) {
      throw new IllegalStateException("Failed to sign token", e);
    }
  }

  /**
   * Verifies a token's signature, algorithm, issuer and validity window.
   *
   * @param token  the compact token string
   * @param secret the signing secret
   * @return the claims, {@link TokenFailure#EXPIRED_TOKEN} for a correctly signed token past its
   *     expiry, or {@link TokenFailure#INVALID_TOKEN} for anything else
   */
  public TokenVerification decode(String token, SigningSecret secret) {
    if (token == null || token.isBlank()) {
      return TokenVerification.invalid();
    }
    DecodedJWT decoded;
    try {
      decoded = verifier(secret).verify(token);
    } catch (TokenExpiredException e) {
      log.debug("Token expired at {}", e.getExpiredOn());
      return TokenVerification.expired();
    } catch (JWTVerificationException e) {
      log.debug("Token verification failed: {}", e.getMessage());
      return TokenVerification.invalid();
    }

    Instant expiresAt = decoded.getExpiresAtAsInstant();
    if (expiresAt == null) {
      log.debug("Token has no exp claim");
      return TokenVerification.invalid();
    }
    // The library accepts now == exp; an expiry instant is exclusive here.
    if (!clock.instant().isBefore(expiresAt)) {
      return TokenVerification.expired();
    }
    Long userId = decoded.getClaim(USER_ID_CLAIM).asLong();
    if (userId == null || userId <= 0) {
      log.debug("Token has no usable {} claim", USER_ID_CLAIM);
      return TokenVerification.invalid();
    }
    if (decoded.getId() == null) {
      log.debug("Token has no jti claim");
      return TokenVerification.invalid();
    }
    return TokenVerification.valid(new TokenClaims(userId, decoded.getId(),
        decoded.getIssuedAtAsInstant(), decoded.getNotBeforeAsInstant(), expiresAt));
  }

  private JWTVerifier verifier(SigningSecret secret) {
    JWTVerifier.BaseVerification verification = (JWTVerifier.BaseVerification)
        JWT.require(Algorithm.HMAC256(secret.bytes())).withIssuer(issuer);
    return verification.build(clock);
  }
}
