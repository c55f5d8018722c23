package com.codeheadsystems.gatekeeper.server.auth;

import java.util.Optional;

/**
 * Outcome of decoding a bearer token: either claims or a {@link TokenFailure}, never both.
 *
 * @param claims  the verified claims, {@code null} on failure
 * @param failure the failure, {@code null} on success
 */
public record TokenVerification(TokenClaims claims, TokenFailure failure) {

  private static final TokenVerification EXPIRED = new TokenVerification(null, TokenFailure.EXPIRED_TOKEN);
  private static final TokenVerification INVALID = new TokenVerification(null, TokenFailure.INVALID_TOKEN);

  public TokenVerification {
    if ((claims == null) == (failure == null)) {
      throw new IllegalArgumentException("Exactly one of claims and failure must be set");
    }
  }

  public static TokenVerification valid(TokenClaims claims) {
    return new TokenVerification(claims, null);
  }

  public static TokenVerification expired() {
    return EXPIRED;
  }

  public static TokenVerification invalid() {
    return INVALID;
  }

  public boolean isValid() {
    return claims != null;
  }

  /**
   * The verified user id.
   *
   * @return the user id, or empty on failure
   */
  public Optional<Long> userId() {
    return Optional.ofNullable(claims).map(TokenClaims::userId);
  }
}
