package com.codeheadsystems.gatekeeper.server.auth;

import java.time.Instant;

/**
 * A freshly signed bearer token plus the values the caller needs for bookkeeping.
 * <p>
 * {@code expiresAt} is the exact instant written into the {@code exp} claim.
 *
 * @param token     the compact {@code header.payload.signature} string
 * @param tokenId   the {@code jti} claim
 * @param issuedAt  the {@code iat} and {@code nbf} claims
 * @param expiresAt the {@code exp} claim
 */
public record EncodedToken(String token, String tokenId, Instant issuedAt, Instant expiresAt) {

  @Override
  public String toString() {
    return "EncodedToken[tokenId=" + tokenId + ", expiresAt=" + expiresAt + "]";
  }
}
