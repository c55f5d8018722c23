package com.codeheadsystems.gatekeeper.server.auth;

import java.time.Instant;

/**
 * Claims carried inside a verified bearer token.
 *
 * @param userId    owning user, from the {@code user_id} claim
 * @param tokenId   the {@code jti} claim; identifies the session row
 * @param issuedAt  the {@code iat} claim
 * @param notBefore the {@code nbf} claim
 * @param expiresAt the {@code exp} claim
 */
public record TokenClaims(long userId, String tokenId, Instant issuedAt, Instant notBefore,
                          Instant expiresAt) {
}
