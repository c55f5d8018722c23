package com.codeheadsystems.gatekeeper.server.model;

import java.time.Instant;

/**
 * One issued login credential and its usage bookkeeping.
 * <p>
 * {@code expiresAt} is always the {@code exp} claim of {@code token}. The token itself is
 * derivable from the claims and the signing secret, so stores drop it; it is only populated
 * on the instance returned from {@code SessionManager.issue}.
 *
 * @param metadata    store bookkeeping, {@code null} until the session has been stored
 * @param userId      owning user
 * @param tokenId     the token's {@code jti} claim, used to find this row from a bearer token
 * @param token       the signed bearer token, or {@code null} when loaded from a store
 * @param expiresAt   absolute expiry
 * @param lastUsedAt  last recorded use
 * @param lastUsedIp  client address of the last recorded use
 * @param lastUsedLoc user agent of the last recorded use
 */
public record Session(
    RecordMetadata metadata,
    long userId,
    String tokenId,
    String token,
    Instant expiresAt,
    Instant lastUsedAt,
    String lastUsedIp,
    String lastUsedLoc) {

  /**
   * The session identifier.
   *
   * @return the id
   * @throws IllegalStateException if the session has not been stored yet
   */
  public long id() {
    if (metadata == null) {
      throw new IllegalStateException("Session has not been stored");
    }
    return metadata.id();
  }

  public Session withMetadata(RecordMetadata metadata) {
    return new Session(metadata, userId, tokenId, token, expiresAt, lastUsedAt, lastUsedIp, lastUsedLoc);
  }

  public Session withToken(String token) {
    return new Session(metadata, userId, tokenId, token, expiresAt, lastUsedAt, lastUsedIp, lastUsedLoc);
  }

  /**
   * Copy with refreshed last-use tracking.
   *
   * @param at        when the session was used
   * @param clientIp  the client address
   * @param userAgent the client user agent
   * @return the session
   */
  public Session withLastUse(Instant at, String clientIp, String userAgent) {
    return new Session(metadata, userId, tokenId, token, expiresAt, at, clientIp, userAgent);
  }

  @Override
  public String toString() {
    return "Session[id=" + (metadata == null ? "unsaved" : metadata.id())
        + ", userId=" + userId + ", tokenId=" + tokenId + ", expiresAt=" + expiresAt + "]";
  }
}
