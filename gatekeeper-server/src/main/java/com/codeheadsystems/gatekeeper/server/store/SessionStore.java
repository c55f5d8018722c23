package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.Session;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for issued login sessions.
 * <p>
 * Implementations must be thread-safe. Typical production implementations back this with a
 * {@code sessions} table (id, user_id, token_id, expires_at, last_used_at, last_used_ip,
 * last_used_loc, timestamps, deleted_at); the bearer token string is never persisted.
 * <p>
 * <strong>Logout contract:</strong> {@link #deleteByUserId(long)} removes <em>every</em>
 * live session of the user, not only the one presented on the logout request. Deleted
 * sessions must no longer be returned by {@link #findByTokenId(String)} so that the gate can
 * reject tokens issued before the logout.
 */
public interface SessionStore {

  /**
   * Stores a new session and assigns its metadata.
   *
   * @param session the session to store; its metadata is ignored
   * @return the stored session with metadata assigned and the token of the argument preserved
   */
  Session create(Session session);

  /**
   * Loads a live session by the token id carried in the bearer token's {@code jti} claim.
   *
   * @param tokenId the token id
   * @return the session, or empty if unknown or deleted
   */
  Optional<Session> findByTokenId(String tokenId);

  /**
   * Lists the live sessions of a user.
   *
   * @param userId the owning user
   * @return the sessions, possibly empty
   */
  List<Session> findByUserId(long userId);

  /**
   * Records a use of a live session.
   *
   * @param tokenId   the token id
   * @param at        when the session was used
   * @param clientIp  the client address
   * @param userAgent the client user agent
   * @return the updated session, or empty if unknown or deleted
   */
  Optional<Session> recordUse(String tokenId, Instant at, String clientIp, String userAgent);

  /**
   * Soft-deletes all live sessions of a user.
   * <p>
   * Must not throw when the user has no sessions.
   *
   * @param userId the owning user
   * @return the number of sessions deleted
   */
  int deleteByUserId(long userId);
}
