package com.codeheadsystems.gatekeeper.server.auth;

import com.codeheadsystems.gatekeeper.server.model.Session;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.store.SessionStore;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues, validates and revokes login sessions.
 * <p>
 * Owns the signing secret; nothing else in the process needs to see it. Thread-safe as long
 * as the {@link SessionStore} is: the only mutable state lives in the store, and concurrent
 * {@link #issue} calls for one user each produce an independent session.
 */
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  private final SigningSecret secret;
  private final TokenCodec codec;
  private final SessionPolicy policy;
  private final SessionStore sessionStore;
  private final Clock clock;

  /**
   * Instantiates a new Session manager.
   *
   * @param secret       the signing secret
   * @param policy       issuer, ttl and revocation behaviour
   * @param sessionStore persistence for issued sessions
   * @param clock        the clock shared with the token codec
   */
  public SessionManager(SigningSecret secret, SessionPolicy policy, SessionStore sessionStore,
                        Clock clock) {
    this(secret, new TokenCodec(policy.issuer(), clock), policy, sessionStore, clock);
  }

  /**
   * Instantiates a new Session manager with an explicit codec.
   *
   * @param secret       the signing secret
   * @param codec        the token codec
   * @param policy       issuer, ttl and revocation behaviour
   * @param sessionStore persistence for issued sessions
   * @param clock        the clock
   */
  public SessionManager(SigningSecret secret, TokenCodec codec, SessionPolicy policy,
                        SessionStore sessionStore, Clock clock) {
    this.secret = secret;
    this.codec = codec;
    this.policy = policy;
    this.sessionStore = sessionStore;
    this.clock = clock;
  }

  /**
   * Signs a new token for {@code user} and stores the session behind it.
   *
   * @param user      the authenticated user
   * @param clientIp  the client address of the login request
   * @param userAgent the client user agent of the login request
   * @return the stored session, with its token populated
   */
  public Session issue(User user, String clientIp, String userAgent) {
    EncodedToken encoded = codec.encode(user.id(), secret, policy.ttl());
    Session session = new Session(null, user.id(), encoded.tokenId(), encoded.token(),
        encoded.expiresAt(), encoded.issuedAt(), clientIp, userAgent);
    Session stored = sessionStore.create(session);
    log.debug("Issued session id={} tokenId={} for user={}", stored.id(), encoded.tokenId(), user.id());
    return stored;
  }

  /**
   * Revokes every live session of a user.
   *
   * @param userId the user
   * @return the number of sessions revoked
   */
  public int invalidate(long userId) {
    int count = sessionStore.deleteByUserId(userId);
    log.debug("Invalidated {} session(s) for user={}", count, userId);
    return count;
  }

  /**
   * Decodes a bearer token with the owned secret.
   * <p>
   * Codec failures pass through unchanged. When the policy requires an active session, a
   * token whose session row is missing, deleted or owned by someone else is
   * {@link TokenFailure#INVALID_TOKEN}.
   *
   * @param token the compact token
   * @return the verification result
   */
  public TokenVerification decodeAndValidate(String token) {
    TokenVerification verification = codec.decode(token, secret);
    if (!verification.isValid() || !policy.requireActiveSession()) {
      return verification;
    }
    TokenClaims claims = verification.claims();
    Optional<Session> session = sessionStore.findByTokenId(claims.tokenId())
        .filter(s -> s.userId() == claims.userId());
    if (session.isEmpty()) {
      log.debug("No live session for tokenId={} (logged out)", claims.tokenId());
      return TokenVerification.invalid();
    }
    return verification;
  }

  /**
   * Refreshes the last-use tracking of the session behind an admitted token.
   *
   * @param claims    the verified claims
   * @param clientIp  the client address
   * @param userAgent the client user agent
   */
  public void recordUse(TokenClaims claims, String clientIp, String userAgent) {
    if (sessionStore.recordUse(claims.tokenId(), clock.instant(), clientIp, userAgent).isEmpty()) {
      log.debug("recordUse: no live session for tokenId={}", claims.tokenId());
    }
  }

  /**
   * The policy in force.
   *
   * @return the session policy
   */
  public SessionPolicy policy() {
    return policy;
  }
}
