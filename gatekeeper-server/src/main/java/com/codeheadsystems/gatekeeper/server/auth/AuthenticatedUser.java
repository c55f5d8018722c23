package com.codeheadsystems.gatekeeper.server.auth;

import java.security.Principal;

/**
 * Identity bound to a request admitted by the bearer gate.
 *
 * @param userId  the verified user id
 * @param tokenId the {@code jti} of the presented token
 */
public record AuthenticatedUser(long userId, String tokenId) implements Principal {

  /**
   * Sentinel returned by {@link #userIdOf(Principal)} when no user is bound.
   */
  public static final long NO_USER = 0L;

  /**
   * The user id bound to a request.
   *
   * @param principal the request principal, may be {@code null}
   * @return the user id, or {@link #NO_USER} when the principal is absent or of another type
   */
  public static long userIdOf(Principal principal) {
    if (principal instanceof AuthenticatedUser user) {
      return user.userId();
    }
    return NO_USER;
  }

  @Override
  public String getName() {
    return Long.toString(userId);
  }
}
