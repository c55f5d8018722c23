package com.codeheadsystems.gatekeeper.server.auth;

/**
 * Outcome of {@link BearerTokenGate#evaluate(String)}: an admitted user, or a reject reason.
 *
 * @param user   the admitted identity, {@code null} when rejected
 * @param claims the verified claims, {@code null} when rejected
 * @param reason the reject reason, {@code null} when admitted
 */
public record GateDecision(AuthenticatedUser user, TokenClaims claims, RejectReason reason) {

  public static GateDecision admit(TokenClaims claims) {
    return new GateDecision(new AuthenticatedUser(claims.userId(), claims.tokenId()), claims, null);
  }

  public static GateDecision reject(RejectReason reason) {
    return new GateDecision(null, null, reason);
  }

  public boolean admitted() {
    return user != null;
  }
}
