package com.codeheadsystems.gatekeeper.server.auth;

/**
 * Decides whether an {@code Authorization} header admits a request.
 * <p>
 * Checks run in a fixed order and stop at the first failure: header present, {@code Bearer }
 * scheme, non-empty credential, then token verification. Framework-agnostic; see
 * {@link BearerAuthFilter} for the JAX-RS binding.
 */
public class BearerTokenGate {

  /**
   * The scheme prefix, including the separating space. Matched case-sensitively.
   */
  public static final String BEARER_PREFIX = "Bearer ";

  private final SessionManager sessionManager;

  public BearerTokenGate(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  /**
   * Evaluate an authorization header.
   *
   * @param authorizationHeader the raw header value, may be {@code null}
   * @return the gate decision
   */
  public GateDecision evaluate(String authorizationHeader) {
    if (authorizationHeader == null || authorizationHeader.isEmpty()) {
      return GateDecision.reject(RejectReason.AUTH_HEADER_REQUIRED);
    }
    if (!authorizationHeader.startsWith(BEARER_PREFIX)) {
      return GateDecision.reject(RejectReason.SCHEME_MISMATCH);
    }
    String token = authorizationHeader.substring(BEARER_PREFIX.length());
    if (token.isEmpty()) {
      return GateDecision.reject(RejectReason.CREDENTIAL_REQUIRED);
    }
    TokenVerification verification = sessionManager.decodeAndValidate(token);
    if (verification.isValid()) {
      return GateDecision.admit(verification.claims());
    }
    return GateDecision.reject(verification.failure() == TokenFailure.EXPIRED_TOKEN
        ? RejectReason.TOKEN_EXPIRED
        : RejectReason.TOKEN_INVALID);
  }
}
