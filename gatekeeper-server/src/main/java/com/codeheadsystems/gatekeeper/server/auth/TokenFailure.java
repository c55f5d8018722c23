package com.codeheadsystems.gatekeeper.server.auth;

/**
 * Why a bearer token was not accepted.
 */
public enum TokenFailure {

  /**
   * Correctly signed, but the current time is at or after its {@code exp} claim.
   * The client should log in again.
   */
  EXPIRED_TOKEN,

  /**
   * Anything else: bad signature, wrong algorithm, malformed structure, wrong issuer,
   * missing claims, or a session that has been logged out.
   */
  INVALID_TOKEN
}
