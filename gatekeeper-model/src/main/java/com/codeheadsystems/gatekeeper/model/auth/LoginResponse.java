package com.codeheadsystems.gatekeeper.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful login: the authenticated user and the session that was opened for it.
 * <p>
 * Used by: {@code POST /auth/login} response
 *
 * @param user    the user, without password
 * @param session the issued session including its bearer token
 */
public record LoginResponse(
    @JsonProperty("user") UserResponse user,
    @JsonProperty("session") SessionResponse session) {
}
