package com.codeheadsystems.gatekeeper.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /auth/register} response (HTTP 201).
 *
 * @param user the created user, without password
 */
public record RegisterResponse(@JsonProperty("user") UserResponse user) {
}
