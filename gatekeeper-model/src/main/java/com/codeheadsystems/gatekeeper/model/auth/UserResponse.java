package com.codeheadsystems.gatekeeper.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public view of a user account. Never carries the password or its hash.
 *
 * @param id        the user identifier
 * @param email     the account email
 * @param createdAt ISO-8601 creation instant
 * @param updatedAt ISO-8601 last-update instant
 */
public record UserResponse(
    @JsonProperty("id") long id,
    @JsonProperty("email") String email,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt) {
}
