package com.codeheadsystems.gatekeeper.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a newly issued login session.
 * <p>
 * {@code token} is the bearer credential to send as {@code Authorization: Bearer <token>};
 * {@code expiresAt} is the same instant as the token's {@code exp} claim.
 *
 * @param id          the session identifier
 * @param userId      the owning user
 * @param token       the signed bearer token
 * @param expiresAt   ISO-8601 expiry instant
 * @param lastUsedAt  ISO-8601 instant of the last recorded use
 * @param lastUsedIp  client address of the last recorded use
 * @param lastUsedLoc user agent of the last recorded use
 */
public record SessionResponse(
    @JsonProperty("id") long id,
    @JsonProperty("user_id") long userId,
    @JsonProperty("token") String token,
    @JsonProperty("expires_at") String expiresAt,
    @JsonProperty("last_used_at") String lastUsedAt,
    @JsonProperty("last_used_ip") String lastUsedIp,
    @JsonProperty("last_used_loc") String lastUsedLoc) {
}
