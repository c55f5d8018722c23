package com.codeheadsystems.gatekeeper.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Plain confirmation body, e.g. after logout.
 *
 * @param message human-readable confirmation
 */
public record MessageResponse(@JsonProperty("message") String message) {
}
