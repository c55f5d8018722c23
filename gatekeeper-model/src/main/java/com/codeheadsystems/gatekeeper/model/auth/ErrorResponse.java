package com.codeheadsystems.gatekeeper.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned with every 4xx produced by the gatekeeper endpoints and bearer filter.
 * <p>
 * The message is meant for humans but is stable, so clients may use it to tell an expired
 * token ("Token has expired") from an otherwise invalid one ("Invalid token").
 *
 * @param error the error message
 */
public record ErrorResponse(@JsonProperty("error") String error) {
}
