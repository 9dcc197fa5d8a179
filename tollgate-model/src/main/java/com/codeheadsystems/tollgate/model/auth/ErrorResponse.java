package com.codeheadsystems.tollgate.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body of every non-2xx response from the authentication endpoints.
 *
 * @param code    the failure category
 * @param message a human-readable description that is safe to display
 */
public record ErrorResponse(
    @JsonProperty("code") ErrorCode code,
    @JsonProperty("message") String message) {
}
