package com.codeheadsystems.tollgate.model.auth;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Wire model returned after a successful login or token refresh.
 * <p>
 * Used by: {@code POST /api/auth/login}, {@code POST /api/auth/refresh}
 *
 * @param token     the signed bearer token
 * @param user      the profile of the authenticated account
 * @param expiresAt when the token stops being accepted
 */
public record LoginResponse(
    @JsonProperty("token") String token,
    @JsonProperty("user") UserProfile user,
    @JsonProperty("expiresAt") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant expiresAt) {
}
