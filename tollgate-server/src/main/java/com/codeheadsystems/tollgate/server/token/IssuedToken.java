package com.codeheadsystems.tollgate.server.token;

import java.time.Instant;

/**
 * A freshly signed token and its metadata.
 *
 * @param token     the compact JWT
 * @param tokenId   the unique token id ({@code jti})
 * @param issuedAt  issuance time
 * @param expiresAt expiry, truncated to whole seconds as carried in the {@code exp} claim
 */
public record IssuedToken(String token, String tokenId, Instant issuedAt, Instant expiresAt) {
}
