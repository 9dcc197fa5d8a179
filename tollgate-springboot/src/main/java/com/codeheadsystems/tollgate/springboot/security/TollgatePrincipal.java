package com.codeheadsystems.tollgate.springboot.security;

/**
 * The authenticated account, available through {@code @AuthenticationPrincipal}.
 *
 * @param accountId the token subject
 * @param username  the username claim
 * @param email     the email claim
 * @param tokenId   the token's jti
 */
public record TollgatePrincipal(String accountId, String username, String email, String tokenId) {
}
