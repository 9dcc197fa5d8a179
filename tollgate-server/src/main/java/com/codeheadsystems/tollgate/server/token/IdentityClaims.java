package com.codeheadsystems.tollgate.server.token;

/**
 * The account identity snapshot carried inside a token.
 *
 * @param subject     the account id
 * @param username    the username
 * @param email       the email address
 * @param givenName   the first name
 * @param familyName  the last name
 * @param displayName the full name
 */
public record IdentityClaims(String subject, String username, String email, String givenName,
                             String familyName, String displayName) {
}
