package com.codeheadsystems.tollgate.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing an authenticated account.
 *
 * @param accountId the token subject
 * @param username  the username claim
 * @param email     the email claim
 * @param tokenId   the token's jti
 */
public record TollgatePrincipal(String accountId, String username, String email, String tokenId)
    implements Principal {

  @Override
  public String getName() {
    return username;
  }
}
