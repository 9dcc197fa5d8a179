package com.codeheadsystems.tollgate.server.token;

import java.time.Instant;

/**
 * Claims of a token that passed every validation check.
 *
 * @param identity  the identity snapshot taken at issuance
 * @param tokenId   the unique token id ({@code jti})
 * @param issuedAt  when the token was issued, millisecond precision
 * @param expiresAt when the token stops being accepted
 */
public record VerifiedClaims(IdentityClaims identity, String tokenId, Instant issuedAt,
                             Instant expiresAt) {

  public String subject() {
    return identity.subject();
  }
}
