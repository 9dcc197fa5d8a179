package com.codeheadsystems.tollgate.server.token;

import java.util.Optional;

/**
 * Outcome of {@link TokenCodec#validate(String)}. Validation never throws; callers switch on
 * this result instead.
 */
public sealed interface TokenValidation permits TokenValidation.Valid, TokenValidation.Invalid {

  /**
   * The claims if valid.
   *
   * @return the verified claims, or empty when rejected
   */
  Optional<VerifiedClaims> claims();

  /**
   * The token passed every check.
   *
   * @param verifiedClaims the token's claims
   */
  record Valid(VerifiedClaims verifiedClaims) implements TokenValidation {

    @Override
    public Optional<VerifiedClaims> claims() {
      return Optional.of(verifiedClaims);
    }
  }

  /**
   * The token was rejected.
   *
   * @param kind   the failed check
   * @param detail diagnostic text for logs; never returned to remote callers
   */
  record Invalid(TokenErrorKind kind, String detail) implements TokenValidation {

    @Override
    public Optional<VerifiedClaims> claims() {
      return Optional.empty();
    }
  }
}
