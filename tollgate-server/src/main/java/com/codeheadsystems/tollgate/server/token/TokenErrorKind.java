package com.codeheadsystems.tollgate.server.token;

/**
 * Why a token was rejected.
 */
public enum TokenErrorKind {
  /** Not a decodable JWT, or a required claim is missing. */
  MALFORMED_ENCODING,
  /** Signature, algorithm or issuer does not match this codec. */
  BAD_SIGNATURE,
  /** Correctly signed but past its expiry. */
  EXPIRED,
  /** Correctly signed and unexpired but revoked by logout, refresh or a password change. */
  REVOKED
}
