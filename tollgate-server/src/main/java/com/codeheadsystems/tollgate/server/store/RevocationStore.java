package com.codeheadsystems.tollgate.server.store;

import java.time.Instant;

/**
 * The revocation list consulted on every token validation.
 * <p>
 * Holds two kinds of entry: individual token ids revoked until their natural expiry (logout
 * and refresh), and per-account fences that revoke every token issued before a given instant
 * (password change).
 */
public interface RevocationStore {

  /**
   * Revokes a token id. Idempotent.
   *
   * @param tokenId   the {@code jti}
   * @param expiresAt the token's expiry; the entry may be dropped after it
   */
  void revoke(String tokenId, Instant expiresAt);

  /**
   * Atomically revokes a token id if it is not revoked yet.
   *
   * @param tokenId   the {@code jti}
   * @param expiresAt the token's expiry
   * @return true if this call added the entry, false if it was already revoked
   */
  boolean revokeIfAbsent(String tokenId, Instant expiresAt);

  /**
   * Checks whether a token id has been revoked.
   *
   * @param tokenId the {@code jti}
   * @return true if revoked
   */
  boolean isRevoked(String tokenId);

  /**
   * Revokes every token for the subject issued strictly before the cutoff. A later cutoff
   * replaces an earlier one; an earlier one is ignored.
   *
   * @param subject the account id
   * @param cutoff  the fence
   */
  void revokeAllIssuedBefore(String subject, Instant cutoff);

  /**
   * Checks a token's issuance time against the subject's fence.
   *
   * @param subject  the account id
   * @param issuedAt the token's issuance time
   * @return true if the token was issued before the fence
   */
  boolean isRevokedBefore(String subject, Instant issuedAt);
}
