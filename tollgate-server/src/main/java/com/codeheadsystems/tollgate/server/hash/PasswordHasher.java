package com.codeheadsystems.tollgate.server.hash;

/**
 * One-way adaptive hashing of passwords.
 * <p>
 * Digests are self-describing: they carry the salt and the cost parameters used to produce
 * them, so {@link #verify} needs no other input.
 */
public interface PasswordHasher {

  /**
   * Hashes the password with a freshly generated salt.
   *
   * @param plaintext the password
   * @return the encoded digest
   */
  String hash(String plaintext);

  /**
   * Checks a password against a digest produced by {@link #hash}. The comparison is constant
   * time. Never throws for a malformed or foreign digest; such input simply does not verify.
   *
   * @param plaintext the candidate password
   * @param digest    the stored digest
   * @return true if the password matches
   */
  boolean verify(String plaintext, String digest);
}
