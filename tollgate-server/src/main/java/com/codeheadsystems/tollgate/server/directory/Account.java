package com.codeheadsystems.tollgate.server.directory;

import java.time.Instant;

/**
 * A stored account record.
 *
 * @param id           opaque unique key
 * @param username     unique username
 * @param email        unique email address, compared case-insensitively
 * @param firstName    given name
 * @param lastName     family name
 * @param passwordHash the digest produced by the configured password hasher
 * @param active       whether the account may authenticate
 * @param createdAt    registration time
 * @param lastLoginAt  the last successful login or refresh, null before the first login
 */
public record Account(String id,
                      String username,
                      String email,
                      String firstName,
                      String lastName,
                      String passwordHash,
                      boolean active,
                      Instant createdAt,
                      Instant lastLoginAt) {

  public Account {
    if (passwordHash == null || passwordHash.isEmpty()) {
      throw new IllegalArgumentException("passwordHash must not be empty");
    }
  }

  public String fullName() {
    return (nullToEmpty(firstName) + " " + nullToEmpty(lastName)).trim();
  }

  public Account withLastLoginAt(final Instant instant) {
    return new Account(id, username, email, firstName, lastName, passwordHash, active, createdAt,
        instant);
  }

  public Account withPasswordHash(final String hash) {
    return new Account(id, username, email, firstName, lastName, hash, active, createdAt,
        lastLoginAt);
  }

  public Account withActive(final boolean isActive) {
    return new Account(id, username, email, firstName, lastName, passwordHash, isActive, createdAt,
        lastLoginAt);
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }
}
