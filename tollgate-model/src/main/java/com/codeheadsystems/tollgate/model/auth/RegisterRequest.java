package com.codeheadsystems.tollgate.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for account registration.
 * <p>
 * Used by: {@code POST /api/auth/register}
 *
 * @param email     the email address; must be unique (case-insensitive)
 * @param password  the plaintext password; must satisfy the password policy
 * @param username  the username; must be unique
 * @param firstName given name
 * @param lastName  family name
 */
public record RegisterRequest(
    @JsonProperty("email") String email,
    @JsonProperty("password") String password,
    @JsonProperty("username") String username,
    @JsonProperty("firstName") String firstName,
    @JsonProperty("lastName") String lastName) {

  @Override
  public String toString() {
    return "RegisterRequest[email=" + email + ", username=" + username
        + ", firstName=" + firstName + ", lastName=" + lastName + "]";
  }
}
