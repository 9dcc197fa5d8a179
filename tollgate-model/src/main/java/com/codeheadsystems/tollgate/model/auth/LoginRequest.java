package com.codeheadsystems.tollgate.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a password login.
 * <p>
 * Used by: {@code POST /api/auth/login}
 *
 * @param usernameOrEmail the username, or the email address when no username matches
 * @param password        the plaintext password
 */
public record LoginRequest(
    @JsonProperty("username") String usernameOrEmail,
    @JsonProperty("password") String password) {

  @Override
  public String toString() {
    return "LoginRequest[usernameOrEmail=" + usernameOrEmail + "]";
  }
}
