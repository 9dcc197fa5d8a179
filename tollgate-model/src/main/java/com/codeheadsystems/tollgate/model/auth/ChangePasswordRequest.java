package com.codeheadsystems.tollgate.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for changing the password of the authenticated account.
 * <p>
 * Used by: {@code POST /api/auth/change-password}
 *
 * @param currentPassword the password in use now
 * @param newPassword     the replacement; must satisfy the password policy
 */
public record ChangePasswordRequest(
    @JsonProperty("currentPassword") String currentPassword,
    @JsonProperty("newPassword") String newPassword) {

  @Override
  public String toString() {
    return "ChangePasswordRequest[***]";
  }
}
