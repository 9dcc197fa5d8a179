package com.codeheadsystems.tollgate.model.auth;

/**
 * Machine-readable failure categories carried in {@link ErrorResponse}.
 */
public enum ErrorCode {
  /** A required field is missing or malformed. HTTP 400. */
  VALIDATION,
  /** The email or username is already registered. HTTP 409. */
  CONFLICT,
  /** Unknown account or wrong password. HTTP 401. */
  INVALID_CREDENTIALS,
  /** Correct credentials for a deactivated account. HTTP 401. */
  INACTIVE_ACCOUNT,
  /** The presented token has expired. HTTP 401. */
  TOKEN_EXPIRED,
  /** The presented token is malformed, tampered, revoked or already exchanged. HTTP 401. */
  TOKEN_INVALID,
  /** The token subject no longer exists. HTTP 401. */
  ACCOUNT_NOT_FOUND,
  /** The token subject has been deactivated. HTTP 401. */
  ACCOUNT_INACTIVE,
  /** Generic rejection for protected endpoints. HTTP 401. */
  UNAUTHORIZED
}
