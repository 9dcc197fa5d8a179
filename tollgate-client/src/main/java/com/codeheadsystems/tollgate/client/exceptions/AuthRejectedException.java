package com.codeheadsystems.tollgate.client.exceptions;

import com.codeheadsystems.tollgate.model.auth.ErrorResponse;

/**
 * The server rejected the credentials or the token (HTTP 401 or 403).
 */
public class AuthRejectedException extends SecurityException {

  private final int status;
  private final transient ErrorResponse error;

  /**
   * Instantiates a new auth rejected exception.
   *
   * @param status the HTTP status
   * @param error  the server's error body
   */
  public AuthRejectedException(final int status, final ErrorResponse error) {
    super(error.message());
    this.status = status;
    this.error = error;
  }

  public int status() {
    return status;
  }

  public ErrorResponse error() {
    return error;
  }
}
