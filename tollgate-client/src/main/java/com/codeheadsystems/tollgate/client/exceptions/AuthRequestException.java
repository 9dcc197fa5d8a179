package com.codeheadsystems.tollgate.client.exceptions;

import com.codeheadsystems.tollgate.model.auth.ErrorResponse;

/**
 * The server refused the request content (HTTP 400 validation or 409 conflict). The caller has
 * to change its input; retrying the same request will fail the same way.
 */
public class AuthRequestException extends RuntimeException {

  private final int status;
  private final transient ErrorResponse error;

  /**
   * Instantiates a new auth request exception.
   *
   * @param status the HTTP status
   * @param error  the server's error body
   */
  public AuthRequestException(final int status, final ErrorResponse error) {
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
