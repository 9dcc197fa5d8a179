package com.codeheadsystems.tollgate.server.exceptions;

import com.codeheadsystems.tollgate.model.auth.ErrorCode;

/**
 * Base type of every failure the authentication manager reports to its callers.
 * <p>
 * The message is always safe to return to the remote caller.
 */
public abstract class AuthException extends RuntimeException {

  private final ErrorCode code;

  protected AuthException(final ErrorCode code, final String message) {
    super(message);
    this.code = code;
  }

  /**
   * The wire-level category of this failure.
   *
   * @return the error code
   */
  public ErrorCode code() {
    return code;
  }
}
