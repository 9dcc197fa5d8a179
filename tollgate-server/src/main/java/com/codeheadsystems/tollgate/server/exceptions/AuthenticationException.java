package com.codeheadsystems.tollgate.server.exceptions;

import com.codeheadsystems.tollgate.model.auth.ErrorCode;

/**
 * Credentials or a token were rejected. HTTP 401.
 * <p>
 * The code tells callers which check failed (for example {@link ErrorCode#TOKEN_EXPIRED}
 * versus {@link ErrorCode#TOKEN_INVALID}); wrong-password and unknown-account failures share
 * {@link ErrorCode#INVALID_CREDENTIALS} and the same message.
 */
public class AuthenticationException extends AuthException {

  public AuthenticationException(final ErrorCode code, final String message) {
    super(code, message);
  }
}
