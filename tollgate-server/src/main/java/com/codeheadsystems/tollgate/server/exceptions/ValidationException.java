package com.codeheadsystems.tollgate.server.exceptions;

import com.codeheadsystems.tollgate.model.auth.ErrorCode;

/**
 * Missing or malformed input. The message names the first rule that failed. HTTP 400.
 */
public class ValidationException extends AuthException {

  public ValidationException(final String message) {
    super(ErrorCode.VALIDATION, message);
  }
}
