package com.codeheadsystems.tollgate.server.exceptions;

import com.codeheadsystems.tollgate.model.auth.ErrorCode;

/**
 * The email or username is already registered. HTTP 409.
 */
public class ConflictException extends AuthException {

  public ConflictException(final String message) {
    super(ErrorCode.CONFLICT, message);
  }
}
