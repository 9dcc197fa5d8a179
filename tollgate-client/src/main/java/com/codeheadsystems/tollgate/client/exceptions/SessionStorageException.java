package com.codeheadsystems.tollgate.client.exceptions;

/**
 * The persisted session could not be written.
 */
public class SessionStorageException extends RuntimeException {

  public SessionStorageException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
