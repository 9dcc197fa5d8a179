package com.codeheadsystems.tollgate.client.exceptions;

/**
 * Transport failure or a server-side (5xx) error. Never retried automatically.
 */
public class AuthAccessorException extends RuntimeException {

  /**
   * Instantiates a new auth accessor exception.
   *
   * @param message the message
   * @param cause   the cause, may be null
   */
  public AuthAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
