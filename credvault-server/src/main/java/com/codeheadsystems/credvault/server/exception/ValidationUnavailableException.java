package com.codeheadsystems.credvault.server.exception;

/**
 * The remote service could not be reached, timed out, or returned an error that says
 * nothing about the credential itself. Stored records must not be invalidated on this.
 */
public class ValidationUnavailableException extends RuntimeException {

  /**
   * Instantiates a new Validation unavailable exception.
   *
   * @param message the message
   */
  public ValidationUnavailableException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Validation unavailable exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ValidationUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
