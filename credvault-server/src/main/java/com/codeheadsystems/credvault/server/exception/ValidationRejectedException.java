package com.codeheadsystems.credvault.server.exception;

/**
 * The remote service answered and refused the credential (revoked, expired or wrong).
 * Distinct from {@link ValidationUnavailableException}, which means no trustworthy answer
 * was obtained.
 */
public class ValidationRejectedException extends RuntimeException {

  /**
   * Instantiates a new Validation rejected exception.
   *
   * @param message the message
   */
  public ValidationRejectedException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Validation rejected exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ValidationRejectedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
