package com.codeheadsystems.credvault.server.exception;

/**
 * Failure of a critical write or read against the credential store backend.
 * The message is safe to log; it never contains credential material.
 */
public class StorageException extends RuntimeException {

  /**
   * Instantiates a new Storage exception.
   *
   * @param message the message
   */
  public StorageException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Storage exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public StorageException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
