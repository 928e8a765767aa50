package com.codeheadsystems.credvault.crypto.exception;

/**
 * Unexpected failure of the cipher while encrypting. Never carries the plaintext.
 */
public class EncryptionException extends RuntimeException {

  /**
   * Instantiates a new Encryption exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public EncryptionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
