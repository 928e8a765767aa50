package com.codeheadsystems.credvault.crypto.exception;

/**
 * The single failure raised by {@code EnvelopeEncryptor#decrypt}.
 * <p>
 * Wrong identity, tampered ciphertext, tampered IV or salt and malformed encodings all surface
 * as this type with the same message. Callers must not try to tell them apart.
 */
public class DecryptionException extends RuntimeException {

  /**
   * Message shared by every decryption failure.
   */
  public static final String MESSAGE =
      "Decryption failed. The data may be corrupted or the identity may not match.";

  /**
   * Instantiates a new Decryption exception.
   *
   * @param cause the cause, kept for local debugging only
   */
  public DecryptionException(final Throwable cause) {
    super(MESSAGE, cause);
  }

  /**
   * Instantiates a new Decryption exception without a cause.
   */
  public DecryptionException() {
    super(MESSAGE);
  }
}
