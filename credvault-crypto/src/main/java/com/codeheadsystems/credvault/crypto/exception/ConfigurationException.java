package com.codeheadsystems.credvault.crypto.exception;

/**
 * Thrown when the encryption layer cannot be constructed from the supplied configuration,
 * typically a missing, undecodable or too-short master secret. Fatal at startup.
 */
public class ConfigurationException extends RuntimeException {

  /**
   * Instantiates a new Configuration exception.
   *
   * @param message the message
   */
  public ConfigurationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Configuration exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
