package com.codeheadsystems.credvault.server.model;

/**
 * Result of the most recent validation of a stored credential.
 * <p>
 * {@code PENDING} only exists between re-encryption and revalidation inside a registration.
 * {@code INVALID} is left only through a fresh registration.
 */
public enum ValidationStatus {
  PENDING("pending"),
  VALID("valid"),
  INVALID("invalid");

  private final String wireValue;

  ValidationStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  /**
   * The lower-case value persisted and shown to users.
   *
   * @return the wire value
   */
  public String wireValue() {
    return wireValue;
  }

  /**
   * Parses a persisted value.
   *
   * @param wireValue the lower-case value
   * @return the status
   * @throws IllegalArgumentException on unknown values
   */
  public static ValidationStatus fromWireValue(String wireValue) {
    for (ValidationStatus status : values()) {
      if (status.wireValue.equals(wireValue)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown validation status: " + wireValue);
  }
}
