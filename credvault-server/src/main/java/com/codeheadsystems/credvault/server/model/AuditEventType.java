package com.codeheadsystems.credvault.server.model;

/**
 * Lifecycle actions recorded in the audit trail.
 */
public enum AuditEventType {
  REGISTER("register"),
  UPDATE("update"),
  UNREGISTER("unregister"),
  VALIDATION_SUCCESS("validation_success"),
  VALIDATION_FAILURE("validation_failure"),
  AUTH_FAILURE("auth_failure");

  private final String wireValue;

  AuditEventType(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  /**
   * Parses a persisted value.
   *
   * @param wireValue the lower-case value
   * @return the event type
   * @throws IllegalArgumentException on unknown values
   */
  public static AuditEventType fromWireValue(String wireValue) {
    for (AuditEventType type : values()) {
      if (type.wireValue.equals(wireValue)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown audit event type: " + wireValue);
  }
}
