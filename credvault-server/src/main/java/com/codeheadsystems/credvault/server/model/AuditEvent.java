package com.codeheadsystems.credvault.server.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable audit trail entry. Metadata must never carry credential material.
 *
 * @param identity  the identity the event concerns
 * @param eventType the lifecycle action
 * @param timestamp when it happened
 * @param metadata  optional structured details, never null (empty when absent)
 */
public record AuditEvent(String identity, AuditEventType eventType, Instant timestamp,
                         Map<String, Object> metadata) {

  public AuditEvent {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(timestamp, "timestamp");
    metadata = metadata == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /**
   * Event without metadata.
   *
   * @param identity  the identity
   * @param eventType the event type
   * @param timestamp the timestamp
   * @return the event
   */
  public static AuditEvent of(String identity, AuditEventType eventType, Instant timestamp) {
    return new AuditEvent(identity, eventType, timestamp, Map.of());
  }
}
