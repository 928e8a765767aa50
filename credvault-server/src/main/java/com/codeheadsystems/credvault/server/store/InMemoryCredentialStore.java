package com.codeheadsystems.credvault.server.store;

import com.codeheadsystems.credvault.crypto.EncryptedPayload;
import com.codeheadsystems.credvault.server.exception.StorageException;
import com.codeheadsystems.credvault.server.model.AuditEvent;
import com.codeheadsystems.credvault.server.model.CredentialRecord;
import com.codeheadsystems.credvault.server.model.RemoteIdentityClaims;
import com.codeheadsystems.credvault.server.model.ValidationStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CredentialStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All records and audit events are lost on restart. Suitable for development and testing
 * only. Each write is a single atomic map operation.
 */
public class InMemoryCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private final ConcurrentHashMap<String, CredentialRecord> records = new ConcurrentHashMap<>();
  private final List<AuditEvent> auditLog = new CopyOnWriteArrayList<>();
  private final Clock clock;

  public InMemoryCredentialStore() {
    this(Clock.systemUTC());
  }

  public InMemoryCredentialStore(Clock clock) {
    this.clock = clock;
    log.warn("Using InMemoryCredentialStore, credentials will NOT survive restarts. "
        + "Configure a database for production.");
  }

  @Override
  public Optional<CredentialRecord> getRecord(String identity) {
    return Optional.ofNullable(records.get(identity));
  }

  @Override
  public void insertRecord(CredentialRecord record) {
    if (records.putIfAbsent(record.identity(), record) != null) {
      throw new StorageException("Credential record already exists for identity " + record.identity());
    }
    log.debug("Inserted credential record for {}", record.identity());
  }

  @Override
  public void updateCiphertext(String identity, EncryptedPayload payload) {
    CredentialRecord updated = records.computeIfPresent(identity,
        (id, existing) -> existing.withPayload(payload, now()));
    if (updated == null) {
      throw new StorageException("No credential record for identity " + identity);
    }
  }

  @Override
  public void updateValidationStatus(String identity, ValidationStatus status,
                                     RemoteIdentityClaims claims) {
    records.computeIfPresent(identity, (id, existing) -> existing.withValidation(status, claims, now()));
  }

  @Override
  public void touchLastUsed(String identity) {
    records.computeIfPresent(identity, (id, existing) -> existing.withLastUsed(now()));
  }

  @Override
  public void deleteRecord(String identity) {
    records.remove(identity);
  }

  @Override
  public void appendAuditEvent(AuditEvent event) {
    auditLog.add(event);
  }

  @Override
  public long countRecords() {
    return records.size();
  }

  @Override
  public List<AuditEvent> auditEvents(String identity) {
    return auditLog.stream()
        .filter(e -> e.identity().equals(identity))
        .toList();
  }

  private Instant now() {
    return Instant.ofEpochMilli(clock.millis());
  }
}
