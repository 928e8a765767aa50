package com.codeheadsystems.credvault.server.store;

import com.codeheadsystems.credvault.crypto.EncryptedPayload;
import com.codeheadsystems.credvault.server.exception.StorageException;
import com.codeheadsystems.credvault.server.model.AuditEvent;
import com.codeheadsystems.credvault.server.model.CredentialRecord;
import com.codeheadsystems.credvault.server.model.RemoteIdentityClaims;
import com.codeheadsystems.credvault.server.model.StatusView;
import com.codeheadsystems.credvault.server.model.ValidationStatus;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for encrypted credential records and their audit trail.
 * <p>
 * Implementations must be thread-safe. Critical operations wrap backend failures in
 * {@link StorageException}. Best-effort operations ({@link #touchLastUsed},
 * {@link #appendAuditEvent}, {@link #countRecords}) log failures and never throw.
 */
public interface CredentialStore {

  /**
   * Loads the record for an identity.
   *
   * @param identity the owner
   * @return the record, or empty when the identity is not registered
   * @throws StorageException if the backend fails
   */
  Optional<CredentialRecord> getRecord(String identity);

  /**
   * Inserts a new record.
   *
   * @param record the record
   * @throws StorageException if a record for the identity already exists or the backend fails
   */
  void insertRecord(CredentialRecord record);

  /**
   * Replaces the encrypted credential of an existing record. The status becomes
   * {@link ValidationStatus#PENDING} and the last-used time is refreshed.
   *
   * @param identity the owner
   * @param payload  the new ciphertext, IV and salt
   * @throws StorageException if no record exists or the backend fails
   */
  void updateCiphertext(String identity, EncryptedPayload payload);

  /**
   * Records a validation outcome and sets the last-validated time to now. A missing record is
   * not an error.
   *
   * @param identity the owner
   * @param status   the new status
   * @param claims   new claims, or null to keep the stored ones
   * @throws StorageException if the backend fails
   */
  void updateValidationStatus(String identity, ValidationStatus status,
                              RemoteIdentityClaims claims);

  /**
   * Refreshes the last-used time. Never throws.
   *
   * @param identity the owner
   */
  void touchLastUsed(String identity);

  /**
   * Removes the record for an identity, if present. The audit trail is kept.
   *
   * @param identity the owner
   * @throws StorageException if the backend fails
   */
  void deleteRecord(String identity);

  /**
   * Appends to the audit trail. Never throws.
   *
   * @param event the event
   */
  void appendAuditEvent(AuditEvent event);

  /**
   * Status projection for an identity.
   *
   * @param identity the owner
   * @return the view, {@link StatusView#notRegistered(String)} when absent
   * @throws StorageException if the backend fails
   */
  default StatusView getStatus(String identity) {
    return getRecord(identity)
        .map(StatusView::of)
        .orElseGet(() -> StatusView.notRegistered(identity));
  }

  /**
   * Number of registered identities. Returns 0 when the backend fails.
   *
   * @return the count
   */
  long countRecords();

  /**
   * Audit trail of an identity, oldest first.
   *
   * @param identity the owner
   * @return the events
   * @throws StorageException if the backend fails
   */
  List<AuditEvent> auditEvents(String identity);
}
