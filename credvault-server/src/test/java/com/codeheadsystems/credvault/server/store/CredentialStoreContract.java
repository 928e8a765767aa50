package com.codeheadsystems.credvault.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.credvault.crypto.EncryptedPayload;
import com.codeheadsystems.credvault.server.SteppingClock;
import com.codeheadsystems.credvault.server.exception.StorageException;
import com.codeheadsystems.credvault.server.model.AuditEvent;
import com.codeheadsystems.credvault.server.model.AuditEventType;
import com.codeheadsystems.credvault.server.model.CredentialRecord;
import com.codeheadsystems.credvault.server.model.RemoteIdentityClaims;
import com.codeheadsystems.credvault.server.model.StatusView;
import com.codeheadsystems.credvault.server.model.ValidationStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Behaviour every {@link CredentialStore} shares. Subclasses supply the implementation.
 */
abstract class CredentialStoreContract {

  protected static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
  protected static final RemoteIdentityClaims CLAIMS =
      new RemoteIdentityClaims("U1", "O1", "u1@example.com");
  protected static final EncryptedPayload PAYLOAD =
      new EncryptedPayload("Y2lwaGVydGV4dA==", "aXYtaXYtaXYtaXY=", "c2FsdC1zYWx0LXNhbHQtc2E=");
  protected static final EncryptedPayload OTHER_PAYLOAD =
      new EncryptedPayload("b3RoZXI=", "b3RoZXItaXYtaXY=", "b3RoZXItc2FsdC1zYWx0LXM=");

  protected SteppingClock clock;
  protected CredentialStore store;

  protected abstract CredentialStore createStore(SteppingClock clock);

  @BeforeEach
  void setUpStore() {
    clock = new SteppingClock(START);
    store = createStore(clock);
  }

  private CredentialRecord newRecord(String identity) {
    return CredentialRecord.newlyValidated(identity, PAYLOAD, CLAIMS, clock.instant());
  }

  @Test
  void getRecord_unknown_returnsEmpty() {
    assertThat(store.getRecord("nobody")).isEmpty();
  }

  @Test
  void insertAndGet_roundTrip() {
    CredentialRecord record = newRecord("u1");
    store.insertRecord(record);

    assertThat(store.getRecord("u1")).contains(record);
  }

  @Test
  void insertRecord_duplicate_throwsStorageException() {
    store.insertRecord(newRecord("u1"));

    assertThatThrownBy(() -> store.insertRecord(newRecord("u1")))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("already exists");
  }

  @Test
  void insertRecord_withoutClaims_readsBackWithoutClaims() {
    CredentialRecord record = new CredentialRecord("u1", PAYLOAD.ciphertext(), PAYLOAD.iv(),
        PAYLOAD.salt(), START, START, null, ValidationStatus.VALID, null);
    store.insertRecord(record);

    CredentialRecord loaded = store.getRecord("u1").orElseThrow();
    assertThat(loaded.remoteIdentityClaims()).isNull();
    assertThat(loaded.lastValidatedAt()).isNull();
  }

  @Test
  void updateCiphertext_replacesPayloadAndMarksPending() {
    CredentialRecord original = newRecord("u1");
    store.insertRecord(original);

    store.updateCiphertext("u1", OTHER_PAYLOAD);

    CredentialRecord updated = store.getRecord("u1").orElseThrow();
    assertThat(updated.payload()).isEqualTo(OTHER_PAYLOAD);
    assertThat(updated.validationStatus()).isEqualTo(ValidationStatus.PENDING);
    assertThat(updated.lastUsedAt()).isAfter(original.lastUsedAt());
    assertThat(updated.registeredAt()).isEqualTo(original.registeredAt());
    assertThat(updated.lastValidatedAt()).isEqualTo(original.lastValidatedAt());
  }

  @Test
  void updateCiphertext_absent_throwsStorageException() {
    assertThatThrownBy(() -> store.updateCiphertext("nobody", OTHER_PAYLOAD))
        .isInstanceOf(StorageException.class);
  }

  @Test
  void updateValidationStatus_setsStatusAndValidatedTime() {
    CredentialRecord original = newRecord("u1");
    store.insertRecord(original);
    RemoteIdentityClaims newClaims = new RemoteIdentityClaims("U2", "O2", null);

    store.updateValidationStatus("u1", ValidationStatus.INVALID, newClaims);

    CredentialRecord updated = store.getRecord("u1").orElseThrow();
    assertThat(updated.validationStatus()).isEqualTo(ValidationStatus.INVALID);
    assertThat(updated.lastValidatedAt()).isAfter(original.lastValidatedAt());
    assertThat(updated.remoteIdentityClaims().userId()).isEqualTo("U2");
    assertThat(updated.remoteIdentityClaims().orgId()).isEqualTo("O2");
  }

  @Test
  void updateValidationStatus_nullClaims_keepsStoredClaims() {
    store.insertRecord(newRecord("u1"));

    store.updateValidationStatus("u1", ValidationStatus.INVALID, null);

    assertThat(store.getRecord("u1").orElseThrow().remoteIdentityClaims()).isEqualTo(CLAIMS);
  }

  @Test
  void updateValidationStatus_isIdempotent() {
    store.insertRecord(newRecord("u1"));

    store.updateValidationStatus("u1", ValidationStatus.VALID, CLAIMS);
    store.updateValidationStatus("u1", ValidationStatus.VALID, CLAIMS);

    CredentialRecord record = store.getRecord("u1").orElseThrow();
    assertThat(record.validationStatus()).isEqualTo(ValidationStatus.VALID);
    assertThat(record.remoteIdentityClaims()).isEqualTo(CLAIMS);
  }

  @Test
  void updateValidationStatus_absent_doesNotThrow() {
    assertThatCode(() -> store.updateValidationStatus("nobody", ValidationStatus.VALID, CLAIMS))
        .doesNotThrowAnyException();
    assertThat(store.getRecord("nobody")).isEmpty();
  }

  @Test
  void touchLastUsed_advancesLastUsed() {
    CredentialRecord original = newRecord("u1");
    store.insertRecord(original);

    store.touchLastUsed("u1");

    CredentialRecord touched = store.getRecord("u1").orElseThrow();
    assertThat(touched.lastUsedAt()).isAfter(original.lastUsedAt());
    assertThat(touched.validationStatus()).isEqualTo(original.validationStatus());
  }

  @Test
  void touchLastUsed_absent_doesNotThrow() {
    assertThatCode(() -> store.touchLastUsed("nobody")).doesNotThrowAnyException();
  }

  @Test
  void deleteRecord_removesRecord_andIsIdempotent() {
    store.insertRecord(newRecord("u1"));
    store.insertRecord(newRecord("u2"));

    store.deleteRecord("u1");
    store.deleteRecord("u1");

    assertThat(store.getRecord("u1")).isEmpty();
    assertThat(store.getRecord("u2")).isPresent();
  }

  @Test
  void getStatus_registered_projectsRecord() {
    CredentialRecord record = newRecord("u1");
    store.insertRecord(record);

    StatusView status = store.getStatus("u1");

    assertThat(status.registered()).isTrue();
    assertThat(status.identity()).isEqualTo("u1");
    assertThat(status.registeredAt()).isEqualTo(record.registeredAt());
    assertThat(status.validationStatus()).isEqualTo(ValidationStatus.VALID);
    assertThat(status.remoteUserId()).isEqualTo("U1");
  }

  @Test
  void getStatus_unknown_returnsNotRegistered() {
    StatusView status = store.getStatus("nobody");

    assertThat(status.registered()).isFalse();
    assertThat(status.validationStatus()).isNull();
    assertThat(status.remoteUserId()).isNull();
  }

  @Test
  void auditEvents_returnedOldestFirst_perIdentity() {
    store.appendAuditEvent(new AuditEvent("u1", AuditEventType.REGISTER, clock.instant(),
        Map.of("remoteUserId", "U1")));
    store.appendAuditEvent(AuditEvent.of("u2", AuditEventType.REGISTER, clock.instant()));
    store.appendAuditEvent(new AuditEvent("u1", AuditEventType.AUTH_FAILURE, clock.instant(),
        Map.of("reason", "credential_rejected")));
    store.appendAuditEvent(AuditEvent.of("u1", AuditEventType.UNREGISTER, clock.instant()));

    List<AuditEvent> events = store.auditEvents("u1");

    assertThat(events).extracting(AuditEvent::eventType).containsExactly(
        AuditEventType.REGISTER, AuditEventType.AUTH_FAILURE, AuditEventType.UNREGISTER);
    assertThat(events.get(0).metadata()).containsEntry("remoteUserId", "U1");
    assertThat(events.get(1).metadata()).containsEntry("reason", "credential_rejected");
    assertThat(events.get(2).metadata()).isEmpty();
  }

  @Test
  void auditEvents_surviveRecordDeletion() {
    store.insertRecord(newRecord("u1"));
    store.appendAuditEvent(AuditEvent.of("u1", AuditEventType.REGISTER, clock.instant()));

    store.deleteRecord("u1");

    assertThat(store.auditEvents("u1")).hasSize(1);
  }

  @Test
  void countRecords_countsRegisteredIdentities() {
    assertThat(store.countRecords()).isZero();
    store.insertRecord(newRecord("u1"));
    store.insertRecord(newRecord("u2"));

    assertThat(store.countRecords()).isEqualTo(2);
  }
}
