package com.codeheadsystems.credvault.server.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.credvault.crypto.EncryptedPayload;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CredentialRecordTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
  private static final RemoteIdentityClaims CLAIMS = new RemoteIdentityClaims("U1", "O1", null);
  private static final EncryptedPayload PAYLOAD =
      new EncryptedPayload("c2VjcmV0LWNpcGhlcnRleHQ=", "aXY=", "c2FsdA==");

  @Test
  void toString_omitsCiphertext() {
    CredentialRecord record = CredentialRecord.newlyValidated("u1", PAYLOAD, CLAIMS, T0);

    assertThat(record.toString())
        .contains("u1")
        .doesNotContain(PAYLOAD.ciphertext())
        .doesNotContain(PAYLOAD.salt());
  }

  @Test
  void withValidation_nullClaims_keepsExisting() {
    CredentialRecord record = CredentialRecord.newlyValidated("u1", PAYLOAD, CLAIMS, T0);

    CredentialRecord updated = record.withValidation(ValidationStatus.INVALID, null,
        T0.plusSeconds(5));

    assertThat(updated.remoteIdentityClaims()).isEqualTo(CLAIMS);
    assertThat(updated.lastValidatedAt()).isEqualTo(T0.plusSeconds(5));
    assertThat(updated.lastUsedAt()).isEqualTo(T0);
  }

  @Test
  void withPayload_resetsStatusToPending() {
    CredentialRecord record = CredentialRecord.newlyValidated("u1", PAYLOAD, CLAIMS, T0);

    CredentialRecord updated = record.withPayload(
        new EncryptedPayload("bmV3", "bmV3aXY=", "bmV3c2FsdA=="), T0.plusSeconds(1));

    assertThat(updated.validationStatus()).isEqualTo(ValidationStatus.PENDING);
    assertThat(updated.registeredAt()).isEqualTo(T0);
    assertThat(updated.lastUsedAt()).isEqualTo(T0.plusSeconds(1));
  }

  @Test
  void wireValues_roundTrip() {
    for (ValidationStatus status : ValidationStatus.values()) {
      assertThat(ValidationStatus.fromWireValue(status.wireValue())).isEqualTo(status);
    }
    for (AuditEventType type : AuditEventType.values()) {
      assertThat(AuditEventType.fromWireValue(type.wireValue())).isEqualTo(type);
    }
    assertThatThrownBy(() -> ValidationStatus.fromWireValue("VALID"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void statusView_notRegistered_hasNoDetails() {
    StatusView view = StatusView.notRegistered("u9");

    assertThat(view.registered()).isFalse();
    assertThat(view.identity()).isEqualTo("u9");
    assertThat(view.registeredAt()).isNull();
    assertThat(view.remoteUserId()).isNull();
  }
}
