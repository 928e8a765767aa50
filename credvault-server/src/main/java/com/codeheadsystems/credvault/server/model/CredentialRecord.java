package com.codeheadsystems.credvault.server.model;

import com.codeheadsystems.credvault.crypto.EncryptedPayload;
import java.time.Instant;
import java.util.Objects;

/**
 * The stored, encrypted credential of one identity.
 *
 * @param identity             primary key, immutable
 * @param ciphertext           base64 AES-GCM ciphertext
 * @param iv                   base64 GCM nonce
 * @param salt                 base64 key-derivation salt
 * @param registeredAt         first registration, never changes
 * @param lastUsedAt           last successful authentication or re-encryption
 * @param lastValidatedAt      last validation write, nullable
 * @param validationStatus     current validation state
 * @param remoteIdentityClaims denormalized remote account info, nullable and possibly stale
 */
public record CredentialRecord(
    String identity,
    String ciphertext,
    String iv,
    String salt,
    Instant registeredAt,
    Instant lastUsedAt,
    Instant lastValidatedAt,
    ValidationStatus validationStatus,
    RemoteIdentityClaims remoteIdentityClaims) {

  public CredentialRecord {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(ciphertext, "ciphertext");
    Objects.requireNonNull(iv, "iv");
    Objects.requireNonNull(salt, "salt");
    Objects.requireNonNull(registeredAt, "registeredAt");
    Objects.requireNonNull(lastUsedAt, "lastUsedAt");
    Objects.requireNonNull(validationStatus, "validationStatus");
  }

  /**
   * A record for a credential that has just passed remote validation.
   *
   * @param identity the owner
   * @param payload  the encrypted credential
   * @param claims   the claims returned by the validation
   * @param now      registration time
   * @return the record, status {@link ValidationStatus#VALID}
   */
  public static CredentialRecord newlyValidated(String identity, EncryptedPayload payload,
                                                RemoteIdentityClaims claims, Instant now) {
    return new CredentialRecord(identity, payload.ciphertext(), payload.iv(), payload.salt(),
        now, now, now, ValidationStatus.VALID, claims);
  }

  /**
   * The encrypted credential in the form {@code EnvelopeEncryptor} consumes.
   *
   * @return the payload
   */
  public EncryptedPayload payload() {
    return new EncryptedPayload(ciphertext, iv, salt);
  }

  /**
   * Copy with a re-encrypted credential; status drops back to pending until revalidated.
   *
   * @param payload the new payload
   * @param now     the time of the change
   * @return the copy
   */
  public CredentialRecord withPayload(EncryptedPayload payload, Instant now) {
    return new CredentialRecord(identity, payload.ciphertext(), payload.iv(), payload.salt(),
        registeredAt, now, lastValidatedAt, ValidationStatus.PENDING, remoteIdentityClaims);
  }

  /**
   * Copy with a new validation outcome.
   *
   * @param status the status
   * @param claims new claims, or null to keep the current ones
   * @param now    the validation time
   * @return the copy
   */
  public CredentialRecord withValidation(ValidationStatus status, RemoteIdentityClaims claims,
                                         Instant now) {
    return new CredentialRecord(identity, ciphertext, iv, salt, registeredAt, lastUsedAt, now,
        status, claims != null ? claims : remoteIdentityClaims);
  }

  /**
   * Copy with a new last-used time.
   *
   * @param now the time
   * @return the copy
   */
  public CredentialRecord withLastUsed(Instant now) {
    return new CredentialRecord(identity, ciphertext, iv, salt, registeredAt, now,
        lastValidatedAt, validationStatus, remoteIdentityClaims);
  }

  @Override
  public String toString() {
    return "CredentialRecord[identity=" + identity
        + ", registeredAt=" + registeredAt
        + ", lastUsedAt=" + lastUsedAt
        + ", lastValidatedAt=" + lastValidatedAt
        + ", validationStatus=" + validationStatus
        + ", remoteIdentityClaims=" + remoteIdentityClaims + "]";
  }
}
