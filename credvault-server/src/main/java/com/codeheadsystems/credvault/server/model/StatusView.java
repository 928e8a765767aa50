package com.codeheadsystems.credvault.server.model;

import java.time.Instant;

/**
 * Read-only projection of a credential record for status display. Unknown identities get an
 * explicit {@link #notRegistered(String)} view rather than an error.
 *
 * @param registered           whether a record exists
 * @param identity             the identity asked about
 * @param registeredAt         null when not registered
 * @param lastUsedAt           null when not registered
 * @param lastValidatedAt      null when not registered or never validated
 * @param validationStatus     null when not registered
 * @param remoteIdentityClaims null when not registered or unknown
 */
public record StatusView(
    boolean registered,
    String identity,
    Instant registeredAt,
    Instant lastUsedAt,
    Instant lastValidatedAt,
    ValidationStatus validationStatus,
    RemoteIdentityClaims remoteIdentityClaims) {

  public static StatusView notRegistered(String identity) {
    return new StatusView(false, identity, null, null, null, null, null);
  }

  public static StatusView of(CredentialRecord record) {
    return new StatusView(true, record.identity(), record.registeredAt(), record.lastUsedAt(),
        record.lastValidatedAt(), record.validationStatus(), record.remoteIdentityClaims());
  }

  /**
   * Remote user id, when known.
   *
   * @return the remote user id or null
   */
  public String remoteUserId() {
    return remoteIdentityClaims == null ? null : remoteIdentityClaims.userId();
  }
}
