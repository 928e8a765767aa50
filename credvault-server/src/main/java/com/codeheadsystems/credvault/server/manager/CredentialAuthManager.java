package com.codeheadsystems.credvault.server.manager;

import com.codeheadsystems.credvault.crypto.EncryptedPayload;
import com.codeheadsystems.credvault.crypto.EnvelopeEncryptor;
import com.codeheadsystems.credvault.crypto.exception.DecryptionException;
import com.codeheadsystems.credvault.crypto.exception.EncryptionException;
import com.codeheadsystems.credvault.server.exception.StorageException;
import com.codeheadsystems.credvault.server.exception.ValidationRejectedException;
import com.codeheadsystems.credvault.server.exception.ValidationUnavailableException;
import com.codeheadsystems.credvault.server.model.AuditEvent;
import com.codeheadsystems.credvault.server.model.AuditEventType;
import com.codeheadsystems.credvault.server.model.AuthResult;
import com.codeheadsystems.credvault.server.model.CredentialRecord;
import com.codeheadsystems.credvault.server.model.RegisterResult;
import com.codeheadsystems.credvault.server.model.RemoteIdentityClaims;
import com.codeheadsystems.credvault.server.model.StatusView;
import com.codeheadsystems.credvault.server.model.ValidationStatus;
import com.codeheadsystems.credvault.server.remote.RemoteServiceClient;
import com.codeheadsystems.credvault.server.remote.RemoteServiceClientFactory;
import com.codeheadsystems.credvault.server.store.CredentialStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service that registers, authenticates and unregisters per-identity API
 * credentials.
 * <p>
 * Credentials are validated against the remote service before they are stored and again on
 * every authentication. They are kept only in encrypted form, bound to their identity.
 * <p>
 * <strong>Error contract</strong>: {@link #register} and {@link #authenticate} never throw for
 * remote, crypto or storage failures; those become typed failures on the result.
 * {@link #unregister} propagates {@link StorageException}. Blank identities or credentials are
 * programming errors and raise {@link IllegalArgumentException}.
 */
public class CredentialAuthManager {

  private static final Logger log = LoggerFactory.getLogger(CredentialAuthManager.class);

  static final String MSG_REGISTER_REJECTED = "Invalid API key. Please check your key and try "
      + "again. Make sure you copied the entire key from the Tembo dashboard.";
  static final String MSG_REGISTER_UNAVAILABLE = "Could not reach Tembo to validate your API key. "
      + "Please try again in a few minutes.";
  static final String MSG_REGISTER_ENCRYPT = "Failed to encrypt your API key. Please try again "
      + "or contact support.";
  static final String MSG_REGISTER_INTERNAL = "An unexpected error occurred while registering "
      + "your API key. Please try again.";
  static final String MSG_AUTH_UNREADABLE = "Failed to decrypt your API key. Please register it "
      + "again.";
  static final String MSG_AUTH_REJECTED = "Your API key is invalid or expired. Please register "
      + "a new one.";
  static final String MSG_AUTH_UNAVAILABLE = "Failed to validate your API key. Please try again "
      + "later.";
  static final String MSG_AUTH_INTERNAL = "An unexpected error occurred during authentication.";

  static final String META_REMOTE_USER_ID = "remoteUserId";
  static final String META_REASON = "reason";
  static final String REASON_DECRYPTION_FAILED = "decryption_failed";
  static final String REASON_CREDENTIAL_REJECTED = "credential_rejected";
  static final String REASON_STATUS_WRITE_FAILED = "validation_status_write_failed";

  private final EnvelopeEncryptor encryptor;
  private final CredentialStore credentialStore;
  private final RemoteServiceClientFactory clientFactory;
  private final Clock clock;

  public CredentialAuthManager(EnvelopeEncryptor encryptor,
                               CredentialStore credentialStore,
                               RemoteServiceClientFactory clientFactory) {
    this(encryptor, credentialStore, clientFactory, Clock.systemUTC());
  }

  public CredentialAuthManager(EnvelopeEncryptor encryptor,
                               CredentialStore credentialStore,
                               RemoteServiceClientFactory clientFactory,
                               Clock clock) {
    this.encryptor = encryptor;
    this.credentialStore = credentialStore;
    this.clientFactory = clientFactory;
    this.clock = clock;
  }

  // ── Registration ─────────────────────────────────────────────────────────

  /**
   * Validates a credential with the remote service, then stores it encrypted for the identity.
   * Replaces any credential the identity already has.
   *
   * @param identity   the owner
   * @param credential the plaintext API credential
   * @return success with the remote claims, or a typed failure; storage is untouched unless
   *     validation succeeded
   * @throws IllegalArgumentException if either argument is blank
   */
  public RegisterResult register(String identity, String credential) {
    log.debug("register({})", identity);
    requireNonBlank(identity, "identity");
    requireNonBlank(credential, "credential");

    RemoteIdentityClaims claims;
    try {
      claims = clientFactory.create(credential).currentUser();
    } catch (ValidationRejectedException e) {
      log.warn("Credential rejected by remote service for {}", identity);
      return RegisterResult.failed(RegisterResult.Failure.REJECTED, MSG_REGISTER_REJECTED);
    } catch (ValidationUnavailableException e) {
      log.warn("Remote validation unavailable for {}: {}", identity, e.getMessage());
      return RegisterResult.failed(RegisterResult.Failure.UNAVAILABLE, MSG_REGISTER_UNAVAILABLE);
    } catch (RuntimeException e) {
      // exception messages from the client may quote the credential
      log.error("Unexpected validation failure for {}: {}", identity, e.getClass().getName());
      return RegisterResult.failed(RegisterResult.Failure.INTERNAL_ERROR, MSG_REGISTER_INTERNAL);
    }
    if (claims == null || !claims.isComplete()) {
      log.warn("Remote service returned incomplete identity claims for {}", identity);
      return RegisterResult.failed(RegisterResult.Failure.REJECTED, MSG_REGISTER_REJECTED);
    }
    log.info("Credential validated for {} (remote user {})", identity, claims.userId());

    EncryptedPayload payload;
    try {
      payload = encryptor.encrypt(credential, identity);
    } catch (EncryptionException e) {
      log.error("Failed to encrypt credential for {}", identity, e);
      return RegisterResult.failed(RegisterResult.Failure.INTERNAL_ERROR, MSG_REGISTER_ENCRYPT);
    }

    try {
      if (credentialStore.getRecord(identity).isPresent()) {
        if (!replace(identity, payload, claims)) {
          return RegisterResult.failed(
              RegisterResult.Failure.INTERNAL_ERROR, MSG_REGISTER_INTERNAL);
        }
        log.info("Credential updated for {}", identity);
      } else if (insert(identity, payload, claims)) {
        credentialStore.appendAuditEvent(
            new AuditEvent(identity, AuditEventType.REGISTER, now(),
                Map.of(META_REMOTE_USER_ID, claims.userId())));
        log.info("New credential registered for {}", identity);
      } else {
        // lost an insert race with a concurrent registration; last writer wins
        if (!replace(identity, payload, claims)) {
          return RegisterResult.failed(
              RegisterResult.Failure.INTERNAL_ERROR, MSG_REGISTER_INTERNAL);
        }
        log.info("Credential updated for {} after concurrent registration", identity);
      }
    } catch (StorageException e) {
      log.error("Failed to store credential for {}", identity, e);
      return RegisterResult.failed(RegisterResult.Failure.INTERNAL_ERROR, MSG_REGISTER_INTERNAL);
    }
    return RegisterResult.succeeded(claims);
  }

  /**
   * Overwrites the stored ciphertext and marks it valid, auditing the update.
   *
   * @return false when the new ciphertext was stored but its status could not be set, leaving
   *     the record pending
   * @throws StorageException if the ciphertext itself could not be written
   */
  private boolean replace(String identity, EncryptedPayload payload, RemoteIdentityClaims claims) {
    credentialStore.updateCiphertext(identity, payload);
    try {
      credentialStore.updateValidationStatus(identity, ValidationStatus.VALID, claims);
    } catch (StorageException e) {
      log.error("New credential for {} is stored but left pending: status update failed",
          identity, e);
      credentialStore.appendAuditEvent(new AuditEvent(identity, AuditEventType.UPDATE, now(),
          Map.of(META_REMOTE_USER_ID, claims.userId(), META_REASON, REASON_STATUS_WRITE_FAILED)));
      return false;
    }
    credentialStore.appendAuditEvent(new AuditEvent(identity, AuditEventType.UPDATE, now(),
        Map.of(META_REMOTE_USER_ID, claims.userId())));
    return true;
  }

  /**
   * Inserts a fresh record.
   *
   * @return false when the insert failed because a record appeared concurrently
   * @throws StorageException for any other storage failure
   */
  private boolean insert(String identity, EncryptedPayload payload, RemoteIdentityClaims claims) {
    try {
      credentialStore.insertRecord(CredentialRecord.newlyValidated(identity, payload, claims, now()));
      return true;
    } catch (StorageException e) {
      if (credentialStore.getRecord(identity).isPresent()) {
        log.debug("Record for {} appeared during registration", identity);
        return false;
      }
      throw e;
    }
  }

  /**
   * Removes the identity's credential and records the removal. Removing an identity that was
   * never registered is not an error.
   *
   * @param identity the owner
   * @throws StorageException if the delete fails
   */
  public void unregister(String identity) {
    log.debug("unregister({})", identity);
    requireNonBlank(identity, "identity");
    credentialStore.deleteRecord(identity);
    credentialStore.appendAuditEvent(AuditEvent.of(identity, AuditEventType.UNREGISTER, now()));
    log.info("Credential unregistered for {}", identity);
  }

  // ── Authentication ───────────────────────────────────────────────────────

  /**
   * Decrypts the identity's credential, revalidates it with the remote service and returns a
   * client bound to it.
   *
   * @param identity the owner
   * @return the outcome; a remote rejection also marks the stored credential invalid
   * @throws IllegalArgumentException if the identity is blank
   */
  public AuthResult authenticate(String identity) {
    log.debug("authenticate({})", identity);
    requireNonBlank(identity, "identity");

    Optional<CredentialRecord> record;
    try {
      record = credentialStore.getRecord(identity);
    } catch (StorageException e) {
      log.error("Failed to load credential for {}", identity, e);
      return AuthResult.failed(AuthResult.Failure.INTERNAL_ERROR, MSG_AUTH_INTERNAL);
    }
    if (record.isEmpty()) {
      log.info("Identity {} is not registered", identity);
      return AuthResult.notRegistered();
    }

    String credential;
    try {
      credential = encryptor.decrypt(record.get().payload(), identity);
    } catch (DecryptionException e) {
      log.error("Failed to decrypt credential for {}", identity, e);
      credentialStore.appendAuditEvent(new AuditEvent(identity, AuditEventType.AUTH_FAILURE, now(),
          Map.of(META_REASON, REASON_DECRYPTION_FAILED)));
      return AuthResult.failed(AuthResult.Failure.UNREADABLE, MSG_AUTH_UNREADABLE);
    }

    RemoteServiceClient client;
    RemoteIdentityClaims claims;
    try {
      client = clientFactory.create(credential);
      claims = client.currentUser();
    } catch (ValidationRejectedException e) {
      log.warn("Stored credential for {} was rejected by the remote service", identity);
      return invalidate(identity);
    } catch (ValidationUnavailableException e) {
      log.warn("Remote validation unavailable for {}: {}", identity, e.getMessage());
      return AuthResult.failed(AuthResult.Failure.UNAVAILABLE, MSG_AUTH_UNAVAILABLE);
    } catch (RuntimeException e) {
      // exception messages from the client may quote the credential
      log.error("Unexpected validation failure for {}: {}", identity, e.getClass().getName());
      return AuthResult.failed(AuthResult.Failure.INTERNAL_ERROR, MSG_AUTH_INTERNAL);
    }
    if (claims == null || !claims.isComplete()) {
      // not a rejection, so the stored status is left alone
      log.warn("Remote service returned incomplete identity claims for {}", identity);
      return AuthResult.failed(AuthResult.Failure.UNAVAILABLE, MSG_AUTH_UNAVAILABLE);
    }

    credentialStore.touchLastUsed(identity);
    log.info("Identity {} authenticated", identity);
    return AuthResult.authenticated(client);
  }

  private AuthResult invalidate(String identity) {
    try {
      credentialStore.updateValidationStatus(identity, ValidationStatus.INVALID, null);
    } catch (StorageException e) {
      log.error("Failed to mark credential invalid for {}", identity, e);
    }
    credentialStore.appendAuditEvent(new AuditEvent(identity, AuditEventType.AUTH_FAILURE, now(),
        Map.of(META_REASON, REASON_CREDENTIAL_REJECTED)));
    return AuthResult.failed(AuthResult.Failure.REJECTED, MSG_AUTH_REJECTED);
  }

  // ── Status ───────────────────────────────────────────────────────────────

  /**
   * Whether the identity has a stored credential, regardless of its validation status.
   *
   * @param identity the owner
   * @return true when a record exists
   * @throws IllegalArgumentException if the identity is blank
   * @throws StorageException if the store cannot be read
   */
  public boolean isRegistered(String identity) {
    log.debug("isRegistered({})", identity);
    requireNonBlank(identity, "identity");
    return credentialStore.getRecord(identity).isPresent();
  }

  /**
   * Status view of the identity's credential.
   *
   * @param identity the owner
   * @return the view, never null
   * @throws IllegalArgumentException if the identity is blank
   * @throws StorageException if the store cannot be read
   */
  public StatusView getStatus(String identity) {
    log.debug("getStatus({})", identity);
    requireNonBlank(identity, "identity");
    return credentialStore.getStatus(identity);
  }

  /**
   * Number of registered identities, 0 when the store cannot say.
   *
   * @return the count
   */
  public long registeredCount() {
    return credentialStore.countRecords();
  }

  private Instant now() {
    return Instant.ofEpochMilli(clock.millis());
  }

  private static void requireNonBlank(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }
}
