package com.codeheadsystems.credvault.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.credvault.server.exception.StorageException;
import com.codeheadsystems.credvault.server.store.CredentialStore;

/**
 * Health check that verifies the credential store answers a primary-key read.
 */
public class CredentialStoreHealthCheck extends HealthCheck {

  static final String PROBE_IDENTITY = "__credvault_health_probe__";

  private final CredentialStore credentialStore;

  /**
   * Instantiates a new Credential store health check.
   *
   * @param credentialStore the store
   */
  public CredentialStoreHealthCheck(CredentialStore credentialStore) {
    this.credentialStore = credentialStore;
  }

  @Override
  protected Result check() {
    try {
      credentialStore.getRecord(PROBE_IDENTITY);
    } catch (StorageException e) {
      return Result.unhealthy(e);
    }
    return Result.healthy("%d registered", credentialStore.countRecords());
  }
}
