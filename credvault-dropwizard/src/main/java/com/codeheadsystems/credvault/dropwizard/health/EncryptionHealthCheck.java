package com.codeheadsystems.credvault.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.credvault.crypto.EncryptedPayload;
import com.codeheadsystems.credvault.crypto.EnvelopeEncryptor;
import com.codeheadsystems.credvault.crypto.exception.DecryptionException;
import com.codeheadsystems.credvault.crypto.exception.EncryptionException;

/**
 * Health check that runs an encrypt/decrypt round trip with the configured master secret.
 */
public class EncryptionHealthCheck extends HealthCheck {

  private static final String PROBE_IDENTITY = "health-check";
  private static final String PROBE_PLAINTEXT = "credvault-self-test";

  private final EnvelopeEncryptor encryptor;

  public EncryptionHealthCheck(EnvelopeEncryptor encryptor) {
    this.encryptor = encryptor;
  }

  @Override
  protected Result check() {
    try {
      EncryptedPayload payload = encryptor.encrypt(PROBE_PLAINTEXT, PROBE_IDENTITY);
      if (!PROBE_PLAINTEXT.equals(encryptor.decrypt(payload, PROBE_IDENTITY))) {
        return Result.unhealthy("Round trip returned different plaintext");
      }
    } catch (EncryptionException | DecryptionException e) {
      return Result.unhealthy(e);
    }
    return Result.healthy();
  }
}
