package com.codeheadsystems.credvault.dropwizard;

import com.codeheadsystems.credvault.server.exception.ValidationRejectedException;
import com.codeheadsystems.credvault.server.model.RemoteIdentityClaims;
import com.codeheadsystems.credvault.server.remote.RemoteServiceClientFactory;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Minimal Dropwizard application used only in integration tests.
 * <p>
 * Validation is stubbed: any credential starting with {@code revoked-} is rejected, every
 * other credential belongs to remote user {@code U1} in organization {@code O1}.
 */
public class CredVaultTestApplication extends Application<CredVaultConfiguration> {

  static final RemoteIdentityClaims CLAIMS = new RemoteIdentityClaims("U1", "O1", "u1@example.com");

  static final RemoteServiceClientFactory STUB_FACTORY = credential -> () -> {
    if (credential.startsWith("revoked-")) {
      throw new ValidationRejectedException("Unauthorized");
    }
    return CLAIMS;
  };

  private final CredVaultBundle<CredVaultConfiguration> bundle = new CredVaultBundle<>(STUB_FACTORY);

  @Override
  public String getName() {
    return "credvault-test";
  }

  @Override
  public void initialize(Bootstrap<CredVaultConfiguration> bootstrap) {
    bootstrap.addBundle(bundle);
  }

  @Override
  public void run(CredVaultConfiguration configuration, Environment environment) {
    // everything is wired by the bundle
  }

  public CredVaultBundle<CredVaultConfiguration> getBundle() {
    return bundle;
  }
}
