package com.codeheadsystems.credvault.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.credvault.server.manager.CredentialAuthManager;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Runs {@link CredVaultBundle} without a database block, falling back to the in-memory store.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class InMemoryBundleIntegrationTest {

  static final DropwizardAppExtension<CredVaultConfiguration> APP =
      new DropwizardAppExtension<>(
          CredVaultTestApplication.class,
          ResourceHelpers.resourceFilePath("test-config-memory.yml"));

  @Test
  void healthCheckReportsInMemoryStore() {
    Response response = APP.client()
        .target(String.format("http://localhost:%d/healthcheck", APP.getAdminPort()))
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.readEntity(String.class)).contains("credential-store");
  }

  @Test
  void registeredCountTracksRegistrations() {
    CredVaultTestApplication application = APP.getApplication();
    CredentialAuthManager manager = application.getBundle().getAuthManager();
    long before = manager.registeredCount();

    manager.register("mem-user", "k-abc");

    assertThat(manager.registeredCount()).isEqualTo(before + 1);
  }
}
