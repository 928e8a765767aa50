package com.codeheadsystems.credvault.dropwizard;

import com.codeheadsystems.credvault.client.TemboClientFactory;
import com.codeheadsystems.credvault.client.config.TemboClientConfig;
import com.codeheadsystems.credvault.crypto.EnvelopeEncryptor;
import com.codeheadsystems.credvault.dropwizard.health.CredentialStoreHealthCheck;
import com.codeheadsystems.credvault.dropwizard.health.EncryptionHealthCheck;
import com.codeheadsystems.credvault.server.manager.CredentialAuthManager;
import com.codeheadsystems.credvault.server.remote.RemoteServiceClientFactory;
import com.codeheadsystems.credvault.server.store.CredentialSchemaMigrator;
import com.codeheadsystems.credvault.server.store.CredentialStore;
import com.codeheadsystems.credvault.server.store.InMemoryCredentialStore;
import com.codeheadsystems.credvault.server.store.JdbcCredentialStore;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.db.DataSourceFactory;
import io.dropwizard.db.ManagedDataSource;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.URI;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Dropwizard bundle that wires the credential vault into an existing Dropwizard application.
 * <p>
 * Builds the envelope encryptor from {@code masterKeyBase64}, the credential store, the Tembo
 * validation client and the {@link CredentialAuthManager}, and registers health checks.
 * Requires a {@link CredVaultConfiguration} block in the application's YAML config.
 * <p>
 * Embed with the store chosen by configuration (JDBC when {@code database} is set):
 * <pre>{@code
 *   bootstrap.addBundle(new CredVaultBundle<>());
 * }</pre>
 * <p>
 * Or supply your own collaborators:
 * <pre>{@code
 *   bootstrap.addBundle(new CredVaultBundle<>(myCredentialStore, myClientFactory));
 * }</pre>
 * The manager is available from {@link #getAuthManager()} once the application is running.
 */
@Singleton
public class CredVaultBundle<C extends CredVaultConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(CredVaultBundle.class);

  private final CredentialStore suppliedStore;
  private final RemoteServiceClientFactory suppliedClientFactory;

  private volatile CredentialAuthManager authManager;

  /**
   * Store from configuration, Tembo client from configuration.
   */
  public CredVaultBundle() {
    this(null, null);
  }

  /**
   * Store from configuration, caller-supplied validation client.
   *
   * @param clientFactory the validation client factory
   */
  public CredVaultBundle(RemoteServiceClientFactory clientFactory) {
    this(null, clientFactory);
  }

  /**
   * Caller-supplied collaborators. A null argument falls back to configuration.
   *
   * @param credentialStore the store
   * @param clientFactory   the validation client factory
   */
  @Inject
  public CredVaultBundle(CredentialStore credentialStore,
                         RemoteServiceClientFactory clientFactory) {
    this.suppliedStore = credentialStore;
    this.suppliedClientFactory = clientFactory;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // nothing to bootstrap
  }

  @Override
  public void run(C configuration, Environment environment) {
    EnvelopeEncryptor encryptor = EnvelopeEncryptor.fromBase64(configuration.getMasterKeyBase64());
    CredentialStore credentialStore = suppliedStore != null
        ? suppliedStore
        : buildStore(configuration, environment);
    RemoteServiceClientFactory clientFactory = suppliedClientFactory != null
        ? suppliedClientFactory
        : TemboClientFactory.create(new TemboClientConfig(
            URI.create(configuration.getTemboBaseUrl()),
            configuration.getValidationTimeout().toJavaDuration()));

    authManager = new CredentialAuthManager(encryptor, credentialStore, clientFactory);
    environment.healthChecks().register("credential-store",
        new CredentialStoreHealthCheck(credentialStore));
    environment.healthChecks().register("envelope-encryption",
        new EncryptionHealthCheck(encryptor));
    log.info("Credential vault ready ({})", credentialStore.getClass().getSimpleName());
  }

  /**
   * The manager built in {@link #run}.
   *
   * @return the manager
   * @throws IllegalStateException if the bundle has not run yet
   */
  public CredentialAuthManager getAuthManager() {
    CredentialAuthManager manager = authManager;
    if (manager == null) {
      throw new IllegalStateException("CredVaultBundle has not been run yet");
    }
    return manager;
  }

  private CredentialStore buildStore(C configuration, Environment environment) {
    DataSourceFactory database = configuration.getDatabase();
    if (database == null) {
      log.warn("""
          #################################################################
          # WARNING: No database configured. Credentials are kept in      #
          # memory and will be lost on restart. Do not use in production. #
          #################################################################
          """);
      return new InMemoryCredentialStore();
    }
    ManagedDataSource dataSource = database.build(environment.metrics(), "credvault");
    environment.lifecycle().manage(dataSource);
    new CredentialSchemaMigrator(dataSource).migrate();
    return new JdbcCredentialStore(new JdbcTemplate(dataSource), environment.getObjectMapper(),
        Clock.systemUTC());
  }
}
