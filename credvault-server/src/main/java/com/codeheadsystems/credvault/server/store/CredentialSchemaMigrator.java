package com.codeheadsystems.credvault.server.store;

import com.codeheadsystems.credvault.server.exception.StorageException;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the credential tables to a database with Flyway. Idempotent: applied versions are
 * tracked in {@value #HISTORY_TABLE}, so repeated runs are no-ops.
 */
public class CredentialSchemaMigrator {

  private static final Logger log = LoggerFactory.getLogger(CredentialSchemaMigrator.class);

  public static final String LOCATION = "classpath:db/migration/credvault";
  public static final String HISTORY_TABLE = "credvault_schema_history";

  private final DataSource dataSource;

  public CredentialSchemaMigrator(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  /**
   * Runs pending migrations.
   *
   * @return the number of migrations applied
   * @throws StorageException if a migration fails
   */
  public int migrate() {
    log.debug("migrate()");
    try {
      MigrateResult result = Flyway.configure()
          .dataSource(dataSource)
          .locations(LOCATION)
          .table(HISTORY_TABLE)
          // the host application may already own tables in this schema
          .baselineOnMigrate(true)
          .baselineVersion("0")
          .load()
          .migrate();
      log.info("Applied {} credential schema migration(s)", result.migrationsExecuted);
      return result.migrationsExecuted;
    } catch (FlywayException e) {
      throw new StorageException("Credential schema migration failed", e);
    }
  }
}
