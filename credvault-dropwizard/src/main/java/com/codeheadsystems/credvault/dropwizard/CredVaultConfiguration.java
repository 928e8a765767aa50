package com.codeheadsystems.credvault.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import io.dropwizard.db.DataSourceFactory;
import io.dropwizard.util.Duration;
import io.dropwizard.validation.MinDuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.concurrent.TimeUnit;

/**
 * Dropwizard configuration for the credential vault.
 * <p>
 * {@code masterKeyBase64} is the envelope-encryption master secret: at least 32 random bytes,
 * base64 encoded. Generate one with {@code openssl rand -base64 32}. Losing or changing it
 * makes every stored credential unreadable.
 * <p>
 * When {@code database} is omitted credentials are kept in memory and lost on restart
 * (dev/test only).
 */
public class CredVaultConfiguration extends Configuration {

  @NotEmpty
  private String masterKeyBase64;

  /**
   * Base URL of the Tembo API used to validate credentials.
   */
  @NotEmpty
  private String temboBaseUrl = "https://api.tembo.io";

  /**
   * Upper bound on one validation call.
   */
  @NotNull
  @MinDuration(value = 1, unit = TimeUnit.MILLISECONDS)
  private Duration validationTimeout = Duration.seconds(10);

  @Valid
  private DataSourceFactory database;

  @JsonProperty
  public String getMasterKeyBase64() {
    return masterKeyBase64;
  }

  @JsonProperty
  public void setMasterKeyBase64(String masterKeyBase64) {
    this.masterKeyBase64 = masterKeyBase64;
  }

  @JsonProperty
  public String getTemboBaseUrl() {
    return temboBaseUrl;
  }

  @JsonProperty
  public void setTemboBaseUrl(String temboBaseUrl) {
    this.temboBaseUrl = temboBaseUrl;
  }

  @JsonProperty
  public Duration getValidationTimeout() {
    return validationTimeout;
  }

  @JsonProperty
  public void setValidationTimeout(Duration validationTimeout) {
    this.validationTimeout = validationTimeout;
  }

  @JsonProperty
  public DataSourceFactory getDatabase() {
    return database;
  }

  @JsonProperty
  public void setDatabase(DataSourceFactory database) {
    this.database = database;
  }
}
