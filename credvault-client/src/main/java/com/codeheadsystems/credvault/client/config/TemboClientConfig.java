package com.codeheadsystems.credvault.client.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Where the Tembo API lives and how long a validation call may take.
 *
 * @param baseUri        base URL of the API, without a trailing path
 * @param requestTimeout per-request timeout for validation calls
 */
public record TemboClientConfig(URI baseUri, Duration requestTimeout) {

  public static final URI DEFAULT_BASE_URI = URI.create("https://api.tembo.io");
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

  public TemboClientConfig {
    Objects.requireNonNull(baseUri, "baseUri");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
    if (requestTimeout.isZero() || requestTimeout.isNegative()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
  }

  /**
   * The public Tembo API with a 10 second timeout.
   *
   * @return the config
   */
  public static TemboClientConfig defaults() {
    return new TemboClientConfig(DEFAULT_BASE_URI, DEFAULT_REQUEST_TIMEOUT);
  }
}
