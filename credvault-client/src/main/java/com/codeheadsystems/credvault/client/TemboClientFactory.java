package com.codeheadsystems.credvault.client;

import com.codeheadsystems.credvault.client.accessor.TemboAccessor;
import com.codeheadsystems.credvault.client.config.TemboClientConfig;
import com.codeheadsystems.credvault.server.remote.RemoteServiceClient;
import com.codeheadsystems.credvault.server.remote.RemoteServiceClientFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.http.HttpClient;

/**
 * Creates {@link TemboClient}s sharing one {@link TemboAccessor}. No network I/O happens until
 * the returned client is used.
 */
@Singleton
public class TemboClientFactory implements RemoteServiceClientFactory {

  private final TemboAccessor accessor;

  @Inject
  public TemboClientFactory(TemboAccessor accessor) {
    this.accessor = accessor;
  }

  /**
   * Factory with its own HTTP client and object mapper.
   *
   * @param config the API location and timeout
   * @return the factory
   */
  public static TemboClientFactory create(TemboClientConfig config) {
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(config.requestTimeout())
        .build();
    return new TemboClientFactory(new TemboAccessor(httpClient, new ObjectMapper(), config));
  }

  @Override
  public RemoteServiceClient create(String credential) {
    return new TemboClient(accessor, credential);
  }
}
