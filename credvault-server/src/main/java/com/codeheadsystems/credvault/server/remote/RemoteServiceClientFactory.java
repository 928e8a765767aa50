package com.codeheadsystems.credvault.server.remote;

/**
 * Creates {@link RemoteServiceClient} instances for plaintext credentials.
 */
@FunctionalInterface
public interface RemoteServiceClientFactory {

  /**
   * Binds a client to the given credential. Must not perform network I/O.
   *
   * @param credential the plaintext credential
   * @return the bound client
   */
  RemoteServiceClient create(String credential);
}
