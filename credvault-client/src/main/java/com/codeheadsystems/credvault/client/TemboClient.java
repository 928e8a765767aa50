package com.codeheadsystems.credvault.client;

import com.codeheadsystems.credvault.client.accessor.TemboAccessor;
import com.codeheadsystems.credvault.server.model.RemoteIdentityClaims;
import com.codeheadsystems.credvault.server.remote.RemoteServiceClient;

/**
 * A {@link RemoteServiceClient} bound to one Tembo API key.
 */
public class TemboClient implements RemoteServiceClient {

  private final TemboAccessor accessor;
  private final String credential;

  public TemboClient(TemboAccessor accessor, String credential) {
    this.accessor = accessor;
    this.credential = credential;
  }

  @Override
  public RemoteIdentityClaims currentUser() {
    return accessor.currentUser(credential);
  }

  @Override
  public String toString() {
    return "TemboClient[credential=<redacted>]";
  }
}
