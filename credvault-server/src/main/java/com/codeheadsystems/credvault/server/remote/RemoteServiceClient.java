package com.codeheadsystems.credvault.server.remote;

import com.codeheadsystems.credvault.server.exception.ValidationRejectedException;
import com.codeheadsystems.credvault.server.exception.ValidationUnavailableException;
import com.codeheadsystems.credvault.server.model.RemoteIdentityClaims;

/**
 * A client of the remote task service bound to one credential.
 * <p>
 * Returned to callers of a successful authentication as the ready-to-use handle; the
 * credential it carries is never exposed back out of it.
 */
public interface RemoteServiceClient {

  /**
   * Asks the remote service who the bound credential belongs to. Doubles as validation.
   *
   * @return the claims reported by the remote service, possibly incomplete
   * @throws ValidationRejectedException    if the service refuses the credential
   * @throws ValidationUnavailableException if no trustworthy answer could be obtained,
   *                                        including timeouts
   */
  RemoteIdentityClaims currentUser();
}
