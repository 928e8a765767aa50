package com.codeheadsystems.credvault.server.model;

/**
 * Outcome of a registration attempt. Never carries the credential.
 *
 * @param success whether the credential was validated and stored
 * @param claims  the validated remote identity, present on success only
 * @param failure the failure reason, present on failure only
 * @param message user-facing explanation of the failure, present on failure only
 */
public record RegisterResult(boolean success, RemoteIdentityClaims claims, Failure failure,
                             String message) {

  /**
   * Why a registration did not complete.
   */
  public enum Failure {
    /**
     * The remote service refused the credential, or returned incomplete identity claims.
     */
    REJECTED,
    /**
     * The remote service could not be reached or answered abnormally.
     */
    UNAVAILABLE,
    /**
     * Encryption or storage failed on our side.
     */
    INTERNAL_ERROR
  }

  public static RegisterResult succeeded(RemoteIdentityClaims claims) {
    return new RegisterResult(true, claims, null, null);
  }

  public static RegisterResult failed(Failure failure, String message) {
    return new RegisterResult(false, null, failure, message);
  }
}
