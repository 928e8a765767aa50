package com.codeheadsystems.credvault.server.model;

import com.codeheadsystems.credvault.server.remote.RemoteServiceClient;

/**
 * Outcome of an authentication attempt.
 * <p>
 * On {@link Outcome#AUTHENTICATED} the result carries a client already bound to the decrypted
 * credential. {@link Outcome#NOT_REGISTERED} tells the caller to start onboarding.
 *
 * @param outcome the outcome
 * @param client  the ready-to-use client, authenticated outcomes only
 * @param failure the failure reason, failed outcomes only
 * @param message user-facing explanation, failed outcomes only
 */
public record AuthResult(Outcome outcome, RemoteServiceClient client, Failure failure,
                         String message) {

  public enum Outcome {
    AUTHENTICATED,
    NOT_REGISTERED,
    FAILED
  }

  public enum Failure {
    /**
     * The stored credential could not be decrypted; the user must register again.
     */
    UNREADABLE,
    /**
     * The remote service no longer accepts the credential; the user must register again.
     */
    REJECTED,
    /**
     * The remote service could not be reached; retrying later may succeed.
     */
    UNAVAILABLE,
    INTERNAL_ERROR
  }

  public static AuthResult authenticated(RemoteServiceClient client) {
    return new AuthResult(Outcome.AUTHENTICATED, client, null, null);
  }

  public static AuthResult notRegistered() {
    return new AuthResult(Outcome.NOT_REGISTERED, null, null, null);
  }

  public static AuthResult failed(Failure failure, String message) {
    return new AuthResult(Outcome.FAILED, null, failure, message);
  }

  public boolean isAuthenticated() {
    return outcome == Outcome.AUTHENTICATED;
  }

  public boolean requiresOnboarding() {
    return outcome == Outcome.NOT_REGISTERED;
  }
}
