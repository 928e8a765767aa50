package com.codeheadsystems.credvault.server.model;

/**
 * Who the remote service says a credential belongs to.
 * <p>
 * Narrowed from the loosely typed remote response at the client boundary. Only complete
 * claims ({@link #isComplete()}) are trusted.
 *
 * @param userId the remote user id
 * @param orgId  the remote organization id
 * @param email  the remote email, optional
 */
public record RemoteIdentityClaims(String userId, String orgId, String email) {

  /**
   * True when both the user id and organization id are present and non-blank.
   *
   * @return whether the claims identify a remote account
   */
  public boolean isComplete() {
    return userId != null && !userId.isBlank() && orgId != null && !orgId.isBlank();
  }
}
