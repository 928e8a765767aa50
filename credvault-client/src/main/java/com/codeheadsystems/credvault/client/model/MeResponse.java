package com.codeheadsystems.credvault.client.model;

import com.codeheadsystems.credvault.server.model.RemoteIdentityClaims;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code GET /me}. Older API versions send {@code organizationId} instead of
 * {@code orgId}.
 *
 * @param userId         the user id
 * @param orgId          the organization id
 * @param organizationId legacy organization id
 * @param email          the email
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MeResponse(@JsonProperty("userId") String userId,
                         @JsonProperty("orgId") String orgId,
                         @JsonProperty("organizationId") String organizationId,
                         @JsonProperty("email") String email) {

  /**
   * Narrows the response to the claims the credential store trusts.
   *
   * @return the claims, possibly incomplete
   */
  public RemoteIdentityClaims toClaims() {
    return new RemoteIdentityClaims(userId, orgId != null ? orgId : organizationId, email);
  }
}
