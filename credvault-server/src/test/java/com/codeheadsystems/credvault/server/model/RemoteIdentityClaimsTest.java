package com.codeheadsystems.credvault.server.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RemoteIdentityClaimsTest {

  @ParameterizedTest
  @CsvSource(value = {
      "U1, O1, true",
      "U1, '', false",
      "'', O1, false",
      "'  ', O1, false",
      "NULL, O1, false",
      "U1, NULL, false"
  }, nullValues = "NULL")
  void isComplete_requiresUserAndOrg(String userId, String orgId, boolean expected) {
    assertThat(new RemoteIdentityClaims(userId, orgId, null).isComplete()).isEqualTo(expected);
  }
}
