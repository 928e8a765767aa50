package com.codeheadsystems.credvault.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.credvault.client.accessor.TemboAccessor;
import com.codeheadsystems.credvault.client.config.TemboClientConfig;
import com.codeheadsystems.credvault.server.model.RemoteIdentityClaims;
import com.codeheadsystems.credvault.server.remote.RemoteServiceClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TemboClientFactoryTest {

  @Mock private TemboAccessor accessor;

  @Test
  void create_doesNoNetworkIo() {
    new TemboClientFactory(accessor).create("k-abc");

    verifyNoInteractions(accessor);
  }

  @Test
  void client_delegatesWithBoundCredential() {
    RemoteIdentityClaims claims = new RemoteIdentityClaims("U1", "O1", null);
    when(accessor.currentUser("k-abc")).thenReturn(claims);

    RemoteServiceClient client = new TemboClientFactory(accessor).create("k-abc");

    assertThat(client.currentUser()).isEqualTo(claims);
    verify(accessor).currentUser("k-abc");
    assertThat(client.toString()).doesNotContain("k-abc");
  }

  @Test
  void create_fromConfig_buildsFactory() {
    assertThat(TemboClientFactory.create(TemboClientConfig.defaults())).isNotNull();
  }
}
