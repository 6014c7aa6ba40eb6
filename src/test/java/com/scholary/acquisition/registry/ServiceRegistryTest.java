package com.scholary.acquisition.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.scholary.acquisition.gateway.TransferClient;
import com.scholary.acquisition.importer.MusicImporter;
import java.util.List;
import org.junit.jupiter.api.Test;

class ServiceRegistryTest {

  @Test
  void lookup_byIdAndDefault() {
    TransferClient slskd = client("slskd");
    TransferClient other = client("other");
    MusicImporter beets = mock(MusicImporter.class);
    when(beets.id()).thenReturn("beets");

    ServiceRegistry registry = new ServiceRegistry(List.of(slskd, other), List.of(beets));

    assertThat(registry.transferClient(null)).contains(slskd);
    assertThat(registry.transferClient("other")).contains(other);
    assertThat(registry.transferClient("missing")).isEmpty();
    assertThat(registry.importer(null)).contains(beets);
    assertThat(registry.transferClients()).containsExactly(slskd, other);
  }

  @Test
  void duplicateIds_areRejected() {
    List<TransferClient> clients = List.of(client("slskd"), client("slskd"));

    assertThatThrownBy(() -> new ServiceRegistry(clients, List.of()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("slskd");
  }

  @Test
  void emptyRegistry_hasNoDefault() {
    ServiceRegistry registry = new ServiceRegistry(List.of(), List.of());

    assertThat(registry.transferClient(null)).isEmpty();
    assertThat(registry.importer(null)).isEmpty();
  }

  private static TransferClient client(String id) {
    TransferClient client = mock(TransferClient.class);
    when(client.id()).thenReturn(id);
    return client;
  }
}
