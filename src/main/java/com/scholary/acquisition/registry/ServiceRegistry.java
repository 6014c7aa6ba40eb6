package com.scholary.acquisition.registry;

import com.scholary.acquisition.gateway.TransferClient;
import com.scholary.acquisition.importer.MusicImporter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Lookup of transfer backends and importers by id.
 *
 * <p>The first registered implementation of each kind is the default.
 */
@Component
public class ServiceRegistry {

  private final Map<String, TransferClient> transferClients;
  private final Map<String, MusicImporter> importers;

  public ServiceRegistry(List<TransferClient> transferClients, List<MusicImporter> importers) {
    this.transferClients = index(transferClients, TransferClient::id);
    this.importers = index(importers, MusicImporter::id);
  }

  /** Backend by id, or the default one when {@code id} is null. */
  public Optional<TransferClient> transferClient(String id) {
    return pick(transferClients, id);
  }

  /** Importer by id, or the default one when {@code id} is null. */
  public Optional<MusicImporter> importer(String id) {
    return pick(importers, id);
  }

  public List<TransferClient> transferClients() {
    return List.copyOf(transferClients.values());
  }

  public List<MusicImporter> importers() {
    return List.copyOf(importers.values());
  }

  private static <T> Map<String, T> index(List<T> services, Function<T, String> id) {
    Map<String, T> byId = new LinkedHashMap<>();
    for (T service : services) {
      if (byId.putIfAbsent(id.apply(service), service) != null) {
        throw new IllegalStateException("Duplicate service id: " + id.apply(service));
      }
    }
    return byId;
  }

  private static <T> Optional<T> pick(Map<String, T> services, String id) {
    if (id == null) {
      return services.values().stream().findFirst();
    }
    return Optional.ofNullable(services.get(id));
  }
}
