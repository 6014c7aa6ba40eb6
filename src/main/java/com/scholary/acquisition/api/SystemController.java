package com.scholary.acquisition.api;

import com.scholary.acquisition.api.SystemStatusResponse.ComponentStatus;
import com.scholary.acquisition.registry.ServiceRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Reports whether the gateway and the importer are usable. */
@RestController
@Tag(name = "System", description = "Backend health")
public class SystemController {

  private final ServiceRegistry registry;

  public SystemController(ServiceRegistry registry) {
    this.registry = registry;
  }

  @GetMapping("/api/system/status")
  @Operation(summary = "System status", description = "Health check of every backend")
  public SystemStatusResponse status() {
    List<ComponentStatus> backends =
        registry.transferClients().stream()
            .map(c -> new ComponentStatus(c.id(), c.name(), c.checkConnectivity()))
            .toList();
    List<ComponentStatus> importers =
        registry.importers().stream()
            .map(i -> new ComponentStatus(i.id(), i.name(), i.healthCheck()))
            .toList();
    return new SystemStatusResponse(backends, importers);
  }
}
