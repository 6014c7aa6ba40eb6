package com.scholary.acquisition.api;

import java.util.List;

/** Health of every registered backend and importer. */
public record SystemStatusResponse(
    List<ComponentStatus> transferBackends, List<ComponentStatus> importers) {

  public record ComponentStatus(String id, String name, boolean healthy) {}
}
