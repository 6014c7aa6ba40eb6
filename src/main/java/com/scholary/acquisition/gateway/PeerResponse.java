package com.scholary.acquisition.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** A single peer's answer to a search: its files plus its current upload capacity. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PeerResponse(
    String username,
    List<PeerFile> files,
    boolean hasFreeUploadSlot,
    int uploadSpeed,
    int queueLength) {

  public PeerResponse {
    files = files == null ? List.of() : List.copyOf(files);
  }
}
