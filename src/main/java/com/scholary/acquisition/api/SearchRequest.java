package com.scholary.acquisition.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * Request to start a search.
 *
 * <p>{@code album} may be omitted for a track search. {@code timeoutSeconds} defaults to the
 * configured session lifetime.
 */
public record SearchRequest(
    @NotBlank String artist,
    String album,
    List<@NotBlank String> tracks,
    @Min(5) @Max(600) Integer timeoutSeconds) {

  public SearchRequest {
    if (tracks == null) {
      tracks = List.of();
    }
  }
}
