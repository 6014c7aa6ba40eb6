package com.scholary.acquisition.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning for the acquisition pipeline: search sessions, transfer submission and download
 * monitoring.
 *
 * <p>{@code downloadRoot} is where the gateway writes finished downloads, as seen from this
 * process. {@code albumMode} imports each finished batch as one album instead of file by file.
 */
@ConfigurationProperties(prefix = "acquisition")
@Validated
public record AcquisitionProperties(
    @NotBlank String downloadRoot,
    boolean albumMode,
    @Valid @NotNull Search search,
    @Valid @NotNull Transfer transfer,
    @Valid @NotNull Monitor monitor) {

  public record Search(
      @Positive int defaultTimeoutSeconds,
      @Positive int longPollSeconds,
      @Positive int pollRetryMillis,
      @Positive int maxResults,
      @DecimalMin("0.0") @DecimalMax("1.0") double minScore,
      @Positive int sessionRetentionMinutes) {}

  public record Transfer(
      @Positive int batchSize,
      @PositiveOrZero long batchDelayMillis,
      @PositiveOrZero int maxRetries,
      @PositiveOrZero long retryBaseDelayMillis) {}

  public record Monitor(
      @Positive int pollIntervalSeconds,
      @Positive int emptyPollGrace,
      @Positive int perTrackTimeoutMinutes) {}
}
