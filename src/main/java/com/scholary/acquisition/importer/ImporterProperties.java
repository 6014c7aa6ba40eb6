package com.scholary.acquisition.importer;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * How to run the beets executable.
 *
 * <p>{@code libraryFileName} is created inside each import target so duplicate detection is scoped
 * to that destination.
 */
@ConfigurationProperties(prefix = "importer")
@Validated
public record ImporterProperties(
    @NotBlank String command,
    @NotBlank String configPath,
    @Positive int timeoutSeconds,
    @NotBlank String libraryFileName) {}
