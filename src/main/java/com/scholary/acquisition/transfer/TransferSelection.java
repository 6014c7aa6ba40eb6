package com.scholary.acquisition.transfer;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/** A file the user picked from search results. */
public record TransferSelection(
    @NotBlank String username, @NotBlank String filename, @PositiveOrZero long size) {}
