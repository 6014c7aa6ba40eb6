package com.scholary.acquisition.api;

import com.scholary.acquisition.transfer.TransferSelection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/** Files to download and the library folder to import them into. */
public record DownloadRequest(
    @NotEmpty List<@Valid TransferSelection> items, @NotBlank String targetFolder) {}
