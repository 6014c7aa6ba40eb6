package com.scholary.acquisition.api;

import com.scholary.acquisition.transfer.TransferOutcome;
import java.util.List;

/** Per-file submission results. */
public record DownloadResponse(List<TransferOutcome> outcomes, long accepted, long failed) {

  static DownloadResponse of(List<TransferOutcome> outcomes) {
    long accepted = outcomes.stream().filter(TransferOutcome::isAccepted).count();
    return new DownloadResponse(outcomes, accepted, outcomes.size() - accepted);
  }
}
