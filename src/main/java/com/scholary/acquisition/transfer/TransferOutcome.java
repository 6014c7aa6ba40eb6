package com.scholary.acquisition.transfer;

/** Submission result for one selected file. {@code error} is null when the gateway queued it. */
public record TransferOutcome(String username, String filename, long size, String error) {

  public boolean isAccepted() {
    return error == null;
  }
}
