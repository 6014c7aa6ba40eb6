package com.scholary.acquisition.importer;

/** What the cataloguing tool made of one import call. {@code reason} is null on success. */
public record ImportResult(Outcome outcome, String reason) {

  public enum Outcome {
    SUCCESS,
    SKIPPED,
    FAILED,
    TIMED_OUT
  }

  public static ImportResult success() {
    return new ImportResult(Outcome.SUCCESS, null);
  }

  public static ImportResult skipped(String reason) {
    return new ImportResult(Outcome.SKIPPED, reason);
  }

  public static ImportResult failed(String reason) {
    return new ImportResult(Outcome.FAILED, reason);
  }

  public static ImportResult timedOut(String reason) {
    return new ImportResult(Outcome.TIMED_OUT, reason);
  }
}
