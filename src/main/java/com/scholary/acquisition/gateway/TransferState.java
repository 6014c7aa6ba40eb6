package com.scholary.acquisition.gateway;

import java.util.Locale;

/**
 * Lifecycle tags a transfer can carry.
 *
 * <p>The gateway reports several tags at once ("Completed, Succeeded", "Queued, Remotely"), and
 * this service adds its own import tags on top, so a transfer holds a list of these rather than a
 * single value. {@link #precedence()} decides which tag drives user-visible classification:
 * failure tags outrank import tags, which outrank transfer progress.
 */
public enum TransferState {
  REQUESTED("Requested", Category.ACTIVE, 10),
  QUEUED("Queued", Category.ACTIVE, 20),
  INITIALIZING("Initializing", Category.ACTIVE, 30),
  IN_PROGRESS("InProgress", Category.ACTIVE, 40),
  COMPLETED("Completed", Category.SUCCESS, 50),
  SUCCEEDED("Succeeded", Category.SUCCESS, 51),
  IMPORTING("Importing", Category.ACTIVE, 60),
  IMPORTED("Imported", Category.IMPORT_DONE, 70),
  IMPORT_SKIPPED("ImportSkipped", Category.IMPORT_DONE, 71),
  CANCELLED("Cancelled", Category.FAILURE, 80),
  ABORTED("Aborted", Category.FAILURE, 81),
  REJECTED("Rejected", Category.FAILURE, 82),
  TIMED_OUT("TimedOut", Category.FAILURE, 83),
  ERRORED("Errored", Category.FAILURE, 90),
  IMPORT_FAILED("ImportFailed", Category.FAILURE, 95),
  LOCALLY("Locally", Category.QUALIFIER, 0),
  REMOTELY("Remotely", Category.QUALIFIER, 0),
  UNKNOWN("Unknown", Category.QUALIFIER, 1);

  enum Category {
    ACTIVE,
    SUCCESS,
    IMPORT_DONE,
    FAILURE,
    QUALIFIER
  }

  private final String tag;
  private final Category category;
  private final int precedence;

  TransferState(String tag, Category category, int precedence) {
    this.tag = tag;
    this.category = category;
    this.precedence = precedence;
  }

  /** Gateway spelling of this tag. */
  public String tag() {
    return tag;
  }

  public int precedence() {
    return precedence;
  }

  public boolean isFailure() {
    return category == Category.FAILURE;
  }

  public boolean isSuccess() {
    return category == Category.SUCCESS;
  }

  public boolean isImportDone() {
    return category == Category.IMPORT_DONE;
  }

  /** Case-insensitive lookup by gateway spelling; unrecognised tags map to {@link #UNKNOWN}. */
  public static TransferState fromTag(String raw) {
    if (raw == null) {
      return UNKNOWN;
    }
    String wanted = raw.trim().toLowerCase(Locale.ROOT);
    for (TransferState state : values()) {
      if (state.tag.toLowerCase(Locale.ROOT).equals(wanted)) {
        return state;
      }
    }
    return UNKNOWN;
  }
}
