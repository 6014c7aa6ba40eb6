package com.scholary.acquisition.search;

/** Where a search session stands after a poll. */
public enum SearchState {
  IN_PROGRESS,
  COMPLETED,
  NOT_FOUND,
  TIMED_OUT
}
