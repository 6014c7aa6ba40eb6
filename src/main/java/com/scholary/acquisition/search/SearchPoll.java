package com.scholary.acquisition.search;

import java.util.List;

/**
 * Result of one poll. {@code groups} is empty when nothing new arrived during the long-poll
 * window; otherwise it is the complete, re-ranked set of groups so far.
 */
public record SearchPoll(List<AlbumGroup> groups, boolean hasMore, SearchState state) {

  public SearchPoll {
    groups = List.copyOf(groups);
  }

  static SearchPoll noNews() {
    return new SearchPoll(List.of(), true, SearchState.IN_PROGRESS);
  }

  static SearchPoll finished(SearchState state) {
    return new SearchPoll(List.of(), false, state);
  }
}
