package com.scholary.acquisition.api;

import com.scholary.acquisition.search.AlbumGroup;
import com.scholary.acquisition.search.SearchPoll;
import com.scholary.acquisition.search.SearchState;
import java.util.List;

/** Groups found so far and whether the client should keep polling. */
public record SearchPollResponse(
    String searchId, List<AlbumGroup> groups, boolean hasMore, SearchState state) {

  static SearchPollResponse of(String searchId, SearchPoll poll) {
    return new SearchPollResponse(searchId, poll.groups(), poll.hasMore(), poll.state());
  }
}
