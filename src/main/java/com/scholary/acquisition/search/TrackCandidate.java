package com.scholary.acquisition.search;

import com.scholary.acquisition.matching.MatchResult;

/** The file chosen for one expected track within an album group. */
public record TrackCandidate(CandidateFile file, MatchResult match) {

  public String title() {
    return match.matchedTrack();
  }

  public double matchScore() {
    return match.totalScore();
  }
}
