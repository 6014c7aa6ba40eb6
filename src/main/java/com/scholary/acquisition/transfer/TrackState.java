package com.scholary.acquisition.transfer;

import java.time.Duration;
import java.time.Instant;

/** Monitor bookkeeping for one requested file: unseen, seen since some time, or processed. */
final class TrackState {

  private Instant firstSeen;
  private boolean processed;

  void markSeen(Instant now) {
    if (firstSeen == null) {
      firstSeen = now;
    }
  }

  void markProcessed() {
    processed = true;
  }

  boolean isSeen() {
    return firstSeen != null;
  }

  boolean isProcessed() {
    return processed;
  }

  boolean hasExceeded(Instant now, Duration limit) {
    return firstSeen != null && Duration.between(firstSeen, now).compareTo(limit) > 0;
  }
}
