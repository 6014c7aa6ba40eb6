package com.scholary.acquisition.search;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One outstanding search and how far we have read into its responses.
 *
 * <p>The seen-response count only ever grows.
 */
public class SearchSession {

  private final String searchId;
  private final String artist;
  private final String album;
  private final List<String> trackTitles;
  private final Instant createdAt;
  private final Duration timeout;
  private int seenResponseCount;

  public SearchSession(
      String searchId,
      String artist,
      String album,
      List<String> trackTitles,
      Instant createdAt,
      Duration timeout) {
    this.searchId = searchId;
    this.artist = artist;
    this.album = album;
    this.trackTitles = List.copyOf(trackTitles);
    this.createdAt = createdAt;
    this.timeout = timeout;
  }

  public String getSearchId() {
    return searchId;
  }

  public String getArtist() {
    return artist;
  }

  public String getAlbum() {
    return album;
  }

  public List<String> getTrackTitles() {
    return trackTitles;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public synchronized int getSeenResponseCount() {
    return seenResponseCount;
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(createdAt.plus(timeout));
  }

  /**
   * Record that {@code responseCount} responses have now been read.
   *
   * @return true if this is more than previously seen
   */
  public synchronized boolean advanceSeen(int responseCount) {
    if (responseCount <= seenResponseCount) {
      return false;
    }
    seenResponseCount = responseCount;
    return true;
  }
}
