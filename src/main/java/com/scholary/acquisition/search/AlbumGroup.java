package com.scholary.acquisition.search;

import java.util.List;

/**
 * Files from one peer that look like they belong to the same release.
 *
 * <p>Keyed by (username, guessed artist, guessed album). Holds at most one file per expected
 * track. {@code score} ranks groups against each other: 0.3 mean match score, 0.3 completeness,
 * 0.4 mean file quality.
 */
public record AlbumGroup(
    String username,
    String artist,
    String albumTitle,
    String albumPath,
    List<TrackCandidate> tracks,
    long totalSize,
    String dominantQuality,
    boolean hasFreeUploadSlot,
    int uploadSpeed,
    int queueLength,
    double completeness,
    double score) {

  public AlbumGroup {
    tracks = List.copyOf(tracks);
  }

  public int trackCount() {
    return tracks.size();
  }
}
