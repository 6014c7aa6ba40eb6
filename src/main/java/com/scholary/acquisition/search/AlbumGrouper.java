package com.scholary.acquisition.search;

import com.scholary.acquisition.gateway.PeerFile;
import com.scholary.acquisition.gateway.PeerResponse;
import com.scholary.acquisition.matching.MatchResult;
import com.scholary.acquisition.matching.MatchScorer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw peer responses into ranked album groups.
 *
 * <p>Files with a non-audio extension and files scoring below the floor are discarded. The rest
 * are grouped by (peer, guessed artist, guessed album), and within each group the best-scoring file
 * is kept for every expected track, ties going to the better quality file. Groups are rebuilt
 * from scratch on every call; the same input always produces the same groups in the same order.
 */
public final class AlbumGrouper {

  static final Set<String> AUDIO_EXTENSIONS =
      Set.of("flac", "wav", "m4a", "ogg", "aac", "wma", "mp3");

  private static final Comparator<AlbumGroup> RANKING =
      Comparator.comparingDouble(AlbumGroup::score)
          .reversed()
          .thenComparing(AlbumGroup::username)
          .thenComparing(AlbumGroup::artist)
          .thenComparing(AlbumGroup::albumTitle);

  private AlbumGrouper() {}

  /**
   * Score, filter, group and rank.
   *
   * @param responses all peer responses collected so far
   * @param artist wanted artist
   * @param album wanted album, or null
   * @param expectedTracks wanted titles; when empty no groups can be formed
   * @param minScore files scoring below this are discarded
   * @return groups ordered best first
   */
  public static List<AlbumGroup> group(
      List<PeerResponse> responses,
      String artist,
      String album,
      List<String> expectedTracks,
      double minScore) {

    List<String> titles = new ArrayList<>(new LinkedHashSet<>(expectedTracks));
    if (titles.isEmpty()) {
      return List.of();
    }

    Map<GroupKey, List<TrackCandidate>> byRelease = new LinkedHashMap<>();
    for (PeerResponse peer : responses) {
      for (PeerFile file : peer.files()) {
        CandidateFile candidate = CandidateFile.of(peer, file);
        String extension = candidate.qualityLabel();
        // Files without an extension are scored like any other.
        if (!extension.isEmpty() && !AUDIO_EXTENSIONS.contains(extension)) {
          continue;
        }
        MatchResult match = MatchScorer.rank(file.filename(), artist, album, titles);
        if (match.totalScore() < minScore) {
          continue;
        }
        GroupKey key = new GroupKey(peer.username(), match.guessedArtist(), match.guessedAlbum());
        byRelease
            .computeIfAbsent(key, k -> new ArrayList<>())
            .add(new TrackCandidate(candidate, match));
      }
    }

    List<AlbumGroup> groups = new ArrayList<>();
    for (Map.Entry<GroupKey, List<TrackCandidate>> entry : byRelease.entrySet()) {
      AlbumGroup group = buildGroup(entry.getKey(), entry.getValue(), titles);
      if (group != null) {
        groups.add(group);
      }
    }
    groups.sort(RANKING);
    return groups;
  }

  private static AlbumGroup buildGroup(
      GroupKey key, List<TrackCandidate> candidates, List<String> titles) {
    List<TrackCandidate> kept = new ArrayList<>();
    for (String title : titles) {
      TrackCandidate best = null;
      for (TrackCandidate candidate : candidates) {
        if (title.equals(candidate.title()) && (best == null || isBetter(candidate, best))) {
          best = candidate;
        }
      }
      if (best != null) {
        kept.add(best);
      }
    }
    if (kept.isEmpty()) {
      return null;
    }

    double meanMatch = kept.stream().mapToDouble(TrackCandidate::matchScore).average().orElse(0);
    double meanQuality =
        kept.stream().mapToDouble(t -> t.file().qualityScore()).average().orElse(0);
    double completeness = (double) kept.size() / titles.size();
    long totalSize = kept.stream().mapToLong(t -> t.file().size()).sum();
    CandidateFile first = kept.get(0).file();

    return new AlbumGroup(
        key.username(),
        key.artist(),
        key.album(),
        first.filename(),
        kept,
        totalSize,
        dominantQuality(kept),
        first.hasFreeUploadSlot(),
        first.uploadSpeed(),
        first.queueLength(),
        completeness,
        0.3 * meanMatch + 0.3 * completeness + 0.4 * meanQuality);
  }

  private static boolean isBetter(TrackCandidate candidate, TrackCandidate current) {
    int byScore = Double.compare(candidate.matchScore(), current.matchScore());
    if (byScore != 0) {
      return byScore > 0;
    }
    return candidate.file().qualityScore() > current.file().qualityScore();
  }

  /** Most common format; the first one seen wins a tie. */
  private static String dominantQuality(List<TrackCandidate> tracks) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (TrackCandidate track : tracks) {
      counts.merge(track.file().qualityLabel(), 1, Integer::sum);
    }
    String dominant = "";
    int best = 0;
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > best) {
        dominant = entry.getKey();
        best = entry.getValue();
      }
    }
    return dominant;
  }

  private record GroupKey(String username, String artist, String album) {}
}
