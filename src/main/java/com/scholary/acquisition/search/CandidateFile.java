package com.scholary.acquisition.search;

import com.scholary.acquisition.gateway.PeerFile;
import com.scholary.acquisition.gateway.PeerResponse;
import java.util.Locale;
import java.util.Map;

/**
 * A file offered by a peer, together with what we know about that peer's capacity.
 *
 * <p>{@link #qualityScore()} blends the format, the bit rate and how quickly the peer is likely to
 * serve the file. It is used to break ties between equally good matches and feeds the album
 * ranking.
 */
public record CandidateFile(
    String username,
    String filename,
    long size,
    Integer bitRate,
    Integer duration,
    boolean hasFreeUploadSlot,
    int uploadSpeed,
    int queueLength) {

  private static final Map<String, Double> FORMAT_WEIGHTS =
      Map.of(
          "flac", 1.0,
          "wav", 0.85,
          "m4a", 0.65,
          "aac", 0.65,
          "ogg", 0.6,
          "mp3", 0.55,
          "wma", 0.4);
  private static final double UNKNOWN_FORMAT_WEIGHT = 0.3;

  static CandidateFile of(PeerResponse peer, PeerFile file) {
    return new CandidateFile(
        peer.username(),
        file.filename(),
        file.size(),
        file.bitRate(),
        file.length(),
        peer.hasFreeUploadSlot(),
        peer.uploadSpeed(),
        peer.queueLength());
  }

  /** Lowercase extension, e.g. "flac", or empty when the file has none. */
  public String qualityLabel() {
    String name = filename.replace('\\', '/');
    name = name.substring(name.lastIndexOf('/') + 1);
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
  }

  /** Score in [0, 1]. */
  public double qualityScore() {
    double score = FORMAT_WEIGHTS.getOrDefault(qualityLabel(), UNKNOWN_FORMAT_WEIGHT);
    if (bitRate != null) {
      if (bitRate >= 320) {
        score += 0.2;
      } else if (bitRate >= 256) {
        score += 0.1;
      } else if (bitRate < 128) {
        score -= 0.3;
      }
    }
    if (hasFreeUploadSlot) {
      score += 0.1;
    }
    if (uploadSpeed > 100) {
      score += 0.05;
    }
    if (queueLength > 10) {
      score -= 0.1;
    }
    return Math.max(0.0, Math.min(1.0, score));
  }
}
