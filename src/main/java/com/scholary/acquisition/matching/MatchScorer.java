package com.scholary.acquisition.matching;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Fuzzy scorer that reconciles a peer's file path with the music the user asked for.
 *
 * <p>Peer paths carry no identifiers, only folder names and a file stem in whatever format the
 * uploader chose ("Artist - Album (1998) [FLAC]/03. Track.flac", "A1 - Track.mp3", ...). The
 * path is split into its ancestor folders and stem, each is stripped of track numbers, bracketed
 * tags and trailing years, and the remaining word sets are compared to the targets:
 *
 * <ul>
 *   <li>artist: containment of the target in any folder, or in the stem's "Artist - " prefix
 *   <li>album: mean of Jaccard and containment, best folder wins
 *   <li>track: 0.6 Dice + 0.4 containment against each expected title, best title wins
 * </ul>
 *
 * <p>The combined score is a weighted mean (artist 0.2, track 0.4, album 0.4) over only the
 * components that were requested. An album score at or below {@value #ALBUM_INFO_THRESHOLD} means
 * the path has no useful album information, so the album term is left out entirely rather than
 * dragging down a confident artist+track match.
 *
 * <p>Stateless and thread-safe.
 */
public final class MatchScorer {

  static final double ARTIST_WEIGHT = 0.2;
  static final double TRACK_WEIGHT = 0.4;
  static final double ALBUM_WEIGHT = 0.4;
  static final double ALBUM_INFO_THRESHOLD = 0.25;

  private static final String TITLE_SEPARATOR = " - ";

  private static final Pattern LEADING_TRACK_NUMBER =
      Pattern.compile(
          "^\\s*(\\d{1,3}|[A-D]\\d{1,2})\\s*[.\\-]\\s*", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern TRAILING_BRACKET =
      Pattern.compile("\\s*\\[\\s*[^\\]]*\\]\\s*$", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern TRAILING_YEAR =
      Pattern.compile("\\s*[-(\\[]?\\d{4}[-)\\]]?\\s*$", Pattern.UNICODE_CHARACTER_CLASS);

  private MatchScorer() {}

  /**
   * Score a candidate path.
   *
   * @param filename gateway path, either separator style
   * @param expectedArtist wanted artist, or null when not searched for
   * @param expectedAlbum wanted album, or null when not searched for
   * @param expectedTracks wanted track titles, possibly empty
   * @return the guesses and scores
   */
  public static MatchResult rank(
      String filename, String expectedArtist, String expectedAlbum, List<String> expectedTracks) {

    ParsedPath path = ParsedPath.parse(filename);
    List<WordSet> folders = new ArrayList<>(path.folders().size());
    for (String folder : path.folders()) {
      folders.add(WordSet.of(cleanName(folder)));
    }
    String stem = path.stem();

    Scored artist =
        expectedArtist != null
            ? scoreArtist(folders, stem, WordSet.of(expectedArtist))
            : Scored.NONE;
    Scored album =
        expectedAlbum != null ? scoreAlbum(folders, WordSet.of(expectedAlbum)) : Scored.NONE;
    boolean tracksRequested = expectedTracks != null && !expectedTracks.isEmpty();
    Scored track =
        tracksRequested
            ? scoreTrack(stem, expectedTracks)
            : new Scored(1.0, extractTrackTitle(stem));

    double weightedSum = 0.0;
    double totalWeight = 0.0;
    if (expectedArtist != null) {
      weightedSum += artist.score() * ARTIST_WEIGHT;
      totalWeight += ARTIST_WEIGHT;
    }
    if (tracksRequested) {
      weightedSum += track.score() * TRACK_WEIGHT;
      totalWeight += TRACK_WEIGHT;
    }
    if (expectedAlbum != null && album.score() > ALBUM_INFO_THRESHOLD) {
      weightedSum += album.score() * ALBUM_WEIGHT;
      totalWeight += ALBUM_WEIGHT;
    }
    double total = totalWeight > 0.0 ? Math.min(1.0, weightedSum / totalWeight) : 0.0;

    return new MatchResult(
        artist.guess(), album.guess(), track.guess(), artist.score(), album.score(), track.score(),
        total);
  }

  /**
   * Strip decorations peers put around names: a leading "01." / "A2 -" track number, a trailing
   * "[FLAC]" tag and a trailing year such as "(1998)".
   */
  static String cleanName(String name) {
    String cleaned = LEADING_TRACK_NUMBER.matcher(name.replace('_', ' ')).replaceFirst("");
    cleaned = TRAILING_BRACKET.matcher(cleaned).replaceFirst("");
    cleaned = TRAILING_YEAR.matcher(cleaned).replaceFirst("");
    return cleaned.trim();
  }

  /** The title part of a stem: everything after the last " - ", once cleaned. */
  static String extractTrackTitle(String stem) {
    String cleaned = cleanName(stem);
    int separator = cleaned.lastIndexOf(TITLE_SEPARATOR);
    if (separator < 0) {
      return cleaned;
    }
    return cleaned.substring(separator + TITLE_SEPARATOR.length()).trim();
  }

  private static Scored scoreArtist(List<WordSet> folders, String stem, WordSet target) {
    double folderScore = 0.0;
    String folderGuess = "";
    // Later (deeper) folders win ties.
    for (WordSet folder : folders) {
      double score = folder.containment(target);
      if (score >= folderScore) {
        folderScore = score;
        folderGuess = folder.original();
      }
    }

    int separator = stem.lastIndexOf(TITLE_SEPARATOR);
    String stemArtist = cleanName(separator >= 0 ? stem.substring(0, separator) : stem);
    double stemScore = WordSet.of(stemArtist).containment(target);

    if (stemScore > folderScore) {
      return new Scored(stemScore, stemArtist);
    }
    if (folderScore > stemScore) {
      return new Scored(folderScore, folderGuess);
    }
    if (stemScore > 0.9 && stemArtist.length() > folderGuess.length()) {
      return new Scored(stemScore, stemArtist);
    }
    return new Scored(folderScore, folderGuess);
  }

  private static Scored scoreAlbum(List<WordSet> folders, WordSet target) {
    Scored best = Scored.NONE;
    for (WordSet folder : folders) {
      double score = (folder.jaccard(target) + folder.containment(target)) / 2.0;
      if (score >= best.score()) {
        best = new Scored(score, folder.original());
      }
    }
    return best;
  }

  private static Scored scoreTrack(String stem, List<String> expectedTracks) {
    WordSet title = WordSet.of(extractTrackTitle(stem));
    Scored best = Scored.NONE;
    for (String expected : expectedTracks) {
      WordSet target = WordSet.of(expected);
      double score = title.dice(target) * 0.6 + title.containment(target) * 0.4;
      if (score >= best.score()) {
        best = new Scored(score, expected);
      }
    }
    return best;
  }

  private record Scored(double score, String guess) {
    static final Scored NONE = new Scored(0.0, "");
  }

  /** Ancestor folders (outermost first) and the extension-less file name. */
  private record ParsedPath(List<String> folders, String stem) {

    static ParsedPath parse(String filename) {
      String normalized = filename == null ? "" : filename.replace('\\', '/');
      List<String> parts = new ArrayList<>();
      for (String part : normalized.split("/")) {
        if (!part.isEmpty() && !part.equals(".")) {
          parts.add(part);
        }
      }
      if (parts.isEmpty()) {
        return new ParsedPath(List.of(), "");
      }
      String name = parts.remove(parts.size() - 1);
      int dot = name.lastIndexOf('.');
      String stem = dot > 0 ? name.substring(0, dot) : name;
      return new ParsedPath(parts, stem);
    }
  }
}
