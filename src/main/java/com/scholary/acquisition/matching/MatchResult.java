package com.scholary.acquisition.matching;

/**
 * Outcome of scoring one candidate path against the wanted artist/album/tracks.
 *
 * <p>All scores are in [0, 1]. {@code matchedTrack} is the expected track title that scored best
 * (verbatim as requested), or the title guessed from the filename when no tracks were requested.
 */
public record MatchResult(
    String guessedArtist,
    String guessedAlbum,
    String matchedTrack,
    double artistScore,
    double albumScore,
    double trackScore,
    double totalScore) {}
