package com.scholary.acquisition.matching;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FilenameMatcherTest {

  @Test
  void matches_ignoresSeparatorAndCase() {
    assertThat(FilenameMatcher.matches("Music\\Album\\01 Track.flac", "music/album/01 track.FLAC"))
        .isTrue();
  }

  @Test
  void matches_suffixEitherWay() {
    String full = "@@alice\\Music\\Album\\01 Track.flac";
    String tail = "Album/01 Track.flac";

    assertThat(FilenameMatcher.matches(full, tail)).isTrue();
    assertThat(FilenameMatcher.matches(tail, full)).isTrue();
  }

  @Test
  void matches_sameLastComponentInDifferentFolders() {
    assertThat(FilenameMatcher.matches("a/b/Track.mp3", "c/d/track.mp3")).isTrue();
  }

  @Test
  void matches_differentFiles() {
    assertThat(FilenameMatcher.matches("Album/01 Track.flac", "Album/02 Track.flac")).isFalse();
  }

  @Test
  void matches_isReflexive() {
    assertThat(FilenameMatcher.matches("Album/01 Track.flac", "Album/01 Track.flac")).isTrue();
    assertThat(FilenameMatcher.matches("", "")).isTrue();
  }

  @Test
  void matches_emptyNeverMatchesNonEmpty() {
    assertThat(FilenameMatcher.matches("", "Album/01 Track.flac")).isFalse();
    assertThat(FilenameMatcher.matches(null, "Album/01 Track.flac")).isFalse();
  }
}
