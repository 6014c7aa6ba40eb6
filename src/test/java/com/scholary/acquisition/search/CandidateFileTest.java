package com.scholary.acquisition.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class CandidateFileTest {

  @Test
  void qualityLabel_isLowercaseExtensionOfLastComponent() {
    assertThat(file("Music\\v1.0\\Track.FLAC", null).qualityLabel()).isEqualTo("flac");
    assertThat(file("Music/v1.0/README", null).qualityLabel()).isEmpty();
  }

  @Test
  void qualityScore_rewardsLosslessAndHighBitRate() {
    assertThat(file("a.flac", null).qualityScore()).isEqualTo(1.0);
    assertThat(file("a.mp3", 320).qualityScore()).isCloseTo(0.75, within(1e-9));
    assertThat(file("a.mp3", 96).qualityScore()).isCloseTo(0.25, within(1e-9));
    assertThat(file("a.xyz", null).qualityScore()).isCloseTo(0.3, within(1e-9));
  }

  @Test
  void qualityScore_accountsForPeerCapacity() {
    CandidateFile busy = new CandidateFile("p", "a.mp3", 1L, null, null, false, 10, 20);
    CandidateFile idle = new CandidateFile("p", "a.mp3", 1L, null, null, true, 500, 0);

    assertThat(busy.qualityScore()).isCloseTo(0.45, within(1e-9));
    assertThat(idle.qualityScore()).isCloseTo(0.7, within(1e-9));
  }

  private static CandidateFile file(String name, Integer bitRate) {
    return new CandidateFile("p", name, 1L, bitRate, null, false, 0, 0);
  }
}
