package com.scholary.acquisition.search;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.acquisition.gateway.PeerFile;
import com.scholary.acquisition.gateway.PeerResponse;
import java.util.List;
import org.junit.jupiter.api.Test;

class AlbumGrouperTest {

  private static final String ARTIST = "Boards of Canada";
  private static final String ALBUM = "Music Has the Right to Children";
  private static final List<String> TRACKS = List.of("Roygbiv", "Telephasic Workshop");
  private static final String FOLDER =
      "Music\\Boards Of Canada - Music Has The Right To Children (1998)\\";

  @Test
  void group_collectsPeerFilesIntoOneAlbum() {
    PeerResponse peer =
        new PeerResponse(
            "alice",
            List.of(
                new PeerFile(FOLDER + "02 - Telephasic Workshop.flac", 30_000_000L, null, 395),
                new PeerFile(FOLDER + "07 - Roygbiv.flac", 20_000_000L, null, 151),
                new PeerFile(FOLDER + "cover.jpg", 100_000L, null, null)),
            true,
            500,
            0);

    List<AlbumGroup> groups = AlbumGrouper.group(List.of(peer), ARTIST, ALBUM, TRACKS, 0.6);

    assertThat(groups).hasSize(1);
    AlbumGroup group = groups.get(0);
    assertThat(group.username()).isEqualTo("alice");
    assertThat(group.trackCount()).isEqualTo(2);
    assertThat(group.completeness()).isEqualTo(1.0);
    assertThat(group.totalSize()).isEqualTo(50_000_000L);
    assertThat(group.dominantQuality()).isEqualTo("flac");
    assertThat(group.tracks())
        .extracting(TrackCandidate::title)
        .containsExactly("Roygbiv", "Telephasic Workshop");
    assertThat(group.score()).isBetween(0.0, 1.0);
  }

  @Test
  void group_dropsNonAudioAndLowScoringFiles() {
    PeerResponse peer =
        new PeerResponse(
            "bob",
            List.of(
                new PeerFile(FOLDER + "02 - Telephasic Workshop.txt", 10L, null, null),
                new PeerFile("Aphex Twin/Xtal.flac", 10L, null, null)),
            false,
            10,
            0);

    assertThat(AlbumGrouper.group(List.of(peer), ARTIST, ALBUM, TRACKS, 0.6)).isEmpty();
  }

  @Test
  void group_keepsFilesWithoutExtension() {
    PeerResponse peer =
        new PeerResponse(
            "dave",
            List.of(new PeerFile(FOLDER + "07 - Roygbiv", 20_000_000L, null, 151)),
            false,
            10,
            0);

    List<AlbumGroup> groups = AlbumGrouper.group(List.of(peer), ARTIST, ALBUM, TRACKS, 0.6);

    assertThat(groups).hasSize(1);
    assertThat(groups.get(0).tracks())
        .singleElement()
        .satisfies(
            track -> {
              assertThat(track.title()).isEqualTo("Roygbiv");
              assertThat(track.file().qualityLabel()).isEmpty();
            });
  }

  @Test
  void group_keepsBetterQualityFileForTheSameTrack() {
    PeerResponse peer =
        new PeerResponse(
            "carol",
            List.of(
                new PeerFile(FOLDER + "02 - Telephasic Workshop.mp3", 9_000_000L, 128, 395),
                new PeerFile(FOLDER + "02 - Telephasic Workshop.flac", 30_000_000L, null, 395)),
            false,
            10,
            0);

    List<AlbumGroup> groups = AlbumGrouper.group(List.of(peer), ARTIST, ALBUM, TRACKS, 0.6);

    assertThat(groups).hasSize(1);
    assertThat(groups.get(0).tracks()).hasSize(1);
    assertThat(groups.get(0).tracks().get(0).file().qualityLabel()).isEqualTo("flac");
    assertThat(groups.get(0).completeness()).isEqualTo(0.5);
  }

  @Test
  void group_separatesPeersAndRanksByScore() {
    PeerResponse slow =
        new PeerResponse(
            "slow",
            List.of(new PeerFile(FOLDER + "07 - Roygbiv.mp3", 5_000_000L, 96, null)),
            false,
            5,
            50);
    PeerResponse fast =
        new PeerResponse(
            "fast",
            List.of(
                new PeerFile(FOLDER + "07 - Roygbiv.flac", 20_000_000L, null, null),
                new PeerFile(FOLDER + "02 - Telephasic Workshop.flac", 30_000_000L, null, null)),
            true,
            900,
            0);

    List<AlbumGroup> groups =
        AlbumGrouper.group(List.of(slow, fast), ARTIST, ALBUM, TRACKS, 0.6);

    assertThat(groups).extracting(AlbumGroup::username).containsExactly("fast", "slow");
  }

  @Test
  void group_isDeterministic() {
    List<PeerResponse> responses =
        List.of(
            new PeerResponse(
                "a", List.of(new PeerFile(FOLDER + "07 - Roygbiv.flac", 1L, null, null)), true, 1,
                0),
            new PeerResponse(
                "b", List.of(new PeerFile(FOLDER + "07 - Roygbiv.flac", 1L, null, null)), true, 1,
                0));

    List<AlbumGroup> first = AlbumGrouper.group(responses, ARTIST, ALBUM, TRACKS, 0.6);
    List<AlbumGroup> second = AlbumGrouper.group(responses, ARTIST, ALBUM, TRACKS, 0.6);

    assertThat(first).isEqualTo(second);
    assertThat(first).extracting(AlbumGroup::username).containsExactly("a", "b");
  }

  @Test
  void group_withoutExpectedTracks_isEmpty() {
    PeerResponse peer =
        new PeerResponse(
            "alice", List.of(new PeerFile(FOLDER + "07 - Roygbiv.flac", 1L, null, null)), true, 1,
            0);

    assertThat(AlbumGrouper.group(List.of(peer), ARTIST, ALBUM, List.of(), 0.6)).isEmpty();
  }
}
