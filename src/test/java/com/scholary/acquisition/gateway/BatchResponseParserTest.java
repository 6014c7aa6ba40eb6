package com.scholary.acquisition.gateway;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class BatchResponseParserTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  private final List<RequestedFile> requested =
      List.of(
          new RequestedFile("Album\\01 - One.flac", 100L),
          new RequestedFile("Album\\02 - Two.flac", 200L),
          new RequestedFile("Album\\03 - Three.flac", 300L));

  @Test
  void parse_emptyBody_acceptsEveryFileWithRequestedSize() {
    List<SubmittedFile> results = BatchResponseParser.parse("", requested, objectMapper);

    assertThat(results).hasSize(3);
    assertThat(results).allMatch(SubmittedFile::isAccepted);
    assertThat(results)
        .extracting(SubmittedFile::filename)
        .containsExactly("Album\\01 - One.flac", "Album\\02 - Two.flac", "Album\\03 - Three.flac");
    assertThat(results).extracting(SubmittedFile::size).containsExactly(100L, 200L, 300L);
  }

  @Test
  void parse_singleObject_acceptsItAndFlagsTheRest() {
    List<SubmittedFile> results =
        BatchResponseParser.parse(
            "{\"filename\":\"Album\\\\01 - One.flac\"}", requested, objectMapper);

    assertThat(results).hasSize(3);
    assertThat(results.get(0).isAccepted()).isTrue();
    assertThat(results.get(0).size()).isEqualTo(100L);
    assertThat(results.subList(1, 3))
        .allMatch(r -> BatchResponseParser.NOT_ACKNOWLEDGED.equals(r.error()));
  }

  @Test
  void parse_arrayOfObjects_acceptsEach() {
    String body =
        "[{\"filename\":\"Album\\\\01 - One.flac\"},"
            + "{\"filename\":\"Album\\\\02 - Two.flac\"},"
            + "{\"filename\":\"Album\\\\03 - Three.flac\"}]";

    List<SubmittedFile> results = BatchResponseParser.parse(body, requested, objectMapper);

    assertThat(results).hasSize(3).allMatch(SubmittedFile::isAccepted);
  }

  @Test
  void parse_enqueuedAndFailed_mixesOutcomes() {
    String body =
        "{\"enqueued\":[{\"filename\":\"Album\\\\01 - One.flac\"}],"
            + "\"failed\":[\"Album\\\\02 - Two.flac\","
            + "{\"filename\":\"Album\\\\03 - Three.flac\",\"error\":\"File not shared\"}]}";

    List<SubmittedFile> results = BatchResponseParser.parse(body, requested, objectMapper);

    assertThat(results).hasSize(3);
    assertThat(results.get(0).isAccepted()).isTrue();
    assertThat(results.get(1).error()).isEqualTo(BatchResponseParser.DEFAULT_FAILURE);
    assertThat(results.get(2).error()).isEqualTo("File not shared");
    assertThat(results.get(2).size()).isEqualTo(300L);
  }

  @Test
  void parse_malformedBody_failsEveryFile() {
    List<SubmittedFile> results = BatchResponseParser.parse("{oops", requested, objectMapper);

    assertThat(results).hasSize(3);
    assertThat(results).noneMatch(SubmittedFile::isAccepted);
    assertThat(results).allMatch(r -> BatchResponseParser.UNPARSEABLE.equals(r.error()));
  }

  @Test
  void parse_unrecognisedShape_failsEveryFile() {
    List<SubmittedFile> results =
        BatchResponseParser.parse("{\"status\":\"ok\"}", requested, objectMapper);

    assertThat(results).hasSize(3).noneMatch(SubmittedFile::isAccepted);
  }
}
