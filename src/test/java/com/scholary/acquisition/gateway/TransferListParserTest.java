package com.scholary.acquisition.gateway;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class TransferListParserTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void parse_flattensUsersAndDirectories() throws Exception {
    JsonNode root =
        objectMapper.readTree(
            "[{\"username\":\"alice\",\"directories\":[{\"directory\":\"Album\",\"files\":["
                + "{\"id\":\"t1\",\"filename\":\"Album\\\\01.flac\",\"size\":10,"
                + "\"state\":\"Completed, Succeeded\",\"percentComplete\":100.0},"
                + "{\"id\":\"t2\",\"filename\":\"Album\\\\02.flac\",\"size\":20,"
                + "\"state\":\"InProgress\",\"bytesTransferred\":5},"
                + "{\"id\":\"t3\",\"size\":30}]}]},"
                + "{\"username\":\"bob\",\"directories\":[{\"directory\":\"Other\",\"files\":["
                + "{\"id\":\"t4\",\"username\":\"bobby\",\"filename\":\"Other\\\\x.mp3\","
                + "\"state\":[\"Completed\",\"Errored\"]}]}]}]");

    List<TransferRecord> records = TransferListParser.parse(root);

    assertThat(records).extracting(TransferRecord::id).containsExactly("t1", "t2", "t4");
    TransferRecord first = records.get(0);
    assertThat(first.username()).isEqualTo("alice");
    assertThat(first.states()).containsExactly(TransferState.COMPLETED, TransferState.SUCCEEDED);
    assertThat(first.isSuccessful()).isTrue();
    assertThat(records.get(1).isTerminal()).isFalse();
    assertThat(records.get(1).bytesTransferred()).isEqualTo(5L);
    assertThat(records.get(2).username()).isEqualTo("bobby");
    assertThat(records.get(2).isFailed()).isTrue();
  }

  @Test
  void parse_nonArray_isEmpty() throws Exception {
    assertThat(TransferListParser.parse(objectMapper.readTree("{}"))).isEmpty();
    assertThat(TransferListParser.parse(null)).isEmpty();
  }

  @Test
  void parseStates_unknownTagsAndMissingState() throws Exception {
    assertThat(TransferListParser.parseStates(objectMapper.readTree("\"Queued, Remotely\"")))
        .containsExactly(TransferState.QUEUED, TransferState.REMOTELY);
    assertThat(TransferListParser.parseStates(objectMapper.readTree("\"Sparkling\"")))
        .containsExactly(TransferState.UNKNOWN);
    assertThat(TransferListParser.parseStates(null)).isEmpty();
  }
}
