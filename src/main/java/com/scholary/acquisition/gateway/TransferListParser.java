package com.scholary.acquisition.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens the gateway's transfer listing into one record per file.
 *
 * <p>The listing is nested: {@code [{username, directories: [{directory, files: [...]}]}]}. The
 * {@code state} of a file is usually a comma-separated string ("Completed, Succeeded") but an
 * array of tags is accepted too. Entries without a filename are skipped.
 */
final class TransferListParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(TransferListParser.class);

  private TransferListParser() {}

  static List<TransferRecord> parse(JsonNode root) {
    List<TransferRecord> records = new ArrayList<>();
    if (root == null || !root.isArray()) {
      return records;
    }
    for (JsonNode user : root) {
      String owner = text(user, "username");
      for (JsonNode directory : user.path("directories")) {
        for (JsonNode file : directory.path("files")) {
          String filename = text(file, "filename");
          if (filename == null) {
            LOGGER.debug("Skipping transfer entry without filename: {}", file);
            continue;
          }
          records.add(toRecord(file, owner, filename));
        }
      }
    }
    return records;
  }

  private static TransferRecord toRecord(JsonNode file, String owner, String filename) {
    String username = text(file, "username");
    return new TransferRecord(
        text(file, "id"),
        username != null ? username : owner,
        filename,
        file.path("size").asLong(0),
        parseStates(file.get("state")),
        text(file, "stateDescription"),
        text(file, "requestedAt"),
        text(file, "enqueuedAt"),
        text(file, "startedAt"),
        text(file, "endedAt"),
        file.path("bytesTransferred").asLong(0),
        file.path("averageSpeed").asDouble(0.0),
        file.path("bytesRemaining").asLong(0),
        file.path("percentComplete").asDouble(0.0),
        text(file, "exception"));
  }

  static List<TransferState> parseStates(JsonNode state) {
    List<TransferState> states = new ArrayList<>();
    if (state == null || state.isNull()) {
      return states;
    }
    if (state.isArray()) {
      for (JsonNode tag : state) {
        states.add(TransferState.fromTag(tag.asText()));
      }
      return states;
    }
    for (String tag : state.asText().split(",")) {
      if (!tag.isBlank()) {
        states.add(TransferState.fromTag(tag));
      }
    }
    return states;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }
}
