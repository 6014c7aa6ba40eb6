package com.scholary.acquisition.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interprets the body of a successful download submission.
 *
 * <p>The gateway has answered with each of these, so they are tried in order:
 *
 * <ol>
 *   <li>an empty body, meaning everything was enqueued
 *   <li>a single object {@code {"filename": ...}}
 *   <li>an array of such objects
 *   <li>{@code {"enqueued": [...], "failed": [...]}} where failed entries are filenames or objects
 * </ol>
 *
 * <p>Anything else yields a failure for every requested file. Requested files the gateway did not
 * mention are reported as failures too, so that no file silently disappears.
 */
final class BatchResponseParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchResponseParser.class);

  static final String UNPARSEABLE = "Unparseable response from gateway";
  static final String NOT_ACKNOWLEDGED = "Not acknowledged by gateway";
  static final String DEFAULT_FAILURE = "Download failed";

  private BatchResponseParser() {}

  static List<SubmittedFile> parse(
      String body, List<RequestedFile> requested, ObjectMapper objectMapper) {

    if (body == null || body.isBlank()) {
      LOGGER.info(
          "Gateway returned an empty success body, assuming {} files queued", requested.size());
      return requested.stream().map(f -> SubmittedFile.accepted(f.filename(), f.size())).toList();
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      LOGGER.error("Failed to parse download submission response: '{}'", body, e);
      return failAll(requested, UNPARSEABLE);
    }

    Map<String, SubmittedFile> outcomes = new LinkedHashMap<>();
    if (root.isObject() && root.hasNonNull("filename")) {
      accept(outcomes, root, requested);
    } else if (root.isArray() && allHaveFilename(root)) {
      for (JsonNode entry : root) {
        accept(outcomes, entry, requested);
      }
    } else if (root.isObject() && root.path("enqueued").isArray()) {
      for (JsonNode entry : root.path("enqueued")) {
        accept(outcomes, entry, requested);
      }
      for (JsonNode entry : root.path("failed")) {
        reject(outcomes, entry, requested);
      }
    } else {
      LOGGER.error("Unrecognised download submission response: '{}'", body);
      return failAll(requested, UNPARSEABLE);
    }

    List<SubmittedFile> results = new ArrayList<>(outcomes.values());
    for (RequestedFile file : requested) {
      if (!outcomes.containsKey(file.filename())) {
        results.add(SubmittedFile.failed(file.filename(), file.size(), NOT_ACKNOWLEDGED));
      }
    }
    return results;
  }

  private static boolean allHaveFilename(JsonNode array) {
    for (JsonNode entry : array) {
      if (!entry.hasNonNull("filename")) {
        return false;
      }
    }
    return true;
  }

  private static void accept(
      Map<String, SubmittedFile> outcomes, JsonNode entry, List<RequestedFile> requested) {
    String filename = entry.path("filename").asText();
    outcomes.put(filename, SubmittedFile.accepted(filename, sizeOf(filename, requested)));
  }

  private static void reject(
      Map<String, SubmittedFile> outcomes, JsonNode entry, List<RequestedFile> requested) {
    String filename;
    String error = DEFAULT_FAILURE;
    if (entry.isTextual()) {
      filename = entry.asText();
    } else if (entry.hasNonNull("filename")) {
      filename = entry.get("filename").asText();
      if (entry.hasNonNull("error")) {
        error = entry.get("error").asText();
      }
    } else {
      LOGGER.warn("Gateway reported a failed download without a filename: {}", entry);
      return;
    }
    outcomes.put(filename, SubmittedFile.failed(filename, sizeOf(filename, requested), error));
  }

  private static long sizeOf(String filename, List<RequestedFile> requested) {
    return requested.stream()
        .filter(f -> f.filename().equals(filename))
        .mapToLong(RequestedFile::size)
        .findFirst()
        .orElse(0L);
  }

  private static List<SubmittedFile> failAll(List<RequestedFile> requested, String error) {
    return requested.stream()
        .map(f -> SubmittedFile.failed(f.filename(), f.size(), error))
        .toList();
  }
}
