package com.scholary.acquisition.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts an {@code event_type} plus the event's fields into the MDC for the duration
 * of one log call, so they can be queried as fields by a log shipper. Correlation keys such as
 * {@code searchId} or {@code batchId} are owned by the caller and left in place.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log one search poll. */
  public void logSearchPoll(String searchId, int responseCount, int groupCount, String state) {
    try {
      MDC.put("event_type", "search_poll");
      MDC.put("responseCount", String.valueOf(responseCount));
      MDC.put("groupCount", String.valueOf(groupCount));
      MDC.put("state", state);

      logger.info(
          "Search poll: searchId={}, responses={}, groups={}, state={}",
          searchId,
          responseCount,
          groupCount,
          state);
    } finally {
      clearEventFields();
    }
  }

  /** Log a transfer batch retry. */
  public void logBatchRetry(
      String username,
      int batchIndex,
      int attempt,
      int maxRetries,
      long backoffMs,
      String message) {
    try {
      MDC.put("event_type", "batch_retry");
      MDC.put("peer", username);
      MDC.put("batchIndex", String.valueOf(batchIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("backoffMs", String.valueOf(backoffMs));

      logger.warn(
          "Batch retry: peer={}, batch={}, attempt={}/{}, backoff={}ms, error={}",
          username,
          batchIndex,
          attempt,
          maxRetries,
          backoffMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a transfer batch that could not be submitted. */
  public void logBatchFailed(String username, int batchIndex, int fileCount, String message) {
    try {
      MDC.put("event_type", "batch_failed");
      MDC.put("peer", username);
      MDC.put("batchIndex", String.valueOf(batchIndex));
      MDC.put("fileCount", String.valueOf(fileCount));

      logger.error(
          "Batch failed: peer={}, batch={}, files={}, error={}",
          username,
          batchIndex,
          fileCount,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a track that exceeded the per-track timeout. */
  public void logTrackTimeout(String filename, long elapsedMinutes) {
    try {
      MDC.put("event_type", "track_timeout");
      MDC.put("filename", filename);
      MDC.put("elapsedMinutes", String.valueOf(elapsedMinutes));

      logger.warn("Track timed out after {} minutes: {}", elapsedMinutes, filename);
    } finally {
      clearEventFields();
    }
  }

  /** Log the end of a monitoring run. */
  public void logMonitorStopped(String reason, int tracked, int processed, int polls) {
    try {
      MDC.put("event_type", "monitor_stopped");
      MDC.put("reason", reason);
      MDC.put("tracked", String.valueOf(tracked));
      MDC.put("processed", String.valueOf(processed));
      MDC.put("polls", String.valueOf(polls));

      logger.info(
          "Monitor stopped: reason={}, processed={}/{}, polls={}",
          reason,
          processed,
          tracked,
          polls);
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of one importer invocation. */
  public void logImportResult(int fileCount, boolean asAlbum, String outcome, String reason) {
    try {
      MDC.put("event_type", "import_result");
      MDC.put("fileCount", String.valueOf(fileCount));
      MDC.put("asAlbum", String.valueOf(asAlbum));
      MDC.put("outcome", outcome);

      logger.info(
          "Import result: files={}, album={}, outcome={}, reason={}",
          fileCount,
          asAlbum,
          outcome,
          reason);
    } finally {
      clearEventFields();
    }
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("responseCount");
    MDC.remove("groupCount");
    MDC.remove("state");
    MDC.remove("peer");
    MDC.remove("batchIndex");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
    MDC.remove("backoffMs");
    MDC.remove("fileCount");
    MDC.remove("filename");
    MDC.remove("elapsedMinutes");
    MDC.remove("reason");
    MDC.remove("tracked");
    MDC.remove("processed");
    MDC.remove("polls");
    MDC.remove("asAlbum");
    MDC.remove("outcome");
  }
}
