package com.scholary.acquisition.gateway;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Snapshot of one download as reported by the gateway, or synthesised by this service when the
 * gateway has nothing to say about a file yet (queued, rejected, timed out, importing...).
 *
 * <p>{@code states} is ordered as reported. Classification helpers apply tag precedence: any
 * failure tag makes the record failed even if it is also "Completed".
 */
public record TransferRecord(
    String id,
    String username,
    String filename,
    long size,
    List<TransferState> states,
    String stateDescription,
    String requestedAt,
    String enqueuedAt,
    String startedAt,
    String endedAt,
    long bytesTransferred,
    double averageSpeed,
    long bytesRemaining,
    double percentComplete,
    String exception) {

  private static final Set<TransferState> IMPORT_STATES =
      EnumSet.of(
          TransferState.IMPORTING,
          TransferState.IMPORTED,
          TransferState.IMPORT_SKIPPED,
          TransferState.IMPORT_FAILED);

  public TransferRecord {
    states =
        states == null || states.isEmpty() ? List.of(TransferState.UNKNOWN) : List.copyOf(states);
  }

  /** A file the gateway accepted but has not reported on yet. */
  public static TransferRecord queued(String username, String filename, long size) {
    return synthetic(username, filename, size, TransferState.QUEUED, "Queued for download", null);
  }

  /** A file that never made it into the gateway's queue. */
  public static TransferRecord errored(String username, String filename, long size, String error) {
    return synthetic(username, filename, size, TransferState.ERRORED, error, error);
  }

  private static TransferRecord synthetic(
      String username,
      String filename,
      long size,
      TransferState state,
      String description,
      String exception) {
    return new TransferRecord(
        UUID.randomUUID().toString(),
        username,
        filename,
        size,
        List.of(state),
        description,
        Instant.now().toString(),
        null,
        null,
        null,
        0,
        0.0,
        size,
        0.0,
        exception);
  }

  /** This record marked failed because it sat unfinished for over {@code limitMinutes}. */
  public TransferRecord asTimeout(long limitMinutes) {
    String description = String.format("Download timed out after %d minutes", limitMinutes);
    return new TransferRecord(
        id,
        username,
        filename,
        size,
        List.of(TransferState.ERRORED),
        description,
        requestedAt,
        enqueuedAt,
        startedAt,
        endedAt,
        bytesTransferred,
        0.0,
        bytesRemaining,
        percentComplete,
        "Per-track timeout");
  }

  /**
   * Copy carrying {@code importState} in place of any earlier import tag. The transfer's own tags
   * are kept so the record still reads as "Completed" underneath.
   */
  public TransferRecord withImportState(
      TransferState importState, String description, String error) {
    List<TransferState> merged = new ArrayList<>();
    for (TransferState state : states) {
      if (!IMPORT_STATES.contains(state) && state != TransferState.UNKNOWN) {
        merged.add(state);
      }
    }
    merged.add(importState);
    return withStates(merged, description, error);
  }

  /** Copy with the tags replaced. */
  public TransferRecord withStates(
      List<TransferState> newStates, String description, String error) {
    return new TransferRecord(
        id,
        username,
        filename,
        size,
        newStates,
        description,
        requestedAt,
        enqueuedAt,
        startedAt,
        endedAt,
        bytesTransferred,
        averageSpeed,
        bytesRemaining,
        percentComplete,
        error);
  }

  public boolean isFailed() {
    return states.stream().anyMatch(TransferState::isFailure);
  }

  /** Transferred completely and nothing went wrong. */
  public boolean isSuccessful() {
    return !isFailed() && states.stream().anyMatch(TransferState::isSuccess);
  }

  /** No further transitions are expected from the gateway for this file. */
  public boolean isTerminal() {
    return isFailed()
        || isSuccessful()
        || states.stream().anyMatch(TransferState::isImportDone);
  }

  /** The tag that describes this record best. */
  public TransferState primaryState() {
    return states.stream().max(Comparator.comparingInt(TransferState::precedence)).orElseThrow();
  }
}
