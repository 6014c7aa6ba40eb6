package com.scholary.acquisition.transfer;

import com.scholary.acquisition.config.AcquisitionProperties;
import com.scholary.acquisition.gateway.GatewayException;
import com.scholary.acquisition.gateway.TransferClient;
import com.scholary.acquisition.gateway.TransferRecord;
import com.scholary.acquisition.importer.ImportOrchestrator;
import com.scholary.acquisition.logging.StructuredLogger;
import com.scholary.acquisition.matching.FilenameMatcher;
import com.scholary.acquisition.updates.TransferUpdateSink;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Follows one submitted batch of files until each is finished, failed or timed out.
 *
 * <p>Every poll interval the gateway's full transfer list is fetched and each entry is matched to
 * a requested filename (paths differ in prefix, case and separators, see {@link
 * FilenameMatcher}). Then, per requested file:
 *
 * <ul>
 *   <li>the first sighting starts its timeout clock
 *   <li>a file unfinished for longer than the per-track timeout gets a synthetic timeout failure
 *   <li>a successful download is imported right away (singleton mode) or held for the end of the
 *       batch (album mode)
 *   <li>a failed, cancelled or aborted download is closed without import
 * </ul>
 *
 * <p>The run ends when every file is processed or every gateway entry matched on a poll is
 * terminal or already timed out; in album mode the successful files are then imported together. If
 * nothing matches for {@code emptyPollGrace} consecutive polls the batch is assumed lost (or long
 * gone) and the run ends without processing any file. Either way, a requested file the gateway
 * never listed is closed with an errored record. Gateway errors while polling are logged and the
 * loop carries on.
 *
 * <p>Each poll publishes the current records of files that were still open at its start, so a
 * file's last published state is never overwritten by later gateway noise.
 */
public class DownloadMonitor {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadMonitor.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);
  static final String NEVER_REPORTED = "Never reported by gateway";

  /** Why a run ended. */
  public enum Outcome {
    FINISHED,
    LOST,
    CANCELLED,
    INTERRUPTED
  }

  /** Timing and mode for a monitor. */
  public record Settings(
      Duration pollInterval, int emptyPollGrace, Duration perTrackTimeout, boolean albumMode) {

    public static Settings from(AcquisitionProperties properties) {
      AcquisitionProperties.Monitor monitor = properties.monitor();
      return new Settings(
          Duration.ofSeconds(monitor.pollIntervalSeconds()),
          monitor.emptyPollGrace(),
          Duration.ofMinutes(monitor.perTrackTimeoutMinutes()),
          properties.albumMode());
    }
  }

  private final Map<String, TransferSelection> requested = new LinkedHashMap<>();
  private final List<String> filenames;
  private final Map<String, TrackState> tracks = new LinkedHashMap<>();
  private final Path targetDir;
  private final TransferClient transferClient;
  private final ImportOrchestrator importOrchestrator;
  private final TransferUpdateSink sink;
  private final Settings settings;
  private final Clock clock;
  private final Executor importExecutor;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  private int consecutiveEmpty;
  private int polls;

  public DownloadMonitor(
      List<TransferSelection> selections,
      Path targetDir,
      TransferClient transferClient,
      ImportOrchestrator importOrchestrator,
      TransferUpdateSink sink,
      Settings settings,
      Clock clock,
      Executor importExecutor) {
    for (TransferSelection selection : selections) {
      requested.putIfAbsent(selection.filename(), selection);
    }
    this.filenames = List.copyOf(requested.keySet());
    this.targetDir = targetDir;
    this.transferClient = transferClient;
    this.importOrchestrator = importOrchestrator;
    this.sink = sink;
    this.settings = settings;
    this.clock = clock;
    this.importExecutor = importExecutor;
    for (String filename : this.filenames) {
      tracks.put(filename, new TrackState());
    }
  }

  /** Ask the run loop to stop at its next iteration. No further updates are published. */
  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public List<String> getFilenames() {
    return filenames;
  }

  public boolean isProcessed(String filename) {
    TrackState state = tracks.get(filename);
    return state != null && state.isProcessed();
  }

  public int processedCount() {
    return (int) tracks.values().stream().filter(TrackState::isProcessed).count();
  }

  /** Poll until the batch is done, lost or cancelled. Blocks the calling thread. */
  public Outcome run() {
    LOGGER.info("Monitoring {} downloads into {}", filenames.size(), targetDir);
    Outcome outcome;
    while (true) {
      if (cancelled.get()) {
        outcome = Outcome.CANCELLED;
        break;
      }
      polls++;

      List<TransferRecord> transfers = null;
      try {
        transfers = transferClient.listAllTransfers();
      } catch (GatewayException e) {
        LOGGER.warn("Error fetching transfer status, will retry: {}", e.getMessage());
      }
      if (cancelled.get()) {
        outcome = Outcome.CANCELLED;
        break;
      }
      Outcome result = transfers != null ? processPoll(transfers) : null;
      if (result != null) {
        outcome = result;
        break;
      }

      try {
        Thread.sleep(settings.pollInterval().toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        outcome = Outcome.INTERRUPTED;
        break;
      }
    }
    STRUCTURED_LOGGER.logMonitorStopped(outcome.name(), filenames.size(), processedCount(), polls);
    return outcome;
  }

  /**
   * Handle one gateway snapshot.
   *
   * @return the outcome if monitoring should stop, null to keep polling
   */
  Outcome processPoll(List<TransferRecord> transfers) {
    Map<String, TransferRecord> matched = match(transfers);

    if (matched.isEmpty()) {
      consecutiveEmpty++;
      if (consecutiveEmpty >= settings.emptyPollGrace()) {
        LOGGER.warn(
            "No downloads of this batch seen for {} polls, assuming finished or lost: {}",
            consecutiveEmpty,
            filenames);
        closeUnseen();
        return Outcome.LOST;
      }
      if (consecutiveEmpty % 5 == 0) {
        LOGGER.info(
            "Waiting for downloads to appear, attempt {}/{}",
            consecutiveEmpty,
            settings.emptyPollGrace());
      }
      return null;
    }
    consecutiveEmpty = 0;
    if (matched.size() != filenames.size()) {
      LOGGER.debug("Matched {} of {} downloads (poll {})", matched.size(), filenames.size(), polls);
    }

    Instant now = clock.instant();
    List<TransferRecord> updates = new ArrayList<>();
    List<TransferRecord> readyNow = new ArrayList<>();
    for (Map.Entry<String, TransferRecord> entry : matched.entrySet()) {
      TrackState state = tracks.get(entry.getKey());
      TransferRecord record = entry.getValue();
      state.markSeen(now);
      if (state.isProcessed()) {
        continue;
      }

      if (!record.isTerminal() && state.hasExceeded(now, settings.perTrackTimeout())) {
        STRUCTURED_LOGGER.logTrackTimeout(
            record.filename(), settings.perTrackTimeout().toMinutes());
        updates.add(record.asTimeout(settings.perTrackTimeout().toMinutes()));
        state.markProcessed();
        continue;
      }

      updates.add(record);
      if (record.isSuccessful()) {
        if (!settings.albumMode()) {
          state.markProcessed();
          readyNow.add(record);
        }
      } else if (record.isTerminal()) {
        state.markProcessed();
      }
    }

    if (!updates.isEmpty()) {
      sink.publish(updates);
    }
    for (TransferRecord record : readyNow) {
      LOGGER.info("Download completed, importing now: {}", record.filename());
      importSingleton(record);
    }

    boolean allProcessed = tracks.values().stream().allMatch(TrackState::isProcessed);
    boolean allSettled =
        matched.entrySet().stream()
            .allMatch(e -> e.getValue().isTerminal() || tracks.get(e.getKey()).isProcessed());
    if (!allProcessed && !allSettled) {
      return null;
    }

    if (settings.albumMode()) {
      importAlbum(matched);
    }
    closeUnseen();
    LOGGER.info("All downloads of the batch finished");
    return Outcome.FINISHED;
  }

  private void importSingleton(TransferRecord record) {
    Runnable task = () -> importOrchestrator.processCompleted(List.of(record), targetDir, sink);
    try {
      importExecutor.execute(task);
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Import pool is full, importing {} on the monitor thread", record.filename());
      task.run();
    }
  }

  /** Publish an errored record for every requested file the gateway never listed. */
  private void closeUnseen() {
    List<TransferRecord> neverSeen = new ArrayList<>();
    for (Map.Entry<String, TrackState> entry : tracks.entrySet()) {
      if (!entry.getValue().isSeen()) {
        TransferSelection selection = requested.get(entry.getKey());
        neverSeen.add(
            TransferRecord.errored(
                selection.username(), selection.filename(), selection.size(), NEVER_REPORTED));
      }
    }
    if (!neverSeen.isEmpty()) {
      LOGGER.warn("{} downloads were never reported by the gateway", neverSeen.size());
      sink.publish(neverSeen);
    }
  }

  private void importAlbum(Map<String, TransferRecord> matched) {
    List<TransferRecord> successful = new ArrayList<>();
    for (Map.Entry<String, TransferRecord> entry : matched.entrySet()) {
      TrackState state = tracks.get(entry.getKey());
      if (entry.getValue().isSuccessful() && !state.isProcessed()) {
        state.markProcessed();
        successful.add(entry.getValue());
      }
    }
    if (successful.isEmpty()) {
      LOGGER.info("Album mode: no successful downloads to import");
      return;
    }
    LOGGER.info("Album mode: importing {} downloads together", successful.size());
    importOrchestrator.processCompleted(successful, targetDir, sink);
  }

  /**
   * Pair gateway entries with requested files, in request order. When the gateway lists a file
   * more than once (an earlier attempt that failed, say) the last entry wins.
   */
  private Map<String, TransferRecord> match(List<TransferRecord> transfers) {
    Map<String, TransferRecord> byFilename = new LinkedHashMap<>();
    for (String filename : filenames) {
      for (TransferRecord transfer : transfers) {
        if (FilenameMatcher.matches(transfer.filename(), filename)) {
          byFilename.put(filename, transfer);
        }
      }
    }
    return byFilename;
  }
}
