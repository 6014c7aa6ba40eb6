package com.scholary.acquisition.transfer;

import com.scholary.acquisition.config.AcquisitionProperties;
import com.scholary.acquisition.gateway.TransferClient;
import com.scholary.acquisition.gateway.TransferRecord;
import com.scholary.acquisition.importer.ImportOrchestrator;
import com.scholary.acquisition.updates.TransferUpdateHub;
import com.scholary.acquisition.updates.TransferUpdateSink;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for downloading a user's selections.
 *
 * <p>Submits the selections, immediately publishes a queued or errored record for every file, and
 * starts a {@link DownloadMonitor} for the accepted ones. Monitors are tracked per user so a user
 * can stop all of theirs at once.
 */
@Service
public class TransferService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TransferService.class);
  static final String MONITOR_UNAVAILABLE = "Queued, but progress tracking could not start";

  private final TransferBatcher batcher;
  private final TransferClient transferClient;
  private final ImportOrchestrator importOrchestrator;
  private final TransferUpdateHub updateHub;
  private final DownloadMonitor.Settings monitorSettings;
  private final Clock clock;
  private final Executor monitorExecutor;
  private final Executor workerExecutor;
  private final Map<String, Set<DownloadMonitor>> activeMonitors = new ConcurrentHashMap<>();

  public TransferService(
      TransferBatcher batcher,
      TransferClient transferClient,
      ImportOrchestrator importOrchestrator,
      TransferUpdateHub updateHub,
      AcquisitionProperties properties,
      Clock clock,
      @Qualifier("monitorExecutor") Executor monitorExecutor,
      @Qualifier("workerExecutor") Executor workerExecutor) {
    this.batcher = batcher;
    this.transferClient = transferClient;
    this.importOrchestrator = importOrchestrator;
    this.updateHub = updateHub;
    this.monitorSettings = DownloadMonitor.Settings.from(properties);
    this.clock = clock;
    this.monitorExecutor = monitorExecutor;
    this.workerExecutor = workerExecutor;
  }

  /**
   * Submit selections and start monitoring the accepted files.
   *
   * @param userId opaque identity of the requesting user
   * @param targetFolder library folder the files are imported into
   * @return one outcome per distinct selected file
   */
  public List<TransferOutcome> queue(
      String userId, List<TransferSelection> selections, String targetFolder) {
    Path target = Path.of(targetFolder);
    try {
      Files.createDirectories(target);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create target folder " + target, e);
    }

    List<TransferOutcome> outcomes = batcher.download(selections);

    TransferUpdateSink sink = updateHub.sinkFor(userId);
    List<TransferRecord> initial = new ArrayList<>();
    List<TransferSelection> accepted = new ArrayList<>();
    for (TransferOutcome outcome : outcomes) {
      if (outcome.isAccepted()) {
        accepted.add(
            new TransferSelection(outcome.username(), outcome.filename(), outcome.size()));
        initial.add(TransferRecord.queued(outcome.username(), outcome.filename(), outcome.size()));
      } else {
        initial.add(
            TransferRecord.errored(
                outcome.username(), outcome.filename(), outcome.size(), outcome.error()));
      }
    }
    sink.publish(initial);

    if (accepted.isEmpty()) {
      LOGGER.warn("No files accepted for user {}, nothing to monitor", userId);
      return outcomes;
    }

    DownloadMonitor monitor =
        new DownloadMonitor(
            accepted,
            target,
            transferClient,
            importOrchestrator,
            sink,
            monitorSettings,
            clock,
            workerExecutor);
    activeMonitors.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(monitor);
    try {
      monitorExecutor.execute(
          () -> {
            try {
              monitor.run();
            } finally {
              release(userId, monitor);
            }
          });
    } catch (RejectedExecutionException e) {
      LOGGER.error("Could not start monitor for user {}: {}", userId, e.getMessage());
      release(userId, monitor);
      sink.publish(unmonitored(accepted));
      return outcomes;
    }
    LOGGER.info("Monitoring {} downloads for user {}", accepted.size(), userId);
    return outcomes;
  }

  /**
   * Stop every active monitor of a user. Downloads keep running in the gateway.
   *
   * @return number of monitors stopped
   */
  public int cancelMonitoring(String userId) {
    Set<DownloadMonitor> monitors = activeMonitors.remove(userId);
    if (monitors == null) {
      return 0;
    }
    monitors.forEach(DownloadMonitor::cancel);
    LOGGER.info("Cancelled {} monitors for user {}", monitors.size(), userId);
    return monitors.size();
  }

  public int activeMonitorCount(String userId) {
    return activeMonitors.getOrDefault(userId, Set.of()).size();
  }

  public List<TransferRecord> latest(String userId) {
    return updateHub.latest(userId);
  }

  public void cancelTransfer(String username, String transferId, boolean remove) {
    transferClient.cancelTransfer(username, transferId, remove);
  }

  public void clearCompleted() {
    transferClient.clearCompletedTransfers();
  }

  private static List<TransferRecord> unmonitored(List<TransferSelection> accepted) {
    List<TransferRecord> records = new ArrayList<>();
    for (TransferSelection selection : accepted) {
      records.add(
          TransferRecord.errored(
              selection.username(), selection.filename(), selection.size(), MONITOR_UNAVAILABLE));
    }
    return records;
  }

  private void release(String userId, DownloadMonitor monitor) {
    activeMonitors.computeIfPresent(
        userId,
        (user, set) -> {
          set.remove(monitor);
          return set.isEmpty() ? null : set;
        });
  }
}
