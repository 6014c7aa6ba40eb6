package com.scholary.acquisition.transfer;

import com.scholary.acquisition.config.AcquisitionProperties;
import com.scholary.acquisition.gateway.GatewayException;
import com.scholary.acquisition.gateway.RequestedFile;
import com.scholary.acquisition.gateway.SubmittedFile;
import com.scholary.acquisition.gateway.TransferClient;
import com.scholary.acquisition.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Submits download requests to the gateway in small per-peer batches.
 *
 * <p>Selections are grouped by peer (first-seen order) and de-duplicated by filename. Each peer's
 * files go out in batches of {@code batchSize}, one after another with {@code batchDelayMillis}
 * between them, so a single peer connection is not flooded. Different peers are handled
 * concurrently.
 *
 * <p>A batch that fails with a retryable gateway error is retried up to {@code maxRetries} times
 * with exponential backoff ({@code retryBaseDelayMillis * 2^attempt}). A batch that still fails
 * produces one failed outcome per file; other batches are unaffected.
 */
@Component
public class TransferBatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(TransferBatcher.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final TransferClient transferClient;
  private final AcquisitionProperties.Transfer settings;
  private final Executor executor;

  public TransferBatcher(
      TransferClient transferClient,
      AcquisitionProperties properties,
      @Qualifier("workerExecutor") Executor executor) {
    this.transferClient = transferClient;
    this.settings = properties.transfer();
    this.executor = executor;
  }

  /**
   * Submit every selection.
   *
   * @return one outcome per distinct (peer, filename), peers in first-seen order
   */
  public List<TransferOutcome> download(List<TransferSelection> selections) {
    Map<String, Map<String, RequestedFile>> byPeer = new LinkedHashMap<>();
    for (TransferSelection selection : selections) {
      byPeer
          .computeIfAbsent(selection.username(), k -> new LinkedHashMap<>())
          .putIfAbsent(
              selection.filename(), new RequestedFile(selection.filename(), selection.size()));
    }

    String batchId = UUID.randomUUID().toString().substring(0, 8);
    LOGGER.info(
        "Submitting {} files from {} peers (batch {})", selections.size(), byPeer.size(), batchId);

    List<CompletableFuture<List<TransferOutcome>>> perPeer = new ArrayList<>();
    for (Map.Entry<String, Map<String, RequestedFile>> entry : byPeer.entrySet()) {
      List<RequestedFile> files = new ArrayList<>(entry.getValue().values());
      perPeer.add(
          CompletableFuture.supplyAsync(
              () -> submitForPeer(batchId, entry.getKey(), files), executor));
    }

    List<TransferOutcome> outcomes = new ArrayList<>();
    for (CompletableFuture<List<TransferOutcome>> future : perPeer) {
      outcomes.addAll(future.join());
    }
    long failed = outcomes.stream().filter(o -> !o.isAccepted()).count();
    LOGGER.info(
        "Batch {} done: {} accepted, {} failed", batchId, outcomes.size() - failed, failed);
    return outcomes;
  }

  private List<TransferOutcome> submitForPeer(
      String batchId, String username, List<RequestedFile> files) {
    MDC.put("batchId", batchId);
    try {
      List<TransferOutcome> outcomes = new ArrayList<>();
      int batchIndex = 0;
      for (int start = 0; start < files.size(); start += settings.batchSize()) {
        List<RequestedFile> batch =
            files.subList(start, Math.min(start + settings.batchSize(), files.size()));
        if (batchIndex > 0 && settings.batchDelayMillis() > 0) {
          if (!pause(settings.batchDelayMillis())) {
            outcomes.addAll(failAll(username, files.subList(start, files.size()), "Interrupted"));
            break;
          }
        }
        outcomes.addAll(submitBatch(username, batchIndex, batch));
        batchIndex++;
      }
      return outcomes;
    } finally {
      MDC.remove("batchId");
    }
  }

  private List<TransferOutcome> submitBatch(
      String username, int batchIndex, List<RequestedFile> batch) {
    GatewayException lastError = null;
    int attempts = 0;

    while (attempts <= settings.maxRetries()) {
      try {
        attempts++;
        List<SubmittedFile> submitted = transferClient.submitDownloads(username, batch);
        return submitted.stream()
            .map(f -> new TransferOutcome(username, f.filename(), f.size(), f.error()))
            .toList();
      } catch (GatewayException e) {
        lastError = e;
        if (!e.isRetryable() || attempts > settings.maxRetries()) {
          break;
        }
        long backoffMs = settings.retryBaseDelayMillis() * (1L << (attempts - 1));
        STRUCTURED_LOGGER.logBatchRetry(
            username, batchIndex, attempts, settings.maxRetries(), backoffMs, e.getMessage());
        if (!pause(backoffMs)) {
          break;
        }
      }
    }

    String message =
        String.format(
            "Failed after %d attempt%s: %s",
            attempts, attempts == 1 ? "" : "s", lastError.getMessage());
    STRUCTURED_LOGGER.logBatchFailed(username, batchIndex, batch.size(), message);
    return failAll(username, batch, message);
  }

  private static List<TransferOutcome> failAll(
      String username, List<RequestedFile> files, String error) {
    return files.stream()
        .map(f -> new TransferOutcome(username, f.filename(), f.size(), error))
        .toList();
  }

  /** @return false if interrupted */
  private static boolean pause(long millis) {
    try {
      Thread.sleep(millis);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Transfer submission interrupted");
      return false;
    }
  }
}
