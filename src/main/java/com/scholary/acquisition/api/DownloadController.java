package com.scholary.acquisition.api;

import com.scholary.acquisition.gateway.TransferRecord;
import com.scholary.acquisition.transfer.TransferOutcome;
import com.scholary.acquisition.transfer.TransferService;
import com.scholary.acquisition.updates.TransferUpdateHub;
import com.scholary.acquisition.updates.UpdateSubscription;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API for downloads.
 *
 * <p>The caller's identity is the opaque {@code X-User} header; it scopes update streams and
 * monitor cancellation.
 */
@RestController
@Tag(name = "Downloads", description = "Transfer submission, progress and maintenance")
public class DownloadController {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadController.class);
  static final String USER_HEADER = "X-User";

  private final TransferService transferService;
  private final TransferUpdateHub updateHub;
  private final Executor streamExecutor;

  public DownloadController(
      TransferService transferService,
      TransferUpdateHub updateHub,
      @Qualifier("streamExecutor") Executor streamExecutor) {
    this.transferService = transferService;
    this.updateHub = updateHub;
    this.streamExecutor = streamExecutor;
  }

  @PostMapping("/api/downloads")
  @Operation(
      summary = "Queue downloads",
      description = "Submit selected files to the gateway and start monitoring them")
  public ResponseEntity<DownloadResponse> queue(
      @RequestHeader(USER_HEADER) String userId, @Valid @RequestBody DownloadRequest request) {
    List<TransferOutcome> outcomes =
        transferService.queue(userId, request.items(), request.targetFolder());
    return ResponseEntity.accepted().body(DownloadResponse.of(outcomes));
  }

  @GetMapping("/api/downloads")
  @Operation(summary = "Current downloads", description = "Latest known state of each file")
  public List<TransferRecord> current(@RequestHeader(USER_HEADER) String userId) {
    return transferService.latest(userId);
  }

  @GetMapping("/api/downloads/updates")
  @Operation(summary = "Stream updates", description = "Server-sent events of transfer snapshots")
  public SseEmitter updates(@RequestHeader(USER_HEADER) String userId) {
    SseEmitter emitter = new SseEmitter(0L);
    UpdateSubscription subscription = updateHub.subscribe(userId);
    emitter.onCompletion(subscription::close);
    emitter.onTimeout(subscription::close);
    emitter.onError(e -> subscription.close());

    try {
      streamExecutor.execute(() -> stream(emitter, subscription, userId));
    } catch (RejectedExecutionException e) {
      subscription.close();
      throw e;
    }
    return emitter;
  }

  @PostMapping("/api/downloads/monitoring/cancel")
  @Operation(summary = "Stop monitoring", description = "Stop all of the caller's monitors")
  public ResponseEntity<Integer> cancelMonitoring(@RequestHeader(USER_HEADER) String userId) {
    return ResponseEntity.ok(transferService.cancelMonitoring(userId));
  }

  @DeleteMapping("/api/downloads/{username}/{id}")
  @Operation(summary = "Cancel transfer", description = "Cancel one transfer in the gateway")
  public ResponseEntity<Void> cancelTransfer(
      @PathVariable String username,
      @PathVariable String id,
      @RequestParam(defaultValue = "false") boolean remove) {
    transferService.cancelTransfer(username, id, remove);
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/api/downloads/completed")
  @Operation(
      summary = "Clear completed",
      description = "Remove finished transfers from the gateway")
  public ResponseEntity<Void> clearCompleted() {
    transferService.clearCompleted();
    return ResponseEntity.noContent().build();
  }

  private void stream(SseEmitter emitter, UpdateSubscription subscription, String userId) {
    try {
      List<TransferRecord> current = transferService.latest(userId);
      if (!current.isEmpty()) {
        emitter.send(SseEmitter.event().name("transfers").data(current));
      }
      while (!subscription.isClosed()) {
        List<TransferRecord> snapshot = subscription.poll(Duration.ofSeconds(15));
        if (snapshot != null) {
          emitter.send(SseEmitter.event().name("transfers").data(snapshot));
        } else {
          emitter.send(SseEmitter.event().comment("keep-alive"));
        }
      }
    } catch (IOException | IllegalStateException e) {
      LOGGER.debug("Update stream for user {} closed: {}", userId, e.getMessage());
      emitter.completeWithError(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      emitter.complete();
    } finally {
      subscription.close();
    }
  }
}
