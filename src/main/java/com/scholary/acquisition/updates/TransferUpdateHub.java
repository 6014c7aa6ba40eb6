package com.scholary.acquisition.updates;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.acquisition.gateway.TransferRecord;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Per-user fan-out of transfer snapshots.
 *
 * <p>Publishers never block: each subscriber has a bounded queue and loses its oldest snapshots
 * when it falls behind (the lag is logged). The hub also remembers the latest record for every
 * (user, filename) so a client that reconnects can catch up without waiting for the next poll.
 */
@Component
public class TransferUpdateHub {

  private static final Logger LOGGER = LoggerFactory.getLogger(TransferUpdateHub.class);

  private final int subscriberQueueSize;
  private final Map<String, Set<UpdateSubscription>> subscribers = new ConcurrentHashMap<>();
  private final Cache<String, Map<String, TransferRecord>> latest;

  public TransferUpdateHub(
      @Value("${updates.subscriberQueueSize}") int subscriberQueueSize,
      @Value("${updates.snapshotRetentionHours}") int snapshotRetentionHours) {
    this.subscriberQueueSize = subscriberQueueSize;
    this.latest =
        Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(Duration.ofHours(snapshotRetentionHours))
            .build();
  }

  /** A sink that publishes to {@code userId}'s subscribers. */
  public TransferUpdateSink sinkFor(String userId) {
    return records -> publish(userId, records);
  }

  public void publish(String userId, List<TransferRecord> records) {
    if (records.isEmpty()) {
      return;
    }
    Map<String, TransferRecord> current =
        latest.get(userId, k -> new ConcurrentHashMap<>());
    for (TransferRecord record : records) {
      current.put(record.filename(), record);
    }
    latest.put(userId, current);

    List<TransferRecord> snapshot = List.copyOf(records);
    for (UpdateSubscription subscription : subscribers.getOrDefault(userId, Set.of())) {
      int evicted = subscription.offer(snapshot);
      if (evicted > 0) {
        LOGGER.warn(
            "Update subscriber for user {} lagging, dropped {} snapshots ({} total)",
            userId,
            evicted,
            subscription.getDropped());
      }
    }
  }

  public UpdateSubscription subscribe(String userId) {
    UpdateSubscription subscription =
        new UpdateSubscription(userId, subscriberQueueSize, this::unsubscribe);
    subscribers.computeIfAbsent(userId, k -> new CopyOnWriteArraySet<>()).add(subscription);
    LOGGER.debug("User {} subscribed to transfer updates", userId);
    return subscription;
  }

  /** Latest known record per file for a user. */
  public List<TransferRecord> latest(String userId) {
    Map<String, TransferRecord> current = latest.getIfPresent(userId);
    return current == null ? List.of() : new ArrayList<>(current.values());
  }

  public int subscriberCount(String userId) {
    return subscribers.getOrDefault(userId, Set.of()).size();
  }

  private void unsubscribe(UpdateSubscription subscription) {
    subscribers.computeIfPresent(
        subscription.getUserId(),
        (user, set) -> {
          set.remove(subscription);
          return set.isEmpty() ? null : set;
        });
  }
}
