package com.scholary.acquisition.updates;

import com.scholary.acquisition.gateway.TransferRecord;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One listener's bounded queue of snapshots.
 *
 * <p>A slow listener loses its oldest snapshots rather than slowing down publishers.
 */
public class UpdateSubscription implements AutoCloseable {

  private final String userId;
  private final BlockingQueue<List<TransferRecord>> queue;
  private final AtomicLong dropped = new AtomicLong();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final Consumer<UpdateSubscription> onClose;

  UpdateSubscription(String userId, int capacity, Consumer<UpdateSubscription> onClose) {
    this.userId = userId;
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.onClose = onClose;
  }

  public String getUserId() {
    return userId;
  }

  /**
   * Wait up to {@code timeout} for the next snapshot.
   *
   * @return the snapshot, or null if none arrived in time
   */
  public List<TransferRecord> poll(Duration timeout) throws InterruptedException {
    return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Snapshots lost to overflow since subscribing. */
  public long getDropped() {
    return dropped.get();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Enqueue, evicting the oldest snapshots while full.
   *
   * @return number of snapshots evicted
   */
  int offer(List<TransferRecord> snapshot) {
    int evicted = 0;
    while (!queue.offer(snapshot)) {
      if (queue.poll() != null) {
        evicted++;
      }
    }
    dropped.addAndGet(evicted);
    return evicted;
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      onClose.accept(this);
    }
  }
}
