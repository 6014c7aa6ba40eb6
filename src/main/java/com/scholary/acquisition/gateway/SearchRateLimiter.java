package com.scholary.acquisition.gateway;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sliding-window limiter for search-initiating gateway calls.
 *
 * <p>Admits at most {@code maxPerWindow} calls in any {@code window}. When the window is full the
 * caller waits until the oldest admission leaves it. The lock covers only the read-then-update of
 * the timestamp list; waiting happens outside it so one blocked caller never holds up the
 * accounting for others.
 */
public class SearchRateLimiter {

  private static final Logger LOGGER = LoggerFactory.getLogger(SearchRateLimiter.class);

  private final int maxPerWindow;
  private final Duration window;
  private final Clock clock;
  private final Deque<Instant> admissions = new ArrayDeque<>();

  public SearchRateLimiter(int maxPerWindow, Duration window, Clock clock) {
    if (maxPerWindow <= 0) {
      throw new IllegalArgumentException("maxPerWindow must be positive");
    }
    this.maxPerWindow = maxPerWindow;
    this.window = window;
    this.clock = clock;
  }

  /**
   * Block until a slot is free, then claim it.
   *
   * @throws GatewayException if interrupted while waiting
   */
  public void acquire() {
    while (true) {
      Duration wait;
      synchronized (admissions) {
        Instant now = clock.instant();
        Instant windowStart = now.minus(window);
        while (!admissions.isEmpty() && !admissions.peekFirst().isAfter(windowStart)) {
          admissions.pollFirst();
        }
        if (admissions.size() < maxPerWindow) {
          admissions.addLast(now);
          return;
        }
        wait = Duration.between(now, admissions.peekFirst().plus(window));
      }

      LOGGER.info(
          "Search rate limit reached ({} per {}s), waiting {}ms",
          maxPerWindow,
          window.toSeconds(),
          wait.toMillis());
      try {
        Thread.sleep(Math.max(1, wait.toMillis()));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new GatewayException(0, "Interrupted while waiting for search rate limit", e);
      }
    }
  }

  /** Admissions currently inside the window. */
  public int inFlight() {
    synchronized (admissions) {
      Instant windowStart = clock.instant().minus(window);
      return (int) admissions.stream().filter(ts -> ts.isAfter(windowStart)).count();
    }
  }
}
