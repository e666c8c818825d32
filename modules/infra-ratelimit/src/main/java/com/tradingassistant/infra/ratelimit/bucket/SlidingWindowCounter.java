package com.tradingassistant.infra.ratelimit.bucket;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

public class SlidingWindowCounter {
  private final Duration window;
  private final Clock clock;
  private final Deque<Instant> requests = new ArrayDeque<>();
  private final ReentrantLock lock = new ReentrantLock();

  public SlidingWindowCounter(Duration window, Clock clock) {
    if (window == null || window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be > 0");
    }
    this.window = window;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public int addRequest() {
    lock.lock();
    try {
      Instant now = clock.instant();
      evictBefore(now.minus(window));
      requests.addLast(now);
      return requests.size();
    } finally {
      lock.unlock();
    }
  }

  public int getCount() {
    lock.lock();
    try {
      evictBefore(clock.instant().minus(window));
      return requests.size();
    } finally {
      lock.unlock();
    }
  }

  private void evictBefore(Instant cutoff) {
    while (!requests.isEmpty() && requests.peekFirst().isBefore(cutoff)) {
      requests.pollFirst();
    }
  }
}
