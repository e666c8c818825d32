package com.tradingassistant.infra.ratelimit.bucket;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket with lazy refill. {@link #acquire(int)} may drive the balance negative: the
 * deficit is a reservation that the caller honours by waiting the returned duration.
 */
public class TokenBucket {
  private final double ratePerSecond;
  private final double capacity;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private double tokens;
  private Instant lastRefillAt;

  public TokenBucket(double ratePerSecond, double capacity, Clock clock) {
    if (ratePerSecond <= 0.0d) {
      throw new IllegalArgumentException("ratePerSecond must be > 0");
    }
    if (capacity <= 0.0d) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.ratePerSecond = ratePerSecond;
    this.capacity = capacity;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.tokens = capacity;
    this.lastRefillAt = clock.instant();
  }

  public Duration acquire(int requested) {
    requirePositive(requested);
    lock.lock();
    try {
      refill();
      if (tokens >= requested) {
        tokens -= requested;
        return Duration.ZERO;
      }
      double deficit = requested - tokens;
      tokens -= requested;
      return secondsToDuration(deficit / ratePerSecond);
    } finally {
      lock.unlock();
    }
  }

  public boolean tryAcquire(int requested) {
    requirePositive(requested);
    lock.lock();
    try {
      refill();
      if (tokens >= requested) {
        tokens -= requested;
        return true;
      }
      return false;
    } finally {
      lock.unlock();
    }
  }

  public double availableTokens() {
    lock.lock();
    try {
      refill();
      return tokens;
    } finally {
      lock.unlock();
    }
  }

  private void refill() {
    Instant now = clock.instant();
    long elapsedNanos = Duration.between(lastRefillAt, now).toNanos();
    if (elapsedNanos > 0L) {
      tokens = Math.min(capacity, tokens + (elapsedNanos / 1_000_000_000.0d) * ratePerSecond);
    }
    lastRefillAt = now;
  }

  private static void requirePositive(int requested) {
    if (requested <= 0) {
      throw new IllegalArgumentException("requested tokens must be > 0");
    }
  }

  private static Duration secondsToDuration(double seconds) {
    return Duration.ofNanos((long) Math.ceil(seconds * 1_000_000_000.0d));
  }
}
