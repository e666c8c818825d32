package com.tradingassistant.infra.ratelimit;

import com.tradingassistant.infra.ratelimit.bucket.SlidingWindowCounter;
import com.tradingassistant.infra.ratelimit.bucket.TokenBucket;
import com.tradingassistant.infra.ratelimit.errors.RateLimitExceededException;
import com.tradingassistant.infra.ratelimit.errors.RateLimitInterruptedException;
import com.tradingassistant.infra.ratelimit.observability.RateLimitTelemetry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Throttles outbound gateway calls per {@link OperationClass}.
 *
 * <p>Bucket exhaustion makes the caller wait; hard ceilings (historical-data window, market-data
 * lines) and an active backoff window fail fast with {@link RateLimitExceededException}.
 * Waiting is not fair across threads.
 */
public class GatewayRateLimiter {
  private static final Logger log = LoggerFactory.getLogger(GatewayRateLimiter.class);

  public static final String SUBSCRIPTION_LIMIT_TYPE = "market_data_subscriptions";
  static final Duration HISTORICAL_DATA_RETRY_AFTER = Duration.ofSeconds(60);

  private final RateLimitConfig config;
  private final Clock clock;
  private final Sleeper sleeper;
  private final RateLimitTelemetry telemetry;
  private final TokenBucket generalBucket;
  private final TokenBucket orderBucket;
  private final SlidingWindowCounter historicalDataWindow;

  private final Set<String> subscriptions = new LinkedHashSet<>();
  private final ReentrantLock subscriptionLock = new ReentrantLock();

  private final ReentrantLock backoffLock = new ReentrantLock();
  private Instant backoffUntil;
  private int consecutiveErrors;

  private final AtomicLong totalRequests = new AtomicLong();
  private final AtomicLong acceptedRequests = new AtomicLong();
  private final AtomicLong rejectedRequests = new AtomicLong();
  private final AtomicLong delayedRequests = new AtomicLong();
  private final AtomicLong totalDelayNanos = new AtomicLong();
  private volatile Instant statisticsResetAt;

  public GatewayRateLimiter(RateLimitConfig config, RateLimitTelemetry telemetry) {
    this(config, Clock.systemUTC(), duration -> Thread.sleep(duration.toMillis()), telemetry);
  }

  public GatewayRateLimiter(
      RateLimitConfig config, Clock clock, Sleeper sleeper, RateLimitTelemetry telemetry) {
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.generalBucket =
        new TokenBucket(config.maxRequestsPerSecond(), config.burstSize(), clock);
    this.orderBucket =
        new TokenBucket(config.maxOrdersPerSecond(), config.maxOrdersPerSecond() * 2.0d, clock);
    this.historicalDataWindow = new SlidingWindowCounter(config.historicalDataWindow(), clock);
    this.statisticsResetAt = clock.instant();
  }

  public void acquire(OperationClass operationClass) {
    acquire(operationClass, 1);
  }

  public void acquire(OperationClass operationClass, int weight) {
    Objects.requireNonNull(operationClass, "operationClass must not be null");
    if (weight <= 0) {
      throw new IllegalArgumentException("weight must be > 0");
    }
    totalRequests.incrementAndGet();

    Optional<Duration> remainingBackoff = remainingBackoff();
    if (remainingBackoff.isPresent()) {
      throw reject(
          operationClass,
          operationClass.limitType(),
          Duration.ofSeconds(remainingBackoff.get().getSeconds()));
    }

    Duration wait =
        switch (operationClass) {
          case GENERAL -> generalBucket.acquire(weight);
          case ORDER -> longer(generalBucket.acquire(weight), orderBucket.acquire(1));
          case HISTORICAL_DATA -> {
            int count = historicalDataWindow.addRequest();
            if (count > config.maxHistoricalDataRequests()) {
              throw reject(
                  operationClass, operationClass.limitType(), HISTORICAL_DATA_RETRY_AFTER);
            }
            yield generalBucket.acquire(weight);
          }
          case MARKET_DATA -> {
            if (subscriptionCount() >= config.maxMarketDataLines()) {
              throw reject(operationClass, SUBSCRIPTION_LIMIT_TYPE, Duration.ZERO);
            }
            yield generalBucket.acquire(weight);
          }
        };

    if (wait.compareTo(Duration.ZERO) > 0) {
      delayedRequests.incrementAndGet();
      totalDelayNanos.addAndGet(wait.toNanos());
      telemetry.onDelayed(operationClass, wait);
      log.debug(
          "Rate limit delay operation={} weight={} delayMs={}",
          operationClass.limitType(),
          weight,
          wait.toMillis());
      sleep(operationClass, wait);
    }

    acceptedRequests.incrementAndGet();
    telemetry.onAccepted(operationClass);
    backoffLock.lock();
    try {
      consecutiveErrors = 0;
    } finally {
      backoffLock.unlock();
    }
  }

  /** Non-blocking check that records no statistics. */
  public boolean tryAcquire(OperationClass operationClass) {
    Objects.requireNonNull(operationClass, "operationClass must not be null");
    if (remainingBackoff().isPresent()) {
      return false;
    }
    if (operationClass == OperationClass.ORDER) {
      return generalBucket.tryAcquire(1) && orderBucket.tryAcquire(1);
    }
    return generalBucket.tryAcquire(1);
  }

  /**
   * Opens (or widens) the backoff window after the gateway reported a rate violation.
   *
   * @return the length of the new backoff window
   */
  public Duration handleRateLimitError(String message) {
    backoffLock.lock();
    try {
      consecutiveErrors++;
      double scaled =
          config.initialBackoff().toMillis()
              * Math.pow(config.backoffMultiplier(), consecutiveErrors);
      long backoffMs = (long) Math.min((double) config.maxBackoff().toMillis(), scaled);
      Duration backoff = Duration.ofMillis(backoffMs);
      backoffUntil = clock.instant().plus(backoff);
      log.warn(
          "Gateway rate limit violation, backing off backoffMs={} consecutiveErrors={} message={}",
          backoffMs,
          consecutiveErrors,
          message);
      telemetry.onBackoff(backoff, consecutiveErrors);
      return backoff;
    } finally {
      backoffLock.unlock();
    }
  }

  public void resetBackoff() {
    backoffLock.lock();
    try {
      backoffUntil = null;
      consecutiveErrors = 0;
    } finally {
      backoffLock.unlock();
    }
  }

  public boolean isInBackoff() {
    return remainingBackoff().isPresent();
  }

  public void addSubscription(String symbol) {
    String key = requireSymbol(symbol);
    subscriptionLock.lock();
    try {
      if (subscriptions.contains(key)) {
        return;
      }
      if (subscriptions.size() >= config.maxMarketDataLines()) {
        throw new RateLimitExceededException(SUBSCRIPTION_LIMIT_TYPE, Duration.ZERO);
      }
      subscriptions.add(key);
      log.debug(
          "Added market data subscription symbol={} active={}/{}",
          key,
          subscriptions.size(),
          config.maxMarketDataLines());
    } finally {
      subscriptionLock.unlock();
    }
  }

  public void removeSubscription(String symbol) {
    String key = requireSymbol(symbol);
    subscriptionLock.lock();
    try {
      if (subscriptions.remove(key)) {
        log.debug(
            "Removed market data subscription symbol={} active={}/{}",
            key,
            subscriptions.size(),
            config.maxMarketDataLines());
      }
    } finally {
      subscriptionLock.unlock();
    }
  }

  public int clearSubscriptions() {
    subscriptionLock.lock();
    try {
      int cleared = subscriptions.size();
      subscriptions.clear();
      log.info("Cleared market data subscriptions count={}", cleared);
      return cleared;
    } finally {
      subscriptionLock.unlock();
    }
  }

  public Set<String> activeSubscriptions() {
    subscriptionLock.lock();
    try {
      return Set.copyOf(subscriptions);
    } finally {
      subscriptionLock.unlock();
    }
  }

  public int subscriptionCount() {
    subscriptionLock.lock();
    try {
      return subscriptions.size();
    } finally {
      subscriptionLock.unlock();
    }
  }

  public RateLimitStatistics statistics() {
    int errors;
    backoffLock.lock();
    try {
      errors = consecutiveErrors;
    } finally {
      backoffLock.unlock();
    }
    return RateLimitStatistics.of(
        totalRequests.get(),
        acceptedRequests.get(),
        rejectedRequests.get(),
        delayedRequests.get(),
        totalDelayNanos.get(),
        Duration.between(statisticsResetAt, clock.instant()),
        subscriptionCount(),
        isInBackoff(),
        errors);
  }

  public void resetStatistics() {
    totalRequests.set(0L);
    acceptedRequests.set(0L);
    rejectedRequests.set(0L);
    delayedRequests.set(0L);
    totalDelayNanos.set(0L);
    statisticsResetAt = clock.instant();
  }

  public RateLimitConfig config() {
    return config;
  }

  private Optional<Duration> remainingBackoff() {
    backoffLock.lock();
    try {
      if (backoffUntil == null) {
        return Optional.empty();
      }
      Duration remaining = Duration.between(clock.instant(), backoffUntil);
      if (remaining.isNegative() || remaining.isZero()) {
        return Optional.empty();
      }
      return Optional.of(remaining);
    } finally {
      backoffLock.unlock();
    }
  }

  private RateLimitExceededException reject(
      OperationClass operationClass, String limitType, Duration retryAfter) {
    rejectedRequests.incrementAndGet();
    telemetry.onRejected(operationClass, limitType);
    log.debug(
        "Rate limit rejection operation={} limitType={} retryAfterSeconds={}",
        operationClass.limitType(),
        limitType,
        retryAfter.getSeconds());
    return new RateLimitExceededException(limitType, retryAfter);
  }

  private void sleep(OperationClass operationClass, Duration wait) {
    try {
      sleeper.sleep(wait);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      rejectedRequests.incrementAndGet();
      telemetry.onRejected(operationClass, "interrupted");
      throw new RateLimitInterruptedException(
          "Interrupted while waiting for " + operationClass.limitType() + " rate limit",
          interrupted);
    }
  }

  private static Duration longer(Duration left, Duration right) {
    return left.compareTo(right) >= 0 ? left : right;
  }

  private static String requireSymbol(String symbol) {
    if (symbol == null || symbol.isBlank()) {
      throw new IllegalArgumentException("symbol is required");
    }
    return symbol.trim();
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
