package com.tradingassistant.integration.gateway;

import com.tradingassistant.domain.connection.ConnectionState;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a gateway call against the monitored connection, retrying connection-class failures
 * with a doubling delay. Any other failure propagates on the first attempt.
 */
public class ConnectionRetryExecutor {
  private static final Logger log = LoggerFactory.getLogger(ConnectionRetryExecutor.class);

  private final ConnectionMonitor monitor;
  private final int maxAttempts;
  private final ExponentialBackoff backoff;
  private final Sleeper sleeper;

  public ConnectionRetryExecutor(ConnectionMonitor monitor, int maxAttempts, Duration baseDelay) {
    this(monitor, maxAttempts, baseDelay, duration -> Thread.sleep(duration.toMillis()));
  }

  public ConnectionRetryExecutor(
      ConnectionMonitor monitor, int maxAttempts, Duration baseDelay, Sleeper sleeper) {
    this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
    this.maxAttempts = Math.max(1, maxAttempts);
    this.backoff =
        new ExponentialBackoff(Objects.requireNonNull(baseDelay, "baseDelay must not be null"));
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  public <T> T execute(Operation<T> operation) {
    Objects.requireNonNull(operation, "operation must not be null");
    ConnectionState state = monitor.state();
    if (state == ConnectionState.ERROR || state == ConnectionState.SHUTDOWN) {
      throw new ConnectionLostException("Gateway connection unavailable state=" + state.value());
    }
    if (!monitor.isConnected()) {
      log.info("Gateway not connected before call, attempting reconnect state={}", state.value());
      monitor.reconnect();
    }

    int attempt = 0;
    while (true) {
      try {
        return operation.run();
      } catch (RuntimeException ex) {
        if (!GatewayConnectionException.isConnectionFailure(ex)) {
          throw ex;
        }
        if (attempt + 1 >= maxAttempts) {
          log.error(
              "Gateway call failed after retries attempts={} error={}",
              attempt + 1,
              ex.getMessage());
          throw ex;
        }
        Duration wait = backoff.backoffForAttempt(attempt + 1);
        log.warn(
            "Gateway call failed, retrying attempt={} maxAttempts={} delayMs={}",
            attempt + 1,
            maxAttempts,
            wait.toMillis());
        sleep(wait);
        attempt++;
      }
    }
  }

  private void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(
          "Interrupted during gateway connection retry backoff", interrupted);
    }
  }

  @FunctionalInterface
  public interface Operation<T> {
    T run();
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
