package com.tradingassistant.integration.gateway;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tradingassistant.domain.connection.ConnectionState;
import com.tradingassistant.integration.gateway.StubSessions.StubFactory;
import com.tradingassistant.integration.gateway.StubSessions.StubSession;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

/** Runs the monitor on real threads with short intervals. */
class ConnectionMonitorLifecycleTest {
  @Test
  void loopsShouldRunOnNamedThreadsAndStopBeforeSessionIsReleased() throws Exception {
    CountDownLatch pingStarted = new CountDownLatch(1);
    AtomicBoolean pingInFlight = new AtomicBoolean(false);
    AtomicBoolean pingInFlightAtDisconnect = new AtomicBoolean(false);
    Set<String> loopThreads = ConcurrentHashMap.newKeySet();

    class SlowPingSession extends StubSession implements Pingable {
      @Override
      public void ping() {
        loopThreads.add(Thread.currentThread().getName());
        pingInFlight.set(true);
        pingStarted.countDown();
        try {
          Thread.sleep(200L);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
        } finally {
          pingInFlight.set(false);
        }
      }

      @Override
      public void disconnect() {
        pingInFlightAtDisconnect.set(pingInFlight.get());
        super.disconnect();
      }
    }

    StubFactory factory = new StubFactory(SlowPingSession::new);
    ConnectionMonitor monitor =
        new ConnectionMonitor(
            factory,
            new ConnectionMonitorConfig(
                Duration.ofMillis(20), 3, Duration.ZERO, Duration.ofSeconds(2)),
            new SimpleMeterRegistry(),
            Clock.fixed(Instant.parse("2026-03-02T14:30:00Z"), ZoneOffset.UTC),
            duration -> Thread.sleep(duration.toMillis()));
    monitor.start();

    assertTrue(pingStarted.await(2, TimeUnit.SECONDS));
    monitor.stop();

    assertEquals(ConnectionState.SHUTDOWN, monitor.state());
    assertFalse(pingInFlightAtDisconnect.get());
    assertEquals(1, ((StubSession) factory.last()).disconnects.get());
    assertEquals(Set.of("gateway-heartbeat"), loopThreads);
  }

  @Test
  void concurrentReconnectCallersShouldShareOneSequence() throws Exception {
    CountDownLatch backoffEntered = new CountDownLatch(1);
    CountDownLatch releaseBackoff = new CountDownLatch(1);
    StubFactory factory = new StubFactory(StubSession::new);
    ConnectionMonitor monitor =
        new ConnectionMonitor(
            factory,
            new ConnectionMonitorConfig(
                Duration.ofMinutes(10), 3, Duration.ofMillis(1), Duration.ofSeconds(2)),
            new SimpleMeterRegistry(),
            Clock.systemUTC(),
            duration -> {
              backoffEntered.countDown();
              releaseBackoff.await();
            });
    ExecutorService callers = Executors.newFixedThreadPool(2);
    try {
      Future<Boolean> first = callers.submit(monitor::reconnect);
      assertTrue(backoffEntered.await(2, TimeUnit.SECONDS));
      Future<Boolean> second = callers.submit(monitor::reconnect);
      releaseBackoff.countDown();

      assertTrue(first.get(2, TimeUnit.SECONDS));
      assertTrue(second.get(2, TimeUnit.SECONDS));
      assertEquals(1, factory.invocations.get());
      assertEquals(1L, monitor.health().reconnectCount());
    } finally {
      callers.shutdownNow();
      monitor.stop();
    }
  }

  @Test
  void queuedReconnectCallerShouldShareAFailedOutcome() throws Exception {
    CountDownLatch backoffEntered = new CountDownLatch(1);
    CountDownLatch releaseBackoff = new CountDownLatch(1);
    StubFactory factory = new StubFactory(StubSession::new).alwaysFail();
    ConnectionMonitor monitor =
        new ConnectionMonitor(
            factory,
            new ConnectionMonitorConfig(
                Duration.ofMinutes(10), 1, Duration.ofMillis(1), Duration.ofSeconds(2)),
            new SimpleMeterRegistry(),
            Clock.systemUTC(),
            duration -> {
              backoffEntered.countDown();
              releaseBackoff.await();
            });
    AtomicReference<Boolean> firstOutcome = new AtomicReference<>();
    AtomicReference<Boolean> secondOutcome = new AtomicReference<>();
    Thread first = new Thread(() -> firstOutcome.set(monitor.reconnect()), "reconnect-a");
    Thread second = new Thread(() -> secondOutcome.set(monitor.reconnect()), "reconnect-b");
    try {
      first.start();
      assertTrue(backoffEntered.await(2, TimeUnit.SECONDS));
      second.start();
      awaitParked(second);
      releaseBackoff.countDown();

      first.join(2000L);
      second.join(2000L);
      assertEquals(Boolean.FALSE, firstOutcome.get());
      assertEquals(Boolean.FALSE, secondOutcome.get());
      assertEquals(1, factory.invocations.get());
      assertEquals(ConnectionState.ERROR, monitor.state());
    } finally {
      releaseBackoff.countDown();
      monitor.stop();
    }
  }

  @Test
  void defaultSleeperShouldWaitBetweenReconnectAttempts() {
    StubFactory factory = new StubFactory(StubSession::new).failNext(1);
    ConnectionMonitor monitor =
        new ConnectionMonitor(
            factory,
            new ConnectionMonitorConfig(
                Duration.ofMinutes(10), 3, Duration.ofMillis(40), Duration.ofSeconds(2)),
            new SimpleMeterRegistry());
    try {
      long startedAt = System.nanoTime();
      assertTrue(monitor.reconnect());
      long elapsedMillis = (System.nanoTime() - startedAt) / 1_000_000L;

      assertEquals(2, factory.invocations.get());
      assertTrue(
          elapsedMillis >= 120L, "expected 40ms + 80ms backoff, elapsedMillis=" + elapsedMillis);
    } finally {
      monitor.stop();
    }
  }

  private static void awaitParked(Thread thread) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
    while (thread.getState() != Thread.State.WAITING) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("thread never blocked state=" + thread.getState());
      }
      Thread.sleep(5L);
    }
  }
}
