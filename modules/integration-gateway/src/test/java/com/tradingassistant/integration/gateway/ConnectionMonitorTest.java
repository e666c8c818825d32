package com.tradingassistant.integration.gateway;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tradingassistant.domain.connection.ConnectionDomainException;
import com.tradingassistant.domain.connection.ConnectionHealth;
import com.tradingassistant.domain.connection.ConnectionState;
import com.tradingassistant.integration.gateway.StubSessions.LivenessSession;
import com.tradingassistant.integration.gateway.StubSessions.PingableSession;
import com.tradingassistant.integration.gateway.StubSessions.StubFactory;
import com.tradingassistant.integration.gateway.StubSessions.StubSession;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConnectionMonitorTest {
  private static final ConnectionMonitorConfig CONFIG =
      new ConnectionMonitorConfig(
          Duration.ofSeconds(10), 3, Duration.ofSeconds(1), Duration.ofSeconds(2));

  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T14:30:00Z"));
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
  private ConnectionMonitor monitor;

  @AfterEach
  void tearDown() {
    if (monitor != null) {
      monitor.stop();
    }
  }

  private ConnectionMonitor monitor(StubFactory factory) {
    monitor = new ConnectionMonitor(factory, CONFIG, registry, clock, sleeps::add);
    return monitor;
  }

  @Test
  void startShouldConnectAndNotifyListener() {
    StubFactory factory = new StubFactory(StubSession::new);
    ConnectionMonitor monitor = monitor(factory);
    AtomicReference<ConnectionHealth> notified = new AtomicReference<>();
    monitor.onConnected(notified::set);

    monitor.start();

    assertEquals(ConnectionState.CONNECTED, monitor.state());
    assertTrue(monitor.isConnected());
    assertSame(factory.last(), monitor.connection().orElseThrow());
    assertEquals(1, ((StubSession) factory.last()).connects.get());
    assertNotNull(notified.get());
    assertEquals(clock.instant(), monitor.health().connectedAt());
    assertEquals(clock.instant(), monitor.health().lastHeartbeatAt());
    assertTrue(monitor.healthReport().healthy());
  }

  @Test
  void startFailureShouldMoveToErrorAndThrow() {
    ConnectionMonitor monitor = monitor(new StubFactory(StubSession::new).alwaysFail());

    GatewayConnectionException ex = assertThrows(GatewayConnectionException.class, monitor::start);

    assertTrue(ex.getMessage().contains("gateway refused connection"));
    assertEquals(ConnectionState.ERROR, monitor.state());
    assertEquals(1L, monitor.health().errorCount());
    assertTrue(monitor.health().lastError().contains("gateway refused connection"));
    assertTrue(monitor.connection().isEmpty());
  }

  @Test
  void startShouldBeRejectedOnceRunning() {
    ConnectionMonitor monitor = monitor(new StubFactory(StubSession::new));
    monitor.start();

    assertThrows(ConnectionDomainException.class, monitor::start);
    assertEquals(ConnectionState.CONNECTED, monitor.state());
  }

  @Test
  void reconnectShouldSucceedAfterOneFailedAttempt() {
    StubFactory factory = new StubFactory(StubSession::new).failNext(1);
    ConnectionMonitor monitor = monitor(factory);

    assertTrue(monitor.reconnect());

    assertEquals(2, factory.invocations.get());
    assertEquals(ConnectionState.CONNECTED, monitor.state());
    assertEquals(1L, monitor.health().reconnectCount());
    assertEquals(1L, monitor.health().errorCount());
    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
    assertEquals(
        1.0d,
        registry
            .get("gateway.connection.reconnect.total")
            .tag("outcome", "success")
            .counter()
            .count());
  }

  @Test
  void reconnectWhileConnectedShouldNotInvokeFactory() {
    StubFactory factory = new StubFactory(StubSession::new);
    ConnectionMonitor monitor = monitor(factory);
    monitor.start();

    assertTrue(monitor.reconnect());

    assertEquals(1, factory.invocations.get());
    assertEquals(0L, monitor.health().reconnectCount());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void exhaustedReconnectShouldMoveToErrorAndNotify() {
    StubFactory factory = new StubFactory(StubSession::new).alwaysFail();
    ConnectionMonitor monitor = monitor(factory);
    AtomicReference<GatewayConnectionException> reported = new AtomicReference<>();
    monitor.onError(reported::set);

    assertFalse(monitor.reconnect());

    assertEquals(3, factory.invocations.get());
    assertEquals(ConnectionState.ERROR, monitor.state());
    assertInstanceOf(ConnectionLostException.class, reported.get());
    assertEquals(
        List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
    assertEquals(
        1.0d,
        registry
            .get("gateway.connection.reconnect.total")
            .tag("outcome", "exhausted")
            .counter()
            .count());
  }

  @Test
  void explicitReconnectShouldRecoverFromError() {
    StubFactory factory = new StubFactory(StubSession::new).failNext(3);
    ConnectionMonitor monitor = monitor(factory);
    assertFalse(monitor.reconnect());

    assertTrue(monitor.reconnect());
    assertEquals(ConnectionState.CONNECTED, monitor.state());
  }

  @Test
  void interruptedBackoffShouldAbortSequence() {
    StubFactory factory = new StubFactory(StubSession::new);
    monitor =
        new ConnectionMonitor(
            factory,
            CONFIG,
            registry,
            clock,
            duration -> {
              throw new InterruptedException("stopping");
            });

    try {
      assertFalse(monitor.reconnect());
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
    assertEquals(0, factory.invocations.get());
    assertEquals(ConnectionState.ERROR, monitor.state());
  }

  @Test
  void reconnectAfterStopShouldReturnFalse() {
    StubFactory factory = new StubFactory(StubSession::new);
    ConnectionMonitor monitor = monitor(factory);
    monitor.stop();

    assertFalse(monitor.reconnect());
    assertEquals(ConnectionState.SHUTDOWN, monitor.state());
    assertEquals(0, factory.invocations.get());
  }

  @Test
  void failingListenerShouldNotBreakConnection() {
    ConnectionMonitor monitor = monitor(new StubFactory(StubSession::new));
    monitor.onConnected(
        health -> {
          throw new IllegalStateException("listener bug");
        });

    monitor.start();

    assertEquals(ConnectionState.CONNECTED, monitor.state());
  }

  @Test
  void lastRegisteredListenerWins() {
    ConnectionMonitor monitor = monitor(new StubFactory(StubSession::new));
    List<String> calls = new CopyOnWriteArrayList<>();
    monitor.onConnected(health -> calls.add("first"));
    monitor.onConnected(health -> calls.add("second"));

    monitor.start();

    assertEquals(List.of("second"), calls);
  }

  @Test
  void heartbeatShouldRecordPingLatencyAndMessages() {
    StubFactory factory = new StubFactory(PingableSession::new);
    ConnectionMonitor monitor = monitor(factory);
    monitor.start();
    clock.advance(Duration.ofSeconds(10));

    monitor.sendHeartbeat();

    ConnectionHealth health = monitor.health();
    assertEquals(1, ((PingableSession) factory.last()).pings.get());
    assertEquals(clock.instant(), health.lastHeartbeatAt());
    assertEquals(1L, health.messagesSent());
    assertEquals(1L, health.messagesReceived());
    assertEquals(1L, registry.get("gateway.connection.heartbeat.latency").timer().count());
  }

  @Test
  void heartbeatShouldMarkUnreachableSessionDisconnected() {
    StubFactory factory = new StubFactory(PingableSession::new);
    ConnectionMonitor monitor = monitor(factory);
    monitor.start();
    ((PingableSession) factory.last()).pingFailure = new ConnectionLostException("socket closed");

    monitor.sendHeartbeat();

    assertEquals(ConnectionState.DISCONNECTED, monitor.state());
    assertEquals("socket closed", monitor.health().lastError());
    assertEquals(
        1.0d, registry.get("gateway.connection.heartbeat.failures.total").counter().count());
  }

  @Test
  void heartbeatShouldCountOtherFailuresWithoutDroppingConnection() {
    StubFactory factory = new StubFactory(PingableSession::new);
    ConnectionMonitor monitor = monitor(factory);
    monitor.start();
    ((PingableSession) factory.last()).pingFailure = new IllegalArgumentException("bad reply");

    monitor.sendHeartbeat();

    assertEquals(ConnectionState.CONNECTED, monitor.state());
    assertEquals(1L, monitor.health().errorCount());
  }

  @Test
  void heartbeatShouldUseLivenessWhenSessionCannotPing() {
    StubFactory factory = new StubFactory(LivenessSession::new);
    ConnectionMonitor monitor = monitor(factory);
    monitor.start();
    ((LivenessSession) factory.last()).connected = false;

    monitor.sendHeartbeat();

    assertEquals(ConnectionState.DISCONNECTED, monitor.state());
  }

  @Test
  void livenessCheckShouldReplaceDeadSession() {
    StubFactory factory = new StubFactory(LivenessSession::new);
    ConnectionMonitor monitor = monitor(factory);
    List<String> events = new CopyOnWriteArrayList<>();
    monitor.onDisconnected(health -> events.add("disconnected"));
    monitor.onConnected(health -> events.add("connected"));
    monitor.start();
    LivenessSession dead = (LivenessSession) factory.last();
    dead.connected = false;

    monitor.checkLiveness();

    assertEquals(ConnectionState.CONNECTED, monitor.state());
    assertEquals(2, factory.invocations.get());
    assertEquals(1, dead.disconnects.get());
    assertSame(factory.last(), monitor.connection().orElseThrow());
    assertEquals(1L, monitor.health().reconnectCount());
    assertEquals(List.of("connected", "disconnected", "connected"), events);
  }

  @Test
  void livenessCheckShouldReconnectWhenHeartbeatIsStale() {
    StubFactory factory = new StubFactory(StubSession::new);
    ConnectionMonitor monitor = monitor(factory);
    monitor.start();

    clock.advance(Duration.ofSeconds(30));
    monitor.checkLiveness();
    assertEquals(1, factory.invocations.get());

    clock.advance(Duration.ofSeconds(1));
    monitor.checkLiveness();
    assertEquals(2, factory.invocations.get());
    assertEquals(ConnectionState.CONNECTED, monitor.state());
  }

  @Test
  void livenessCheckShouldLeaveExhaustedMonitorAlone() {
    StubFactory factory = new StubFactory(StubSession::new).alwaysFail();
    ConnectionMonitor monitor = monitor(factory);
    monitor.reconnect();

    monitor.checkLiveness();

    assertEquals(3, factory.invocations.get());
    assertEquals(ConnectionState.ERROR, monitor.state());
  }

  @Test
  void stopShouldReleaseSessionOnce() {
    StubFactory factory = new StubFactory(StubSession::new);
    ConnectionMonitor monitor = monitor(factory);
    List<ConnectionState> disconnectedStates = new CopyOnWriteArrayList<>();
    monitor.onDisconnected(health -> disconnectedStates.add(health.state()));
    monitor.start();

    monitor.stop();
    monitor.stop();

    assertEquals(ConnectionState.SHUTDOWN, monitor.state());
    assertEquals(1, ((StubSession) factory.last()).disconnects.get());
    assertEquals(List.of(ConnectionState.SHUTDOWN), disconnectedStates);
    assertTrue(monitor.connection().isEmpty());
    assertThrows(ConnectionDomainException.class, monitor::start);
  }

  @Test
  void healthReportShouldExposeUptime() {
    ConnectionMonitor monitor = monitor(new StubFactory(StubSession::new));
    monitor.start();
    clock.advance(Duration.ofMinutes(2));

    ConnectionHealthReport report = monitor.healthReport();

    assertEquals("connected", report.state());
    assertEquals(Duration.ofMinutes(2), report.uptime());
    assertFalse(report.healthy());
  }
}
