package com.tradingassistant.bridge.session;

import com.tradingassistant.integration.gateway.ConnectionLostException;
import com.tradingassistant.integration.gateway.GatewayConnectionException;
import com.tradingassistant.integration.gateway.GatewaySession;
import com.tradingassistant.integration.gateway.LivenessAware;
import com.tradingassistant.integration.gateway.Pingable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plain TCP session to the gateway's API port. No messages are exchanged; {@link #ping()} probes
 * the socket with a short read so a peer close or reset is noticed. Bytes read by the probe are
 * discarded.
 */
public class TcpGatewaySession implements GatewaySession, LivenessAware, Pingable {
  private static final Logger log = LoggerFactory.getLogger(TcpGatewaySession.class);

  private final String host;
  private final int port;
  private final Duration connectTimeout;
  private final Duration pingTimeout;
  private volatile Socket socket;
  private volatile boolean peerClosed;

  public TcpGatewaySession(String host, int port, Duration connectTimeout, Duration pingTimeout) {
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("host is required");
    }
    if (port <= 0 || port > 65535) {
      throw new IllegalArgumentException("port must be between 1 and 65535");
    }
    this.host = host;
    this.port = port;
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
    this.pingTimeout = Objects.requireNonNull(pingTimeout, "pingTimeout must not be null");
    if (pingTimeout.isNegative() || pingTimeout.isZero()) {
      throw new IllegalArgumentException("pingTimeout must be > 0");
    }
  }

  @Override
  public synchronized void connect() {
    if (isConnected()) {
      return;
    }
    Socket candidate = new Socket();
    try {
      candidate.setKeepAlive(true);
      candidate.setTcpNoDelay(true);
      candidate.connect(new InetSocketAddress(host, port), toMillis(connectTimeout));
    } catch (IOException ex) {
      closeQuietly(candidate);
      throw new GatewayConnectionException(
          "Unable to reach gateway at " + endpoint() + ": " + ex.getMessage(), ex);
    }
    peerClosed = false;
    socket = candidate;
    log.info("Gateway socket connected endpoint={}", endpoint());
  }

  @Override
  public synchronized void disconnect() {
    Socket current = socket;
    socket = null;
    if (current != null) {
      closeQuietly(current);
      log.info("Gateway socket closed endpoint={}", endpoint());
    }
  }

  @Override
  public void ping() {
    Socket current = socket;
    if (current == null || !isConnected()) {
      throw new ConnectionLostException("Gateway socket is not connected endpoint=" + endpoint());
    }
    try {
      current.setSoTimeout(toMillis(pingTimeout));
      if (current.getInputStream().read() < 0) {
        peerClosed = true;
        throw new ConnectionLostException("Gateway closed the connection endpoint=" + endpoint());
      }
    } catch (SocketTimeoutException idle) {
      // nothing to read, the peer is still there
    } catch (IOException ex) {
      peerClosed = true;
      throw new ConnectionLostException(
          "Gateway connection failed endpoint=" + endpoint() + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public boolean isConnected() {
    Socket current = socket;
    return current != null
        && !peerClosed
        && current.isConnected()
        && !current.isClosed()
        && !current.isInputShutdown()
        && !current.isOutputShutdown();
  }

  public String endpoint() {
    return host + ":" + port;
  }

  private static int toMillis(Duration duration) {
    return (int) Math.min(Integer.MAX_VALUE, Math.max(1L, duration.toMillis()));
  }

  private static void closeQuietly(Socket candidate) {
    try {
      candidate.close();
    } catch (IOException ex) {
      log.debug("Failed to close gateway socket", ex);
    }
  }
}
