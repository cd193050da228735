package com.changefeed.gateway.connection;

import com.changefeed.domain.sessions.AccessClaims;
import com.changefeed.domain.sessions.ConnectionState;
import com.changefeed.domain.sessions.ConnectionStateMachine;
import com.changefeed.domain.sessions.ErrorCode;
import com.changefeed.gateway.protocol.ServerMessage;
import com.changefeed.gateway.protocol.ServerMessageCodec;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One client session: its state machine, bounded outbound queue and serial sender.
 *
 * <p>Producers (dispatcher workers, the message handler, the sweeper) only enqueue. At most one
 * drain task per connection runs on the shared sender executor, so frames reach the transport in
 * enqueue order and a blocked send stalls this connection alone.
 */
public class ClientConnection {
  private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);

  static final int NORMAL_CLOSURE = 1000;
  static final int GOING_AWAY = 1001;
  static final int SERVER_ERROR = 1011;

  private final String connectionId;
  private final ClientTransport transport;
  private final OutboundQueue queue;
  private final ServerMessageCodec codec;
  private final Executor senderExecutor;
  private final ConnectionListener listener;
  private final Clock clock;
  private final long lagThreshold;
  private final Instant openedAt;

  private final Object stateMonitor = new Object();
  private final AtomicBoolean drainScheduled = new AtomicBoolean();
  private final AtomicBoolean released = new AtomicBoolean();
  private final AtomicLong droppedEvents = new AtomicLong();

  private volatile ConnectionState state = ConnectionState.CONNECTING;
  private volatile AccessClaims claims;
  private volatile String resumeIdentity;
  private volatile String resumeKey;
  private volatile Long resumeSequence;
  private volatile Instant lastActivityAt;
  private volatile Instant laggingSince;
  private volatile Instant closingSince;
  private volatile long lastDeliveredSequence;
  private volatile long resumableSequence = -1L;
  private volatile boolean closeAfterFlush;
  private volatile boolean transportReleased;
  private volatile ErrorCode closeCode;

  public ClientConnection(
      String connectionId,
      ClientTransport transport,
      int queueCapacity,
      long lagThreshold,
      ServerMessageCodec codec,
      Executor senderExecutor,
      ConnectionListener listener,
      Clock clock) {
    if (connectionId == null || connectionId.isBlank()) {
      throw new IllegalArgumentException("connectionId must not be blank");
    }
    this.connectionId = connectionId;
    this.transport = Objects.requireNonNull(transport, "transport must not be null");
    this.queue = new OutboundQueue(queueCapacity);
    this.lagThreshold = Math.max(0L, lagThreshold);
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.senderExecutor = Objects.requireNonNull(senderExecutor, "senderExecutor must not be null");
    this.listener = listener == null ? ConnectionListener.NONE : listener;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.openedAt = clock.instant();
    this.lastActivityAt = openedAt;
  }

  public boolean authenticate(
      AccessClaims claims, String resumeIdentity, String resumeKey, Long resumeSequence) {
    Objects.requireNonNull(claims, "claims must not be null");
    synchronized (stateMonitor) {
      if (state != ConnectionState.CONNECTING) {
        return false;
      }
      ConnectionStateMachine.validateTransition(state, ConnectionState.AUTHENTICATED);
      this.claims = claims;
      this.resumeIdentity = resumeIdentity;
      this.resumeKey = resumeKey;
      this.resumeSequence = resumeSequence;
      this.state = ConnectionState.AUTHENTICATED;
    }
    log.info(
        "Connection authenticated connection_id={} subject={} resumed={}",
        connectionId,
        claims.subject(),
        resumeSequence != null);
    return true;
  }

  /** Moves an authenticated connection to active; a no-op in any other state. */
  public boolean activate() {
    synchronized (stateMonitor) {
      if (state != ConnectionState.AUTHENTICATED) {
        return false;
      }
      ConnectionStateMachine.validateTransition(state, ConnectionState.ACTIVE);
      state = ConnectionState.ACTIVE;
      return true;
    }
  }

  public void touch() {
    lastActivityAt = clock.instant();
  }

  /** Never blocks. A full queue marks the connection lagging and every later event is dropped. */
  public OfferResult offerEvent(ServerMessage.Event event) {
    if (!state.acceptsEvents() || closeAfterFlush) {
      return OfferResult.REJECTED;
    }
    if (laggingSince != null) {
      return drop();
    }
    if (!queue.offerEvent(event)) {
      markLagging();
      return drop();
    }
    scheduleDrain();
    return OfferResult.ACCEPTED;
  }

  public boolean sendControl(ServerMessage message) {
    if (state.isTerminal() || closeAfterFlush) {
      return false;
    }
    queue.offerControl(message);
    scheduleDrain();
    return true;
  }

  /**
   * Queues a resume checkpoint behind the frames already enqueued. A lagging connection has lost
   * frames, so its checkpoint stays where it was.
   */
  public boolean checkpoint(long sequence) {
    if (state.isTerminal() || closeAfterFlush || laggingSince != null) {
      return false;
    }
    queue.offerControl(new ResumeCheckpoint(sequence));
    scheduleDrain();
    return true;
  }

  /** Sends an error frame, closing the connection when the code demands it. */
  public boolean sendError(ErrorCode code, String message, String subscriptionId) {
    if (code.closesConnection()) {
      return closeWithError(code, message);
    }
    return sendControl(ServerMessage.Error.of(code, message, subscriptionId));
  }

  /** Aborts: pending frames are discarded, the error frame is flushed, then the transport closes. */
  public boolean closeWithError(ErrorCode code, String message) {
    Objects.requireNonNull(code, "code must not be null");
    synchronized (stateMonitor) {
      if (state.isTerminal() || state == ConnectionState.DRAINING) {
        return false;
      }
      ConnectionStateMachine.validateTransition(state, ConnectionState.CLOSED);
      state = ConnectionState.CLOSED;
      closeCode = code;
      closingSince = clock.instant();
      queue.clear();
      queue.offerControl(ServerMessage.Error.of(code, message, null));
      closeAfterFlush = true;
    }
    log.info(
        "Connection aborted connection_id={} code={} message={} dropped_events={}",
        connectionId,
        code.wireCode(),
        message,
        droppedEvents.get());
    release();
    scheduleDrain();
    return true;
  }

  /**
   * Graceful close: no further events are accepted, the queue is flushed within the drain grace
   * period, then the optional final error frame is sent and the transport closed.
   */
  public boolean drain(ErrorCode finalCode, String message) {
    ConnectionState current = state;
    if (current == ConnectionState.CONNECTING && finalCode != null) {
      return closeWithError(finalCode, message);
    }
    synchronized (stateMonitor) {
      if (state.isTerminal() || state == ConnectionState.DRAINING) {
        return false;
      }
      if (state == ConnectionState.CONNECTING) {
        state = ConnectionState.CLOSED;
      } else {
        ConnectionStateMachine.validateTransition(state, ConnectionState.DRAINING);
        state = ConnectionState.DRAINING;
      }
      closeCode = finalCode;
      closingSince = clock.instant();
      if (finalCode != null) {
        queue.offerControl(ServerMessage.Error.of(finalCode, message, null));
      }
      closeAfterFlush = true;
    }
    log.info(
        "Connection draining connection_id={} pending_events={} final_code={}",
        connectionId,
        queue.pendingEvents(),
        finalCode == null ? "none" : finalCode.wireCode());
    release();
    scheduleDrain();
    return true;
  }

  /** The peer went away or the transport failed; nothing more can be flushed. */
  public void transportClosed() {
    synchronized (stateMonitor) {
      if (state == ConnectionState.ACTIVE || state == ConnectionState.AUTHENTICATED) {
        state = ConnectionState.DRAINING;
      }
      if (state != ConnectionState.CLOSED) {
        ConnectionStateMachine.validateTransition(state, ConnectionState.CLOSED);
        state = ConnectionState.CLOSED;
        closingSince = clock.instant();
      }
      closeAfterFlush = false;
      transportReleased = true;
      queue.clear();
    }
    log.debug("Connection transport closed connection_id={}", connectionId);
    release();
  }

  /** Closes the transport regardless of pending frames, e.g. after the drain grace period. */
  public void forceClose() {
    synchronized (stateMonitor) {
      if (state != ConnectionState.CLOSED) {
        ConnectionStateMachine.validateTransition(state, ConnectionState.CLOSED);
        state = ConnectionState.CLOSED;
      }
      closeAfterFlush = false;
      queue.clear();
    }
    log.warn(
        "Connection force closed connection_id={} code={}",
        connectionId,
        closeCode == null ? "none" : closeCode.wireCode());
    closeTransport();
    release();
  }

  public String connectionId() {
    return connectionId;
  }

  public ConnectionState state() {
    return state;
  }

  public AccessClaims claims() {
    return claims;
  }

  public String resumeIdentity() {
    return resumeIdentity;
  }

  public String resumeKey() {
    return resumeKey;
  }

  /** Sequence the client resumed from, or null for a fresh session. */
  public Long resumeSequence() {
    return resumeSequence;
  }

  public Instant openedAt() {
    return openedAt;
  }

  public Instant lastActivityAt() {
    return lastActivityAt;
  }

  public Instant laggingSince() {
    return laggingSince;
  }

  public boolean isLagging() {
    return laggingSince != null;
  }

  public Instant closingSince() {
    return closingSince;
  }

  public long droppedEvents() {
    return droppedEvents.get();
  }

  /** Highest event sequence written to the transport. */
  public long lastDeliveredSequence() {
    return lastDeliveredSequence;
  }

  /**
   * Last checkpoint the sender passed, or -1 before the first one. It can move back when a
   * subscription that replays older entries joins the connection.
   */
  public long resumableSequence() {
    return resumableSequence;
  }

  public int pendingEvents() {
    return queue.pendingEvents();
  }

  public ErrorCode closeCode() {
    return closeCode;
  }

  /** Closed and the transport has been released; nothing further will happen. */
  public boolean isTerminated() {
    return state == ConnectionState.CLOSED && transportReleased;
  }

  private OfferResult drop() {
    long dropped = droppedEvents.incrementAndGet();
    if (dropped > lagThreshold) {
      closeWithError(
          ErrorCode.SLOW_CONSUMER, "dropped " + dropped + " events while the client lagged");
    }
    return OfferResult.DROPPED;
  }

  private void markLagging() {
    synchronized (stateMonitor) {
      if (laggingSince != null) {
        return;
      }
      laggingSince = clock.instant();
    }
    log.warn(
        "Connection lagging connection_id={} queue_capacity={}", connectionId, queue.capacity());
  }

  private void scheduleDrain() {
    if (!drainScheduled.compareAndSet(false, true)) {
      return;
    }
    try {
      senderExecutor.execute(this::drainQueue);
    } catch (RejectedExecutionException ex) {
      drainScheduled.set(false);
      log.warn("Connection sender rejected connection_id={} error={}", connectionId, ex.getMessage());
      forceClose();
    }
  }

  private void drainQueue() {
    boolean failed = false;
    try {
      ServerMessage next;
      while ((next = queue.poll()) != null) {
        if (next instanceof ResumeCheckpoint checkpoint) {
          recordCheckpoint(checkpoint.sequence());
          continue;
        }
        if (!transport.isOpen()) {
          queue.clear();
          failed = true;
          break;
        }
        transport.send(codec.encode(next));
        recordDelivery(next);
      }
    } catch (IOException | RuntimeException ex) {
      log.warn("Connection send failed connection_id={} error={}", connectionId, ex.getMessage());
      failed = true;
    } finally {
      drainScheduled.set(false);
    }

    if (failed) {
      closeTransport();
      transportClosed();
      return;
    }
    if (!queue.isEmpty()) {
      scheduleDrain();
      return;
    }
    if (closeAfterFlush) {
      finishClose();
    }
  }

  private void recordDelivery(ServerMessage message) {
    if (message instanceof ServerMessage.Event event) {
      lastDeliveredSequence = Math.max(lastDeliveredSequence, event.sequence());
    }
  }

  private void recordCheckpoint(long sequence) {
    if (sequence == resumableSequence) {
      return;
    }
    resumableSequence = sequence;
    listener.onResumable(this, sequence);
  }

  private void finishClose() {
    synchronized (stateMonitor) {
      if (!closeAfterFlush || !queue.isEmpty()) {
        return;
      }
      closeAfterFlush = false;
      if (state == ConnectionState.DRAINING) {
        state = ConnectionState.CLOSED;
      }
    }
    closeTransport();
    log.info(
        "Connection closed connection_id={} code={} last_delivered_sequence={}",
        connectionId,
        closeCode == null ? "none" : closeCode.wireCode(),
        lastDeliveredSequence);
  }

  private void closeTransport() {
    transportReleased = true;
    transport.close(closeStatusFor(closeCode), closeCode == null ? "" : closeCode.wireCode());
  }

  private void release() {
    if (released.compareAndSet(false, true)) {
      listener.onClosed(this);
    }
  }

  static int closeStatusFor(ErrorCode code) {
    if (code == null) {
      return NORMAL_CLOSURE;
    }
    return switch (code) {
      case SERVER_SHUTDOWN -> GOING_AWAY;
      case AUTH_INVALID, AUTH_EXPIRED -> 4401;
      case MALFORMED_CLIENT_MESSAGE -> 4400;
      case HEARTBEAT_TIMEOUT, HANDSHAKE_TIMEOUT -> 4408;
      case SLOW_CONSUMER -> 4429;
      default -> SERVER_ERROR;
    };
  }
}
