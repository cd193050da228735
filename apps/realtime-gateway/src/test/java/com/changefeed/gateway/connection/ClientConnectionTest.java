package com.changefeed.gateway.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.changefeed.domain.changes.ChangeEvent;
import com.changefeed.domain.changes.ChangeOperation;
import com.changefeed.domain.sessions.AccessClaims;
import com.changefeed.domain.sessions.ConnectionState;
import com.changefeed.domain.sessions.ErrorCode;
import com.changefeed.gateway.protocol.ServerMessage;
import com.changefeed.gateway.protocol.ServerMessageCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClientConnectionTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final AccessClaims CLAIMS = new AccessClaims("u1", Set.of("USER"), null, Map.of());

  private final ServerMessageCodec codec = new ServerMessageCodec(new ObjectMapper());
  private RecordingClientTransport transport;
  private RecordingListener listener;

  @BeforeEach
  void setUp() {
    transport = new RecordingClientTransport("ws-1");
    listener = new RecordingListener();
  }

  @Test
  void eventsShouldReachTransportInOfferOrder() {
    ClientConnection connection = connection(10, 10L, Runnable::run);
    connection.authenticate(CLAIMS, "ident", "ident.sig", null);

    for (long sequence = 1L; sequence <= 3L; sequence++) {
      assertEquals(OfferResult.ACCEPTED, connection.offerEvent(event(sequence)));
    }

    List<String> frames = transport.frames();
    assertEquals(3, frames.size());
    assertTrue(frames.get(0).contains("\"sequence\":1"));
    assertTrue(frames.get(2).contains("\"sequence\":3"));
    assertEquals(3L, connection.lastDeliveredSequence());
    assertTrue(listener.resumable.isEmpty());
  }

  @Test
  void checkpointShouldTakeEffectOnlyAfterFramesAheadOfItAreSent() {
    QueuedExecutor sender = new QueuedExecutor();
    ClientConnection connection = connection(10, 10L, sender);
    connection.authenticate(CLAIMS, "ident", "ident.sig", null);
    connection.offerEvent(event(1L));
    connection.offerEvent(event(2L));

    assertTrue(connection.checkpoint(2L));
    assertEquals(-1L, connection.resumableSequence());
    assertTrue(listener.resumable.isEmpty());

    sender.runAll();

    assertEquals(2, transport.frames().size());
    assertEquals(2L, connection.resumableSequence());
    assertEquals(List.of(2L), listener.resumable);
  }

  @Test
  void repeatedCheckpointShouldNotifyOnce() {
    ClientConnection connection = connection(10, 10L, Runnable::run);
    connection.authenticate(CLAIMS, "ident", "ident.sig", null);

    connection.checkpoint(6L);
    connection.checkpoint(6L);
    connection.checkpoint(4L);

    assertEquals(4L, connection.resumableSequence());
    assertEquals(List.of(6L, 4L), listener.resumable);
    assertTrue(transport.frames().isEmpty());
  }

  @Test
  void laggingConnectionShouldRefuseCheckpoint() {
    QueuedExecutor sender = new QueuedExecutor();
    ClientConnection connection = connection(1, 10L, sender);
    connection.authenticate(CLAIMS, "ident", "ident.sig", null);
    connection.offerEvent(event(1L));
    assertEquals(OfferResult.DROPPED, connection.offerEvent(event(2L)));

    assertFalse(connection.checkpoint(2L));
    sender.runAll();

    assertEquals(-1L, connection.resumableSequence());
    assertTrue(listener.resumable.isEmpty());
  }

  @Test
  void eventsShouldBeRejectedBeforeAuthentication() {
    ClientConnection connection = connection(10, 10L, Runnable::run);

    assertEquals(OfferResult.REJECTED, connection.offerEvent(event(1L)));
    assertTrue(transport.frames().isEmpty());
  }

  @Test
  void fullQueueShouldMarkLaggingThenCloseAsSlowConsumer() {
    QueuedExecutor sender = new QueuedExecutor();
    ClientConnection connection = connection(2, 1L, sender);
    connection.authenticate(CLAIMS, "ident", "ident.sig", null);

    assertEquals(OfferResult.ACCEPTED, connection.offerEvent(event(1L)));
    assertEquals(OfferResult.ACCEPTED, connection.offerEvent(event(2L)));
    assertEquals(OfferResult.DROPPED, connection.offerEvent(event(3L)));
    assertTrue(connection.isLagging());
    assertEquals(ConnectionState.AUTHENTICATED, connection.state());

    assertEquals(OfferResult.DROPPED, connection.offerEvent(event(4L)));
    assertEquals(ConnectionState.CLOSED, connection.state());
    assertEquals(ErrorCode.SLOW_CONSUMER, connection.closeCode());
    assertEquals(1, listener.closed);

    sender.runAll();

    assertEquals(1, transport.frames().size());
    assertTrue(transport.lastFrame().contains("\"code\":\"SlowConsumer\""));
    assertEquals(4429, transport.closeStatus());
    assertTrue(connection.isTerminated());
  }

  @Test
  void controlFramesShouldNotCountAgainstEventCapacity() {
    QueuedExecutor sender = new QueuedExecutor();
    ClientConnection connection = connection(1, 5L, sender);
    connection.authenticate(CLAIMS, "ident", "ident.sig", null);

    assertEquals(OfferResult.ACCEPTED, connection.offerEvent(event(1L)));
    assertTrue(connection.sendControl(ServerMessage.Pong.of()));
    assertTrue(connection.sendControl(ServerMessage.Subscribed.of("sub-1", 1L)));
    sender.runAll();

    List<String> frames = transport.frames();
    assertEquals(3, frames.size());
    assertTrue(frames.get(0).contains("\"type\":\"event\""));
    assertTrue(frames.get(1).contains("\"type\":\"pong\""));
    assertFalse(connection.isLagging());
  }

  @Test
  void drainShouldFlushPendingEventsBeforeFinalErrorAndClose() {
    QueuedExecutor sender = new QueuedExecutor();
    ClientConnection connection = connection(10, 10L, sender);
    connection.authenticate(CLAIMS, "ident", "ident.sig", null);
    connection.offerEvent(event(1L));
    connection.offerEvent(event(2L));

    assertTrue(connection.drain(ErrorCode.SERVER_SHUTDOWN, "bye"));
    assertEquals(ConnectionState.DRAINING, connection.state());
    assertEquals(OfferResult.REJECTED, connection.offerEvent(event(3L)));

    sender.runAll();

    List<String> frames = transport.frames();
    assertEquals(3, frames.size());
    assertTrue(frames.get(1).contains("\"sequence\":2"));
    assertTrue(frames.get(2).contains("\"code\":\"ServerShutdown\""));
    assertEquals(ClientConnection.GOING_AWAY, transport.closeStatus());
    assertEquals(ConnectionState.CLOSED, connection.state());
  }

  @Test
  void closeWithErrorShouldDiscardQueuedEvents() {
    QueuedExecutor sender = new QueuedExecutor();
    ClientConnection connection = connection(10, 10L, sender);
    connection.authenticate(CLAIMS, "ident", "ident.sig", null);
    connection.offerEvent(event(1L));

    assertTrue(connection.closeWithError(ErrorCode.AUTH_EXPIRED, "credential expired"));
    assertFalse(connection.closeWithError(ErrorCode.HEARTBEAT_TIMEOUT, "again"));
    sender.runAll();

    assertEquals(1, transport.frames().size());
    assertTrue(transport.lastFrame().contains("\"code\":\"AuthExpired\""));
    assertEquals(4401, transport.closeStatus());
    assertEquals(1, listener.closed);
  }

  @Test
  void nonFatalErrorShouldKeepConnectionOpen() {
    ClientConnection connection = connection(10, 10L, Runnable::run);
    connection.authenticate(CLAIMS, "ident", "ident.sig", null);

    assertTrue(connection.sendError(ErrorCode.OFFSET_EVICTED, "evicted", "sub-1"));

    assertEquals(ConnectionState.AUTHENTICATED, connection.state());
    assertTrue(transport.lastFrame().contains("\"subscriptionId\":\"sub-1\""));
    assertTrue(transport.isOpen());
  }

  @Test
  void sendFailureShouldCloseAndReleaseConnection() {
    ClientConnection connection = connection(10, 10L, Runnable::run);
    connection.authenticate(CLAIMS, "ident", "ident.sig", null);
    transport.failSends();

    connection.offerEvent(event(1L));

    assertEquals(ConnectionState.CLOSED, connection.state());
    assertTrue(connection.isTerminated());
    assertFalse(transport.isOpen());
    assertEquals(1, listener.closed);
  }

  @Test
  void activateShouldOnlyFollowAuthentication() {
    ClientConnection connection = connection(10, 10L, Runnable::run);

    assertFalse(connection.activate());
    connection.authenticate(CLAIMS, "ident", "ident.sig", 5L);
    assertTrue(connection.activate());
    assertEquals(ConnectionState.ACTIVE, connection.state());
    assertEquals(5L, connection.resumeSequence());
  }

  @Test
  void closeStatusShouldFollowErrorCode() {
    assertEquals(ClientConnection.NORMAL_CLOSURE, ClientConnection.closeStatusFor(null));
    assertEquals(4408, ClientConnection.closeStatusFor(ErrorCode.HANDSHAKE_TIMEOUT));
    assertEquals(4400, ClientConnection.closeStatusFor(ErrorCode.MALFORMED_CLIENT_MESSAGE));
    assertEquals(ClientConnection.SERVER_ERROR, ClientConnection.closeStatusFor(ErrorCode.RESYNC_REQUIRED));
  }

  private ClientConnection connection(int capacity, long lagThreshold, Executor sender) {
    return new ClientConnection(
        "conn-1",
        transport,
        capacity,
        lagThreshold,
        codec,
        sender,
        listener,
        new MutableClock(NOW));
  }

  private static ServerMessage.Event event(long sequence) {
    return ServerMessage.Event.of(
        "sub-1",
        new ChangeEvent(
            sequence,
            "tasks",
            ChangeOperation.INSERT,
            "t-" + sequence,
            null,
            Map.of("id", "t-" + sequence),
            NOW,
            "tx-" + sequence));
  }

  private static final class RecordingListener implements ConnectionListener {
    private final List<Long> resumable = new ArrayList<>();
    private int closed;

    @Override
    public void onResumable(ClientConnection connection, long sequence) {
      resumable.add(sequence);
    }

    @Override
    public void onClosed(ClientConnection connection) {
      closed++;
    }
  }
}
