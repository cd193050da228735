package com.changefeed.gateway.connection;

import com.changefeed.domain.sessions.AccessClaims;
import com.changefeed.domain.sessions.ConnectionState;
import com.changefeed.domain.sessions.ErrorCode;
import com.changefeed.domain.sessions.ResumeToken;
import com.changefeed.domain.sessions.SessionDomainException;
import com.changefeed.gateway.auth.CredentialRejectedException;
import com.changefeed.gateway.auth.CredentialValidator;
import com.changefeed.gateway.protocol.ClientMessage;
import com.changefeed.gateway.protocol.ClientMessageParser;
import com.changefeed.gateway.protocol.MalformedClientMessageException;
import com.changefeed.gateway.protocol.ServerMessage;
import com.changefeed.gateway.protocol.ServerMessageCodec;
import com.changefeed.gateway.registry.Subscription;
import com.changefeed.gateway.registry.SubscriptionRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every client session: handshake and credential validation, resume, client messages,
 * heartbeat checks and shutdown. Subscriptions of a closing connection are removed from the
 * registry in one swap.
 */
public class ConnectionManager implements ConnectionDirectory, ConnectionListener {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private final SubscriptionRegistry registry;
  private final CredentialValidator credentialValidator;
  private final ResumeTokenService resumeTokens;
  private final ResumeSessionStore resumeSessions;
  private final ClientMessageParser parser;
  private final ServerMessageCodec codec;
  private final ConnectionProperties properties;
  private final ExecutorService senderExecutor;
  private final ExecutorService authExecutor;
  private final LongSupplier headSequence;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();

  public ConnectionManager(
      SubscriptionRegistry registry,
      CredentialValidator credentialValidator,
      ResumeTokenService resumeTokens,
      ResumeSessionStore resumeSessions,
      ClientMessageParser parser,
      ServerMessageCodec codec,
      ConnectionProperties properties,
      ExecutorService senderExecutor,
      ExecutorService authExecutor,
      LongSupplier headSequence,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.registry = registry;
    this.credentialValidator = credentialValidator;
    this.resumeTokens = resumeTokens;
    this.resumeSessions = resumeSessions;
    this.parser = parser;
    this.codec = codec;
    this.properties = properties;
    this.senderExecutor = senderExecutor;
    this.authExecutor = authExecutor;
    this.headSequence = headSequence;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Registers a new transport and starts validating its credential. The connection stays in
   * {@code CONNECTING} until validation completes.
   */
  public ClientConnection open(ClientTransport transport, String bearerToken, String resumeToken) {
    ClientConnection connection =
        new ClientConnection(
            UUID.randomUUID().toString(),
            transport,
            properties.getQueueCapacity(),
            properties.getLagThreshold(),
            codec,
            senderExecutor,
            this,
            clock);
    connections.put(connection.connectionId(), connection);
    meterRegistry.counter("changefeed.connections.opened.total").increment();
    log.debug(
        "Connection opened connection_id={} transport_id={} resume_requested={}",
        connection.connectionId(),
        transport.id(),
        resumeToken != null && !resumeToken.isBlank());

    if (bearerToken == null || bearerToken.isBlank()) {
      reject(connection, ErrorCode.AUTH_INVALID, "missing bearer token");
      return connection;
    }
    ResumeToken resume;
    try {
      resume = resumeToken == null || resumeToken.isBlank() ? null : ResumeToken.parse(resumeToken);
    } catch (SessionDomainException ex) {
      reject(connection, ErrorCode.MALFORMED_CLIENT_MESSAGE, "invalid resume token: " + ex.getMessage());
      return connection;
    }

    try {
      CompletableFuture.supplyAsync(() -> credentialValidator.validate(bearerToken), authExecutor)
          .orTimeout(properties.getCredentialTimeout().toMillis(), TimeUnit.MILLISECONDS)
          .whenComplete((claims, error) -> completeHandshake(connection, claims, error, resume));
    } catch (RejectedExecutionException ex) {
      log.warn("Credential validation rejected connection_id={} error={}", connection.connectionId(), ex.getMessage());
      reject(connection, ErrorCode.AUTH_INVALID, "credential validation unavailable");
    }
    return connection;
  }

  public void onMessage(ClientConnection connection, String payload) {
    connection.touch();
    ConnectionState state = connection.state();
    if (state.isTerminal() || state == ConnectionState.DRAINING) {
      return;
    }
    if (state == ConnectionState.CONNECTING) {
      reject(connection, ErrorCode.MALFORMED_CLIENT_MESSAGE, "message received before authentication completed");
      return;
    }
    ClientMessage message;
    try {
      message = parser.parse(payload);
    } catch (MalformedClientMessageException ex) {
      reject(connection, ErrorCode.MALFORMED_CLIENT_MESSAGE, ex.getMessage());
      return;
    }

    if (message instanceof ClientMessage.Subscribe subscribe) {
      subscribe(connection, subscribe);
    } else if (message instanceof ClientMessage.Unsubscribe unsubscribe) {
      unsubscribe(connection, unsubscribe.subscriptionId());
    } else if (message instanceof ClientMessage.Ping) {
      connection.sendControl(ServerMessage.Pong.of());
    } else if (message instanceof ClientMessage.Ready) {
      connection.activate();
    }
  }

  public void onTransportClosed(ClientConnection connection) {
    connection.transportClosed();
  }

  /** Enforces handshake, idle, credential-expiry, slow-consumer and drain deadlines. */
  public void sweep() {
    Instant now = clock.instant();
    for (ClientConnection connection : connections.values()) {
      if (connection.isTerminated()) {
        connections.remove(connection.connectionId());
        continue;
      }
      switch (connection.state()) {
        case CONNECTING -> {
          if (expired(connection.openedAt(), properties.getHandshakeTimeout().toMillis(), now)) {
            reject(connection, ErrorCode.HANDSHAKE_TIMEOUT, "handshake not completed in time");
          }
        }
        case AUTHENTICATED, ACTIVE -> sweepLive(connection, now);
        case DRAINING, CLOSED -> {
          Instant closingSince = connection.closingSince();
          if (closingSince != null
              && expired(closingSince, properties.getDrainGracePeriod().toMillis(), now)) {
            connection.forceClose();
          }
        }
      }
    }
    resumeSessions.evictExpired();
  }

  /** Drains every live connection with a {@code ServerShutdown} notice. */
  public void shutdown() {
    log.info("Connection manager shutting down connections={}", connections.size());
    for (ClientConnection connection : connections.values()) {
      connection.drain(ErrorCode.SERVER_SHUTDOWN, "server is shutting down");
    }
  }

  /** Sends a connection-level error frame to every authenticated connection. */
  public int broadcastError(ErrorCode code, String message) {
    int notified = 0;
    for (ClientConnection connection : connections.values()) {
      if (connection.state().acceptsEvents() && connection.sendError(code, message, null)) {
        notified++;
      }
    }
    log.warn("Error broadcast code={} connections={}", code.wireCode(), notified);
    return notified;
  }

  @Override
  public Optional<ClientConnection> find(String connectionId) {
    return Optional.ofNullable(connections.get(connectionId));
  }

  public Collection<ClientConnection> connections() {
    return connections.values();
  }

  public Map<ConnectionState, Integer> countByState() {
    Map<ConnectionState, Integer> counts = new EnumMap<>(ConnectionState.class);
    for (ClientConnection connection : connections.values()) {
      counts.merge(connection.state(), 1, Integer::sum);
    }
    return counts;
  }

  public long laggingCount() {
    return connections.values().stream().filter(ClientConnection::isLagging).count();
  }

  @Override
  public void onResumable(ClientConnection connection, long sequence) {
    resumeSessions.checkpoint(connection.resumeKey(), sequence);
  }

  @Override
  public void onClosed(ClientConnection connection) {
    registry.removeConnection(connection.connectionId());
    ErrorCode code = connection.closeCode();
    meterRegistry
        .counter(
            "changefeed.connections.closed.total",
            "code",
            code == null ? "none" : code.wireCode())
        .increment();
  }

  private void completeHandshake(
      ClientConnection connection, AccessClaims claims, Throwable error, ResumeToken resume) {
    if (error != null) {
      handleCredentialFailure(connection, error);
      return;
    }
    if (claims.isExpired(clock.instant())) {
      reject(connection, ErrorCode.AUTH_EXPIRED, "credential expired");
      return;
    }

    String identity;
    Long resumeSequence = null;
    if (resume != null) {
      if (!resumeTokens.verify(resume, claims.subject())) {
        reject(connection, ErrorCode.AUTH_INVALID, "resume token does not belong to this credential");
        return;
      }
      identity = resume.connectionIdentity();
      long cited = resume.lastDeliveredSequence();
      resumeSequence =
          resumeSessions
              .find(resume.resumeKey())
              .map(session -> Math.min(session.lastDeliveredSequence(), cited))
              .orElse(cited);
    } else {
      identity = ResumeTokenService.randomIdentity();
    }

    String resumeKey = resumeTokens.issue(identity, claims.subject());
    long head = headSequence.getAsLong();
    if (!connection.authenticate(claims, identity, resumeKey, resumeSequence)) {
      return;
    }
    resumeSessions.register(
        resumeKey, claims.subject(), resumeSequence != null ? resumeSequence : head);
    connection.sendControl(ServerMessage.Connected.of(connection.connectionId(), resumeKey, head));
  }

  private void handleCredentialFailure(ClientConnection connection, Throwable error) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    if (cause instanceof CredentialRejectedException rejected) {
      reject(connection, rejected.code(), rejected.getMessage());
    } else if (cause instanceof TimeoutException) {
      reject(connection, ErrorCode.AUTH_INVALID, "credential validation timed out");
    } else {
      log.warn(
          "Credential validation failed connection_id={} error={}",
          connection.connectionId(),
          cause.toString());
      reject(connection, ErrorCode.AUTH_INVALID, "credential could not be validated");
    }
  }

  private void subscribe(ClientConnection connection, ClientMessage.Subscribe subscribe) {
    Long resumeFrom = subscribe.resumeFrom() != null ? subscribe.resumeFrom() : connection.resumeSequence();
    Subscription subscription =
        registry.subscribe(
            connection.connectionId(), subscribe.filter(), connection.claims(), resumeFrom);
    connection.activate();
    log.info(
        "Subscribe accepted connection_id={} subscription_id={} channel={} filtered={} resume_from={}",
        connection.connectionId(),
        subscription.subscriptionId(),
        subscription.channel(),
        subscribe.filter().predicate() != null,
        resumeFrom);
  }

  private void unsubscribe(ClientConnection connection, String subscriptionId) {
    Optional<Subscription> existing =
        registry
            .find(subscriptionId)
            .filter(subscription -> subscription.connectionId().equals(connection.connectionId()));
    if (existing.isEmpty()) {
      connection.sendError(
          ErrorCode.SUBSCRIPTION_NOT_FOUND, "no subscription " + subscriptionId, subscriptionId);
      return;
    }
    registry.unsubscribe(subscriptionId);
  }

  private void sweepLive(ClientConnection connection, Instant now) {
    AccessClaims claims = connection.claims();
    if (claims != null && claims.isExpired(now)) {
      reject(connection, ErrorCode.AUTH_EXPIRED, "credential expired");
    } else if (expired(connection.lastActivityAt(), properties.getIdleTimeout().toMillis(), now)) {
      reject(connection, ErrorCode.HEARTBEAT_TIMEOUT, "no client frame within the idle timeout");
    } else if (connection.laggingSince() != null
        && expired(connection.laggingSince(), properties.getSlowConsumerTimeout().toMillis(), now)) {
      reject(connection, ErrorCode.SLOW_CONSUMER, "client lagged longer than the slow consumer timeout");
    }
  }

  private void reject(ClientConnection connection, ErrorCode code, String message) {
    if (connection.closeWithError(code, message)) {
      log.info(
          "Connection rejected connection_id={} code={} message={}",
          connection.connectionId(),
          code.wireCode(),
          message);
    }
  }

  private static boolean expired(Instant since, long timeoutMs, Instant now) {
    return since.plusMillis(timeoutMs).isBefore(now);
  }
}
