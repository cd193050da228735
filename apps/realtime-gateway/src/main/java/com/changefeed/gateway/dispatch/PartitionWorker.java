package com.changefeed.gateway.dispatch;

import com.changefeed.domain.changes.ChangeEvent;
import com.changefeed.domain.sessions.ErrorCode;
import com.changefeed.gateway.auth.AccessPolicy;
import com.changefeed.gateway.connection.ClientConnection;
import com.changefeed.gateway.connection.ConnectionDirectory;
import com.changefeed.gateway.connection.OfferResult;
import com.changefeed.gateway.protocol.ServerMessage;
import com.changefeed.gateway.registry.Subscription;
import com.changefeed.gateway.registry.SubscriptionRegistry;
import com.changefeed.infra.eventlog.DurableEventLog;
import com.changefeed.infra.eventlog.LogEntry;
import com.changefeed.infra.eventlog.LogReader;
import com.changefeed.infra.eventlog.OffsetEvictedException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers to the connections of one partition. Only this worker's thread touches its cursors,
 * which keeps every connection's delivery single-threaded and in log order.
 *
 * <p>A connection with a subscription that replays history is caught up as a whole: one lease
 * reads the log from the earliest position any of its subscriptions needs, and each entry is
 * offered to every subscription of that connection before the next entry. Live delivery for the
 * connection resumes once the lease reaches the pass's end, so frames never go backwards behind a
 * live subscription.
 */
class PartitionWorker {
  private static final Logger log = LoggerFactory.getLogger(PartitionWorker.class);

  private final int partition;
  private final DurableEventLog eventLog;
  private final SubscriptionRegistry registry;
  private final ConnectionDirectory connections;
  private final AccessPolicy accessPolicy;
  private final DispatchMetrics metrics;
  private final int catchUpChunk;

  private final Map<String, SubscriptionCursor> cursors = new LinkedHashMap<>();
  private final Map<String, LogReader> catchUps = new LinkedHashMap<>();
  private final Map<String, Long> checkpoints = new HashMap<>();
  private final Set<String> retired = new HashSet<>();

  PartitionWorker(
      int partition,
      DurableEventLog eventLog,
      SubscriptionRegistry registry,
      ConnectionDirectory connections,
      AccessPolicy accessPolicy,
      DispatchMetrics metrics,
      int catchUpChunk) {
    this.partition = partition;
    this.eventLog = eventLog;
    this.registry = registry;
    this.connections = connections;
    this.accessPolicy = accessPolicy;
    this.metrics = metrics;
    this.catchUpChunk = Math.max(1, catchUpChunk);
  }

  /** Runs one pass; returns true when a connection still has backlog to catch up on. */
  boolean run(DispatchPass pass) {
    removeVanished(pass);
    activateNew(pass);
    boolean backlog = catchUp(pass);
    deliverLive(pass);
    dropRetired();
    publishCheckpoints();
    return backlog;
  }

  /** Forgets every cursor; used after the shared reader was evicted or a pass failed. */
  void retireAll() {
    for (SubscriptionCursor cursor : cursors.values()) {
      retired.add(cursor.subscription().subscriptionId());
    }
    cursors.clear();
    for (LogReader lease : catchUps.values()) {
      lease.close();
    }
    catchUps.clear();
    checkpoints.clear();
  }

  int partition() {
    return partition;
  }

  private void removeVanished(DispatchPass pass) {
    Iterator<SubscriptionCursor> iterator = cursors.values().iterator();
    while (iterator.hasNext()) {
      SubscriptionCursor cursor = iterator.next();
      Subscription subscription = cursor.subscription();
      if (pass.snapshot().contains(subscription.subscriptionId())) {
        continue;
      }
      iterator.remove();
      connection(subscription.connectionId())
          .ifPresent(connection -> connection.sendControl(ServerMessage.Unsubscribed.of(subscription.subscriptionId())));
    }
    retired.removeIf(subscriptionId -> !pass.snapshot().contains(subscriptionId));
    releaseIdleConnections();
  }

  private void activateNew(DispatchPass pass) {
    for (Subscription subscription : pass.snapshot().forPartition(partition)) {
      String subscriptionId = subscription.subscriptionId();
      if (cursors.containsKey(subscriptionId) || retired.contains(subscriptionId)) {
        continue;
      }
      Optional<ClientConnection> owner = connection(subscription.connectionId());
      if (owner.isEmpty() || owner.get().state().isTerminal()) {
        continue;
      }
      activate(subscription, owner.get(), pass);
    }
  }

  private void activate(Subscription subscription, ClientConnection connection, DispatchPass pass) {
    long liveFrom = pass.previousOffset();
    Long resumeFrom = subscription.resumeFrom();
    long start = resumeFrom == null ? liveFrom : Math.min(resumeFrom, pass.throughOffset());
    String connectionId = subscription.connectionId();
    LogReader lease = catchUps.get(connectionId);
    boolean replay = lease == null ? start < liveFrom : start + 1L < lease.nextOffset();
    if (replay) {
      LogReader replacement;
      try {
        replacement = eventLog.openReader(start + 1L);
      } catch (OffsetEvictedException ex) {
        evict(subscription, connection, ex);
        return;
      }
      if (lease != null) {
        lease.close();
      }
      catchUps.put(connectionId, replacement);
      log.debug(
          "Connection catching up connection_id={} subscription_id={} from={} through={}",
          connectionId,
          subscription.subscriptionId(),
          start + 1L,
          pass.throughOffset());
    }
    cursors.put(subscription.subscriptionId(), new SubscriptionCursor(subscription, start));
    connection.sendControl(ServerMessage.Subscribed.of(subscription.subscriptionId(), start));
  }

  private boolean catchUp(DispatchPass pass) {
    if (catchUps.isEmpty()) {
      return false;
    }
    Map<String, List<SubscriptionCursor>> byConnection = cursorsByConnection();
    boolean backlog = false;
    Iterator<Map.Entry<String, LogReader>> iterator = catchUps.entrySet().iterator();
    while (iterator.hasNext()) {
      Map.Entry<String, LogReader> catchUp = iterator.next();
      String connectionId = catchUp.getKey();
      LogReader lease = catchUp.getValue();
      List<SubscriptionCursor> members = byConnection.getOrDefault(connectionId, List.of());
      Optional<ClientConnection> owner = connection(connectionId);
      if (members.isEmpty() || owner.isEmpty()) {
        continue;
      }
      long remaining = pass.throughOffset() - lease.lastReadOffset();
      if (remaining > 0L) {
        List<LogEntry> chunk;
        try {
          chunk = lease.poll((int) Math.min(catchUpChunk, remaining), Duration.ZERO);
        } catch (OffsetEvictedException ex) {
          iterator.remove();
          lease.close();
          for (SubscriptionCursor cursor : members) {
            evict(cursor.subscription(), owner.get(), ex);
          }
          continue;
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          return true;
        }
        for (LogEntry entry : chunk) {
          for (SubscriptionCursor cursor : members) {
            if (isRetired(cursor) || !cursor.awaits(entry.offset())) {
              continue;
            }
            offer(cursor.subscription(), owner.get(), entry.event());
            cursor.advanceTo(entry.offset());
          }
        }
      }
      if (lease.lastReadOffset() >= pass.throughOffset()) {
        iterator.remove();
        lease.close();
        for (SubscriptionCursor cursor : members) {
          cursor.advanceTo(pass.throughOffset());
        }
        log.debug("Connection caught up connection_id={} through={}", connectionId, pass.throughOffset());
      } else {
        backlog = true;
      }
    }
    return backlog;
  }

  private void deliverLive(DispatchPass pass) {
    for (LogEntry entry : pass.entries()) {
      ChangeEvent event = entry.event();
      for (Subscription subscription : pass.snapshot().forPartitionAndChannel(partition, event.channel())) {
        SubscriptionCursor cursor = cursors.get(subscription.subscriptionId());
        if (cursor == null
            || isRetired(cursor)
            || catchUps.containsKey(subscription.connectionId())
            || !cursor.awaits(entry.offset())) {
          continue;
        }
        connection(subscription.connectionId()).ifPresent(connection -> offer(subscription, connection, event));
      }
    }
    for (SubscriptionCursor cursor : cursors.values()) {
      if (!catchUps.containsKey(cursor.connectionId())) {
        cursor.advanceTo(pass.throughOffset());
      }
    }
  }

  /**
   * Tells each connection how far every one of its subscriptions has been offered. The value drops
   * when a replaying subscription joins. A lagging connection has dropped frames, so it keeps its
   * last checkpoint.
   */
  private void publishCheckpoints() {
    Map<String, Long> reached = new HashMap<>();
    for (SubscriptionCursor cursor : cursors.values()) {
      reached.merge(cursor.connectionId(), cursor.deliveredThrough(), Math::min);
    }
    for (Map.Entry<String, Long> entry : reached.entrySet()) {
      String connectionId = entry.getKey();
      long sequence = entry.getValue();
      Long previous = checkpoints.get(connectionId);
      if (previous != null && previous == sequence) {
        continue;
      }
      connection(connectionId)
          .filter(connection -> connection.checkpoint(sequence))
          .ifPresent(connection -> checkpoints.put(connectionId, sequence));
    }
  }

  private void offer(Subscription subscription, ClientConnection connection, ChangeEvent event) {
    OfferResult result;
    try {
      if (!subscription.filter().matches(event) || !accessPolicy.authorize(subscription.claims(), event)) {
        return;
      }
      result = connection.offerEvent(ServerMessage.Event.of(subscription.subscriptionId(), event));
    } catch (RuntimeException ex) {
      fail(subscription, connection, event, ex);
      return;
    }
    metrics.recordOffer(result);
  }

  /** Ends one subscription whose delivery threw; the rest of the partition carries on. */
  private void fail(
      Subscription subscription, ClientConnection connection, ChangeEvent event, RuntimeException ex) {
    retired.add(subscription.subscriptionId());
    registry.unsubscribe(subscription.subscriptionId());
    metrics.recordFailed();
    log.error(
        "Subscription delivery failed subscription_id={} connection_id={} sequence={}",
        subscription.subscriptionId(),
        subscription.connectionId(),
        event.sequence(),
        ex);
    connection.sendError(
        ErrorCode.RESYNC_REQUIRED,
        "delivery failed at sequence " + event.sequence() + "; refetch a snapshot and subscribe again",
        subscription.subscriptionId());
  }

  private void evict(Subscription subscription, ClientConnection connection, OffsetEvictedException ex) {
    if (!retired.add(subscription.subscriptionId())) {
      return;
    }
    connection.sendError(
        ErrorCode.OFFSET_EVICTED,
        "sequence "
            + ex.requestedOffset()
            + " is no longer retained (oldest is "
            + ex.floorOffset()
            + "); refetch a snapshot and subscribe again",
        subscription.subscriptionId());
    registry.unsubscribe(subscription.subscriptionId());
    metrics.recordEvicted();
    log.info(
        "Subscription evicted subscription_id={} connection_id={} requested={} floor={}",
        subscription.subscriptionId(),
        subscription.connectionId(),
        ex.requestedOffset(),
        ex.floorOffset());
  }

  private void dropRetired() {
    if (cursors.keySet().removeIf(retired::contains)) {
      releaseIdleConnections();
    }
  }

  private void releaseIdleConnections() {
    Set<String> active = new HashSet<>();
    for (SubscriptionCursor cursor : cursors.values()) {
      active.add(cursor.connectionId());
    }
    Iterator<Map.Entry<String, LogReader>> iterator = catchUps.entrySet().iterator();
    while (iterator.hasNext()) {
      Map.Entry<String, LogReader> catchUp = iterator.next();
      if (!active.contains(catchUp.getKey())) {
        catchUp.getValue().close();
        iterator.remove();
      }
    }
    checkpoints.keySet().retainAll(active);
  }

  private Map<String, List<SubscriptionCursor>> cursorsByConnection() {
    Map<String, List<SubscriptionCursor>> byConnection = new HashMap<>();
    for (SubscriptionCursor cursor : cursors.values()) {
      byConnection.computeIfAbsent(cursor.connectionId(), ignored -> new ArrayList<>()).add(cursor);
    }
    return byConnection;
  }

  private boolean isRetired(SubscriptionCursor cursor) {
    return retired.contains(cursor.subscription().subscriptionId());
  }

  private Optional<ClientConnection> connection(String connectionId) {
    return connections.find(connectionId);
  }
}
