package com.changefeed.gateway.registry;

import com.changefeed.domain.sessions.AccessClaims;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copy-on-write subscription index. Writers serialize on a short monitor and publish a new
 * {@link RegistrySnapshot}; readers never lock.
 */
public class SubscriptionRegistry {
  private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

  private final int partitions;
  private final Clock clock;
  private final Object writeMonitor = new Object();
  private volatile RegistrySnapshot current;

  public SubscriptionRegistry(int partitions) {
    this(partitions, Clock.systemUTC());
  }

  SubscriptionRegistry(int partitions, Clock clock) {
    if (partitions < 1) {
      throw new IllegalArgumentException("partitions must be >= 1");
    }
    this.partitions = partitions;
    this.clock = clock;
    this.current = RegistrySnapshot.empty(partitions);
  }

  public Subscription subscribe(
      String connectionId, ChannelFilter filter, AccessClaims claims, Long resumeFrom) {
    Subscription subscription =
        new Subscription(
            UUID.randomUUID().toString(), connectionId, filter, claims, resumeFrom, clock.instant());
    synchronized (writeMonitor) {
      List<Subscription> next = new ArrayList<>(current.all());
      next.add(subscription);
      publish(next);
    }
    log.debug(
        "Subscription added subscription_id={} connection_id={} channel={} resume_from={}",
        subscription.subscriptionId(),
        connectionId,
        filter.channel(),
        resumeFrom);
    return subscription;
  }

  public Optional<Subscription> unsubscribe(String subscriptionId) {
    synchronized (writeMonitor) {
      Optional<Subscription> existing = current.find(subscriptionId);
      existing.ifPresent(
          removed -> publishWithout(subscription -> subscription.subscriptionId().equals(subscriptionId)));
      return existing;
    }
  }

  /** Removes every subscription of a connection in a single snapshot swap. */
  public List<Subscription> removeConnection(String connectionId) {
    synchronized (writeMonitor) {
      List<Subscription> removed = current.forConnection(connectionId);
      if (!removed.isEmpty()) {
        publishWithout(subscription -> subscription.connectionId().equals(connectionId));
        log.debug(
            "Subscriptions removed connection_id={} count={}", connectionId, removed.size());
      }
      return removed;
    }
  }

  public List<Subscription> listFor(String channel) {
    return current.forChannel(channel);
  }

  public Optional<Subscription> find(String subscriptionId) {
    return current.find(subscriptionId);
  }

  public RegistrySnapshot snapshot() {
    return current;
  }

  public int partitions() {
    return partitions;
  }

  public int partitionOf(String connectionId) {
    return RegistrySnapshot.partitionOf(connectionId, partitions);
  }

  public int size() {
    return current.size();
  }

  public Map<String, Integer> countByChannel() {
    Map<String, Integer> counts = new TreeMap<>();
    for (Subscription subscription : current.all()) {
      counts.merge(subscription.channel(), 1, Integer::sum);
    }
    return counts;
  }

  private void publishWithout(Predicate<Subscription> removal) {
    List<Subscription> next = new ArrayList<>(current.all());
    next.removeIf(removal);
    publish(next);
  }

  private void publish(List<Subscription> subscriptions) {
    current = new RegistrySnapshot(current.version() + 1L, partitions, subscriptions);
  }
}
