package com.changefeed.gateway.registry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of every subscription, indexed by channel and by dispatcher partition. One
 * dispatch pass reads exactly one snapshot.
 */
public final class RegistrySnapshot {
  private final long version;
  private final int partitions;
  private final Map<String, Subscription> byId;
  private final Map<String, List<Subscription>> byChannel;
  private final List<List<Subscription>> byPartition;
  private final List<Map<String, List<Subscription>>> byPartitionAndChannel;

  RegistrySnapshot(long version, int partitions, Collection<Subscription> subscriptions) {
    this.version = version;
    this.partitions = partitions;
    Map<String, Subscription> ids = new LinkedHashMap<>();
    Map<String, List<Subscription>> channels = new HashMap<>();
    List<List<Subscription>> partitioned = new ArrayList<>(partitions);
    List<Map<String, List<Subscription>>> partitionedChannels = new ArrayList<>(partitions);
    for (int i = 0; i < partitions; i++) {
      partitioned.add(new ArrayList<>());
      partitionedChannels.add(new HashMap<>());
    }
    for (Subscription subscription : subscriptions) {
      ids.put(subscription.subscriptionId(), subscription);
      channels.computeIfAbsent(subscription.channel(), ignored -> new ArrayList<>()).add(subscription);
      int partition = partitionOf(subscription.connectionId(), partitions);
      partitioned.get(partition).add(subscription);
      partitionedChannels
          .get(partition)
          .computeIfAbsent(subscription.channel(), ignored -> new ArrayList<>())
          .add(subscription);
    }
    this.byId = Collections.unmodifiableMap(ids);
    this.byChannel = freeze(channels);
    this.byPartition = partitioned.stream().map(List::copyOf).toList();
    this.byPartitionAndChannel = partitionedChannels.stream().map(RegistrySnapshot::freeze).toList();
  }

  static RegistrySnapshot empty(int partitions) {
    return new RegistrySnapshot(0L, partitions, List.of());
  }

  public static int partitionOf(String connectionId, int partitions) {
    return Math.floorMod(connectionId.hashCode(), partitions);
  }

  public long version() {
    return version;
  }

  public int partitions() {
    return partitions;
  }

  public int size() {
    return byId.size();
  }

  public Collection<Subscription> all() {
    return byId.values();
  }

  public Optional<Subscription> find(String subscriptionId) {
    return Optional.ofNullable(byId.get(subscriptionId));
  }

  public boolean contains(String subscriptionId) {
    return byId.containsKey(subscriptionId);
  }

  public List<Subscription> forChannel(String channel) {
    return byChannel.getOrDefault(channel, List.of());
  }

  public List<Subscription> forPartition(int partition) {
    return byPartition.get(partition);
  }

  public List<Subscription> forPartitionAndChannel(int partition, String channel) {
    return byPartitionAndChannel.get(partition).getOrDefault(channel, List.of());
  }

  public List<Subscription> forConnection(String connectionId) {
    return forPartition(partitionOf(connectionId, partitions)).stream()
        .filter(subscription -> subscription.connectionId().equals(connectionId))
        .toList();
  }

  private static Map<String, List<Subscription>> freeze(Map<String, List<Subscription>> index) {
    Map<String, List<Subscription>> frozen = new HashMap<>();
    index.forEach((channel, subscriptions) -> frozen.put(channel, List.copyOf(subscriptions)));
    return Collections.unmodifiableMap(frozen);
  }
}
