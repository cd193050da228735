package com.changefeed.gateway.dispatch;

import com.changefeed.domain.sessions.ErrorCode;
import com.changefeed.gateway.auth.AccessPolicy;
import com.changefeed.gateway.connection.ConnectionDirectory;
import com.changefeed.gateway.registry.RegistrySnapshot;
import com.changefeed.gateway.registry.Subscription;
import com.changefeed.gateway.registry.SubscriptionRegistry;
import com.changefeed.infra.eventlog.DurableEventLog;
import com.changefeed.infra.eventlog.LogEntry;
import com.changefeed.infra.eventlog.LogReader;
import com.changefeed.infra.eventlog.OffsetEvictedException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Reads the event log through one shared reader and fans each batch out to a fixed set of
 * partition workers. The coordinator waits for every worker before the next pass, so a pass is
 * the unit in which a registry snapshot applies. Workers only enqueue, so a slow client never
 * holds a pass up.
 */
public class FanOutDispatcher {
  private static final Logger log = LoggerFactory.getLogger(FanOutDispatcher.class);

  private final DurableEventLog eventLog;
  private final SubscriptionRegistry registry;
  private final ConnectionDirectory connections;
  private final DispatchProperties properties;
  private final DispatchMetrics metrics;
  private final List<PartitionWorker> workers;
  private final List<ExecutorService> executors;

  private volatile boolean running;
  private volatile Thread coordinator;
  private volatile long dispatchedThrough;
  private LogReader reader;
  private boolean backlog;

  public FanOutDispatcher(
      DurableEventLog eventLog,
      SubscriptionRegistry registry,
      ConnectionDirectory connections,
      AccessPolicy accessPolicy,
      DispatchProperties properties,
      MeterRegistry meterRegistry) {
    this.eventLog = eventLog;
    this.registry = registry;
    this.connections = connections;
    this.properties = properties;
    this.metrics = new DispatchMetrics(meterRegistry);
    int partitions = registry.partitions();
    this.workers = new ArrayList<>(partitions);
    this.executors = new ArrayList<>(partitions);
    for (int i = 0; i < partitions; i++) {
      workers.add(
          new PartitionWorker(
              i, eventLog, registry, connections, accessPolicy, metrics, properties.getCatchUpChunk()));
      String threadName = "fanout-worker-" + i;
      executors.add(
          Executors.newSingleThreadExecutor(
              runnable -> {
                Thread thread = new Thread(runnable, threadName);
                thread.setDaemon(true);
                return thread;
              }));
    }
  }

  @EventListener(ApplicationReadyEvent.class)
  public synchronized void start() {
    if (!properties.isEnabled()) {
      log.info("Fan-out dispatcher disabled");
      return;
    }
    if (running) {
      return;
    }
    initialize();
    running = true;
    Thread thread = new Thread(this::coordinate, "fanout-coordinator");
    thread.setDaemon(true);
    coordinator = thread;
    thread.start();
    log.info(
        "Fan-out dispatcher started workers={} dispatched_through={}", workers.size(), dispatchedThrough);
  }

  @PreDestroy
  public synchronized void stop() {
    running = false;
    Thread thread = coordinator;
    coordinator = null;
    if (thread != null) {
      thread.interrupt();
      try {
        thread.join(5_000L);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }
    for (ExecutorService executor : executors) {
      executor.shutdownNow();
    }
    if (reader != null) {
      reader.close();
    }
    log.info("Fan-out dispatcher stopped dispatched_through={}", dispatchedThrough);
  }

  /** Highest offset every worker has processed. */
  public long dispatchedThrough() {
    return dispatchedThrough;
  }

  public long lag() {
    return Math.max(0L, eventLog.headOffset() - dispatchedThrough);
  }

  public int workerCount() {
    return workers.size();
  }

  void initialize() {
    if (reader != null) {
      reader.close();
    }
    reader = eventLog.openReaderAtHead();
    dispatchedThrough = reader.lastReadOffset();
  }

  /**
   * Runs a single pass: waits up to {@code maxWait} for new entries, then dispatches them (or an
   * empty pass that only activates and retires subscriptions). Returns the number of entries.
   */
  int dispatchOnce(Duration maxWait) throws InterruptedException {
    List<LogEntry> batch;
    try {
      batch = reader.poll(properties.getBatchSize(), backlog ? Duration.ZERO : maxWait);
    } catch (OffsetEvictedException ex) {
      recoverFromEviction(ex);
      return 0;
    }
    long started = System.nanoTime();
    long from = dispatchedThrough + 1L;
    long through = batch.isEmpty() ? dispatchedThrough : batch.get(batch.size() - 1).offset();
    DispatchPass pass = new DispatchPass(batch, from, through, registry.snapshot());

    List<Future<Boolean>> results = new ArrayList<>(workers.size());
    for (int i = 0; i < workers.size(); i++) {
      PartitionWorker worker = workers.get(i);
      results.add(executors.get(i).submit(() -> worker.run(pass)));
    }
    boolean pending = false;
    List<PartitionWorker> failed = new ArrayList<>();
    for (int i = 0; i < results.size(); i++) {
      try {
        pending |= results.get(i).get();
      } catch (ExecutionException ex) {
        log.error(
            "Dispatch pass failed partition={} from={} through={}",
            i,
            from,
            through,
            ex.getCause());
        failed.add(workers.get(i));
      }
    }
    for (PartitionWorker worker : failed) {
      resetPartition(worker, pass);
    }
    backlog = pending;
    dispatchedThrough = through;
    metrics.recordPass(started);
    if (!batch.isEmpty()) {
      log.debug(
          "Dispatch pass completed from={} through={} subscriptions={}",
          from,
          through,
          pass.snapshot().size());
    }
    return batch.size();
  }

  private void coordinate() {
    Duration idleTick = Duration.ofMillis(Math.max(1L, properties.getIdleTickMs()));
    while (running) {
      try {
        dispatchOnce(idleTick);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        break;
      } catch (RuntimeException ex) {
        log.error("Dispatch coordinator error dispatched_through={}", dispatchedThrough, ex);
      }
    }
  }

  /**
   * The pass moves on without the failed partition, so its subscriptions cannot be continued
   * without a gap; each is told to resynchronize and removed.
   */
  private void resetPartition(PartitionWorker worker, DispatchPass pass) throws InterruptedException {
    try {
      executors.get(worker.partition()).submit(worker::retireAll).get(5, TimeUnit.SECONDS);
    } catch (ExecutionException | TimeoutException failure) {
      log.warn("Dispatcher worker reset failed partition={} error={}", worker.partition(), failure.toString());
    }
    for (Subscription subscription : pass.snapshot().forPartition(worker.partition())) {
      connections
          .find(subscription.connectionId())
          .ifPresent(
              connection ->
                  connection.sendError(
                      ErrorCode.RESYNC_REQUIRED,
                      "delivery failed after sequence "
                          + pass.previousOffset()
                          + "; refetch a snapshot and subscribe again",
                      subscription.subscriptionId()));
      registry.unsubscribe(subscription.subscriptionId());
    }
  }

  private void recoverFromEviction(OffsetEvictedException ex) throws InterruptedException {
    RegistrySnapshot snapshot = registry.snapshot();
    log.error(
        "Dispatcher reader evicted requested={} floor={} subscriptions={}",
        ex.requestedOffset(),
        ex.floorOffset(),
        snapshot.size());
    List<Future<?>> resets = new ArrayList<>(workers.size());
    for (int i = 0; i < workers.size(); i++) {
      resets.add(executors.get(i).submit(workers.get(i)::retireAll));
    }
    for (Future<?> reset : resets) {
      try {
        reset.get(5, TimeUnit.SECONDS);
      } catch (ExecutionException | TimeoutException failure) {
        log.warn("Dispatcher worker reset failed error={}", failure.toString());
      }
    }
    for (Subscription subscription : snapshot.all()) {
      connections
          .find(subscription.connectionId())
          .ifPresent(
              connection ->
                  connection.sendError(
                      ErrorCode.OFFSET_EVICTED,
                      "dispatcher fell behind the retained window; refetch a snapshot and subscribe again",
                      subscription.subscriptionId()));
      registry.unsubscribe(subscription.subscriptionId());
    }
    initialize();
    backlog = false;
  }
}
