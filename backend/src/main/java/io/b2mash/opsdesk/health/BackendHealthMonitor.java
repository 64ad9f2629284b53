package io.b2mash.opsdesk.health;

import io.b2mash.opsdesk.exception.BackendUnavailableException;
import io.b2mash.opsdesk.store.Availability;
import io.b2mash.opsdesk.store.StoreAdapter;
import io.b2mash.opsdesk.store.StoreKind;
import jakarta.annotation.PreDestroy;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Process-wide availability signal for the backing stores. Refreshed by a periodic probe and
 * updated opportunistically by callers that observe a failure or recovery. Readers get the current
 * immutable snapshot without blocking.
 */
@Component
public class BackendHealthMonitor {

  private static final Logger log = LoggerFactory.getLogger(BackendHealthMonitor.class);

  private final Map<StoreKind, StoreAdapter> adapters = new EnumMap<>(StoreKind.class);
  private final long pingTimeoutMillis;
  private final ExecutorService probeExecutor;
  private final AtomicReference<HealthSnapshot> snapshot =
      new AtomicReference<>(HealthSnapshot.of(true, true, true));

  public BackendHealthMonitor(
      List<StoreAdapter> adapters,
      @Value("${opsdesk.health.ping-timeout-ms:1500}") long pingTimeoutMillis) {
    for (var adapter : adapters) {
      this.adapters.put(adapter.kind(), adapter);
    }
    this.pingTimeoutMillis = pingTimeoutMillis;
    var threadCount = new AtomicInteger();
    this.probeExecutor =
        Executors.newCachedThreadPool(
            runnable -> {
              var thread = new Thread(runnable, "health-probe-" + threadCount.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            });
  }

  public HealthSnapshot snapshot() {
    return snapshot.get();
  }

  @Scheduled(
      initialDelayString = "${opsdesk.health.initial-delay:0}",
      fixedDelayString = "${opsdesk.health.probe-interval:5000}")
  public void probeAll() {
    refresh();
  }

  /** Probes every store in parallel; a store that does not answer within the timeout is down. */
  public HealthSnapshot refresh() {
    var relational = probe(StoreKind.RELATIONAL);
    var search = probe(StoreKind.SEARCH);
    var cache = probe(StoreKind.CACHE);

    var next =
        HealthSnapshot.of(
            relational.join().isAvailable(),
            search.join().isAvailable(),
            cache.join().isAvailable());
    var previous = snapshot.getAndSet(next);
    logChanges(previous, next);
    return next;
  }

  /** Fails fast when the system of record is known to be down, before any side effect. */
  public void requireRelationalAvailable() {
    if (!snapshot().relational()) {
      throw new BackendUnavailableException(
          StoreKind.RELATIONAL, "Relational store is unavailable, mutations are rejected");
    }
  }

  public void reportUnavailable(StoreKind kind) {
    update(kind, false);
  }

  public void reportAvailable(StoreKind kind) {
    update(kind, true);
  }

  private void update(StoreKind kind, boolean available) {
    var previous = snapshot.getAndUpdate(current -> current.with(kind, available));
    if (previous.isAvailable(kind) != available) {
      logChange(kind, available);
    }
  }

  private CompletableFuture<Availability> probe(StoreKind kind) {
    var adapter = adapters.get(kind);
    if (adapter == null) {
      return CompletableFuture.completedFuture(Availability.UNAVAILABLE);
    }
    return CompletableFuture.supplyAsync(adapter::ping, probeExecutor)
        .completeOnTimeout(Availability.UNAVAILABLE, pingTimeoutMillis, TimeUnit.MILLISECONDS)
        .exceptionally(
            ex -> {
              log.debug("Probe of {} store failed: {}", kind.key(), ex.getMessage());
              return Availability.UNAVAILABLE;
            });
  }

  private void logChanges(HealthSnapshot previous, HealthSnapshot next) {
    for (var kind : StoreKind.values()) {
      if (previous.isAvailable(kind) != next.isAvailable(kind)) {
        logChange(kind, next.isAvailable(kind));
      }
    }
  }

  private void logChange(StoreKind kind, boolean available) {
    if (available) {
      log.info("Backend {} is available again", kind.key());
    } else {
      log.warn("Backend {} is unavailable, switching to degraded mode", kind.key());
    }
  }

  @PreDestroy
  void shutdown() {
    probeExecutor.shutdownNow();
  }
}
