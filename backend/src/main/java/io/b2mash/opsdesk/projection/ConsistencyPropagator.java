package io.b2mash.opsdesk.projection;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.opsdesk.exception.BackendUnavailableException;
import io.b2mash.opsdesk.health.BackendHealthMonitor;
import io.b2mash.opsdesk.store.RecordKey;
import io.b2mash.opsdesk.store.RecordReader;
import io.b2mash.opsdesk.store.RecordWriter;
import io.b2mash.opsdesk.store.StaleRecordException;
import io.b2mash.opsdesk.store.StoreKind;
import io.b2mash.opsdesk.store.relational.RelationalStoreAdapter;
import io.b2mash.opsdesk.store.search.SearchIndexAdapter;
import java.time.Clock;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Keeps the search index eventually consistent with the relational store.
 *
 * <p>Committed mutations enqueue {@code (key, version)} tasks. Background workers drain the queue,
 * re-read the authoritative record and upsert it into the index with its version. A task is skipped
 * when an equal or newer version has already been projected or is waiting in the queue. While a
 * backend is unavailable the task stays pending and the worker backs off exponentially, retrying
 * without limit.
 */
@Component
public class ConsistencyPropagator implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(ConsistencyPropagator.class);

  private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

  private final RecordReader relational;
  private final RecordWriter searchIndex;
  private final BackendHealthMonitor healthMonitor;
  private final ProjectionQueue queue;
  private final BackoffPolicy backoff;
  private final int workerCount;
  private final Clock clock;

  // Hint only: an evicted entry costs one extra write that the index rejects as stale.
  private final Cache<RecordKey, Long> projectedVersions;
  private final AtomicLong projected = new AtomicLong();
  private final AtomicLong superseded = new AtomicLong();
  private final AtomicLong failedAttempts = new AtomicLong();

  private volatile boolean running;
  private ExecutorService workers;

  @Autowired
  public ConsistencyPropagator(
      RelationalStoreAdapter relational,
      SearchIndexAdapter searchIndex,
      BackendHealthMonitor healthMonitor,
      @Value("${opsdesk.projection.workers:1}") int workerCount,
      @Value("${opsdesk.projection.initial-backoff-ms:200}") long initialBackoffMillis,
      @Value("${opsdesk.projection.max-backoff-ms:30000}") long maxBackoffMillis,
      @Value("${opsdesk.projection.version-cache-size:100000}") long versionCacheSize) {
    this(
        relational,
        searchIndex,
        healthMonitor,
        new ProjectionQueue(Clock.systemUTC()),
        new BackoffPolicy(
            Duration.ofMillis(initialBackoffMillis), Duration.ofMillis(maxBackoffMillis)),
        workerCount,
        Clock.systemUTC(),
        Caffeine.newBuilder()
            .maximumSize(versionCacheSize)
            .expireAfterAccess(Duration.ofHours(6))
            .build());
  }

  ConsistencyPropagator(
      RecordReader relational,
      RecordWriter searchIndex,
      BackendHealthMonitor healthMonitor,
      ProjectionQueue queue,
      BackoffPolicy backoff,
      int workerCount,
      Clock clock,
      Cache<RecordKey, Long> projectedVersions) {
    this.relational = relational;
    this.searchIndex = searchIndex;
    this.healthMonitor = healthMonitor;
    this.queue = queue;
    this.backoff = backoff;
    this.workerCount = Math.max(1, workerCount);
    this.clock = clock;
    this.projectedVersions = projectedVersions;
  }

  public void enqueue(RecordKey key, long version) {
    queue.enqueue(key, version);
  }

  /** Drops the locally known projected version so the next task for {@code key} is projected. */
  public void forget(RecordKey key) {
    projectedVersions.invalidate(key);
  }

  public OptionalLong projectedVersion(RecordKey key) {
    var version = projectedVersions.getIfPresent(key);
    return version != null ? OptionalLong.of(version) : OptionalLong.empty();
  }

  /** Takes one task off the queue and projects it. */
  public ProjectionOutcome processNext(Duration timeout) throws InterruptedException {
    var task = queue.poll(timeout);
    return task.isPresent() ? project(task.get()) : ProjectionOutcome.IDLE;
  }

  ProjectionOutcome project(ProjectionTask task) {
    var key = task.key();
    if (isCovered(key, task.version())
        || queue.pendingVersion(key).orElse(-1L) > task.version()) {
      superseded.incrementAndGet();
      return ProjectionOutcome.SUPERSEDED;
    }
    try {
      var current = relational.read(key.type(), key.id());
      if (current.isEmpty()) {
        log.warn("No relational record for {}, dropping projection task", key);
        return ProjectionOutcome.DROPPED;
      }
      var record = current.get();
      if (isCovered(key, record.version())) {
        superseded.incrementAndGet();
        return ProjectionOutcome.SUPERSEDED;
      }
      try {
        searchIndex.write(record);
      } catch (StaleRecordException e) {
        log.debug("Search index already holds {} at or above version {}", key, record.version());
        markProjected(key, record.version());
        superseded.incrementAndGet();
        return ProjectionOutcome.SUPERSEDED;
      }
      markProjected(key, record.version());
      projected.incrementAndGet();
      healthMonitor.reportAvailable(StoreKind.SEARCH);
      return ProjectionOutcome.PROJECTED;
    } catch (BackendUnavailableException e) {
      failedAttempts.incrementAndGet();
      healthMonitor.reportUnavailable(e.getStore());
      queue.requeue(task);
      log.warn(
          "Projection of {} v{} deferred, {} store unavailable",
          key,
          task.version(),
          e.getStore().key());
      return ProjectionOutcome.RETRY;
    } catch (RuntimeException e) {
      failedAttempts.incrementAndGet();
      queue.requeue(task);
      log.error("Projection of {} v{} failed", key, task.version(), e);
      return ProjectionOutcome.RETRY;
    }
  }

  private boolean isCovered(RecordKey key, long version) {
    var known = projectedVersions.getIfPresent(key);
    return known != null && known >= version;
  }

  private void markProjected(RecordKey key, long version) {
    projectedVersions.asMap().merge(key, version, Math::max);
  }

  long trackedVersionCount() {
    projectedVersions.cleanUp();
    return projectedVersions.estimatedSize();
  }

  public ProjectionStatus status() {
    Long oldestAge =
        queue
            .oldestPendingSince()
            .map(since -> Duration.between(since, clock.instant()).toMillis())
            .orElse(null);
    return new ProjectionStatus(
        queue.size(), oldestAge, projected.get(), superseded.get(), failedAttempts.get());
  }

  // --- Worker lifecycle ---

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    var threadCount = new AtomicInteger();
    workers =
        Executors.newFixedThreadPool(
            workerCount,
            runnable -> {
              var name = "projection-worker-" + threadCount.incrementAndGet();
              var thread = new Thread(runnable, name);
              thread.setDaemon(true);
              return thread;
            });
    for (int i = 0; i < workerCount; i++) {
      workers.submit(this::runWorker);
    }
    log.info("Started {} projection worker(s)", workerCount);
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    workers.shutdownNow();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Projection workers did not stop within 5s, {} task(s) pending", queue.size());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  private void runWorker() {
    int consecutiveFailures = 0;
    while (running && !Thread.currentThread().isInterrupted()) {
      try {
        var outcome = processNext(POLL_TIMEOUT);
        if (outcome == ProjectionOutcome.RETRY) {
          consecutiveFailures++;
          Thread.sleep(backoff.delayFor(consecutiveFailures).toMillis());
        } else if (outcome != ProjectionOutcome.IDLE) {
          consecutiveFailures = 0;
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
    }
  }
}
