package io.b2mash.opsdesk.projection;

import io.b2mash.opsdesk.store.RecordKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Work queue holding at most one pending task per record. Enqueuing a key that is already pending
 * keeps the higher version, so an older task is superseded instead of being projected first.
 */
public class ProjectionQueue {

  private record Pending(long version, Instant enqueuedAt) {}

  private final Map<RecordKey, Pending> pending = new ConcurrentHashMap<>();
  private final LinkedBlockingQueue<RecordKey> ready = new LinkedBlockingQueue<>();
  private final Clock clock;

  public ProjectionQueue(Clock clock) {
    this.clock = clock;
  }

  public void enqueue(RecordKey key, long version) {
    offer(key, version, clock.instant());
  }

  /** Puts a failed task back, keeping its original enqueue time for lag reporting. */
  public void requeue(ProjectionTask task) {
    offer(task.key(), task.version(), task.enqueuedAt());
  }

  private void offer(RecordKey key, long version, Instant enqueuedAt) {
    var fresh = new boolean[1];
    pending.compute(
        key,
        (k, current) -> {
          if (current == null) {
            fresh[0] = true;
            return new Pending(version, enqueuedAt);
          }
          var oldest =
              current.enqueuedAt().isBefore(enqueuedAt) ? current.enqueuedAt() : enqueuedAt;
          return new Pending(Math.max(current.version(), version), oldest);
        });
    if (fresh[0]) {
      ready.offer(key);
    }
  }

  /** Removes and returns the next pending task, waiting up to {@code timeout}. */
  public Optional<ProjectionTask> poll(Duration timeout) throws InterruptedException {
    var key = ready.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    if (key == null) {
      return Optional.empty();
    }
    var task = pending.remove(key);
    if (task == null) {
      return Optional.empty();
    }
    return Optional.of(new ProjectionTask(key, task.version(), task.enqueuedAt()));
  }

  public OptionalLong pendingVersion(RecordKey key) {
    var task = pending.get(key);
    return task != null ? OptionalLong.of(task.version()) : OptionalLong.empty();
  }

  public int size() {
    return pending.size();
  }

  public Optional<Instant> oldestPendingSince() {
    return pending.values().stream().map(Pending::enqueuedAt).min(Instant::compareTo);
  }
}
