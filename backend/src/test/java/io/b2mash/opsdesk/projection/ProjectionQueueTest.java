package io.b2mash.opsdesk.projection;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.opsdesk.store.EntityType;
import io.b2mash.opsdesk.store.RecordKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ProjectionQueueTest {

  private static final Instant NOW = Instant.parse("2026-04-01T10:00:00Z");

  private final ProjectionQueue queue = new ProjectionQueue(Clock.fixed(NOW, ZoneOffset.UTC));
  private final RecordKey lead = new RecordKey(EntityType.LEAD, UUID.randomUUID());
  private final RecordKey offer = new RecordKey(EntityType.OFFER, UUID.randomUUID());

  @Test
  void keepsOneTaskPerKeyWithHighestVersion() throws InterruptedException {
    queue.enqueue(lead, 3);
    queue.enqueue(lead, 1);
    queue.enqueue(lead, 5);

    assertThat(queue.size()).isEqualTo(1);
    assertThat(queue.pendingVersion(lead)).hasValue(5);

    var task = queue.poll(Duration.ZERO);
    assertThat(task).isPresent();
    assertThat(task.get().version()).isEqualTo(5);
    assertThat(queue.poll(Duration.ZERO)).isEmpty();
  }

  @Test
  void pollsKeysInArrivalOrder() throws InterruptedException {
    queue.enqueue(lead, 1);
    queue.enqueue(offer, 1);

    assertThat(queue.poll(Duration.ZERO).get().key()).isEqualTo(lead);
    assertThat(queue.poll(Duration.ZERO).get().key()).isEqualTo(offer);
  }

  @Test
  void requeueKeepsOriginalEnqueueTime() throws InterruptedException {
    var earlier = NOW.minusSeconds(60);
    queue.requeue(new ProjectionTask(lead, 2, earlier));
    queue.enqueue(lead, 4);

    assertThat(queue.oldestPendingSince()).hasValue(earlier);
    var task = queue.poll(Duration.ZERO).get();
    assertThat(task.version()).isEqualTo(4);
    assertThat(task.enqueuedAt()).isEqualTo(earlier);
  }

  @Test
  void emptyQueueHasNoPendingState() throws InterruptedException {
    assertThat(queue.poll(Duration.ofMillis(10))).isEmpty();
    assertThat(queue.pendingVersion(lead)).isEmpty();
    assertThat(queue.oldestPendingSince()).isEmpty();
  }
}
