package io.b2mash.opsdesk.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.opsdesk.exception.BackendUnavailableException;
import io.b2mash.opsdesk.store.Availability;
import io.b2mash.opsdesk.store.StoreAdapter;
import io.b2mash.opsdesk.store.StoreKind;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BackendHealthMonitorTest {

  private final CountDownLatch release = new CountDownLatch(1);
  private BackendHealthMonitor monitor;

  @AfterEach
  void tearDown() {
    release.countDown();
    if (monitor != null) {
      monitor.shutdown();
    }
  }

  private static StoreAdapter adapter(StoreKind kind, Availability availability) {
    return new StoreAdapter() {
      @Override
      public StoreKind kind() {
        return kind;
      }

      @Override
      public Availability ping() {
        return availability;
      }
    };
  }

  private StoreAdapter hanging(StoreKind kind) {
    return new StoreAdapter() {
      @Override
      public StoreKind kind() {
        return kind;
      }

      @Override
      public Availability ping() {
        try {
          release.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        return Availability.AVAILABLE;
      }
    };
  }

  @Test
  void startsOptimistic() {
    monitor = new BackendHealthMonitor(List.of(), 100);

    var snapshot = monitor.snapshot();
    assertThat(snapshot.ok()).isTrue();
    assertThat(snapshot.search()).isTrue();
    assertThat(snapshot.cache()).isTrue();
  }

  @Test
  void refreshReflectsEachStore() {
    monitor =
        new BackendHealthMonitor(
            List.of(
                adapter(StoreKind.RELATIONAL, Availability.AVAILABLE),
                adapter(StoreKind.SEARCH, Availability.UNAVAILABLE),
                adapter(StoreKind.CACHE, Availability.AVAILABLE)),
            500);

    var snapshot = monitor.refresh();

    assertThat(snapshot.ok()).isTrue();
    assertThat(snapshot.relational()).isTrue();
    assertThat(snapshot.search()).isFalse();
    assertThat(snapshot.cache()).isTrue();
    assertThat(monitor.snapshot()).isSameAs(snapshot);
  }

  @Test
  void hangingProbeCountsAsUnavailable() {
    monitor =
        new BackendHealthMonitor(
            List.of(
                adapter(StoreKind.RELATIONAL, Availability.AVAILABLE),
                hanging(StoreKind.SEARCH),
                adapter(StoreKind.CACHE, Availability.AVAILABLE)),
            100);

    var snapshot = monitor.refresh();

    assertThat(snapshot.search()).isFalse();
    assertThat(snapshot.relational()).isTrue();
  }

  @Test
  void throwingProbeCountsAsUnavailable() {
    var failing =
        new StoreAdapter() {
          @Override
          public StoreKind kind() {
            return StoreKind.CACHE;
          }

          @Override
          public Availability ping() {
            throw new IllegalStateException("connection refused");
          }
        };
    monitor =
        new BackendHealthMonitor(
            List.of(
                adapter(StoreKind.RELATIONAL, Availability.AVAILABLE),
                adapter(StoreKind.SEARCH, Availability.AVAILABLE),
                failing),
            500);

    assertThat(monitor.refresh().cache()).isFalse();
  }

  @Test
  void missingAdapterIsUnavailable() {
    var relational = adapter(StoreKind.RELATIONAL, Availability.AVAILABLE);
    monitor = new BackendHealthMonitor(List.of(relational), 500);

    var snapshot = monitor.refresh();

    assertThat(snapshot.relational()).isTrue();
    assertThat(snapshot.search()).isFalse();
    assertThat(snapshot.cache()).isFalse();
  }

  @Test
  void relationalOutageMakesSnapshotNotOk() {
    monitor = new BackendHealthMonitor(List.of(), 100);

    monitor.reportUnavailable(StoreKind.RELATIONAL);

    assertThat(monitor.snapshot().ok()).isFalse();
    assertThatThrownBy(() -> monitor.requireRelationalAvailable())
        .isInstanceOf(BackendUnavailableException.class)
        .satisfies(
            e ->
                assertThat(((BackendUnavailableException) e).getStore())
                    .isEqualTo(StoreKind.RELATIONAL));

    monitor.reportAvailable(StoreKind.RELATIONAL);
    assertThat(monitor.snapshot().ok()).isTrue();
  }

  @Test
  void searchOutageKeepsSnapshotOk() {
    monitor = new BackendHealthMonitor(List.of(), 100);

    monitor.reportUnavailable(StoreKind.SEARCH);
    monitor.reportUnavailable(StoreKind.CACHE);

    var snapshot = monitor.snapshot();
    assertThat(snapshot.ok()).isTrue();
    assertThat(snapshot.search()).isFalse();
    assertThat(snapshot.cache()).isFalse();
  }
}
