package io.b2mash.opsdesk.health;

import io.b2mash.opsdesk.store.StoreKind;
import java.time.Instant;

/**
 * Immutable availability view of the backing stores. {@code ok} mirrors the relational store:
 * search and cache only affect completeness and speed.
 */
public record HealthSnapshot(
    boolean ok, boolean relational, boolean search, boolean cache, Instant checkedAt) {

  public HealthSnapshot {
    ok = relational;
  }

  public static HealthSnapshot of(boolean relational, boolean search, boolean cache) {
    return new HealthSnapshot(relational, relational, search, cache, Instant.now());
  }

  public boolean isAvailable(StoreKind kind) {
    return switch (kind) {
      case RELATIONAL -> relational;
      case SEARCH -> search;
      case CACHE -> cache;
    };
  }

  public HealthSnapshot with(StoreKind kind, boolean available) {
    return switch (kind) {
      case RELATIONAL -> new HealthSnapshot(available, available, search, cache, Instant.now());
      case SEARCH -> new HealthSnapshot(ok, relational, available, cache, Instant.now());
      case CACHE -> new HealthSnapshot(ok, relational, search, available, Instant.now());
    };
  }
}
