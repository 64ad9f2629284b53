package io.b2mash.opsdesk.search;

import io.b2mash.opsdesk.config.OpenSearchConfig.SearchIndexProperties;
import io.b2mash.opsdesk.exception.BackendUnavailableException;
import io.b2mash.opsdesk.health.BackendHealthMonitor;
import io.b2mash.opsdesk.store.EntityRecord;
import io.b2mash.opsdesk.store.RecordQuery;
import io.b2mash.opsdesk.store.StoreKind;
import io.b2mash.opsdesk.store.relational.RelationalStoreAdapter;
import io.b2mash.opsdesk.store.search.SearchIndexAdapter;
import io.b2mash.opsdesk.store.search.SearchOrder;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Chooses between the search index and the relational store for each query. The index is used
 * while the health snapshot reports it available; otherwise, or when it fails mid-request, the
 * same predicate is evaluated against the relational store.
 */
@Component
public class QueryRouter {

  private static final Logger log = LoggerFactory.getLogger(QueryRouter.class);

  static final Comparator<EntityRecord> NEWEST_FIRST =
      Comparator.comparing(
              EntityRecord::updatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
          .thenComparing(record -> record.id().toString());

  private final SearchIndexAdapter searchIndex;
  private final RelationalStoreAdapter relational;
  private final BackendHealthMonitor healthMonitor;
  private final int maxScan;

  public QueryRouter(
      SearchIndexAdapter searchIndex,
      RelationalStoreAdapter relational,
      BackendHealthMonitor healthMonitor,
      SearchIndexProperties properties) {
    this.searchIndex = searchIndex;
    this.relational = relational;
    this.healthMonitor = healthMonitor;
    this.maxScan = properties.maxScan();
  }

  /** Upper bound on the number of records a single query materializes. */
  public int maxScan() {
    return maxScan;
  }

  public RoutedResult find(RecordQuery query, SearchOrder order, int limit) {
    int bounded = Math.min(limit, maxScan);
    if (healthMonitor.snapshot().search()) {
      try {
        return new RoutedResult(searchIndex.search(query, order, bounded), StoreKind.SEARCH);
      } catch (BackendUnavailableException e) {
        log.warn("Search index failed, falling back to relational store: {}", e.getMessage());
        healthMonitor.reportUnavailable(StoreKind.SEARCH);
      }
    }
    return new RoutedResult(fallback(query, bounded), StoreKind.RELATIONAL);
  }

  /** Relational evaluation of {@code query}. Unranked; newest first regardless of order. */
  private List<EntityRecord> fallback(RecordQuery query, int limit) {
    return query.entityTypes().stream()
        .flatMap(type -> relational.query(type, query).limit(limit))
        .sorted(NEWEST_FIRST)
        .limit(limit)
        .toList();
  }
}
