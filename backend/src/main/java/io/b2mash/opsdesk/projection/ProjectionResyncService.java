package io.b2mash.opsdesk.projection;

import io.b2mash.opsdesk.store.EntityType;
import io.b2mash.opsdesk.store.relational.RelationalStoreAdapter;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Re-enqueues every relational record of the given types, tombstones included. Used after the
 * search index was rebuilt or lost. The index's version check keeps a resync from regressing newer
 * projections.
 */
@Service
public class ProjectionResyncService {

  private static final Logger log = LoggerFactory.getLogger(ProjectionResyncService.class);

  private final RelationalStoreAdapter relational;
  private final ConsistencyPropagator propagator;

  public ProjectionResyncService(
      RelationalStoreAdapter relational, ConsistencyPropagator propagator) {
    this.relational = relational;
    this.propagator = propagator;
  }

  public int resync(Set<EntityType> types) {
    var selected = types == null || types.isEmpty() ? EnumSet.allOf(EntityType.class) : types;
    var count = new AtomicInteger();
    for (var type : selected) {
      int before = count.get();
      try (var records = relational.scan(type)) {
        records.forEach(
            record -> {
              propagator.forget(record.key());
              propagator.enqueue(record.key(), record.version());
              count.incrementAndGet();
            });
      }
      log.info("Resync enqueued {} {} record(s)", count.get() - before, type);
    }
    return count.get();
  }
}
