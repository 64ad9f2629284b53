package io.b2mash.opsdesk.store.relational;

import io.b2mash.opsdesk.store.EntityRecord;
import io.b2mash.opsdesk.store.EntityType;
import io.b2mash.opsdesk.store.RecordQuery;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;

/**
 * Exposes one JPA aggregate as {@link EntityRecord}s. Implementations narrow pages by the
 * structured filters they can push into SQL; remaining predicates are applied by {@link
 * RelationalStoreAdapter}.
 */
public interface RecordSource {

  EntityType type();

  Optional<EntityRecord> load(UUID id);

  /** One page of candidate records, ordered by last update descending. */
  Slice<EntityRecord> page(RecordQuery query, Pageable pageable);
}
