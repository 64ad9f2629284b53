package io.b2mash.opsdesk.projection;

import io.b2mash.opsdesk.store.EntityType;
import io.b2mash.opsdesk.store.RecordKey;
import java.util.UUID;

/** Published inside the writing transaction after a searchable entity was flushed. */
public record EntityChangedEvent(EntityType type, UUID id, long version) {

  public RecordKey key() {
    return new RecordKey(type, id);
  }
}
