package io.b2mash.opsdesk.store;

import java.util.UUID;

public record RecordKey(EntityType type, UUID id) {

  /** Identifier used for the search document, stable across versions. */
  public String documentId() {
    return type.name().toLowerCase() + ":" + id;
  }

  @Override
  public String toString() {
    return documentId();
  }
}
