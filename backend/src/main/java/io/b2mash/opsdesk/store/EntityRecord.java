package io.b2mash.opsdesk.store;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Store-neutral view of a searchable entity. The relational store produces it from the system of
 * record; the search index stores it as a projection tagged with {@code version}.
 */
public record EntityRecord(
    EntityType type,
    UUID id,
    long version,
    boolean deleted,
    String status,
    String title,
    String body,
    UUID ownerId,
    UUID companyId,
    UUID technicianId,
    UUID parentId,
    Instant createdAt,
    Instant updatedAt) {

  public EntityRecord {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(id, "id must not be null");
    status = TextTerms.normalizeStatus(status);
  }

  public RecordKey key() {
    return new RecordKey(type, id);
  }

  /** Free text the keyword filters match against. */
  public String searchableText() {
    return (title != null ? title : "") + " " + (body != null ? body : "");
  }
}
