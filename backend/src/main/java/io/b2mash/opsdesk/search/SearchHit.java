package io.b2mash.opsdesk.search;

import io.b2mash.opsdesk.store.EntityRecord;
import java.time.Instant;
import java.util.UUID;

public record SearchHit(
    String entityType,
    UUID id,
    long version,
    String status,
    String title,
    String snippet,
    UUID ownerId,
    UUID companyId,
    UUID technicianId,
    UUID parentId,
    Instant createdAt,
    Instant updatedAt) {

  static final int SNIPPET_LENGTH = 200;

  public static SearchHit from(EntityRecord record) {
    var body = record.body();
    var snippet =
        body != null && body.length() > SNIPPET_LENGTH ? body.substring(0, SNIPPET_LENGTH) : body;
    return new SearchHit(
        record.type().name(),
        record.id(),
        record.version(),
        record.status(),
        record.title(),
        snippet,
        record.ownerId(),
        record.companyId(),
        record.technicianId(),
        record.parentId(),
        record.createdAt(),
        record.updatedAt());
  }
}
