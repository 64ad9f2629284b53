package io.b2mash.opsdesk.search;

import io.b2mash.opsdesk.store.EntityType;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Structured filters shared by the advanced, latest and options queries. All fields optional. */
public record SearchFilter(
    Instant from,
    Instant to,
    List<EntityType> entityTypes,
    List<String> statuses,
    UUID ownerId,
    UUID companyId,
    UUID technicianId,
    String keywords,
    String keywordsOperator) {

  public static SearchFilter empty() {
    return new SearchFilter(null, null, null, null, null, null, null, null, null);
  }
}
