package io.b2mash.opsdesk.search;

import java.util.List;
import java.util.Map;

/** Same shape whichever store answered. */
public record SearchResponse(
    List<SearchHit> results, long total, int page, int size, Facets facets) {

  /** Match counts keyed by entity type, status and update month ({@code yyyy-MM}, UTC). */
  public record Facets(
      Map<String, Long> entityTypes, Map<String, Long> statuses, Map<String, Long> months) {}
}
