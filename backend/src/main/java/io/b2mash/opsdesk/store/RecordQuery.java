package io.b2mash.opsdesk.store;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Predicate over {@link EntityRecord}s. The relational fallback evaluates {@link #matches} in
 * memory; the search index translates the same fields into filter clauses.
 */
public record RecordQuery(
    Set<EntityType> entityTypes,
    Set<String> statuses,
    UUID ownerId,
    UUID companyId,
    UUID technicianId,
    Instant updatedFrom,
    Instant updatedTo,
    String keywords,
    KeywordOperator keywordOperator) {

  public RecordQuery {
    entityTypes =
        entityTypes == null || entityTypes.isEmpty()
            ? EnumSet.allOf(EntityType.class)
            : EnumSet.copyOf(entityTypes);
    statuses =
        statuses == null
            ? Set.of()
            : Set.copyOf(
                statuses.stream()
                    .filter(s -> s != null && !s.isBlank())
                    .map(TextTerms::normalizeStatus)
                    .toList());
    keywords = keywords == null || keywords.isBlank() ? null : keywords.trim();
    keywordOperator = keywordOperator == null ? KeywordOperator.AND : keywordOperator;
  }

  public static RecordQuery all() {
    return new RecordQuery(null, null, null, null, null, null, null, null, null);
  }

  public static RecordQuery text(String keywords) {
    return new RecordQuery(null, null, null, null, null, null, null, keywords, KeywordOperator.AND);
  }

  public RecordQuery withTypes(Set<EntityType> types) {
    return new RecordQuery(
        types,
        statuses,
        ownerId,
        companyId,
        technicianId,
        updatedFrom,
        updatedTo,
        keywords,
        keywordOperator);
  }

  /** Lower-cased keyword tokens, empty when no keyword filter applies. */
  public List<String> terms() {
    return TextTerms.tokenize(keywords);
  }

  public boolean matches(EntityRecord record) {
    if (record.deleted() || !entityTypes.contains(record.type())) {
      return false;
    }
    if (!statuses.isEmpty() && !statuses.contains(record.status())) {
      return false;
    }
    if (ownerId != null && !ownerId.equals(record.ownerId())) {
      return false;
    }
    if (companyId != null && !companyId.equals(record.companyId())) {
      return false;
    }
    if (technicianId != null && !technicianId.equals(record.technicianId())) {
      return false;
    }
    var updatedAt = record.updatedAt();
    if (updatedFrom != null && (updatedAt == null || updatedAt.isBefore(updatedFrom))) {
      return false;
    }
    if (updatedTo != null && (updatedAt == null || updatedAt.isAfter(updatedTo))) {
      return false;
    }
    var terms = terms();
    if (terms.isEmpty()) {
      return true;
    }
    var tokens = Set.copyOf(TextTerms.tokenize(record.searchableText()));
    return keywordOperator == KeywordOperator.ANY
        ? terms.stream().anyMatch(tokens::contains)
        : terms.stream().allMatch(tokens::contains);
  }
}
