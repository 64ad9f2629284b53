package io.b2mash.opsdesk.search;

import io.b2mash.opsdesk.exception.InvalidRequestException;
import io.b2mash.opsdesk.store.EntityRecord;
import io.b2mash.opsdesk.store.KeywordOperator;
import io.b2mash.opsdesk.store.RecordQuery;
import io.b2mash.opsdesk.store.search.SearchOrder;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class SearchService {

  static final int MAX_PAGE_SIZE = 100;
  static final int RECOMMENDATION_COUNT = 5;

  private static final DateTimeFormatter MONTH =
      DateTimeFormatter.ofPattern("yyyy-MM").withZone(ZoneOffset.UTC);

  private final QueryRouter queryRouter;
  private final Duration defaultRange;

  public SearchService(
      QueryRouter queryRouter,
      @Value("${opsdesk.search.default-range-days:730}") long defaultRangeDays) {
    this.queryRouter = queryRouter;
    this.defaultRange = Duration.ofDays(defaultRangeDays);
  }

  /** Free text over title and body; every term must match. */
  public SearchResponse results(String query, int page, int size) {
    return respond(RecordQuery.text(query), SearchOrder.RELEVANCE, page, size);
  }

  public SearchResponse advancedResults(SearchFilter filter, int page, int size) {
    return respond(toQuery(filter), SearchOrder.RELEVANCE, page, size);
  }

  public SearchResponse latestTickets(SearchFilter filter, int page, int size) {
    return respond(toQuery(filter), SearchOrder.NEWEST, page, size);
  }

  public SearchOptions options(SearchFilter filter) {
    var records = queryRouter.find(toQuery(filter), SearchOrder.NEWEST, queryRouter.maxScan());
    return new SearchOptions(
        distinct(records.records(), r -> r.type().name()),
        distinct(records.records(), EntityRecord::status),
        distinct(records.records(), EntityRecord::ownerId),
        distinct(records.records(), EntityRecord::companyId),
        distinct(records.records(), EntityRecord::technicianId));
  }

  public List<SearchHit> recommendations(String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    return queryRouter
        .find(RecordQuery.text(query), SearchOrder.RELEVANCE, RECOMMENDATION_COUNT)
        .records()
        .stream()
        .map(SearchHit::from)
        .toList();
  }

  /**
   * Builds the record predicate for {@code filter}. Without an explicit range only records updated
   * within the default range are considered.
   */
  RecordQuery toQuery(SearchFilter filter) {
    var f = filter != null ? filter : SearchFilter.empty();
    var to = f.to();
    var from = f.from();
    if (from == null && to == null) {
      from = Instant.now().minus(defaultRange);
    }
    if (from != null && to != null && from.isAfter(to)) {
      throw new InvalidRequestException("Invalid date range", "'from' must not be after 'to'");
    }
    return new RecordQuery(
        f.entityTypes() == null || f.entityTypes().isEmpty()
            ? null
            : EnumSet.copyOf(f.entityTypes()),
        f.statuses() == null ? null : Set.copyOf(f.statuses()),
        f.ownerId(),
        f.companyId(),
        f.technicianId(),
        from,
        to,
        f.keywords(),
        KeywordOperator.parse(f.keywordsOperator()));
  }

  private SearchResponse respond(RecordQuery query, SearchOrder order, int page, int size) {
    if (page < 0) {
      throw new InvalidRequestException("Invalid page", "page must not be negative");
    }
    if (size < 1 || size > MAX_PAGE_SIZE) {
      throw new InvalidRequestException(
          "Invalid page size", "size must be between 1 and " + MAX_PAGE_SIZE);
    }
    var matches = queryRouter.find(query, order, queryRouter.maxScan()).records();
    var results =
        matches.stream()
            .skip((long) page * size)
            .limit(size)
            .map(SearchHit::from)
            .toList();
    return new SearchResponse(results, matches.size(), page, size, facets(matches));
  }

  static SearchResponse.Facets facets(List<EntityRecord> records) {
    return new SearchResponse.Facets(
        count(records, r -> r.type().name()),
        count(records, EntityRecord::status),
        count(records, r -> r.updatedAt() != null ? MONTH.format(r.updatedAt()) : null));
  }

  private static Map<String, Long> count(
      List<EntityRecord> records, Function<EntityRecord, String> key) {
    return records.stream()
        .map(key)
        .filter(Objects::nonNull)
        .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()));
  }

  private static <T extends Comparable<T>> List<T> distinct(
      List<EntityRecord> records, Function<EntityRecord, T> key) {
    return records.stream().map(key).filter(Objects::nonNull).distinct().sorted().toList();
  }
}
