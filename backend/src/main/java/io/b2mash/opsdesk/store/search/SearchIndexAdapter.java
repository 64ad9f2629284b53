package io.b2mash.opsdesk.store.search;

import static io.b2mash.opsdesk.store.search.SearchDocuments.BODY;
import static io.b2mash.opsdesk.store.search.SearchDocuments.COMPANY_ID;
import static io.b2mash.opsdesk.store.search.SearchDocuments.DELETED;
import static io.b2mash.opsdesk.store.search.SearchDocuments.ENTITY_TYPE;
import static io.b2mash.opsdesk.store.search.SearchDocuments.OWNER_ID;
import static io.b2mash.opsdesk.store.search.SearchDocuments.STATUS;
import static io.b2mash.opsdesk.store.search.SearchDocuments.TECHNICIAN_ID;
import static io.b2mash.opsdesk.store.search.SearchDocuments.TEXT;
import static io.b2mash.opsdesk.store.search.SearchDocuments.TITLE;
import static io.b2mash.opsdesk.store.search.SearchDocuments.UPDATED_AT;

import io.b2mash.opsdesk.config.OpenSearchConfig.SearchIndexProperties;
import io.b2mash.opsdesk.exception.BackendUnavailableException;
import io.b2mash.opsdesk.store.Availability;
import io.b2mash.opsdesk.store.EntityRecord;
import io.b2mash.opsdesk.store.EntityType;
import io.b2mash.opsdesk.store.KeywordOperator;
import io.b2mash.opsdesk.store.RecordKey;
import io.b2mash.opsdesk.store.RecordQuery;
import io.b2mash.opsdesk.store.RecordReader;
import io.b2mash.opsdesk.store.RecordWriter;
import io.b2mash.opsdesk.store.StaleRecordException;
import io.b2mash.opsdesk.store.StoreAdapter;
import io.b2mash.opsdesk.store.StoreKind;
import java.io.IOException;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import org.opensearch.client.json.JsonData;
import org.opensearch.client.opensearch.OpenSearchClient;
import org.opensearch.client.opensearch._types.FieldValue;
import org.opensearch.client.opensearch._types.OpenSearchException;
import org.opensearch.client.opensearch._types.SortOrder;
import org.opensearch.client.opensearch._types.VersionType;
import org.opensearch.client.opensearch._types.query_dsl.BoolQuery;
import org.opensearch.client.opensearch._types.query_dsl.Operator;
import org.opensearch.client.opensearch._types.query_dsl.Query;
import org.opensearch.client.opensearch.core.GetRequest;
import org.opensearch.client.opensearch.core.IndexRequest;
import org.opensearch.client.opensearch.core.SearchRequest;
import org.opensearch.client.opensearch.indices.CreateIndexRequest;
import org.opensearch.client.opensearch.indices.ExistsRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Search projection store backed by OpenSearch. Writes use external versioning so the index itself
 * rejects any projection older than the one it holds.
 */
@Component
public class SearchIndexAdapter implements StoreAdapter, RecordReader, RecordWriter {

  private static final Logger log = LoggerFactory.getLogger(SearchIndexAdapter.class);

  private final OpenSearchClient client;
  private final SearchIndexProperties properties;
  private final AtomicBoolean indexReady = new AtomicBoolean(false);

  public SearchIndexAdapter(OpenSearchClient client, SearchIndexProperties properties) {
    this.client = client;
    this.properties = properties;
  }

  @Override
  public StoreKind kind() {
    return StoreKind.SEARCH;
  }

  @Override
  public Availability ping() {
    try {
      return client.ping().value() ? Availability.AVAILABLE : Availability.UNAVAILABLE;
    } catch (IOException | RuntimeException e) {
      log.debug("Search ping failed: {}", e.getMessage());
      return Availability.UNAVAILABLE;
    }
  }

  @Override
  public Optional<EntityRecord> read(EntityType type, UUID id) {
    var key = new RecordKey(type, id);
    var request = new GetRequest.Builder().index(properties.index()).id(key.documentId()).build();
    try {
      var response = client.get(request, SearchDocuments.Source.class);
      if (!response.found() || response.source() == null) {
        return Optional.empty();
      }
      return Optional.of(SearchDocuments.fromSource(response.source()));
    } catch (OpenSearchException e) {
      if (e.status() == 404) {
        return Optional.empty();
      }
      throw unavailable("read " + key, e);
    } catch (IOException | RuntimeException e) {
      throw unavailable("read " + key, e);
    }
  }

  @Override
  public Stream<EntityRecord> query(EntityType type, RecordQuery query) {
    var scoped = query.withTypes(EnumSet.of(type));
    return search(scoped, SearchOrder.NEWEST, properties.maxScan()).stream();
  }

  @Override
  public EntityRecord write(EntityRecord record) {
    ensureIndex();
    var key = record.key();
    var request =
        new IndexRequest.Builder<SearchDocuments.Source>()
            .index(properties.index())
            .id(key.documentId())
            .versionType(VersionType.External)
            .version(record.version())
            .document(SearchDocuments.toSource(record))
            .build();
    try {
      client.index(request);
      log.debug("Projected {} at version {}", key, record.version());
      return record;
    } catch (OpenSearchException e) {
      if (e.status() == 409) {
        throw new StaleRecordException(key, record.version(), e);
      }
      throw unavailable("write " + key, e);
    } catch (IOException | RuntimeException e) {
      throw unavailable("write " + key, e);
    }
  }

  /**
   * Runs {@code query} against the index across all of its entity types and returns at most {@code
   * limit} live records.
   */
  public List<EntityRecord> search(RecordQuery query, SearchOrder order, int limit) {
    var builder =
        new SearchRequest.Builder().index(properties.index()).size(limit).query(toQuery(query));
    if (order == SearchOrder.NEWEST || query.terms().isEmpty()) {
      builder.sort(s -> s.field(f -> f.field(UPDATED_AT).order(SortOrder.Desc)));
    }
    try {
      var response = client.search(builder.build(), SearchDocuments.Source.class);
      return response.hits().hits().stream()
          .map(hit -> hit.source())
          .filter(Objects::nonNull)
          .map(SearchDocuments::fromSource)
          .toList();
    } catch (IOException | RuntimeException e) {
      // A missing index means nothing has been projected yet; it cannot answer for the store.
      throw unavailable("search", e);
    }
  }

  Query toQuery(RecordQuery query) {
    var bool = new BoolQuery.Builder();
    bool.mustNot(term(DELETED, FieldValue.of(true)));
    bool.filter(terms(ENTITY_TYPE, query.entityTypes().stream().map(Enum::name).toList()));
    if (!query.statuses().isEmpty()) {
      bool.filter(terms(STATUS, query.statuses()));
    }
    if (query.ownerId() != null) {
      bool.filter(term(OWNER_ID, FieldValue.of(query.ownerId().toString())));
    }
    if (query.companyId() != null) {
      bool.filter(term(COMPANY_ID, FieldValue.of(query.companyId().toString())));
    }
    if (query.technicianId() != null) {
      bool.filter(term(TECHNICIAN_ID, FieldValue.of(query.technicianId().toString())));
    }
    if (query.updatedFrom() != null || query.updatedTo() != null) {
      bool.filter(
          Query.of(
              q ->
                  q.range(
                      r -> {
                        r.field(UPDATED_AT);
                        if (query.updatedFrom() != null) {
                          r.gte(JsonData.of(query.updatedFrom().toString()));
                        }
                        if (query.updatedTo() != null) {
                          r.lte(JsonData.of(query.updatedTo().toString()));
                        }
                        return r;
                      })));
    }
    var terms = query.terms();
    if (!terms.isEmpty()) {
      // Pre-tokenized so the index and the relational fallback agree on what a term is.
      var operator = query.keywordOperator() == KeywordOperator.ANY ? Operator.Or : Operator.And;
      var text = String.join(" ", terms);
      bool.must(
          Query.of(
              q -> q.match(m -> m.field(TEXT).query(FieldValue.of(text)).operator(operator))));
    }
    var built = bool.build();
    return Query.of(q -> q.bool(built));
  }

  private static Query term(String field, FieldValue value) {
    return Query.of(q -> q.term(t -> t.field(field).value(value)));
  }

  private static Query terms(String field, Collection<String> values) {
    var fieldValues = values.stream().map(FieldValue::of).toList();
    return Query.of(q -> q.terms(t -> t.field(field).terms(v -> v.value(fieldValues))));
  }

  private void ensureIndex() {
    if (indexReady.get()) {
      return;
    }
    try {
      var exists =
          client.indices().exists(new ExistsRequest.Builder().index(properties.index()).build());
      if (!exists.value()) {
        var request =
            new CreateIndexRequest.Builder()
                .index(properties.index())
                .mappings(
                    m ->
                        m.properties(ENTITY_TYPE, p -> p.keyword(k -> k))
                            .properties(SearchDocuments.ID, p -> p.keyword(k -> k))
                            .properties(SearchDocuments.VERSION, p -> p.long_(l -> l))
                            .properties(DELETED, p -> p.boolean_(b -> b))
                            .properties(STATUS, p -> p.keyword(k -> k))
                            .properties(TITLE, p -> p.text(t -> t))
                            .properties(BODY, p -> p.text(t -> t))
                            .properties(TEXT, p -> p.text(t -> t))
                            .properties(OWNER_ID, p -> p.keyword(k -> k))
                            .properties(COMPANY_ID, p -> p.keyword(k -> k))
                            .properties(TECHNICIAN_ID, p -> p.keyword(k -> k))
                            .properties(SearchDocuments.PARENT_ID, p -> p.keyword(k -> k))
                            .properties(SearchDocuments.CREATED_AT, p -> p.date(d -> d))
                            .properties(UPDATED_AT, p -> p.date(d -> d)))
                .build();
        client.indices().create(request);
        log.info("Created search index {}", properties.index());
      }
      indexReady.set(true);
    } catch (OpenSearchException e) {
      if ("resource_already_exists_exception".equals(e.error().type())) {
        indexReady.set(true);
        return;
      }
      throw unavailable("create index", e);
    } catch (IOException | RuntimeException e) {
      throw unavailable("create index", e);
    }
  }

  private BackendUnavailableException unavailable(String operation, Exception cause) {
    return new BackendUnavailableException(
        StoreKind.SEARCH, "Search index unavailable during " + operation, cause);
  }
}
