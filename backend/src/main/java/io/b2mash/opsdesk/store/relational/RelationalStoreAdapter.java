package io.b2mash.opsdesk.store.relational;

import io.b2mash.opsdesk.exception.BackendUnavailableException;
import io.b2mash.opsdesk.store.Availability;
import io.b2mash.opsdesk.store.EntityRecord;
import io.b2mash.opsdesk.store.EntityType;
import io.b2mash.opsdesk.store.RecordQuery;
import io.b2mash.opsdesk.store.RecordReader;
import io.b2mash.opsdesk.store.StoreAdapter;
import io.b2mash.opsdesk.store.StoreKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Slice;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

/** System-of-record adapter. Reads go through the per-aggregate {@link RecordSource}s. */
@Component
public class RelationalStoreAdapter implements StoreAdapter, RecordReader {

  private static final Logger log = LoggerFactory.getLogger(RelationalStoreAdapter.class);

  static final int PAGE_SIZE = 200;

  private final JdbcTemplate jdbcTemplate;
  private final Map<EntityType, RecordSource> sources = new EnumMap<>(EntityType.class);

  public RelationalStoreAdapter(JdbcTemplate jdbcTemplate, List<RecordSource> sources) {
    this.jdbcTemplate = jdbcTemplate;
    for (var source : sources) {
      this.sources.put(source.type(), source);
    }
  }

  /** Returns true if the failure means the database could not be reached in time. */
  public static boolean isConnectivityFailure(Throwable ex) {
    for (var t = ex; t != null; t = t.getCause()) {
      if (t instanceof DataAccessResourceFailureException
          || t instanceof CannotCreateTransactionException
          || t instanceof QueryTimeoutException
          || t instanceof TransientDataAccessResourceException) {
        return true;
      }
    }
    return false;
  }

  @Override
  public StoreKind kind() {
    return StoreKind.RELATIONAL;
  }

  @Override
  public Availability ping() {
    try {
      jdbcTemplate.queryForObject("SELECT 1", Integer.class);
      return Availability.AVAILABLE;
    } catch (DataAccessException | CannotCreateTransactionException e) {
      log.debug("Relational ping failed: {}", e.getMessage());
      return Availability.UNAVAILABLE;
    }
  }

  @Override
  public Optional<EntityRecord> read(EntityType type, UUID id) {
    var source = source(type);
    return translate("read " + type, () -> source.load(id));
  }

  @Override
  public Stream<EntityRecord> query(EntityType type, RecordQuery query) {
    return pages(source(type), query).filter(query::matches);
  }

  /** Every record of {@code type}, tombstones included. */
  public Stream<EntityRecord> scan(EntityType type) {
    return pages(source(type), RecordQuery.all());
  }

  private Stream<EntityRecord> pages(RecordSource source, RecordQuery query) {
    var first = fetch(source, query, 0);
    return Stream.iterate(
            first,
            Objects::nonNull,
            slice -> slice.hasNext() ? fetch(source, query, slice.getNumber() + 1) : null)
        .flatMap(slice -> slice.getContent().stream());
  }

  private Slice<EntityRecord> fetch(RecordSource source, RecordQuery query, int pageNumber) {
    return translate(
        "query " + source.type(), () -> source.page(query, PageRequest.of(pageNumber, PAGE_SIZE)));
  }

  private RecordSource source(EntityType type) {
    var source = sources.get(type);
    if (source == null) {
      throw new IllegalStateException("No relational record source registered for " + type);
    }
    return source;
  }

  private <T> T translate(String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (RuntimeException e) {
      if (isConnectivityFailure(e)) {
        throw new BackendUnavailableException(
            StoreKind.RELATIONAL, "Relational store unavailable during " + operation, e);
      }
      throw e;
    }
  }
}
