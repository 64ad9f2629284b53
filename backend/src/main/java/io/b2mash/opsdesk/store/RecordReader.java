package io.b2mash.opsdesk.store;

import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/** Read capability over {@link EntityRecord}s. */
public interface RecordReader {

  Optional<EntityRecord> read(EntityType type, UUID id);

  /**
   * Returns the records of {@code type} matching {@code query}, newest first. The stream is lazy
   * and must be closed or fully consumed by the caller.
   */
  Stream<EntityRecord> query(EntityType type, RecordQuery query);
}
