package io.b2mash.opsdesk.store;

/** Versioned upsert capability over {@link EntityRecord}s. */
public interface RecordWriter {

  /**
   * Stores {@code record} under its key if its version is newer than the stored one.
   *
   * @throws StaleRecordException if the store already holds the same or a newer version
   */
  EntityRecord write(EntityRecord record);
}
