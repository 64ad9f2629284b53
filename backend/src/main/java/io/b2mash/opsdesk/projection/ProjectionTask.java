package io.b2mash.opsdesk.projection;

import io.b2mash.opsdesk.store.RecordKey;
import java.time.Instant;

/** Request to bring the search projection of {@code key} up to at least {@code version}. */
public record ProjectionTask(RecordKey key, long version, Instant enqueuedAt) {}
