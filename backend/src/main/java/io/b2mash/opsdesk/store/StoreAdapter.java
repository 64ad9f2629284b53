package io.b2mash.opsdesk.store;

/**
 * Common surface of every backing store wrapper. Adapters translate timeouts and connection
 * failures into {@link Availability#UNAVAILABLE} (for pings) or {@link
 * io.b2mash.opsdesk.exception.BackendUnavailableException} (for operations); raw transport errors
 * never escape.
 */
public interface StoreAdapter {

  StoreKind kind();

  /** Cheap liveness probe. Must return within the transport's bounded timeout. */
  Availability ping();
}
