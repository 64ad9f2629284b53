package io.b2mash.opsdesk.store;

/** A versioned write was rejected because the store already holds an equal or newer version. */
public class StaleRecordException extends RuntimeException {

  private final RecordKey key;
  private final long rejectedVersion;

  public StaleRecordException(RecordKey key, long rejectedVersion, Throwable cause) {
    super("Version " + rejectedVersion + " of " + key + " is stale", cause);
    this.key = key;
    this.rejectedVersion = rejectedVersion;
  }

  public RecordKey getKey() {
    return key;
  }

  public long getRejectedVersion() {
    return rejectedVersion;
  }
}
