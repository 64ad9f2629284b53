package io.b2mash.opsdesk.projection;

public enum ProjectionOutcome {
  /** The current relational record was written to the search index. */
  PROJECTED,
  /** An equal or newer version is already projected or queued. */
  SUPERSEDED,
  /** The relational record no longer exists. */
  DROPPED,
  /** A backend was unavailable; the task went back on the queue. */
  RETRY,
  /** Nothing was queued. */
  IDLE
}
