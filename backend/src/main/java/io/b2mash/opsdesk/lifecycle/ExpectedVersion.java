package io.b2mash.opsdesk.lifecycle;

import io.b2mash.opsdesk.exception.VersionConflictException;
import java.util.UUID;

public final class ExpectedVersion {

  private ExpectedVersion() {}

  /** No-op when the caller sent no expected version. */
  public static void check(String entityType, UUID id, Long expected, Long actual) {
    if (expected != null && !expected.equals(actual)) {
      throw new VersionConflictException(entityType, id, expected, actual);
    }
  }
}
