package io.b2mash.opsdesk.lifecycle;

import io.b2mash.opsdesk.store.EntityType;
import java.time.Instant;
import java.util.UUID;

/**
 * Published inside the transaction of a successful transition. Consumers run after commit, so a
 * failing consumer never rolls the transition back.
 */
public record LifecycleTransitionEvent(
    EntityType entityType,
    UUID entityId,
    String title,
    String action,
    String fromStatus,
    String toStatus,
    long version,
    Audience audience,
    UUID ownerId,
    UUID companyId,
    UUID technicianId,
    Instant occurredAt) {

  /** Notification type, e.g. {@code OFFER_SENT}. */
  public String notificationType() {
    return entityType.name() + "_" + toStatus;
  }
}
