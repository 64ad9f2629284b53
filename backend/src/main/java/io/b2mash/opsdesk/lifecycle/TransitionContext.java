package io.b2mash.opsdesk.lifecycle;

import io.b2mash.opsdesk.store.EntityType;
import java.util.UUID;

/** Identity and parties of the entity a transition applies to. */
public record TransitionContext(
    EntityType entityType,
    UUID entityId,
    String title,
    UUID ownerId,
    UUID companyId,
    UUID technicianId) {}
