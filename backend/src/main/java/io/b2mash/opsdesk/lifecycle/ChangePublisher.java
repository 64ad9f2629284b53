package io.b2mash.opsdesk.lifecycle;

import io.b2mash.opsdesk.projection.EntityChangedEvent;
import io.b2mash.opsdesk.store.EntityType;
import java.time.Instant;
import java.util.UUID;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes the change events of a mutation. Must be called inside the writing transaction, after
 * the entity was flushed so its version is final.
 */
@Component
public class ChangePublisher {

  private final ApplicationEventPublisher eventPublisher;

  public ChangePublisher(ApplicationEventPublisher eventPublisher) {
    this.eventPublisher = eventPublisher;
  }

  public void changed(EntityType type, UUID id, long version) {
    eventPublisher.publishEvent(new EntityChangedEvent(type, id, version));
  }

  public <S extends Enum<S>> void transitioned(
      TransitionContext context, LifecycleEvent<S> event, S from, long version) {
    changed(context.entityType(), context.entityId(), version);
    eventPublisher.publishEvent(
        new LifecycleTransitionEvent(
            context.entityType(),
            context.entityId(),
            context.title(),
            event.action(),
            from.name(),
            event.target().name(),
            version,
            event.audience(),
            context.ownerId(),
            context.companyId(),
            context.technicianId(),
            Instant.now()));
  }
}
