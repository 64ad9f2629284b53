package io.b2mash.opsdesk.projection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Enqueues projections once the relational write has committed. */
@Component
public class ProjectionEventHandler {

  private static final Logger log = LoggerFactory.getLogger(ProjectionEventHandler.class);

  private final ConsistencyPropagator propagator;

  public ProjectionEventHandler(ConsistencyPropagator propagator) {
    this.propagator = propagator;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onEntityChanged(EntityChangedEvent event) {
    try {
      propagator.enqueue(event.key(), event.version());
    } catch (Exception e) {
      log.error("Failed to enqueue projection for {} v{}", event.key(), event.version(), e);
    }
  }
}
