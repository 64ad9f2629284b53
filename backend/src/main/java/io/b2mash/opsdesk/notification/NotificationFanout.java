package io.b2mash.opsdesk.notification;

import io.b2mash.opsdesk.lifecycle.LifecycleTransitionEvent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Turns committed lifecycle transitions into inbox notifications. Runs after commit, so a failed
 * write never affects the transition. Failed writes are parked in a bounded buffer and retried a
 * limited number of times by {@link #drainParked()}.
 */
@Component
public class NotificationFanout {

  private static final Logger log = LoggerFactory.getLogger(NotificationFanout.class);

  private final NotificationService notificationService;
  private final int bufferCapacity;
  private final int maxAttempts;
  private final Deque<PendingNotification> parked = new ArrayDeque<>();

  public NotificationFanout(
      NotificationService notificationService,
      @Value("${opsdesk.notification.buffer-capacity:1000}") int bufferCapacity,
      @Value("${opsdesk.notification.max-attempts:3}") int maxAttempts) {
    this.notificationService = notificationService;
    this.bufferCapacity = bufferCapacity;
    this.maxAttempts = maxAttempts;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onTransition(LifecycleTransitionEvent event) {
    for (var recipient : recipientsOf(event)) {
      deliver(new PendingNotification(recipient, event, 1));
    }
  }

  /** Resolves the event's audience to member ids. Missing references are skipped. */
  static Set<UUID> recipientsOf(LifecycleTransitionEvent event) {
    var recipients = new LinkedHashSet<UUID>();
    switch (event.audience()) {
      case NONE -> {}
      case OWNER -> addIfPresent(recipients, event.ownerId(), "owner", event);
      case COMPANY -> addIfPresent(recipients, event.companyId(), "company", event);
      case TECHNICIAN -> addIfPresent(recipients, event.technicianId(), "technician", event);
      case STAKEHOLDERS -> {
        addIfPresent(recipients, event.ownerId(), "owner", event);
        addIfPresent(recipients, event.technicianId(), "technician", event);
      }
    }
    return recipients;
  }

  @Scheduled(fixedDelayString = "${opsdesk.notification.retry-interval:30000}")
  public void drainParked() {
    List<PendingNotification> batch;
    synchronized (parked) {
      if (parked.isEmpty()) {
        return;
      }
      batch = new ArrayList<>(parked);
      parked.clear();
    }
    log.debug("Retrying {} parked notification(s)", batch.size());
    for (var pending : batch) {
      deliver(pending.nextAttempt());
    }
  }

  public int parkedCount() {
    synchronized (parked) {
      return parked.size();
    }
  }

  private void deliver(PendingNotification pending) {
    var event = pending.event();
    try {
      notificationService.createNotification(
          pending.recipientId(),
          event.notificationType(),
          titleOf(event),
          event.action() + ": " + event.fromStatus() + " -> " + event.toStatus(),
          event.entityType().name(),
          event.entityId());
    } catch (RuntimeException e) {
      log.warn(
          "Failed to notify {} of {} {} (attempt {}/{})",
          pending.recipientId(),
          event.notificationType(),
          event.entityId(),
          pending.attempt(),
          maxAttempts,
          e);
      park(pending);
    }
  }

  private void park(PendingNotification pending) {
    if (pending.attempt() >= maxAttempts) {
      log.error(
          "Dropping notification {} for {} after {} attempts",
          pending.event().notificationType(),
          pending.recipientId(),
          pending.attempt());
      return;
    }
    synchronized (parked) {
      if (parked.size() >= bufferCapacity) {
        var dropped = parked.pollFirst();
        log.error(
            "Notification buffer full, dropping {} for {}",
            dropped.event().notificationType(),
            dropped.recipientId());
      }
      parked.addLast(pending);
    }
  }

  private static String titleOf(LifecycleTransitionEvent event) {
    var subject = event.title() != null ? event.title() : event.entityType().name();
    return subject + " is now " + event.toStatus().toLowerCase().replace('_', ' ');
  }

  private static void addIfPresent(
      Set<UUID> recipients, UUID id, String role, LifecycleTransitionEvent event) {
    if (id == null) {
      log.info("No {} to notify of {} {}", role, event.notificationType(), event.entityId());
      return;
    }
    recipients.add(id);
  }

  record PendingNotification(UUID recipientId, LifecycleTransitionEvent event, int attempt) {

    PendingNotification nextAttempt() {
      return new PendingNotification(recipientId, event, attempt + 1);
    }
  }
}
