package io.b2mash.opsdesk.notification;

import io.b2mash.opsdesk.exception.ResourceNotFoundException;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class NotificationService {

  private final NotificationRepository notificationRepository;

  public NotificationService(NotificationRepository notificationRepository) {
    this.notificationRepository = notificationRepository;
  }

  /** Writes one inbox row in its own transaction. Only the fan-out calls this. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Notification createNotification(
      UUID recipientId,
      String type,
      String title,
      String body,
      String refEntityType,
      UUID refEntityId) {
    var notification =
        new Notification(recipientId, type, title, body, refEntityType, refEntityId);
    return notificationRepository.save(notification);
  }

  @Transactional(readOnly = true)
  public Page<Notification> listNotifications(
      UUID recipientId, boolean unreadOnly, Pageable pageable) {
    if (unreadOnly) {
      return notificationRepository.findUnreadByRecipient(recipientId, pageable);
    }
    return notificationRepository.findByRecipient(recipientId, pageable);
  }

  @Transactional(readOnly = true)
  public long getUnreadCount(UUID recipientId) {
    return notificationRepository.countUnreadByRecipient(recipientId);
  }

  @Transactional
  public void markAsRead(UUID notificationId, UUID recipientId) {
    var notification =
        notificationRepository
            .findById(notificationId)
            .filter(n -> n.getRecipientId().equals(recipientId))
            .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
    notification.markAsRead();
  }

  @Transactional
  public int markAllAsRead(UUID recipientId) {
    return notificationRepository.markAllAsRead(recipientId);
  }
}
