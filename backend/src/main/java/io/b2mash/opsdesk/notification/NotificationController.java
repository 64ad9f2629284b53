package io.b2mash.opsdesk.notification;

import io.b2mash.opsdesk.member.RequestScopes;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Inbox of the calling member. Notifications are never created through this controller. */
@RestController
@RequestMapping("/notifications")
public class NotificationController {

  private final NotificationService notificationService;

  public NotificationController(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @GetMapping
  public ResponseEntity<NotificationPageResponse> listNotifications(
      @RequestParam(defaultValue = "false") boolean unreadOnly,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    UUID memberId = RequestScopes.requireMemberId();
    var pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 100));
    var notifications = notificationService.listNotifications(memberId, unreadOnly, pageable);
    return ResponseEntity.ok(
        new NotificationPageResponse(
            notifications.getContent().stream().map(NotificationResponse::from).toList(),
            notifications.getTotalElements(),
            notifications.getNumber(),
            notifications.getSize()));
  }

  @GetMapping("/unread-count")
  public ResponseEntity<UnreadCountResponse> getUnreadCount() {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(new UnreadCountResponse(notificationService.getUnreadCount(memberId)));
  }

  @PutMapping("/{id}/read")
  public ResponseEntity<Void> markAsRead(@PathVariable UUID id) {
    UUID memberId = RequestScopes.requireMemberId();
    notificationService.markAsRead(id, memberId);
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/read-all")
  public ResponseEntity<Void> markAllAsRead() {
    UUID memberId = RequestScopes.requireMemberId();
    notificationService.markAllAsRead(memberId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record NotificationResponse(
      UUID id,
      String type,
      String title,
      String body,
      String referenceEntityType,
      UUID referenceEntityId,
      boolean isRead,
      Instant createdAt) {

    public static NotificationResponse from(Notification notification) {
      return new NotificationResponse(
          notification.getId(),
          notification.getType(),
          notification.getTitle(),
          notification.getBody(),
          notification.getReferenceEntityType(),
          notification.getReferenceEntityId(),
          notification.isRead(),
          notification.getCreatedAt());
    }
  }

  public record NotificationPageResponse(
      List<NotificationResponse> items, long total, int page, int size) {}

  public record UnreadCountResponse(long count) {}
}
