package io.b2mash.opsdesk.notification;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.recipientId = :recipientId
      ORDER BY n.createdAt DESC
      """)
  Page<Notification> findByRecipient(@Param("recipientId") UUID recipientId, Pageable pageable);

  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.recipientId = :recipientId
        AND n.isRead = false
      ORDER BY n.createdAt DESC
      """)
  Page<Notification> findUnreadByRecipient(
      @Param("recipientId") UUID recipientId, Pageable pageable);

  @Query(
      """
      SELECT COUNT(n) FROM Notification n
      WHERE n.recipientId = :recipientId
        AND n.isRead = false
      """)
  long countUnreadByRecipient(@Param("recipientId") UUID recipientId);

  @Modifying
  @Query(
      """
      UPDATE Notification n SET n.isRead = true
      WHERE n.recipientId = :recipientId
        AND n.isRead = false
      """)
  int markAllAsRead(@Param("recipientId") UUID recipientId);
}
