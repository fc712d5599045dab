package io.chatpad.pilot.notification;

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
      WHERE n.userId = :userId
      ORDER BY n.createdAt DESC
      """)
  Page<Notification> findByUserId(@Param("userId") UUID userId, Pageable pageable);

  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.userId = :userId
        AND n.read = false
      ORDER BY n.createdAt DESC
      """)
  Page<Notification> findUnreadByUserId(@Param("userId") UUID userId, Pageable pageable);

  @Query(
      """
      SELECT COUNT(n) FROM Notification n
      WHERE n.userId = :userId
        AND n.read = false
      """)
  long countUnreadByUserId(@Param("userId") UUID userId);

  @Modifying
  @Query(
      """
      UPDATE Notification n SET n.read = true
      WHERE n.userId = :userId
        AND n.read = false
      """)
  int markAllAsRead(@Param("userId") UUID userId);

  @Modifying
  @Query("DELETE FROM Notification n WHERE n.userId = :userId")
  int deleteAllByUserId(@Param("userId") UUID userId);
}
