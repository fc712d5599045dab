package io.chatpad.pilot.webhook;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WebhookRepository extends JpaRepository<Webhook, UUID> {

  List<Webhook> findByUserIdOrderByCreatedAtDesc(UUID userId);

  @Modifying
  @Query("DELETE FROM Webhook w WHERE w.userId = :userId")
  int deleteAllByUserId(@Param("userId") UUID userId);
}
