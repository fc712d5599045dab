package io.chatpad.pilot.conversation;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

  Page<Conversation> findByUserIdOrderByUpdatedAtDesc(UUID userId, Pageable pageable);

  @Modifying
  @Query("DELETE FROM Conversation c WHERE c.userId = :userId")
  int deleteAllByUserId(@Param("userId") UUID userId);
}
