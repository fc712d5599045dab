package io.chatpad.pilot.agent;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AgentRepository extends JpaRepository<Agent, UUID> {

  List<Agent> findByUserIdOrderByCreatedAtDesc(UUID userId);

  @Modifying
  @Query("DELETE FROM Agent a WHERE a.userId = :userId")
  int deleteAllByUserId(@Param("userId") UUID userId);
}
