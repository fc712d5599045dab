package io.chatpad.pilot.lead;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeadRepository extends JpaRepository<Lead, UUID> {

  Page<Lead> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);

  @Modifying
  @Query("DELETE FROM Lead l WHERE l.userId = :userId")
  int deleteAllByUserId(@Param("userId") UUID userId);
}
