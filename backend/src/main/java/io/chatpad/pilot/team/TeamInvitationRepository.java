package io.chatpad.pilot.team;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TeamInvitationRepository extends JpaRepository<TeamInvitation, UUID> {

  Optional<TeamInvitation> findByToken(String token);

  Optional<TeamInvitation> findByOwnerIdAndEmailIgnoreCaseAndStatus(
      UUID ownerId, String email, String status);

  List<TeamInvitation> findByOwnerIdAndStatusOrderByCreatedAtDesc(UUID ownerId, String status);

  @Modifying
  @Query("DELETE FROM TeamInvitation ti WHERE ti.ownerId = :ownerId")
  int deleteAllByOwnerId(@Param("ownerId") UUID ownerId);
}
