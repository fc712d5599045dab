package io.chatpad.pilot.impersonation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ImpersonationSessionRepository extends JpaRepository<ImpersonationSession, UUID> {

  Optional<ImpersonationSession>
      findFirstByAdminUserIdAndActiveTrueAndStartedAtAfterOrderByStartedAtDesc(
          UUID adminUserId, Instant startedAfter);

  List<ImpersonationSession> findByAdminUserIdAndActiveTrue(UUID adminUserId);

  long countByAdminUserIdAndStartedAtAfter(UUID adminUserId, Instant startedAfter);

  List<ImpersonationSession> findByAdminUserIdOrderByStartedAtDesc(UUID adminUserId);
}
