package io.chatpad.pilot.platform;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserRoleRepository extends JpaRepository<UserRole, UUID> {

  Optional<UserRole> findByUserId(UUID userId);

  List<UserRole> findByRoleInOrderByCreatedAtAsc(Collection<String> roles);
}
