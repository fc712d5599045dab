package io.chatpad.pilot.profile;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProfileRepository extends JpaRepository<Profile, UUID> {

  Optional<Profile> findByUserId(UUID userId);

  Optional<Profile> findByEmailIgnoreCase(String email);

  boolean existsByUserId(UUID userId);
}
