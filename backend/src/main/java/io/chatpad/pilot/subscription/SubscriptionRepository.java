package io.chatpad.pilot.subscription;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

  Optional<Subscription> findFirstByUserIdOrderByCreatedAtDesc(UUID userId);

  boolean existsByUserIdAndStatusIn(UUID userId, Collection<String> statuses);

  long deleteByUserId(UUID userId);
}
