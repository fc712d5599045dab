package io.chatpad.pilot.apikey;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ApiKeyRepository extends JpaRepository<ApiKey, UUID> {

  List<ApiKey> findByUserIdOrderByCreatedAtDesc(UUID userId);

  Optional<ApiKey> findByKeyHash(String keyHash);

  @Modifying
  @Query("DELETE FROM ApiKey k WHERE k.userId = :userId")
  int deleteAllByUserId(@Param("userId") UUID userId);
}
