package io.chatpad.pilot.content;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface HelpCategoryRepository extends JpaRepository<HelpCategory, UUID> {

  List<HelpCategory> findAllByOrderByOrderIndexAsc();

  Optional<HelpCategory> findBySlug(String slug);

  boolean existsBySlug(String slug);
}
