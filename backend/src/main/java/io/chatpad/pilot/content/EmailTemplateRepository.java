package io.chatpad.pilot.content;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EmailTemplateRepository extends JpaRepository<EmailTemplate, UUID> {

  Optional<EmailTemplate> findByName(String name);

  Optional<EmailTemplate> findByNameAndActiveTrue(String name);

  List<EmailTemplate> findAllByOrderByNameAsc();

  boolean existsByName(String name);
}
