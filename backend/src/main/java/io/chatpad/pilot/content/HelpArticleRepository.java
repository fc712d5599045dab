package io.chatpad.pilot.content;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface HelpArticleRepository extends JpaRepository<HelpArticle, UUID> {

  List<HelpArticle> findByPublishedTrueOrderByOrderIndexAsc();

  List<HelpArticle> findByCategoryIdAndPublishedTrueOrderByOrderIndexAsc(UUID categoryId);

  Optional<HelpArticle> findByCategoryIdAndSlugAndPublishedTrue(UUID categoryId, String slug);

  List<HelpArticle> findAllByOrderByCategoryIdAscOrderIndexAsc();

  boolean existsByCategoryIdAndSlug(UUID categoryId, String slug);

  boolean existsByCategoryId(UUID categoryId);
}
