package io.chatpad.pilot.content;

import io.chatpad.pilot.audit.AuditEventBuilder;
import io.chatpad.pilot.audit.AuditService;
import io.chatpad.pilot.exception.ForbiddenException;
import io.chatpad.pilot.exception.ResourceConflictException;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.platform.AdminPermission;
import io.chatpad.pilot.platform.PlatformAccessService;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Platform help center. Public reads see categories and published articles only; anything else
 * requires {@code view_content}, and every write requires {@code manage_content}.
 */
@Service
public class HelpCenterService {

  private static final Logger log = LoggerFactory.getLogger(HelpCenterService.class);

  private final HelpCategoryRepository categoryRepository;
  private final HelpArticleRepository articleRepository;
  private final PlatformAccessService platformAccessService;
  private final AuditService auditService;

  public HelpCenterService(
      HelpCategoryRepository categoryRepository,
      HelpArticleRepository articleRepository,
      PlatformAccessService platformAccessService,
      AuditService auditService) {
    this.categoryRepository = categoryRepository;
    this.articleRepository = articleRepository;
    this.platformAccessService = platformAccessService;
    this.auditService = auditService;
  }

  // --- public reads ---

  @Transactional(readOnly = true)
  public List<HelpCategory> listCategories() {
    return categoryRepository.findAllByOrderByOrderIndexAsc();
  }

  @Transactional(readOnly = true)
  public List<HelpArticle> listPublishedArticles(String categorySlug) {
    if (categorySlug == null) {
      return articleRepository.findByPublishedTrueOrderByOrderIndexAsc();
    }
    return categoryRepository
        .findBySlug(categorySlug)
        .map(c -> articleRepository.findByCategoryIdAndPublishedTrueOrderByOrderIndexAsc(c.getId()))
        .orElse(List.of());
  }

  /** Unpublished articles are reported as not found. */
  @Transactional(readOnly = true)
  public HelpArticle getPublishedArticle(String categorySlug, String articleSlug) {
    return categoryRepository
        .findBySlug(categorySlug)
        .flatMap(
            c -> articleRepository.findByCategoryIdAndSlugAndPublishedTrue(c.getId(), articleSlug))
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Article not found", "No article " + categorySlug + "/" + articleSlug));
  }

  // --- admin ---

  @Transactional(readOnly = true)
  public List<HelpArticle> listAllArticles(UUID principalId) {
    requirePermission(principalId, AdminPermission.VIEW_CONTENT);
    return articleRepository.findAllByOrderByCategoryIdAscOrderIndexAsc();
  }

  @Transactional(readOnly = true)
  public HelpArticle getArticle(UUID articleId, UUID principalId) {
    requirePermission(principalId, AdminPermission.VIEW_CONTENT);
    return findArticle(articleId);
  }

  @Transactional
  public HelpCategory createCategory(
      String name, String slug, String description, int orderIndex, UUID principalId) {
    requirePermission(principalId, AdminPermission.MANAGE_CONTENT);
    if (categoryRepository.existsBySlug(slug)) {
      throw new ResourceConflictException(
          "Category exists", "A category with slug '" + slug + "' already exists");
    }
    var category = categoryRepository.save(new HelpCategory(name, slug, description, orderIndex));
    log.info("Created help category {} ({})", category.getId(), slug);
    return category;
  }

  @Transactional
  public HelpCategory updateCategory(
      UUID categoryId,
      String name,
      String description,
      String color,
      String iconName,
      Integer orderIndex,
      UUID principalId) {
    requirePermission(principalId, AdminPermission.MANAGE_CONTENT);
    var category =
        categoryRepository
            .findById(categoryId)
            .orElseThrow(() -> new ResourceNotFoundException("Category", categoryId));
    category.update(name, description, color, iconName, orderIndex);
    return category;
  }

  @Transactional
  public void deleteCategory(UUID categoryId, UUID principalId) {
    requirePermission(principalId, AdminPermission.MANAGE_CONTENT);
    var category =
        categoryRepository
            .findById(categoryId)
            .orElseThrow(() -> new ResourceNotFoundException("Category", categoryId));
    if (articleRepository.existsByCategoryId(categoryId)) {
      throw new ResourceConflictException(
          "Category not empty", "Move or delete the category's articles first");
    }
    categoryRepository.delete(category);
  }

  @Transactional
  public HelpArticle createArticle(
      UUID categoryId,
      String title,
      String slug,
      String description,
      String content,
      int orderIndex,
      UUID principalId) {
    requirePermission(principalId, AdminPermission.MANAGE_CONTENT);
    if (!categoryRepository.existsById(categoryId)) {
      throw new ResourceNotFoundException("Category", categoryId);
    }
    if (articleRepository.existsByCategoryIdAndSlug(categoryId, slug)) {
      throw new ResourceConflictException(
          "Article exists", "An article with slug '" + slug + "' already exists in this category");
    }
    var article =
        articleRepository.save(
            new HelpArticle(categoryId, title, slug, description, content, orderIndex));
    log.info("Created help article {} ({})", article.getId(), slug);
    return article;
  }

  @Transactional
  public HelpArticle updateArticle(
      UUID articleId,
      UUID categoryId,
      String title,
      String description,
      String content,
      Integer orderIndex,
      UUID principalId) {
    requirePermission(principalId, AdminPermission.MANAGE_CONTENT);
    var article = findArticle(articleId);
    if (categoryId != null && !categoryRepository.existsById(categoryId)) {
      throw new ResourceNotFoundException("Category", categoryId);
    }
    article.update(categoryId, title, description, content, orderIndex);
    return article;
  }

  @Transactional
  public HelpArticle setPublished(UUID articleId, boolean published, UUID principalId) {
    requirePermission(principalId, AdminPermission.MANAGE_CONTENT);
    var article = findArticle(articleId);
    article.setPublished(published);

    auditService.log(
        AuditEventBuilder.builder()
            .action(published ? "help_article.published" : "help_article.unpublished")
            .resourceType("help_article")
            .resourceId(articleId)
            .actorId(principalId)
            .details(Map.of("slug", article.getSlug()))
            .build());
    return article;
  }

  @Transactional
  public void deleteArticle(UUID articleId, UUID principalId) {
    requirePermission(principalId, AdminPermission.MANAGE_CONTENT);
    var article = findArticle(articleId);
    articleRepository.delete(article);

    auditService.log(
        AuditEventBuilder.builder()
            .action("help_article.deleted")
            .resourceType("help_article")
            .resourceId(articleId)
            .actorId(principalId)
            .details(Map.of("slug", article.getSlug()))
            .build());
  }

  private HelpArticle findArticle(UUID articleId) {
    return articleRepository
        .findById(articleId)
        .orElseThrow(() -> new ResourceNotFoundException("Article", articleId));
  }

  private void requirePermission(UUID principalId, String capability) {
    if (!platformAccessService.hasAdminPermission(principalId, capability)) {
      throw new ForbiddenException(
          "Insufficient content permission", "The " + capability + " permission is required");
    }
  }
}
