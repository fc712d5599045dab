package io.chatpad.pilot.content;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Response shapes shared by the public and admin content endpoints. */
final class ContentResponses {

  private ContentResponses() {}

  record CategoryResponse(
      UUID id,
      String name,
      String slug,
      String description,
      String color,
      String iconName,
      int orderIndex) {

    static CategoryResponse from(HelpCategory category) {
      return new CategoryResponse(
          category.getId(),
          category.getName(),
          category.getSlug(),
          category.getDescription(),
          category.getColor(),
          category.getIconName(),
          category.getOrderIndex());
    }
  }

  record ArticleResponse(
      UUID id,
      UUID categoryId,
      String title,
      String slug,
      String description,
      String content,
      boolean published,
      int orderIndex,
      Instant updatedAt) {

    static ArticleResponse from(HelpArticle article) {
      return new ArticleResponse(
          article.getId(),
          article.getCategoryId(),
          article.getTitle(),
          article.getSlug(),
          article.getDescription(),
          article.getContent(),
          article.isPublished(),
          article.getOrderIndex(),
          article.getUpdatedAt());
    }
  }

  record EmailTemplateResponse(
      UUID id,
      String name,
      String subject,
      String htmlContent,
      String textContent,
      Map<String, Object> variables,
      boolean active,
      Instant updatedAt) {

    static EmailTemplateResponse from(EmailTemplate template) {
      return new EmailTemplateResponse(
          template.getId(),
          template.getName(),
          template.getSubject(),
          template.getHtmlContent(),
          template.getTextContent(),
          template.getVariables(),
          template.isActive(),
          template.getUpdatedAt());
    }
  }
}
