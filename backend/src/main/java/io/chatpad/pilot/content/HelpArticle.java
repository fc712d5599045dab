package io.chatpad.pilot.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/** Platform help-center article. Only published articles are visible without a permission. */
@Entity
@Table(
    name = "platform_hc_articles",
    uniqueConstraints = @UniqueConstraint(columnNames = {"category_id", "slug"}))
public class HelpArticle {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "category_id", nullable = false)
  private UUID categoryId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "slug", nullable = false, length = 200)
  private String slug;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "content", nullable = false, columnDefinition = "TEXT")
  private String content;

  @Column(name = "is_published", nullable = false)
  private boolean published;

  @Column(name = "order_index", nullable = false)
  private int orderIndex;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected HelpArticle() {}

  public HelpArticle(
      UUID categoryId,
      String title,
      String slug,
      String description,
      String content,
      int orderIndex) {
    this.categoryId = categoryId;
    this.title = title;
    this.slug = slug;
    this.description = description;
    this.content = content;
    this.orderIndex = orderIndex;
    this.published = false;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(
      UUID categoryId, String title, String description, String content, Integer orderIndex) {
    if (categoryId != null) {
      this.categoryId = categoryId;
    }
    if (title != null) {
      this.title = title;
    }
    if (description != null) {
      this.description = description;
    }
    if (content != null) {
      this.content = content;
    }
    if (orderIndex != null) {
      this.orderIndex = orderIndex;
    }
    this.updatedAt = Instant.now();
  }

  public void setPublished(boolean published) {
    this.published = published;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getCategoryId() {
    return categoryId;
  }

  public String getTitle() {
    return title;
  }

  public String getSlug() {
    return slug;
  }

  public String getDescription() {
    return description;
  }

  public String getContent() {
    return content;
  }

  public boolean isPublished() {
    return published;
  }

  public int getOrderIndex() {
    return orderIndex;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
