package io.chatpad.pilot.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "platform_hc_categories")
public class HelpCategory {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "slug", nullable = false, unique = true, length = 100)
  private String slug;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "color", length = 50)
  private String color;

  @Column(name = "icon_name", length = 50)
  private String iconName;

  @Column(name = "order_index", nullable = false)
  private int orderIndex;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected HelpCategory() {}

  public HelpCategory(String name, String slug, String description, int orderIndex) {
    this.name = name;
    this.slug = slug;
    this.description = description;
    this.orderIndex = orderIndex;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(
      String name, String description, String color, String iconName, Integer orderIndex) {
    if (name != null) {
      this.name = name;
    }
    if (description != null) {
      this.description = description;
    }
    if (color != null) {
      this.color = color;
    }
    if (iconName != null) {
      this.iconName = iconName;
    }
    if (orderIndex != null) {
      this.orderIndex = orderIndex;
    }
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getSlug() {
    return slug;
  }

  public String getDescription() {
    return description;
  }

  public String getColor() {
    return color;
  }

  public String getIconName() {
    return iconName;
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
