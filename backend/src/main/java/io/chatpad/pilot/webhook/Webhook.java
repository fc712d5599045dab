package io.chatpad.pilot.webhook;

import io.chatpad.pilot.resource.AccountOwned;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Customer-configured outbound webhook. The signing secret is write-only through the API. */
@Entity
@Table(name = "webhooks")
public class Webhook implements AccountOwned {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "url", nullable = false, length = 2000)
  private String url;

  @JdbcTypeCode(SqlTypes.ARRAY)
  @Column(name = "events", columnDefinition = "text[]", nullable = false)
  private List<String> events = new ArrayList<>();

  @Column(name = "secret", nullable = false, length = 100)
  private String secret;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Webhook() {}

  public Webhook(UUID userId, String name, String url, List<String> events, String secret) {
    this.userId = userId;
    this.name = name;
    this.url = url;
    this.events = events != null ? new ArrayList<>(events) : new ArrayList<>();
    this.secret = secret;
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(String name, String url, List<String> events, Boolean active) {
    if (name != null) {
      this.name = name;
    }
    if (url != null) {
      this.url = url;
    }
    if (events != null) {
      this.events = new ArrayList<>(events);
    }
    if (active != null) {
      this.active = active;
    }
    this.updatedAt = Instant.now();
  }

  public void rotateSecret(String newSecret) {
    this.secret = newSecret;
    this.updatedAt = Instant.now();
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public UUID getUserId() {
    return userId;
  }

  public String getName() {
    return name;
  }

  public String getUrl() {
    return url;
  }

  public List<String> getEvents() {
    return events;
  }

  public String getSecret() {
    return secret;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
