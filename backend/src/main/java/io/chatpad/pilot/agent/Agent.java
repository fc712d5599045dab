package io.chatpad.pilot.agent;

import io.chatpad.pilot.resource.AccountOwned;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "agents")
public class Agent implements AccountOwned {

  public static final String STATUS_DRAFT = "draft";
  public static final String STATUS_ACTIVE = "active";
  public static final String STATUS_PAUSED = "paused";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Agent() {}

  public Agent(UUID userId, String name, String description) {
    this.userId = userId;
    this.name = name;
    this.description = description;
    this.status = STATUS_DRAFT;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public static boolean isValidStatus(String status) {
    return STATUS_DRAFT.equals(status)
        || STATUS_ACTIVE.equals(status)
        || STATUS_PAUSED.equals(status);
  }

  public void update(String name, String description, String status) {
    if (name != null) {
      this.name = name;
    }
    if (description != null) {
      this.description = description;
    }
    if (status != null) {
      this.status = status;
    }
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

  public String getDescription() {
    return description;
  }

  public String getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
