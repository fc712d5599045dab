package io.chatpad.pilot.profile;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "profiles")
public class Profile {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, unique = true)
  private UUID userId;

  @Column(name = "display_name", length = 255)
  private String displayName;

  @Column(name = "avatar_url", length = 1000)
  private String avatarUrl;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "signup_completed_at")
  private Instant signupCompletedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Profile() {}

  public Profile(UUID userId, String email, String displayName) {
    this.userId = userId;
    this.email = email;
    this.displayName = displayName;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getAvatarUrl() {
    return avatarUrl;
  }

  public String getEmail() {
    return email;
  }

  public Instant getSignupCompletedAt() {
    return signupCompletedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void update(String displayName, String avatarUrl) {
    this.displayName = displayName;
    this.avatarUrl = avatarUrl;
    this.updatedAt = Instant.now();
  }

  public void completeSignup() {
    if (this.signupCompletedAt == null) {
      this.signupCompletedAt = Instant.now();
      this.updatedAt = this.signupCompletedAt;
    }
  }
}
