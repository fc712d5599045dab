package io.chatpad.pilot.impersonation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "impersonation_sessions")
public class ImpersonationSession {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "admin_user_id", nullable = false, updatable = false)
  private UUID adminUserId;

  @Column(name = "target_user_id", nullable = false, updatable = false)
  private UUID targetUserId;

  @Column(name = "reason", nullable = false, columnDefinition = "TEXT")
  private String reason;

  @Column(name = "started_at", nullable = false, updatable = false)
  private Instant startedAt;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "ended_at")
  private Instant endedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ImpersonationSession() {}

  public ImpersonationSession(UUID adminUserId, UUID targetUserId, String reason, Instant now) {
    this.adminUserId = adminUserId;
    this.targetUserId = targetUserId;
    this.reason = reason;
    this.startedAt = now;
    this.active = true;
    this.createdAt = now;
  }

  /**
   * True when the flag is set and the session started less than {@code maxDuration} ago. The flag
   * alone is not enough: a session nobody ended still expires.
   */
  public boolean isLive(Instant now, Duration maxDuration) {
    return active && startedAt.isAfter(now.minus(maxDuration));
  }

  public void end(Instant now) {
    if (active) {
      this.active = false;
      this.endedAt = now;
    }
  }

  public Instant expiresAt(Duration maxDuration) {
    return startedAt.plus(maxDuration);
  }

  public UUID getId() {
    return id;
  }

  public UUID getAdminUserId() {
    return adminUserId;
  }

  public UUID getTargetUserId() {
    return targetUserId;
  }

  public String getReason() {
    return reason;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getEndedAt() {
    return endedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
