package io.chatpad.pilot.team;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/**
 * Grants {@code memberId} access to the account owned by {@code ownerId}. The schema enforces
 * {@code unique(owner_id, member_id)} and {@code owner_id <> member_id}.
 */
@Entity
@Table(
    name = "team_members",
    uniqueConstraints = @UniqueConstraint(columnNames = {"owner_id", "member_id"}))
public class TeamMember {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "owner_id", nullable = false, updatable = false)
  private UUID ownerId;

  @Column(name = "member_id", nullable = false, updatable = false)
  private UUID memberId;

  @Column(name = "role", nullable = false, length = 20)
  private String role;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TeamMember() {}

  public TeamMember(UUID ownerId, UUID memberId, String role) {
    this.ownerId = ownerId;
    this.memberId = memberId;
    this.role = role;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public UUID getMemberId() {
    return memberId;
  }

  public String getRole() {
    return role;
  }

  public boolean isAdmin() {
    return TeamRole.ADMIN.equals(role);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void changeRole(String role) {
    this.role = role;
    this.updatedAt = Instant.now();
  }
}
