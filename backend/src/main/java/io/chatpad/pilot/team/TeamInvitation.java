package io.chatpad.pilot.team;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A pending offer to join an owner's team. Accepting it creates the {@link TeamMember} row. */
@Entity
@Table(name = "team_invitations")
public class TeamInvitation {

  public static final String STATUS_PENDING = "pending";
  public static final String STATUS_ACCEPTED = "accepted";
  public static final String STATUS_REVOKED = "revoked";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "owner_id", nullable = false, updatable = false)
  private UUID ownerId;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Column(name = "role", nullable = false, length = 20)
  private String role;

  @Column(name = "token", nullable = false, unique = true, length = 100)
  private String token;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "invited_by", nullable = false)
  private UUID invitedBy;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "accepted_by")
  private UUID acceptedBy;

  @Column(name = "accepted_at")
  private Instant acceptedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected TeamInvitation() {}

  public TeamInvitation(
      UUID ownerId, String email, String role, String token, UUID invitedBy, Instant expiresAt) {
    this.ownerId = ownerId;
    this.email = email;
    this.role = role;
    this.token = token;
    this.invitedBy = invitedBy;
    this.expiresAt = expiresAt;
    this.status = STATUS_PENDING;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public String getEmail() {
    return email;
  }

  public String getRole() {
    return role;
  }

  public String getToken() {
    return token;
  }

  public String getStatus() {
    return status;
  }

  public UUID getInvitedBy() {
    return invitedBy;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public UUID getAcceptedBy() {
    return acceptedBy;
  }

  public Instant getAcceptedAt() {
    return acceptedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public boolean isPending() {
    return STATUS_PENDING.equals(status);
  }

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public void accept(UUID principalId, Instant now) {
    this.status = STATUS_ACCEPTED;
    this.acceptedBy = principalId;
    this.acceptedAt = now;
  }

  public void revoke() {
    this.status = STATUS_REVOKED;
  }

  public void reissue(String role, String token, UUID invitedBy, Instant expiresAt) {
    this.role = role;
    this.token = token;
    this.invitedBy = invitedBy;
    this.expiresAt = expiresAt;
  }
}
