package io.chatpad.pilot.subscription;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Billing subscription of an account owner. Holding an active subscription is what makes a
 * principal an account owner; the account id is the subscriber's user id.
 */
@Entity
@Table(name = "subscriptions")
public class Subscription {

  public static final String STATUS_ACTIVE = "active";
  public static final String STATUS_TRIALING = "trialing";
  public static final String STATUS_PAST_DUE = "past_due";
  public static final String STATUS_CANCELED = "canceled";

  /** Statuses that keep the subscriber an account owner. */
  public static final Set<String> ACTIVE_STATUSES =
      Set.of(STATUS_ACTIVE, STATUS_TRIALING, STATUS_PAST_DUE);

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "plan_id", length = 100)
  private String planId;

  @Column(name = "status", nullable = false, length = 30)
  private String status;

  @Column(name = "current_period_end")
  private Instant currentPeriodEnd;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Subscription() {}

  public Subscription(UUID userId, String planId, String status, Instant currentPeriodEnd) {
    this.userId = userId;
    this.planId = planId;
    this.status = status;
    this.currentPeriodEnd = currentPeriodEnd;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getPlanId() {
    return planId;
  }

  public String getStatus() {
    return status;
  }

  public Instant getCurrentPeriodEnd() {
    return currentPeriodEnd;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public boolean isActive() {
    return ACTIVE_STATUSES.contains(status);
  }

  public void syncFrom(String planId, String status, Instant currentPeriodEnd) {
    this.planId = planId;
    this.status = status;
    this.currentPeriodEnd = currentPeriodEnd;
    this.updatedAt = Instant.now();
  }
}
