package io.chatpad.pilot.conversation;

import io.chatpad.pilot.resource.AccountOwned;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "conversations")
public class Conversation implements AccountOwned {

  public static final String STATUS_ACTIVE = "active";
  public static final String STATUS_HUMAN_TAKEOVER = "human_takeover";
  public static final String STATUS_CLOSED = "closed";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "agent_id", nullable = false, updatable = false)
  private UUID agentId;

  @Column(name = "channel", nullable = false, length = 30)
  private String channel;

  @Column(name = "status", nullable = false, length = 30)
  private String status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Conversation() {}

  public Conversation(UUID userId, UUID agentId, String channel) {
    this.userId = userId;
    this.agentId = agentId;
    this.channel = channel;
    this.status = STATUS_ACTIVE;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public static boolean isValidStatus(String status) {
    return STATUS_ACTIVE.equals(status)
        || STATUS_HUMAN_TAKEOVER.equals(status)
        || STATUS_CLOSED.equals(status);
  }

  public void changeStatus(String status) {
    this.status = status;
    this.updatedAt = Instant.now();
  }

  public Map<String, Object> toRecord() {
    var record = new LinkedHashMap<String, Object>();
    record.put("id", id);
    record.put("user_id", userId);
    record.put("agent_id", agentId);
    record.put("channel", channel);
    record.put("status", status);
    record.put("created_at", createdAt);
    record.put("updated_at", updatedAt);
    return record;
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public UUID getUserId() {
    return userId;
  }

  public UUID getAgentId() {
    return agentId;
  }

  public String getChannel() {
    return channel;
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
