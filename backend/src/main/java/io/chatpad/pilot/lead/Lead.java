package io.chatpad.pilot.lead;

import io.chatpad.pilot.resource.AccountOwned;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "leads")
public class Lead implements AccountOwned {

  public static final String STATUS_NEW = "new";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "agent_id")
  private UUID agentId;

  @Column(name = "conversation_id")
  private UUID conversationId;

  @Column(name = "name", length = 255)
  private String name;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "phone", length = 50)
  private String phone;

  @Column(name = "status", nullable = false, length = 30)
  private String status;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "data", columnDefinition = "jsonb")
  private Map<String, Object> data;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Lead() {}

  public Lead(
      UUID userId,
      UUID agentId,
      UUID conversationId,
      String name,
      String email,
      String phone,
      Map<String, Object> data) {
    this.userId = userId;
    this.agentId = agentId;
    this.conversationId = conversationId;
    this.name = name;
    this.email = email;
    this.phone = phone;
    this.status = STATUS_NEW;
    this.data = data != null ? new HashMap<>(data) : new HashMap<>();
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Applies the non-null arguments. */
  public void update(
      String name, String email, String phone, String status, Map<String, Object> data) {
    if (name != null) {
      this.name = name;
    }
    if (email != null) {
      this.email = email;
    }
    if (phone != null) {
      this.phone = phone;
    }
    if (status != null) {
      this.status = status;
    }
    if (data != null) {
      this.data = new HashMap<>(data);
    }
    this.updatedAt = Instant.now();
  }

  /** Row image in column names, as sent to dispatch receivers. */
  public Map<String, Object> toRecord() {
    var record = new LinkedHashMap<String, Object>();
    record.put("id", id);
    record.put("user_id", userId);
    record.put("agent_id", agentId);
    record.put("conversation_id", conversationId);
    record.put("name", name);
    record.put("email", email);
    record.put("phone", phone);
    record.put("status", status);
    record.put("data", data != null ? new HashMap<>(data) : null);
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

  public UUID getConversationId() {
    return conversationId;
  }

  public String getName() {
    return name;
  }

  public String getEmail() {
    return email;
  }

  public String getPhone() {
    return phone;
  }

  public String getStatus() {
    return status;
  }

  public Map<String, Object> getData() {
    return data;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
