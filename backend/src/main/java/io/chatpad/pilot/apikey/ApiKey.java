package io.chatpad.pilot.apikey;

import io.chatpad.pilot.resource.AccountOwned;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Account API key. Only the SHA-256 hash and a display prefix are stored. */
@Entity
@Table(name = "api_keys")
public class ApiKey implements AccountOwned {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "agent_id")
  private UUID agentId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "key_prefix", nullable = false, length = 20)
  private String keyPrefix;

  @Column(name = "key_hash", nullable = false, unique = true, length = 64)
  private String keyHash;

  @Column(name = "created_by", nullable = false, updatable = false)
  private UUID createdBy;

  @Column(name = "revoked_at")
  private Instant revokedAt;

  @Column(name = "last_used_at")
  private Instant lastUsedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ApiKey() {}

  public ApiKey(
      UUID userId, UUID agentId, String name, String keyPrefix, String keyHash, UUID createdBy) {
    this.userId = userId;
    this.agentId = agentId;
    this.name = name;
    this.keyPrefix = keyPrefix;
    this.keyHash = keyHash;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
  }

  public boolean isRevoked() {
    return revokedAt != null;
  }

  public void revoke() {
    if (revokedAt == null) {
      this.revokedAt = Instant.now();
    }
  }

  public void rename(String name) {
    this.name = name;
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

  public String getName() {
    return name;
  }

  public String getKeyPrefix() {
    return keyPrefix;
  }

  public String getKeyHash() {
    return keyHash;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getRevokedAt() {
    return revokedAt;
  }

  public Instant getLastUsedAt() {
    return lastUsedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
