package io.chatpad.pilot.platform;

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

@Entity
@Table(name = "user_roles")
public class UserRole {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, unique = true)
  private UUID userId;

  @Column(name = "role", nullable = false, length = 30)
  private String role;

  @JdbcTypeCode(SqlTypes.ARRAY)
  @Column(name = "permissions", columnDefinition = "text[]")
  private List<String> permissions = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.ARRAY)
  @Column(name = "admin_permissions", columnDefinition = "text[]")
  private List<String> adminPermissions = new ArrayList<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected UserRole() {}

  public UserRole(UUID userId, String role, List<String> adminPermissions) {
    this.userId = userId;
    this.role = role;
    this.adminPermissions = new ArrayList<>(adminPermissions);
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getRole() {
    return role;
  }

  public List<String> getPermissions() {
    return permissions == null ? List.of() : List.copyOf(permissions);
  }

  public List<String> getAdminPermissions() {
    return adminPermissions == null ? List.of() : List.copyOf(adminPermissions);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public boolean isSuperAdmin() {
    return PlatformRole.SUPER_ADMIN.equals(role);
  }

  public boolean hasAdminPermission(String capability) {
    return isSuperAdmin() || getAdminPermissions().contains(capability);
  }

  public void assign(String role, List<String> adminPermissions) {
    this.role = role;
    this.adminPermissions = new ArrayList<>(adminPermissions);
    this.updatedAt = Instant.now();
  }
}
