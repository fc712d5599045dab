package io.chatpad.pilot.platform;

import io.chatpad.pilot.audit.AuditEventBuilder;
import io.chatpad.pilot.audit.AuditService;
import io.chatpad.pilot.exception.ForbiddenException;
import io.chatpad.pilot.exception.InvalidStateException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PlatformRoleService {

  private static final Logger log = LoggerFactory.getLogger(PlatformRoleService.class);

  private static final Set<String> STAFF_ROLES =
      Set.of(PlatformRole.ADMIN, PlatformRole.SUPER_ADMIN, PlatformRole.PILOT_SUPPORT);

  private final UserRoleRepository userRoleRepository;
  private final PlatformAccessService platformAccessService;
  private final AuditService auditService;

  public PlatformRoleService(
      UserRoleRepository userRoleRepository,
      PlatformAccessService platformAccessService,
      AuditService auditService) {
    this.userRoleRepository = userRoleRepository;
    this.platformAccessService = platformAccessService;
    this.auditService = auditService;
  }

  /**
   * Sets the platform role and admin permissions of {@code targetUserId}. Requires {@code
   * manage_team}; only a super admin may hand out {@code super_admin}; nobody edits their own
   * role.
   */
  @Transactional
  public UserRole assignRole(
      UUID targetUserId, String role, List<String> adminPermissions, UUID actorId) {
    if (!platformAccessService.hasAdminPermission(actorId, AdminPermission.MANAGE_TEAM)) {
      throw new ForbiddenException(
          "Cannot assign roles", "The manage_team permission is required");
    }
    if (targetUserId.equals(actorId)) {
      throw new ForbiddenException("Cannot assign roles", "You cannot change your own role");
    }
    if (!PlatformRole.isValid(role)) {
      throw new InvalidStateException("Invalid platform role", "Unknown role: " + role);
    }
    if (PlatformRole.SUPER_ADMIN.equals(role) && !platformAccessService.isSuperAdmin(actorId)) {
      throw new ForbiddenException(
          "Cannot assign roles", "Only a super admin can grant super_admin");
    }
    List<String> permissions = adminPermissions == null ? List.of() : adminPermissions;
    for (String permission : permissions) {
      if (!AdminPermission.ALL.contains(permission)) {
        throw new InvalidStateException(
            "Invalid admin permission", "Unknown permission: " + permission);
      }
    }

    var existing = userRoleRepository.findByUserId(targetUserId);
    String previousRole = existing.map(UserRole::getRole).orElse(PlatformRole.MEMBER);
    List<String> previousPermissions =
        existing.map(r -> List.copyOf(r.getAdminPermissions())).orElse(List.of());
    if (existing.map(UserRole::isSuperAdmin).orElse(false)
        && !platformAccessService.isSuperAdmin(actorId)) {
      throw new ForbiddenException(
          "Cannot assign roles", "Only a super admin can change another super admin");
    }

    UserRole userRole;
    if (existing.isPresent()) {
      userRole = existing.get();
      userRole.assign(role, new ArrayList<>(permissions));
    } else {
      userRole =
          userRoleRepository.save(
              new UserRole(targetUserId, role, new ArrayList<>(permissions)));
    }
    log.info("Platform role of {} changed: {} -> {}", targetUserId, previousRole, role);

    var details = new LinkedHashMap<String, Object>();
    details.put("target_user_id", targetUserId.toString());
    details.put("role", Map.of("from", previousRole, "to", role));
    details.put("admin_permissions", Map.of("from", previousPermissions, "to", permissions));
    auditService.log(
        AuditEventBuilder.builder()
            .action("role.changed")
            .resourceType("user_role")
            .resourceId(userRole.getId())
            .actorId(actorId)
            .details(details)
            .build());
    return userRole;
  }

  /** Platform staff, oldest first. Requires {@code view_team}. */
  @Transactional(readOnly = true)
  public List<UserRole> listPilotTeam(UUID actorId) {
    if (!platformAccessService.hasAdminPermission(actorId, AdminPermission.VIEW_TEAM)) {
      throw new ForbiddenException("Cannot view team", "The view_team permission is required");
    }
    return userRoleRepository.findByRoleInOrderByCreatedAtAsc(STAFF_ROLES);
  }
}
