package io.chatpad.pilot.platform;

import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Platform-operator checks. Evaluated independently of the per-account predicates: a platform
 * operator holding the right capability needs no team membership in the account it inspects.
 */
@Service
public class PlatformAccessService {

  private final UserRoleRepository userRoleRepository;

  public PlatformAccessService(UserRoleRepository userRoleRepository) {
    this.userRoleRepository = userRoleRepository;
  }

  @Transactional(readOnly = true)
  public boolean isSuperAdmin(UUID principalId) {
    return userRoleRepository.findByUserId(principalId).map(UserRole::isSuperAdmin).orElse(false);
  }

  /** True for {@code super_admin} and {@code pilot_support}. */
  @Transactional(readOnly = true)
  public boolean isPilotTeamMember(UUID principalId) {
    return userRoleRepository
        .findByUserId(principalId)
        .map(role -> PlatformRole.isPilotTeam(role.getRole()))
        .orElse(false);
  }

  /**
   * True iff the principal is {@code super_admin} or {@code capability} appears in its {@code
   * admin_permissions}.
   */
  @Transactional(readOnly = true)
  public boolean hasAdminPermission(UUID principalId, String capability) {
    return userRoleRepository
        .findByUserId(principalId)
        .map(role -> role.hasAdminPermission(capability))
        .orElse(false);
  }

  @Transactional(readOnly = true)
  public String platformRoleOf(UUID principalId) {
    return userRoleRepository
        .findByUserId(principalId)
        .map(UserRole::getRole)
        .orElse(PlatformRole.MEMBER);
  }
}
