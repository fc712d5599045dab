package io.chatpad.pilot.team;

import io.chatpad.pilot.account.AccountAccessService;
import io.chatpad.pilot.audit.AuditEventBuilder;
import io.chatpad.pilot.audit.AuditService;
import io.chatpad.pilot.exception.ForbiddenException;
import io.chatpad.pilot.exception.InvalidStateException;
import io.chatpad.pilot.exception.ResourceConflictException;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.platform.AdminPermission;
import io.chatpad.pilot.platform.PlatformAccessService;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TeamMemberService {

  private static final Logger log = LoggerFactory.getLogger(TeamMemberService.class);

  private final TeamMemberRepository teamMemberRepository;
  private final AccountAccessService accountAccessService;
  private final PlatformAccessService platformAccessService;
  private final AuditService auditService;

  public TeamMemberService(
      TeamMemberRepository teamMemberRepository,
      AccountAccessService accountAccessService,
      PlatformAccessService platformAccessService,
      AuditService auditService) {
    this.teamMemberRepository = teamMemberRepository;
    this.accountAccessService = accountAccessService;
    this.platformAccessService = platformAccessService;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public List<TeamMember> listMembers(UUID ownerId, UUID principalId) {
    if (!accountAccessService.hasAccountAccess(ownerId, principalId)
        && !platformAccessService.hasAdminPermission(principalId, AdminPermission.VIEW_ACCOUNTS)) {
      throw new ForbiddenException(
          "Cannot view team", "You do not have access to account " + ownerId);
    }
    return teamMemberRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId);
  }

  @Transactional
  public TeamMember addMember(UUID ownerId, UUID memberId, String role, UUID actorId) {
    requireValidRole(role);
    requireAccountAdmin(ownerId, actorId);
    if (TeamRole.ADMIN.equals(role) && !canGrantAdmin(ownerId, actorId)) {
      throw new ForbiddenException(
          "Cannot grant admin", "Only the account owner may grant the admin role");
    }
    assertCanJoin(ownerId, memberId);

    var member = teamMemberRepository.save(new TeamMember(ownerId, memberId, role));
    log.info("Added member {} to account {} as {}", memberId, ownerId, role);

    auditService.log(
        AuditEventBuilder.builder()
            .action("team_member.added")
            .resourceType("team_member")
            .resourceId(member.getId())
            .actorId(actorId)
            .details(
                Map.of(
                    "owner_id", ownerId.toString(),
                    "member_id", memberId.toString(),
                    "role", role))
            .build());
    return member;
  }

  @Transactional
  public TeamMember changeRole(UUID ownerId, UUID memberId, String role, UUID actorId) {
    requireValidRole(role);
    if (!canGrantAdmin(ownerId, actorId)) {
      throw new ForbiddenException(
          "Cannot change role", "Only the account owner may change team roles");
    }
    var member =
        teamMemberRepository
            .findByOwnerIdAndMemberId(ownerId, memberId)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Team member not found",
                        "Principal " + memberId + " is not a member of account " + ownerId));

    String previousRole = member.getRole();
    if (previousRole.equals(role)) {
      return member;
    }
    member.changeRole(role);
    log.info(
        "Changed role of member {} in account {}: {} -> {}",
        memberId,
        ownerId,
        previousRole,
        role);

    auditService.log(
        AuditEventBuilder.builder()
            .action("team_member.role_changed")
            .resourceType("team_member")
            .resourceId(member.getId())
            .actorId(actorId)
            .details(
                Map.of(
                    "owner_id", ownerId.toString(),
                    "member_id", memberId.toString(),
                    "role", Map.of("from", previousRole, "to", role)))
            .build());
    return member;
  }

  /**
   * Deletes the membership row. Account admins may remove anyone; a member may remove itself.
   * Access derived from the row ends with the transaction, there is no cache to expire.
   */
  @Transactional
  public void removeMember(UUID ownerId, UUID memberId, UUID actorId) {
    boolean leaving = memberId.equals(actorId);
    if (!leaving) {
      requireAccountAdmin(ownerId, actorId);
    }
    var member =
        teamMemberRepository
            .findByOwnerIdAndMemberId(ownerId, memberId)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Team member not found",
                        "Principal " + memberId + " is not a member of account " + ownerId));

    teamMemberRepository.delete(member);
    teamMemberRepository.flush();
    log.info("Removed member {} from account {} (leaving={})", memberId, ownerId, leaving);

    auditService.log(
        AuditEventBuilder.builder()
            .action("team_member.removed")
            .resourceType("team_member")
            .resourceId(member.getId())
            .actorId(actorId)
            .details(
                Map.of(
                    "owner_id", ownerId.toString(),
                    "member_id", memberId.toString(),
                    "self_removal", leaving))
            .build());
  }

  /**
   * Checks the single-owner convention: no self-membership, no duplicate pair, and no membership
   * of a second owner. Shared with invitation acceptance.
   */
  void assertCanJoin(UUID ownerId, UUID memberId) {
    if (ownerId.equals(memberId)) {
      throw new InvalidStateException(
          "Invalid team membership", "An account owner cannot be a member of its own team");
    }
    if (teamMemberRepository.existsByOwnerIdAndMemberId(ownerId, memberId)) {
      throw new ResourceConflictException(
          "Already a team member",
          "Principal " + memberId + " is already a member of account " + ownerId);
    }
    if (!teamMemberRepository.findMembershipsOf(memberId).isEmpty()) {
      throw new ResourceConflictException(
          "Member of another team",
          "Principal " + memberId + " already belongs to another account");
    }
  }

  private void requireAccountAdmin(UUID ownerId, UUID actorId) {
    if (!accountAccessService.isAccountAdmin(ownerId, actorId)
        && !platformAccessService.hasAdminPermission(actorId, AdminPermission.MANAGE_ACCOUNTS)) {
      throw new ForbiddenException(
          "Cannot manage team", "Only the account owner or a team admin may manage the team");
    }
  }

  boolean canGrantAdmin(UUID ownerId, UUID actorId) {
    return ownerId.equals(actorId)
        || platformAccessService.hasAdminPermission(actorId, AdminPermission.MANAGE_ACCOUNTS);
  }

  private static void requireValidRole(String role) {
    if (!TeamRole.isValid(role)) {
      throw new InvalidStateException(
          "Invalid team role", "Role must be one of: admin, member (got " + role + ")");
    }
  }
}
