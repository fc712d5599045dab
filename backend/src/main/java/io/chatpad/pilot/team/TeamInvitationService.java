package io.chatpad.pilot.team;

import io.chatpad.pilot.account.AccountAccessService;
import io.chatpad.pilot.audit.AuditEventBuilder;
import io.chatpad.pilot.audit.AuditService;
import io.chatpad.pilot.exception.ForbiddenException;
import io.chatpad.pilot.exception.InvalidStateException;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.platform.AdminPermission;
import io.chatpad.pilot.platform.PlatformAccessService;
import io.chatpad.pilot.profile.Profile;
import io.chatpad.pilot.profile.ProfileRepository;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Invitation lifecycle: an account admin invites an email address, the invited principal accepts
 * with the one-time token and becomes a team member.
 */
@Service
public class TeamInvitationService {

  private static final Logger log = LoggerFactory.getLogger(TeamInvitationService.class);
  private static final int TOKEN_BYTES = 32;

  private final TeamInvitationRepository invitationRepository;
  private final TeamMemberRepository teamMemberRepository;
  private final TeamMemberService teamMemberService;
  private final AccountAccessService accountAccessService;
  private final PlatformAccessService platformAccessService;
  private final ProfileRepository profileRepository;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final InvitationProperties properties;
  private final Clock clock;
  private final SecureRandom secureRandom = new SecureRandom();

  public TeamInvitationService(
      TeamInvitationRepository invitationRepository,
      TeamMemberRepository teamMemberRepository,
      TeamMemberService teamMemberService,
      AccountAccessService accountAccessService,
      PlatformAccessService platformAccessService,
      ProfileRepository profileRepository,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      InvitationProperties properties,
      Clock clock) {
    this.invitationRepository = invitationRepository;
    this.teamMemberRepository = teamMemberRepository;
    this.teamMemberService = teamMemberService;
    this.accountAccessService = accountAccessService;
    this.platformAccessService = platformAccessService;
    this.profileRepository = profileRepository;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  /** Creates a pending invitation. Re-inviting a pending address issues a fresh token. */
  @Transactional
  public TeamInvitation invite(UUID ownerId, String email, String role, UUID actorId) {
    requireAccountAdmin(ownerId, actorId);
    if (!TeamRole.isValid(role)) {
      throw new InvalidStateException(
          "Invalid team role", "Role must be one of: admin, member (got " + role + ")");
    }
    if (TeamRole.ADMIN.equals(role) && !teamMemberService.canGrantAdmin(ownerId, actorId)) {
      throw new ForbiddenException(
          "Cannot grant admin", "Only the account owner may invite admins");
    }
    String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
    Instant expiresAt = clock.instant().plus(properties.ttl());
    String token = generateToken();

    var invitation =
        invitationRepository
            .findByOwnerIdAndEmailIgnoreCaseAndStatus(
                ownerId, normalizedEmail, TeamInvitation.STATUS_PENDING)
            .map(
                existing -> {
                  existing.reissue(role, token, actorId, expiresAt);
                  return existing;
                })
            .orElseGet(
                () ->
                    invitationRepository.save(
                        new TeamInvitation(
                            ownerId, normalizedEmail, role, token, actorId, expiresAt)));

    log.info("Invited {} to account {} as {}", normalizedEmail, ownerId, role);
    auditService.log(
        AuditEventBuilder.builder()
            .action("team_invitation.created")
            .resourceType("team_invitation")
            .resourceId(invitation.getId())
            .actorId(actorId)
            .details(Map.of("owner_id", ownerId.toString(), "email", normalizedEmail, "role", role))
            .build());
    return invitation;
  }

  /**
   * Accepts an invitation for {@code principalId}, whose profile email must match the invited
   * address. Needs no account context: a brand-new principal resolves to no account until this
   * succeeds.
   */
  @Transactional
  public TeamMember accept(String token, UUID principalId) {
    var invitation =
        invitationRepository
            .findByToken(token)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Invitation not found", "No invitation matches the supplied token"));

    if (!invitation.isPending()) {
      throw new InvalidStateException(
          "Invitation not pending", "Invitation is " + invitation.getStatus());
    }
    Instant now = clock.instant();
    if (invitation.isExpired(now)) {
      throw new InvalidStateException(
          "Invitation expired", "Invitation expired at " + invitation.getExpiresAt());
    }

    String principalEmail =
        profileRepository.findByUserId(principalId).map(Profile::getEmail).orElse(null);
    if (principalEmail == null || !principalEmail.trim().equalsIgnoreCase(invitation.getEmail())) {
      throw new ForbiddenException(
          "Invitation not addressed to you",
          "This invitation was sent to a different email address");
    }

    teamMemberService.assertCanJoin(invitation.getOwnerId(), principalId);

    var member =
        teamMemberRepository.save(
            new TeamMember(invitation.getOwnerId(), principalId, invitation.getRole()));
    invitation.accept(principalId, now);
    log.info(
        "Principal {} accepted invitation {} to account {}",
        principalId,
        invitation.getId(),
        invitation.getOwnerId());

    auditService.log(
        AuditEventBuilder.builder()
            .action("team_invitation.accepted")
            .resourceType("team_invitation")
            .resourceId(invitation.getId())
            .actorId(principalId)
            .details(
                Map.of(
                    "owner_id", invitation.getOwnerId().toString(),
                    "member_id", principalId.toString(),
                    "role", invitation.getRole()))
            .build());
    eventPublisher.publishEvent(
        new TeamMemberJoinedEvent(
            invitation.getOwnerId(),
            principalId,
            invitation.getInvitedBy(),
            principalEmail,
            invitation.getRole()));
    return member;
  }

  @Transactional
  public void revoke(UUID invitationId, UUID actorId) {
    var invitation =
        invitationRepository
            .findById(invitationId)
            .orElseThrow(() -> new ResourceNotFoundException("Invitation", invitationId));
    requireAccountAdmin(invitation.getOwnerId(), actorId);
    if (!invitation.isPending()) {
      throw new InvalidStateException(
          "Invitation not pending", "Invitation is " + invitation.getStatus());
    }
    invitation.revoke();
    log.info("Revoked invitation {} of account {}", invitationId, invitation.getOwnerId());

    auditService.log(
        AuditEventBuilder.builder()
            .action("team_invitation.revoked")
            .resourceType("team_invitation")
            .resourceId(invitationId)
            .actorId(actorId)
            .details(Map.of("owner_id", invitation.getOwnerId().toString()))
            .build());
  }

  @Transactional(readOnly = true)
  public List<TeamInvitation> listPending(UUID ownerId, UUID actorId) {
    requireAccountAdmin(ownerId, actorId);
    return invitationRepository.findByOwnerIdAndStatusOrderByCreatedAtDesc(
        ownerId, TeamInvitation.STATUS_PENDING);
  }

  private void requireAccountAdmin(UUID ownerId, UUID actorId) {
    if (!accountAccessService.isAccountAdmin(ownerId, actorId)
        && !platformAccessService.hasAdminPermission(actorId, AdminPermission.MANAGE_ACCOUNTS)) {
      throw new ForbiddenException(
          "Cannot manage invitations", "Only the account owner or a team admin may invite");
    }
  }

  private String generateToken() {
    byte[] tokenBytes = new byte[TOKEN_BYTES];
    secureRandom.nextBytes(tokenBytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(tokenBytes);
  }
}
