package io.chatpad.pilot.impersonation;

import io.chatpad.pilot.audit.AuditEventBuilder;
import io.chatpad.pilot.audit.AuditService;
import io.chatpad.pilot.exception.ForbiddenException;
import io.chatpad.pilot.exception.InvalidStateException;
import io.chatpad.pilot.exception.RateLimitExceededException;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.platform.AdminPermission;
import io.chatpad.pilot.platform.PlatformAccessService;
import io.chatpad.pilot.profile.ProfileRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Lets a platform operator act inside another principal's account for a bounded time. While a
 * session is live, account resolution for the operator yields the target's account.
 */
@Service
public class ImpersonationService {

  private static final Logger log = LoggerFactory.getLogger(ImpersonationService.class);
  private static final Duration RATE_WINDOW = Duration.ofHours(1);

  private final ImpersonationSessionRepository sessionRepository;
  private final PlatformAccessService platformAccessService;
  private final ProfileRepository profileRepository;
  private final AuditService auditService;
  private final ImpersonationProperties properties;
  private final Clock clock;

  public ImpersonationService(
      ImpersonationSessionRepository sessionRepository,
      PlatformAccessService platformAccessService,
      ProfileRepository profileRepository,
      AuditService auditService,
      ImpersonationProperties properties,
      Clock clock) {
    this.sessionRepository = sessionRepository;
    this.platformAccessService = platformAccessService;
    this.profileRepository = profileRepository;
    this.auditService = auditService;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Returns the admin's live session: flagged active AND started within the session duration. A
   * session left active past its duration is ignored even though nobody ended it.
   */
  @Transactional(readOnly = true)
  public Optional<ImpersonationSession> findActiveSession(UUID adminUserId) {
    Instant now = clock.instant();
    Duration duration = properties.sessionDuration();
    return sessionRepository
        .findFirstByAdminUserIdAndActiveTrueAndStartedAtAfterOrderByStartedAtDesc(
            adminUserId, now.minus(duration))
        .filter(session -> session.isLive(now, duration));
  }

  @Transactional
  public StartResult start(UUID adminUserId, UUID targetUserId, String reason) {
    if (!platformAccessService.hasAdminPermission(
        adminUserId, AdminPermission.IMPERSONATE_USERS)) {
      throw new ForbiddenException(
          "Cannot impersonate", "The impersonate_users permission is required");
    }
    String trimmedReason = reason == null ? "" : reason.trim();
    if (trimmedReason.length() < properties.minReasonLength()) {
      throw new InvalidStateException(
          "Reason too short",
          "A reason of at least " + properties.minReasonLength() + " characters is required");
    }
    if (adminUserId.equals(targetUserId)) {
      throw new InvalidStateException("Invalid target", "Cannot impersonate yourself");
    }
    if (platformAccessService.isSuperAdmin(targetUserId)) {
      throw new ForbiddenException("Cannot impersonate", "Super admins cannot be impersonated");
    }
    if (!profileRepository.existsByUserId(targetUserId)) {
      throw new ResourceNotFoundException("User", targetUserId);
    }

    Instant now = clock.instant();
    long recent =
        sessionRepository.countByAdminUserIdAndStartedAtAfter(adminUserId, now.minus(RATE_WINDOW));
    if (recent >= properties.maxSessionsPerHour()) {
      throw new RateLimitExceededException(
          "At most " + properties.maxSessionsPerHour() + " impersonation sessions per hour");
    }

    for (var previous : sessionRepository.findByAdminUserIdAndActiveTrue(adminUserId)) {
      previous.end(now);
    }

    var session =
        sessionRepository.save(
            new ImpersonationSession(adminUserId, targetUserId, trimmedReason, now));
    Instant expiresAt = session.expiresAt(properties.sessionDuration());

    log.info(
        "Impersonation started: session={}, admin={}, target={}",
        session.getId(),
        adminUserId,
        targetUserId);
    auditService.log(
        AuditEventBuilder.builder()
            .action("impersonation.started")
            .resourceType("impersonation_session")
            .resourceId(session.getId())
            .actorId(adminUserId)
            .details(
                Map.of(
                    "target_user_id", targetUserId.toString(),
                    "reason", trimmedReason,
                    "expires_at", expiresAt.toString()))
            .build());

    return new StartResult(session.getId(), targetUserId, expiresAt);
  }

  @Transactional
  public EndResult end(UUID adminUserId, UUID sessionId) {
    var session =
        sessionRepository
            .findById(sessionId)
            .filter(s -> s.getAdminUserId().equals(adminUserId))
            .orElseThrow(() -> new ResourceNotFoundException("Impersonation session", sessionId));

    if (!session.isActive()) {
      return new EndResult(sessionId, true);
    }

    session.end(clock.instant());
    log.info("Impersonation ended: session={}, admin={}", sessionId, adminUserId);
    auditService.log(
        AuditEventBuilder.builder()
            .action("impersonation.ended")
            .resourceType("impersonation_session")
            .resourceId(sessionId)
            .actorId(adminUserId)
            .details(Map.of("target_user_id", session.getTargetUserId().toString()))
            .build());
    return new EndResult(sessionId, false);
  }

  public record StartResult(UUID sessionId, UUID targetUserId, Instant expiresAt) {}

  public record EndResult(UUID sessionId, boolean alreadyEnded) {}
}
