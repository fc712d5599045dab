package io.chatpad.pilot.account;

import io.chatpad.pilot.exception.NoAccountContextException;
import io.chatpad.pilot.impersonation.ImpersonationService;
import io.chatpad.pilot.subscription.Subscription;
import io.chatpad.pilot.subscription.SubscriptionRepository;
import io.chatpad.pilot.team.TeamMemberRepository;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maps a principal to its default account. First match wins:
 *
 * <ol>
 *   <li>a live impersonation session started by the principal: the target's account
 *   <li>the principal holds an active subscription: its own id
 *   <li>the principal is a team member: the owner of its earliest membership
 *   <li>otherwise no account
 * </ol>
 *
 * <p>Reads current state on every call. Nothing is cached, so a removed membership or an expired
 * impersonation session stops counting on the very next call.
 */
@Service
public class AccountResolver {

  private static final Logger log = LoggerFactory.getLogger(AccountResolver.class);

  private final ImpersonationService impersonationService;
  private final SubscriptionRepository subscriptionRepository;
  private final TeamMemberRepository teamMemberRepository;

  public AccountResolver(
      ImpersonationService impersonationService,
      SubscriptionRepository subscriptionRepository,
      TeamMemberRepository teamMemberRepository) {
    this.impersonationService = impersonationService;
    this.subscriptionRepository = subscriptionRepository;
    this.teamMemberRepository = teamMemberRepository;
  }

  @Transactional(readOnly = true)
  public AccountResolution resolve(UUID principalId) {
    var session = impersonationService.findActiveSession(principalId);
    if (session.isPresent()) {
      UUID targetId = session.get().getTargetUserId();
      // The target's own resolution never follows impersonation again
      UUID targetAccount = resolveWithoutImpersonation(targetId).accountId();
      return new AccountResolution(
          principalId,
          targetAccount != null ? targetAccount : targetId,
          AccountResolution.Source.IMPERSONATION);
    }
    return resolveWithoutImpersonation(principalId);
  }

  @Transactional(readOnly = true)
  public Optional<UUID> resolveAccountId(UUID principalId) {
    return resolve(principalId).account();
  }

  /** Same as {@link #resolveAccountId(UUID)} but fails with a "no account context" problem. */
  @Transactional(readOnly = true)
  public UUID requireAccountId(UUID principalId) {
    return resolveAccountId(principalId)
        .orElseThrow(() -> new NoAccountContextException(principalId));
  }

  private AccountResolution resolveWithoutImpersonation(UUID principalId) {
    if (subscriptionRepository.existsByUserIdAndStatusIn(
        principalId, Subscription.ACTIVE_STATUSES)) {
      return new AccountResolution(
          principalId, principalId, AccountResolution.Source.SUBSCRIPTION_OWNER);
    }

    var memberships = teamMemberRepository.findMembershipsOf(principalId);
    if (memberships.isEmpty()) {
      return AccountResolution.none(principalId);
    }
    if (memberships.size() > 1) {
      log.warn(
          "Principal {} belongs to {} owners; using earliest membership owner={}",
          principalId,
          memberships.size(),
          memberships.get(0).getOwnerId());
    }
    return new AccountResolution(
        principalId, memberships.get(0).getOwnerId(), AccountResolution.Source.TEAM_MEMBERSHIP);
  }
}
