package io.chatpad.pilot.account;

import io.chatpad.pilot.team.TeamMember;
import io.chatpad.pilot.team.TeamMemberRepository;
import io.chatpad.pilot.team.TeamRole;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The two per-account predicates every resource check builds on. Both query current membership
 * state; results must not be cached across requests.
 */
@Service
public class AccountAccessService {

  private final TeamMemberRepository teamMemberRepository;

  public AccountAccessService(TeamMemberRepository teamMemberRepository) {
    this.teamMemberRepository = teamMemberRepository;
  }

  /** True iff the principal is the account owner or any team member of the account. */
  @Transactional(readOnly = true)
  public boolean hasAccountAccess(UUID accountId, UUID principalId) {
    if (accountId == null || principalId == null) {
      return false;
    }
    return principalId.equals(accountId)
        || teamMemberRepository.existsByOwnerIdAndMemberId(accountId, principalId);
  }

  /** True iff the principal is the account owner or an {@code admin} team member. */
  @Transactional(readOnly = true)
  public boolean isAccountAdmin(UUID accountId, UUID principalId) {
    if (accountId == null || principalId == null) {
      return false;
    }
    return principalId.equals(accountId)
        || teamMemberRepository.existsByOwnerIdAndMemberIdAndRole(
            accountId, principalId, TeamRole.ADMIN);
  }

  /** {@code owner}, {@code admin}, {@code member}, or null when the principal has no access. */
  @Transactional(readOnly = true)
  public String teamRoleIn(UUID accountId, UUID principalId) {
    if (accountId == null || principalId == null) {
      return null;
    }
    if (principalId.equals(accountId)) {
      return TeamRole.OWNER;
    }
    return teamMemberRepository
        .findByOwnerIdAndMemberId(accountId, principalId)
        .map(TeamMember::getRole)
        .orElse(null);
  }
}
