package io.chatpad.pilot.account;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import io.chatpad.pilot.exception.NoAccountContextException;
import io.chatpad.pilot.impersonation.ImpersonationService;
import io.chatpad.pilot.impersonation.ImpersonationSession;
import io.chatpad.pilot.subscription.Subscription;
import io.chatpad.pilot.subscription.SubscriptionRepository;
import io.chatpad.pilot.team.TeamMember;
import io.chatpad.pilot.team.TeamMemberRepository;
import io.chatpad.pilot.team.TeamRole;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccountResolverTest {

  private static final UUID PRINCIPAL = UUID.randomUUID();
  private static final UUID OWNER_A = UUID.randomUUID();
  private static final UUID OWNER_B = UUID.randomUUID();

  @Mock private ImpersonationService impersonationService;
  @Mock private SubscriptionRepository subscriptionRepository;
  @Mock private TeamMemberRepository teamMemberRepository;
  @InjectMocks private AccountResolver resolver;

  @Test
  void subscriberResolvesToOwnAccount() {
    when(impersonationService.findActiveSession(PRINCIPAL)).thenReturn(Optional.empty());
    when(subscriptionRepository.existsByUserIdAndStatusIn(PRINCIPAL, Subscription.ACTIVE_STATUSES))
        .thenReturn(true);

    var resolution = resolver.resolve(PRINCIPAL);

    assertThat(resolution.accountId()).isEqualTo(PRINCIPAL);
    assertThat(resolution.source()).isEqualTo(AccountResolution.Source.SUBSCRIPTION_OWNER);
  }

  @Test
  void memberResolvesToOwnerOfMembership() {
    when(impersonationService.findActiveSession(PRINCIPAL)).thenReturn(Optional.empty());
    when(subscriptionRepository.existsByUserIdAndStatusIn(PRINCIPAL, Subscription.ACTIVE_STATUSES))
        .thenReturn(false);
    when(teamMemberRepository.findMembershipsOf(PRINCIPAL))
        .thenReturn(List.of(new TeamMember(OWNER_A, PRINCIPAL, TeamRole.MEMBER)));

    var resolution = resolver.resolve(PRINCIPAL);

    assertThat(resolution.accountId()).isEqualTo(OWNER_A);
    assertThat(resolution.source()).isEqualTo(AccountResolution.Source.TEAM_MEMBERSHIP);
  }

  @Test
  void resolvingTwiceWithUnchangedStateIsStable() {
    when(impersonationService.findActiveSession(PRINCIPAL)).thenReturn(Optional.empty());
    when(subscriptionRepository.existsByUserIdAndStatusIn(PRINCIPAL, Subscription.ACTIVE_STATUSES))
        .thenReturn(false);
    when(teamMemberRepository.findMembershipsOf(PRINCIPAL))
        .thenReturn(List.of(new TeamMember(OWNER_B, PRINCIPAL, TeamRole.ADMIN)));

    assertThat(resolver.resolve(PRINCIPAL)).isEqualTo(resolver.resolve(PRINCIPAL));
  }

  @Test
  void subscriptionWinsOverMembership() {
    when(impersonationService.findActiveSession(PRINCIPAL)).thenReturn(Optional.empty());
    when(subscriptionRepository.existsByUserIdAndStatusIn(PRINCIPAL, Subscription.ACTIVE_STATUSES))
        .thenReturn(true);

    assertThat(resolver.resolveAccountId(PRINCIPAL)).contains(PRINCIPAL);
  }

  @Test
  void severalMembershipsUseTheEarliest() {
    when(impersonationService.findActiveSession(PRINCIPAL)).thenReturn(Optional.empty());
    when(subscriptionRepository.existsByUserIdAndStatusIn(PRINCIPAL, Subscription.ACTIVE_STATUSES))
        .thenReturn(false);
    when(teamMemberRepository.findMembershipsOf(PRINCIPAL))
        .thenReturn(
            List.of(
                new TeamMember(OWNER_A, PRINCIPAL, TeamRole.MEMBER),
                new TeamMember(OWNER_B, PRINCIPAL, TeamRole.ADMIN)));

    assertThat(resolver.resolveAccountId(PRINCIPAL)).contains(OWNER_A);
  }

  @Test
  void noSubscriptionAndNoMembershipHasNoAccount() {
    when(impersonationService.findActiveSession(PRINCIPAL)).thenReturn(Optional.empty());
    when(subscriptionRepository.existsByUserIdAndStatusIn(PRINCIPAL, Subscription.ACTIVE_STATUSES))
        .thenReturn(false);
    when(teamMemberRepository.findMembershipsOf(PRINCIPAL)).thenReturn(List.of());

    var resolution = resolver.resolve(PRINCIPAL);

    assertThat(resolution.hasAccount()).isFalse();
    assertThat(resolution.source()).isEqualTo(AccountResolution.Source.NONE);
  }

  @Test
  void requireAccountIdFailsWithoutAccount() {
    when(impersonationService.findActiveSession(PRINCIPAL)).thenReturn(Optional.empty());
    when(subscriptionRepository.existsByUserIdAndStatusIn(PRINCIPAL, Subscription.ACTIVE_STATUSES))
        .thenReturn(false);
    when(teamMemberRepository.findMembershipsOf(PRINCIPAL)).thenReturn(List.of());

    assertThatThrownBy(() -> resolver.requireAccountId(PRINCIPAL))
        .isInstanceOf(NoAccountContextException.class);
  }

  @Test
  void liveImpersonationResolvesToTargetAccount() {
    var target = UUID.randomUUID();
    var session =
        new ImpersonationSession(PRINCIPAL, target, "Customer ticket 4411", Instant.now());
    when(impersonationService.findActiveSession(PRINCIPAL)).thenReturn(Optional.of(session));
    when(subscriptionRepository.existsByUserIdAndStatusIn(target, Subscription.ACTIVE_STATUSES))
        .thenReturn(false);
    when(teamMemberRepository.findMembershipsOf(target))
        .thenReturn(List.of(new TeamMember(OWNER_B, target, TeamRole.MEMBER)));

    var resolution = resolver.resolve(PRINCIPAL);

    assertThat(resolution.accountId()).isEqualTo(OWNER_B);
    assertThat(resolution.source()).isEqualTo(AccountResolution.Source.IMPERSONATION);
    assertThat(resolution.principalId()).isEqualTo(PRINCIPAL);
  }

  @Test
  void impersonatedTargetWithoutAccountFallsBackToTargetId() {
    var target = UUID.randomUUID();
    var session =
        new ImpersonationSession(PRINCIPAL, target, "Customer ticket 4411", Instant.now());
    when(impersonationService.findActiveSession(PRINCIPAL)).thenReturn(Optional.of(session));
    when(subscriptionRepository.existsByUserIdAndStatusIn(target, Subscription.ACTIVE_STATUSES))
        .thenReturn(false);
    when(teamMemberRepository.findMembershipsOf(target)).thenReturn(List.of());

    assertThat(resolver.resolveAccountId(PRINCIPAL)).contains(target);
  }
}
