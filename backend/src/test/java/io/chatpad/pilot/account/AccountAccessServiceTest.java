package io.chatpad.pilot.account;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import io.chatpad.pilot.team.TeamMember;
import io.chatpad.pilot.team.TeamMemberRepository;
import io.chatpad.pilot.team.TeamRole;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccountAccessServiceTest {

  private static final UUID OWNER = UUID.randomUUID();
  private static final UUID MEMBER = UUID.randomUUID();
  private static final UUID STRANGER = UUID.randomUUID();

  @Mock private TeamMemberRepository teamMemberRepository;
  @InjectMocks private AccountAccessService service;

  @Test
  void ownerHasAccessAndIsAdminWithoutAnyRow() {
    assertThat(service.hasAccountAccess(OWNER, OWNER)).isTrue();
    assertThat(service.isAccountAdmin(OWNER, OWNER)).isTrue();
    assertThat(service.teamRoleIn(OWNER, OWNER)).isEqualTo(TeamRole.OWNER);
  }

  @Test
  void plainMemberHasAccessButIsNotAdmin() {
    when(teamMemberRepository.existsByOwnerIdAndMemberId(OWNER, MEMBER)).thenReturn(true);
    when(teamMemberRepository.existsByOwnerIdAndMemberIdAndRole(OWNER, MEMBER, TeamRole.ADMIN))
        .thenReturn(false);

    assertThat(service.hasAccountAccess(OWNER, MEMBER)).isTrue();
    assertThat(service.isAccountAdmin(OWNER, MEMBER)).isFalse();
  }

  @Test
  void strangerHasNoAccess() {
    when(teamMemberRepository.existsByOwnerIdAndMemberId(OWNER, STRANGER)).thenReturn(false);
    when(teamMemberRepository.findByOwnerIdAndMemberId(OWNER, STRANGER))
        .thenReturn(Optional.empty());

    assertThat(service.hasAccountAccess(OWNER, STRANGER)).isFalse();
    assertThat(service.teamRoleIn(OWNER, STRANGER)).isNull();
  }

  @Test
  void nullArgumentsNeverGrantAccess() {
    assertThat(service.hasAccountAccess(null, MEMBER)).isFalse();
    assertThat(service.hasAccountAccess(OWNER, null)).isFalse();
    assertThat(service.isAccountAdmin(null, null)).isFalse();
  }

  @Test
  void removingMembershipRevokesAccessOnTheNextCall() {
    var rows = new ArrayList<TeamMember>();
    rows.add(new TeamMember(OWNER, MEMBER, TeamRole.ADMIN));
    backRepositoryWith(rows);

    assertThat(service.hasAccountAccess(OWNER, MEMBER)).isTrue();
    assertThat(service.isAccountAdmin(OWNER, MEMBER)).isTrue();

    rows.clear();

    assertThat(service.hasAccountAccess(OWNER, MEMBER)).isFalse();
    assertThat(service.isAccountAdmin(OWNER, MEMBER)).isFalse();
  }

  @Test
  void predicatesMatchMembershipGraphForRandomGraphs() {
    var random = new Random(20240917L);
    for (int round = 0; round < 50; round++) {
      var principals = new ArrayList<UUID>();
      for (int i = 0; i < 8; i++) {
        principals.add(UUID.randomUUID());
      }
      var rows = new ArrayList<TeamMember>();
      for (UUID owner : principals.subList(0, 3)) {
        for (UUID member : principals.subList(3, 8)) {
          if (random.nextInt(3) == 0) {
            rows.add(
                new TeamMember(
                    owner, member, random.nextBoolean() ? TeamRole.ADMIN : TeamRole.MEMBER));
          }
        }
      }
      backRepositoryWith(rows);

      for (UUID account : principals) {
        for (UUID principal : principals) {
          boolean expectedAccess =
              account.equals(principal) || rowFor(rows, account, principal) != null;
          var row = rowFor(rows, account, principal);
          boolean expectedAdmin =
              account.equals(principal) || (row != null && TeamRole.ADMIN.equals(row.getRole()));

          assertThat(service.hasAccountAccess(account, principal)).isEqualTo(expectedAccess);
          assertThat(service.isAccountAdmin(account, principal)).isEqualTo(expectedAdmin);
          if (expectedAdmin) {
            assertThat(service.hasAccountAccess(account, principal)).isTrue();
          }
        }
      }
    }
  }

  private void backRepositoryWith(List<TeamMember> rows) {
    lenient()
        .when(teamMemberRepository.existsByOwnerIdAndMemberId(any(), any()))
        .thenAnswer(
            inv -> rowFor(rows, inv.getArgument(0), inv.getArgument(1)) != null);
    lenient()
        .when(teamMemberRepository.existsByOwnerIdAndMemberIdAndRole(any(), any(), anyString()))
        .thenAnswer(
            inv -> {
              var row = rowFor(rows, inv.getArgument(0), inv.getArgument(1));
              return row != null && row.getRole().equals(inv.getArgument(2));
            });
  }

  private static TeamMember rowFor(List<TeamMember> rows, UUID owner, UUID member) {
    return rows.stream()
        .filter(r -> r.getOwnerId().equals(owner) && r.getMemberId().equals(member))
        .findFirst()
        .orElse(null);
  }
}
