package io.chatpad.pilot.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.chatpad.pilot.account.AccountAccessService;
import io.chatpad.pilot.account.AccountResolution;
import io.chatpad.pilot.account.AccountResolver;
import io.chatpad.pilot.exception.ForbiddenException;
import io.chatpad.pilot.exception.InvalidStateException;
import io.chatpad.pilot.platform.AdminPermission;
import io.chatpad.pilot.platform.PlatformAccessService;
import io.chatpad.pilot.resource.ResourceAuthorizationService;
import io.chatpad.pilot.team.TeamMemberRepository;
import io.chatpad.pilot.team.TeamRole;
import io.chatpad.pilot.testutil.TestEntities;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AgentServiceTest {

  private static final UUID OWNER = UUID.randomUUID();
  private static final UUID ADMIN = UUID.randomUUID();
  private static final UUID MEMBER = UUID.randomUUID();

  @Mock private AgentRepository agentRepository;
  @Mock private TeamMemberRepository teamMemberRepository;
  @Mock private PlatformAccessService platformAccessService;
  @Mock private AccountResolver accountResolver;

  private AgentService service;

  @BeforeEach
  void setUp() {
    var authorizationService =
        new ResourceAuthorizationService(
            new AccountAccessService(teamMemberRepository), platformAccessService, accountResolver);
    service = new AgentService(agentRepository, authorizationService);

    lenient()
        .when(teamMemberRepository.existsByOwnerIdAndMemberId(any(), any()))
        .thenAnswer(
            inv ->
                OWNER.equals(inv.getArgument(0))
                    && (ADMIN.equals(inv.getArgument(1)) || MEMBER.equals(inv.getArgument(1))));
    lenient()
        .when(teamMemberRepository.existsByOwnerIdAndMemberIdAndRole(any(), any(), anyString()))
        .thenAnswer(
            inv ->
                OWNER.equals(inv.getArgument(0))
                    && ADMIN.equals(inv.getArgument(1))
                    && TeamRole.ADMIN.equals(inv.getArgument(2)));
    lenient()
        .when(accountResolver.resolve(any()))
        .thenAnswer(
            inv ->
                new AccountResolution(
                    inv.getArgument(0), OWNER, AccountResolution.Source.TEAM_MEMBERSHIP));
  }

  @Test
  void memberCannotDelete() {
    var agent = existingAgent();

    assertThatThrownBy(() -> service.delete(agent.getId(), MEMBER))
        .isInstanceOf(ForbiddenException.class);
    verify(agentRepository, never()).delete(any());
  }

  @Test
  void teamAdminMayDelete() {
    var agent = existingAgent();

    service.delete(agent.getId(), ADMIN);

    verify(agentRepository).delete(agent);
  }

  @Test
  void memberWithManageAccountsMayDelete() {
    var agent = existingAgent();
    when(platformAccessService.hasAdminPermission(MEMBER, AdminPermission.MANAGE_ACCOUNTS))
        .thenReturn(true);

    service.delete(agent.getId(), MEMBER);

    verify(agentRepository).delete(agent);
  }

  @Test
  void memberMayUpdate() {
    var agent = existingAgent();

    service.update(agent.getId(), "Front desk", null, null, MEMBER);

    assertThat(agent.getName()).isEqualTo("Front desk");
  }

  @Test
  void unknownStatusIsRejected() {
    var agent = existingAgent();

    assertThatThrownBy(() -> service.update(agent.getId(), null, null, "sleeping", OWNER))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void createWithoutAccountIdUsesResolvedAccount() {
    when(accountResolver.requireAccountId(MEMBER)).thenReturn(OWNER);
    when(agentRepository.save(any(Agent.class))).thenAnswer(inv -> inv.getArgument(0));

    var agent = service.create(null, "Concierge", null, MEMBER);

    assertThat(agent.getUserId()).isEqualTo(OWNER);
  }

  private Agent existingAgent() {
    var agent = TestEntities.withId(new Agent(OWNER, "Concierge", null), UUID.randomUUID());
    when(agentRepository.findById(agent.getId())).thenReturn(Optional.of(agent));
    return agent;
  }
}
