package io.chatpad.pilot.account;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.chatpad.pilot.agent.AgentRepository;
import io.chatpad.pilot.apikey.ApiKeyRepository;
import io.chatpad.pilot.audit.AuditEventRecord;
import io.chatpad.pilot.audit.AuditService;
import io.chatpad.pilot.conversation.ConversationRepository;
import io.chatpad.pilot.exception.ForbiddenException;
import io.chatpad.pilot.lead.LeadRepository;
import io.chatpad.pilot.notification.NotificationRepository;
import io.chatpad.pilot.platform.AdminPermission;
import io.chatpad.pilot.platform.PlatformAccessService;
import io.chatpad.pilot.subscription.SubscriptionRepository;
import io.chatpad.pilot.team.TeamInvitationRepository;
import io.chatpad.pilot.team.TeamMemberRepository;
import io.chatpad.pilot.webhook.WebhookRepository;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccountDeletionServiceTest {

  private static final UUID OWNER = UUID.randomUUID();

  @Mock private AgentRepository agentRepository;
  @Mock private LeadRepository leadRepository;
  @Mock private ConversationRepository conversationRepository;
  @Mock private ApiKeyRepository apiKeyRepository;
  @Mock private WebhookRepository webhookRepository;
  @Mock private TeamMemberRepository teamMemberRepository;
  @Mock private TeamInvitationRepository teamInvitationRepository;
  @Mock private SubscriptionRepository subscriptionRepository;
  @Mock private NotificationRepository notificationRepository;
  @Mock private PlatformAccessService platformAccessService;
  @Mock private AuditService auditService;
  @InjectMocks private AccountDeletionService service;

  @Test
  void ownerDeletesEverythingConversationsFirst() {
    when(conversationRepository.deleteAllByUserId(OWNER)).thenReturn(4);
    when(leadRepository.deleteAllByUserId(OWNER)).thenReturn(2);

    service.deleteAccount(OWNER, OWNER);

    var order = inOrder(conversationRepository, agentRepository);
    order.verify(conversationRepository).deleteAllByUserId(OWNER);
    order.verify(agentRepository).deleteAllByUserId(OWNER);
    verify(teamMemberRepository).deleteAllByOwnerId(OWNER);
    verify(teamMemberRepository).deleteAllByMemberId(OWNER);
    verify(teamInvitationRepository).deleteAllByOwnerId(OWNER);
    verify(subscriptionRepository).deleteByUserId(OWNER);
    verify(notificationRepository).deleteAllByUserId(OWNER);

    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().action()).isEqualTo("account.deleted");
    assertThat(captor.getValue().resourceId()).isEqualTo(OWNER);
    assertThat(captor.getValue().details())
        .containsEntry("conversations", 4)
        .containsEntry("leads", 2);
    verifyNoInteractions(platformAccessService);
  }

  @Test
  void strangerCannotDelete() {
    var stranger = UUID.randomUUID();
    when(platformAccessService.hasAdminPermission(stranger, AdminPermission.MANAGE_ACCOUNTS))
        .thenReturn(false);

    assertThatThrownBy(() -> service.deleteAccount(OWNER, stranger))
        .isInstanceOf(ForbiddenException.class);
    verifyNoInteractions(agentRepository, leadRepository, conversationRepository);
    verify(auditService, never()).log(any());
  }

  @Test
  void operatorWithManageAccountsMayDelete() {
    var operator = UUID.randomUUID();
    when(platformAccessService.hasAdminPermission(operator, AdminPermission.MANAGE_ACCOUNTS))
        .thenReturn(true);

    service.deleteAccount(OWNER, operator);

    verify(agentRepository).deleteAllByUserId(OWNER);
  }

  @Test
  void internalCallNeedsNoActor() {
    service.deleteAccount(OWNER, null);

    verify(agentRepository).deleteAllByUserId(OWNER);
    verifyNoInteractions(platformAccessService);
  }
}
