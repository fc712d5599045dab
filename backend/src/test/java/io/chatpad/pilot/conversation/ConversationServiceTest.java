package io.chatpad.pilot.conversation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.chatpad.pilot.agent.Agent;
import io.chatpad.pilot.agent.AgentRepository;
import io.chatpad.pilot.dispatch.RowChangeEvent;
import io.chatpad.pilot.exception.InvalidStateException;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.resource.ResourceAccess;
import io.chatpad.pilot.resource.ResourceAuthorizationService;
import io.chatpad.pilot.resource.ResourceType;
import io.chatpad.pilot.testutil.TestEntities;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class ConversationServiceTest {

  private static final UUID ACCOUNT = UUID.randomUUID();
  private static final UUID PRINCIPAL = UUID.randomUUID();

  @Mock private ConversationRepository conversationRepository;
  @Mock private AgentRepository agentRepository;
  @Mock private ResourceAuthorizationService authorizationService;
  @Mock private ApplicationEventPublisher eventPublisher;
  @InjectMocks private ConversationService service;

  @Test
  void cannotOpenOnAnotherAccountsAgent() {
    var foreignAgent =
        TestEntities.withId(new Agent(UUID.randomUUID(), "Theirs", null), UUID.randomUUID());
    when(authorizationService.requireCreateAccount(ResourceType.CONVERSATION, null, PRINCIPAL))
        .thenReturn(ACCOUNT);
    when(agentRepository.findById(foreignAgent.getId())).thenReturn(Optional.of(foreignAgent));

    assertThatThrownBy(() -> service.create(null, foreignAgent.getId(), "widget", PRINCIPAL))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(conversationRepository, never()).saveAndFlush(any());
    verifyNoInteractions(eventPublisher);
  }

  @Test
  void insertPublishesRowChangeWithDefaultChannel() {
    var agent = TestEntities.withId(new Agent(ACCOUNT, "Concierge", null), UUID.randomUUID());
    var conversationId = UUID.randomUUID();
    when(authorizationService.requireCreateAccount(ResourceType.CONVERSATION, null, PRINCIPAL))
        .thenReturn(ACCOUNT);
    when(agentRepository.findById(agent.getId())).thenReturn(Optional.of(agent));
    when(conversationRepository.saveAndFlush(any(Conversation.class)))
        .thenAnswer(inv -> TestEntities.withId(inv.getArgument(0), conversationId));

    var conversation = service.create(null, agent.getId(), null, PRINCIPAL);

    assertThat(conversation.getChannel()).isEqualTo("widget");
    var captor = ArgumentCaptor.forClass(RowChangeEvent.class);
    verify(eventPublisher).publishEvent(captor.capture());
    assertThat(captor.getValue().type()).isEqualTo(RowChangeEvent.INSERT);
    assertThat(captor.getValue().table()).isEqualTo("conversations");
    assertThat(captor.getValue().accountId()).isEqualTo(ACCOUNT);
    assertThat(captor.getValue().record())
        .containsEntry("id", conversationId)
        .containsEntry("agent_id", agent.getId());
  }

  @Test
  void statusChangePublishesUpdateWithPreviousRow() {
    var conversation = existingConversation();
    when(authorizationService.requireEditAccess(
            ResourceType.CONVERSATION, conversation, PRINCIPAL))
        .thenReturn(ResourceAccess.full(ResourceAccess.GrantedBy.TEAM_MEMBER));

    service.updateStatus(conversation.getId(), Conversation.STATUS_HUMAN_TAKEOVER, PRINCIPAL);

    var captor = ArgumentCaptor.forClass(RowChangeEvent.class);
    verify(eventPublisher).publishEvent(captor.capture());
    assertThat(captor.getValue().type()).isEqualTo(RowChangeEvent.UPDATE);
    assertThat(captor.getValue().record())
        .containsEntry("status", Conversation.STATUS_HUMAN_TAKEOVER);
    assertThat(captor.getValue().oldRecord()).containsEntry("status", Conversation.STATUS_ACTIVE);
  }

  @Test
  void unknownStatusIsRejectedBeforeLookup() {
    assertThatThrownBy(() -> service.updateStatus(UUID.randomUUID(), "archived", PRINCIPAL))
        .isInstanceOf(InvalidStateException.class);
    verifyNoInteractions(conversationRepository, eventPublisher);
  }

  private Conversation existingConversation() {
    var conversation =
        TestEntities.withId(
            new Conversation(ACCOUNT, UUID.randomUUID(), "widget"), UUID.randomUUID());
    when(conversationRepository.findById(conversation.getId()))
        .thenReturn(Optional.of(conversation));
    return conversation;
  }
}
