package io.chatpad.pilot.lead;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.chatpad.pilot.agent.Agent;
import io.chatpad.pilot.agent.AgentRepository;
import io.chatpad.pilot.conversation.Conversation;
import io.chatpad.pilot.conversation.ConversationRepository;
import io.chatpad.pilot.dispatch.RowChangeEvent;
import io.chatpad.pilot.exception.ForbiddenException;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.resource.ResourceAccess;
import io.chatpad.pilot.resource.ResourceAuthorizationService;
import io.chatpad.pilot.resource.ResourceType;
import io.chatpad.pilot.testutil.TestEntities;
import java.util.Map;
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
class LeadServiceTest {

  private static final UUID ACCOUNT = UUID.randomUUID();
  private static final UUID PRINCIPAL = UUID.randomUUID();

  @Mock private LeadRepository leadRepository;
  @Mock private AgentRepository agentRepository;
  @Mock private ConversationRepository conversationRepository;
  @Mock private ResourceAuthorizationService authorizationService;
  @Mock private ApplicationEventPublisher eventPublisher;
  @InjectMocks private LeadService service;

  @Test
  void insertPublishesExactlyOneRowChange() {
    var leadId = UUID.randomUUID();
    when(authorizationService.requireCreateAccount(ResourceType.LEAD, null, PRINCIPAL))
        .thenReturn(ACCOUNT);
    when(leadRepository.saveAndFlush(any(Lead.class)))
        .thenAnswer(inv -> TestEntities.withId(inv.getArgument(0), leadId));

    service.create(
        null,
        new LeadService.LeadDraft(
            null, null, "Ada Lovelace", "ada@example.com", null, Map.of("budget", "5k")),
        PRINCIPAL);

    var captor = ArgumentCaptor.forClass(RowChangeEvent.class);
    verify(eventPublisher, times(1)).publishEvent(captor.capture());
    var event = captor.getValue();
    assertThat(event.type()).isEqualTo(RowChangeEvent.INSERT);
    assertThat(event.table()).isEqualTo("leads");
    assertThat(event.accountId()).isEqualTo(ACCOUNT);
    assertThat(event.record())
        .containsEntry("id", leadId)
        .containsEntry("user_id", ACCOUNT)
        .containsEntry("email", "ada@example.com");
    assertThat(event.oldRecord()).isNull();
  }

  @Test
  void leadCannotReferenceAnotherAccountsAgent() {
    var foreignAgent =
        TestEntities.withId(new Agent(UUID.randomUUID(), "Theirs", null), UUID.randomUUID());
    when(authorizationService.requireCreateAccount(ResourceType.LEAD, null, PRINCIPAL))
        .thenReturn(ACCOUNT);
    when(agentRepository.findById(foreignAgent.getId())).thenReturn(Optional.of(foreignAgent));

    assertThatThrownBy(
            () ->
                service.create(
                    null,
                    new LeadService.LeadDraft(foreignAgent.getId(), null, "x", null, null, null),
                    PRINCIPAL))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(leadRepository, never()).saveAndFlush(any());
    verify(eventPublisher, never()).publishEvent(any());
  }

  @Test
  void leadCannotReferenceAnotherAccountsConversation() {
    var agent = TestEntities.withId(new Agent(ACCOUNT, "Ours", null), UUID.randomUUID());
    var foreignConversation =
        TestEntities.withId(
            new Conversation(UUID.randomUUID(), UUID.randomUUID(), "widget"), UUID.randomUUID());
    when(authorizationService.requireCreateAccount(ResourceType.LEAD, null, PRINCIPAL))
        .thenReturn(ACCOUNT);
    when(agentRepository.findById(agent.getId())).thenReturn(Optional.of(agent));
    when(conversationRepository.findById(foreignConversation.getId()))
        .thenReturn(Optional.of(foreignConversation));

    assertThatThrownBy(
            () ->
                service.create(
                    null,
                    new LeadService.LeadDraft(
                        agent.getId(), foreignConversation.getId(), "x", null, null, null),
                    PRINCIPAL))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(leadRepository, never()).saveAndFlush(any());
  }

  @Test
  void rejectedCreatePublishesNothing() {
    var other = UUID.randomUUID();
    when(authorizationService.requireCreateAccount(ResourceType.LEAD, other, PRINCIPAL))
        .thenThrow(new ForbiddenException("Cannot create lead", "no"));

    assertThatThrownBy(
            () ->
                service.create(
                    other,
                    new LeadService.LeadDraft(null, null, "x", null, null, null),
                    PRINCIPAL))
        .isInstanceOf(ForbiddenException.class);
    verify(leadRepository, never()).saveAndFlush(any());
    verify(eventPublisher, never()).publishEvent(any());
  }

  @Test
  void updateCarriesPreviousRow() {
    var lead =
        TestEntities.withId(
            new Lead(ACCOUNT, null, null, "Old name", null, null, null), UUID.randomUUID());
    when(leadRepository.findById(lead.getId())).thenReturn(Optional.of(lead));
    when(authorizationService.requireEditAccess(ResourceType.LEAD, lead, PRINCIPAL))
        .thenReturn(ResourceAccess.full(ResourceAccess.GrantedBy.TEAM_MEMBER));

    service.update(lead.getId(), "New name", null, null, null, null, PRINCIPAL);

    var captor = ArgumentCaptor.forClass(RowChangeEvent.class);
    verify(eventPublisher).publishEvent(captor.capture());
    assertThat(captor.getValue().type()).isEqualTo(RowChangeEvent.UPDATE);
    assertThat(captor.getValue().oldRecord()).containsEntry("name", "Old name");
    assertThat(captor.getValue().record()).containsEntry("name", "New name");
  }
}
