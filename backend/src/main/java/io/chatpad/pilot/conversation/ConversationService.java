package io.chatpad.pilot.conversation;

import io.chatpad.pilot.agent.AgentRepository;
import io.chatpad.pilot.dispatch.RowChangeEvent;
import io.chatpad.pilot.exception.InvalidStateException;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.resource.ResourceAuthorizationService;
import io.chatpad.pilot.resource.ResourceType;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ConversationService {

  private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

  private final ConversationRepository conversationRepository;
  private final AgentRepository agentRepository;
  private final ResourceAuthorizationService authorizationService;
  private final ApplicationEventPublisher eventPublisher;

  public ConversationService(
      ConversationRepository conversationRepository,
      AgentRepository agentRepository,
      ResourceAuthorizationService authorizationService,
      ApplicationEventPublisher eventPublisher) {
    this.conversationRepository = conversationRepository;
    this.agentRepository = agentRepository;
    this.authorizationService = authorizationService;
    this.eventPublisher = eventPublisher;
  }

  /** Opens a conversation on one of the account's agents. */
  @Transactional
  public Conversation create(
      UUID requestedAccountId, UUID agentId, String channel, UUID principalId) {
    UUID accountId =
        authorizationService.requireCreateAccount(
            ResourceType.CONVERSATION, requestedAccountId, principalId);
    var agent =
        agentRepository
            .findById(agentId)
            .filter(a -> a.getUserId().equals(accountId))
            .orElseThrow(() -> new ResourceNotFoundException("Agent", agentId));

    var conversation =
        conversationRepository.saveAndFlush(
            new Conversation(accountId, agent.getId(), channel != null ? channel : "widget"));
    eventPublisher.publishEvent(
        RowChangeEvent.insert(
            ResourceType.CONVERSATION.table(), accountId, conversation.toRecord()));
    return conversation;
  }

  @Transactional(readOnly = true)
  public Conversation get(UUID conversationId, UUID principalId) {
    var conversation = find(conversationId);
    authorizationService.requireViewAccess(ResourceType.CONVERSATION, conversation, principalId);
    return conversation;
  }

  @Transactional(readOnly = true)
  public Page<Conversation> list(UUID principalId, UUID requestedAccountId, Pageable pageable) {
    return authorizationService
        .listableAccountId(principalId, requestedAccountId)
        .map(id -> conversationRepository.findByUserIdOrderByUpdatedAtDesc(id, pageable))
        .orElse(Page.empty(pageable));
  }

  @Transactional
  public Conversation updateStatus(UUID conversationId, String status, UUID principalId) {
    if (!Conversation.isValidStatus(status)) {
      throw new InvalidStateException("Invalid conversation status", "Unknown status: " + status);
    }
    var conversation = find(conversationId);
    authorizationService.requireEditAccess(ResourceType.CONVERSATION, conversation, principalId);
    var before = conversation.toRecord();
    conversation.changeStatus(status);
    conversationRepository.flush();

    eventPublisher.publishEvent(
        RowChangeEvent.update(
            ResourceType.CONVERSATION.table(),
            conversation.getUserId(),
            conversation.toRecord(),
            before));
    return conversation;
  }

  @Transactional
  public void delete(UUID conversationId, UUID principalId) {
    var conversation = find(conversationId);
    authorizationService.requireDeleteAccess(ResourceType.CONVERSATION, conversation, principalId);
    conversationRepository.delete(conversation);
    log.info("Deleted conversation {} from account {}", conversationId, conversation.getUserId());
  }

  private Conversation find(UUID conversationId) {
    return conversationRepository
        .findById(conversationId)
        .orElseThrow(() -> new ResourceNotFoundException("Conversation", conversationId));
  }
}
