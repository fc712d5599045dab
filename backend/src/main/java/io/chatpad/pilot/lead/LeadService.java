package io.chatpad.pilot.lead;

import io.chatpad.pilot.agent.AgentRepository;
import io.chatpad.pilot.conversation.ConversationRepository;
import io.chatpad.pilot.dispatch.RowChangeEvent;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.resource.ResourceAuthorizationService;
import io.chatpad.pilot.resource.ResourceType;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Lead CRUD. Every committed insert, update and delete emits one {@link RowChangeEvent} on the
 * {@code leads} table; inserts also fan out {@code new_lead} notifications.
 */
@Service
public class LeadService {

  private static final Logger log = LoggerFactory.getLogger(LeadService.class);

  private final LeadRepository leadRepository;
  private final AgentRepository agentRepository;
  private final ConversationRepository conversationRepository;
  private final ResourceAuthorizationService authorizationService;
  private final ApplicationEventPublisher eventPublisher;

  public LeadService(
      LeadRepository leadRepository,
      AgentRepository agentRepository,
      ConversationRepository conversationRepository,
      ResourceAuthorizationService authorizationService,
      ApplicationEventPublisher eventPublisher) {
    this.leadRepository = leadRepository;
    this.agentRepository = agentRepository;
    this.conversationRepository = conversationRepository;
    this.authorizationService = authorizationService;
    this.eventPublisher = eventPublisher;
  }

  /** Captures a lead. A referenced agent or conversation must belong to the same account. */
  @Transactional
  public Lead create(UUID requestedAccountId, LeadDraft draft, UUID principalId) {
    UUID accountId =
        authorizationService.requireCreateAccount(
            ResourceType.LEAD, requestedAccountId, principalId);
    if (draft.agentId() != null) {
      agentRepository
          .findById(draft.agentId())
          .filter(a -> a.getUserId().equals(accountId))
          .orElseThrow(() -> new ResourceNotFoundException("Agent", draft.agentId()));
    }
    if (draft.conversationId() != null) {
      conversationRepository
          .findById(draft.conversationId())
          .filter(c -> c.getUserId().equals(accountId))
          .orElseThrow(
              () -> new ResourceNotFoundException("Conversation", draft.conversationId()));
    }
    var lead =
        leadRepository.saveAndFlush(
            new Lead(
                accountId,
                draft.agentId(),
                draft.conversationId(),
                draft.name(),
                draft.email(),
                draft.phone(),
                draft.data()));
    log.info("Created lead {} in account {}", lead.getId(), accountId);

    eventPublisher.publishEvent(
        RowChangeEvent.insert(ResourceType.LEAD.table(), accountId, lead.toRecord()));
    return lead;
  }

  @Transactional(readOnly = true)
  public Lead get(UUID leadId, UUID principalId) {
    var lead = find(leadId);
    authorizationService.requireViewAccess(ResourceType.LEAD, lead, principalId);
    return lead;
  }

  @Transactional(readOnly = true)
  public Page<Lead> list(UUID principalId, UUID requestedAccountId, Pageable pageable) {
    return authorizationService
        .listableAccountId(principalId, requestedAccountId)
        .map(accountId -> leadRepository.findByUserIdOrderByCreatedAtDesc(accountId, pageable))
        .orElse(Page.empty(pageable));
  }

  @Transactional
  public Lead update(
      UUID leadId,
      String name,
      String email,
      String phone,
      String status,
      Map<String, Object> data,
      UUID principalId) {
    var lead = find(leadId);
    authorizationService.requireEditAccess(ResourceType.LEAD, lead, principalId);
    var before = lead.toRecord();
    lead.update(name, email, phone, status, data);
    leadRepository.flush();

    eventPublisher.publishEvent(
        RowChangeEvent.update(
            ResourceType.LEAD.table(), lead.getUserId(), lead.toRecord(), before));
    return lead;
  }

  @Transactional
  public void delete(UUID leadId, UUID principalId) {
    var lead = find(leadId);
    authorizationService.requireDeleteAccess(ResourceType.LEAD, lead, principalId);
    var before = lead.toRecord();
    leadRepository.delete(lead);
    log.info("Deleted lead {} from account {}", leadId, lead.getUserId());

    eventPublisher.publishEvent(
        RowChangeEvent.delete(ResourceType.LEAD.table(), lead.getUserId(), before));
  }

  private Lead find(UUID leadId) {
    return leadRepository
        .findById(leadId)
        .orElseThrow(() -> new ResourceNotFoundException("Lead", leadId));
  }

  /** Fields supplied when capturing a lead. */
  public record LeadDraft(
      UUID agentId,
      UUID conversationId,
      String name,
      String email,
      String phone,
      Map<String, Object> data) {}
}
