package io.chatpad.pilot.agent;

import io.chatpad.pilot.exception.InvalidStateException;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.resource.ResourceAuthorizationService;
import io.chatpad.pilot.resource.ResourceType;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AgentService {

  private static final Logger log = LoggerFactory.getLogger(AgentService.class);

  private final AgentRepository agentRepository;
  private final ResourceAuthorizationService authorizationService;

  public AgentService(
      AgentRepository agentRepository, ResourceAuthorizationService authorizationService) {
    this.agentRepository = agentRepository;
    this.authorizationService = authorizationService;
  }

  @Transactional
  public Agent create(UUID requestedAccountId, String name, String description, UUID principalId) {
    UUID accountId =
        authorizationService.requireCreateAccount(
            ResourceType.AGENT, requestedAccountId, principalId);
    var agent = agentRepository.save(new Agent(accountId, name, description));
    log.info("Created agent {} in account {}", agent.getId(), accountId);
    return agent;
  }

  @Transactional(readOnly = true)
  public Agent get(UUID agentId, UUID principalId) {
    var agent = find(agentId);
    authorizationService.requireViewAccess(ResourceType.AGENT, agent, principalId);
    return agent;
  }

  @Transactional(readOnly = true)
  public List<Agent> list(UUID principalId, UUID requestedAccountId) {
    return authorizationService
        .listableAccountId(principalId, requestedAccountId)
        .map(agentRepository::findByUserIdOrderByCreatedAtDesc)
        .orElse(List.of());
  }

  @Transactional
  public Agent update(
      UUID agentId, String name, String description, String status, UUID principalId) {
    var agent = find(agentId);
    authorizationService.requireEditAccess(ResourceType.AGENT, agent, principalId);
    if (status != null && !Agent.isValidStatus(status)) {
      throw new InvalidStateException("Invalid agent status", "Unknown status: " + status);
    }
    agent.update(name, description, status);
    return agent;
  }

  @Transactional
  public void delete(UUID agentId, UUID principalId) {
    var agent = find(agentId);
    authorizationService.requireDeleteAccess(ResourceType.AGENT, agent, principalId);
    agentRepository.delete(agent);
    log.info("Deleted agent {} from account {}", agentId, agent.getUserId());
  }

  private Agent find(UUID agentId) {
    return agentRepository
        .findById(agentId)
        .orElseThrow(() -> new ResourceNotFoundException("Agent", agentId));
  }
}
