package io.chatpad.pilot.account;

import io.chatpad.pilot.agent.AgentRepository;
import io.chatpad.pilot.apikey.ApiKeyRepository;
import io.chatpad.pilot.audit.AuditEventBuilder;
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
import java.util.LinkedHashMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Removes an account and everything it owns in one transaction. Memberships the deleted principal
 * holds in other accounts go too, so no dangling member rows survive.
 */
@Service
public class AccountDeletionService {

  private static final Logger log = LoggerFactory.getLogger(AccountDeletionService.class);

  private final AgentRepository agentRepository;
  private final LeadRepository leadRepository;
  private final ConversationRepository conversationRepository;
  private final ApiKeyRepository apiKeyRepository;
  private final WebhookRepository webhookRepository;
  private final TeamMemberRepository teamMemberRepository;
  private final TeamInvitationRepository teamInvitationRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final NotificationRepository notificationRepository;
  private final PlatformAccessService platformAccessService;
  private final AuditService auditService;

  public AccountDeletionService(
      AgentRepository agentRepository,
      LeadRepository leadRepository,
      ConversationRepository conversationRepository,
      ApiKeyRepository apiKeyRepository,
      WebhookRepository webhookRepository,
      TeamMemberRepository teamMemberRepository,
      TeamInvitationRepository teamInvitationRepository,
      SubscriptionRepository subscriptionRepository,
      NotificationRepository notificationRepository,
      PlatformAccessService platformAccessService,
      AuditService auditService) {
    this.agentRepository = agentRepository;
    this.leadRepository = leadRepository;
    this.conversationRepository = conversationRepository;
    this.apiKeyRepository = apiKeyRepository;
    this.webhookRepository = webhookRepository;
    this.teamMemberRepository = teamMemberRepository;
    this.teamInvitationRepository = teamInvitationRepository;
    this.subscriptionRepository = subscriptionRepository;
    this.notificationRepository = notificationRepository;
    this.platformAccessService = platformAccessService;
    this.auditService = auditService;
  }

  /**
   * Deletes the account owned by {@code ownerId}.
   *
   * @param actorPrincipalId the requesting principal, or null for an internal service call
   */
  @Transactional
  public void deleteAccount(UUID ownerId, UUID actorPrincipalId) {
    if (actorPrincipalId != null
        && !actorPrincipalId.equals(ownerId)
        && !platformAccessService.hasAdminPermission(
            actorPrincipalId, AdminPermission.MANAGE_ACCOUNTS)) {
      throw new ForbiddenException(
          "Cannot delete account", "Only the owner or a platform operator can delete an account");
    }

    var removed = new LinkedHashMap<String, Object>();
    // Conversations reference agents, so they go first
    removed.put("conversations", conversationRepository.deleteAllByUserId(ownerId));
    removed.put("agents", agentRepository.deleteAllByUserId(ownerId));
    removed.put("leads", leadRepository.deleteAllByUserId(ownerId));
    removed.put("api_keys", apiKeyRepository.deleteAllByUserId(ownerId));
    removed.put("webhooks", webhookRepository.deleteAllByUserId(ownerId));
    removed.put("team_members", teamMemberRepository.deleteAllByOwnerId(ownerId));
    removed.put("memberships", teamMemberRepository.deleteAllByMemberId(ownerId));
    removed.put("invitations", teamInvitationRepository.deleteAllByOwnerId(ownerId));
    removed.put("subscriptions", subscriptionRepository.deleteByUserId(ownerId));
    removed.put("notifications", notificationRepository.deleteAllByUserId(ownerId));

    log.info("Deleted account {} (actor={}): {}", ownerId, actorPrincipalId, removed);

    auditService.log(
        AuditEventBuilder.builder()
            .action("account.deleted")
            .resourceType("account")
            .resourceId(ownerId)
            .actorId(actorPrincipalId)
            .details(removed)
            .build());
  }
}
