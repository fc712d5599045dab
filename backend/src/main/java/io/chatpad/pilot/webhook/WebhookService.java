package io.chatpad.pilot.webhook;

import io.chatpad.pilot.audit.AuditEventBuilder;
import io.chatpad.pilot.audit.AuditService;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.resource.ResourceAuthorizationService;
import io.chatpad.pilot.resource.ResourceType;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class WebhookService {

  private static final Logger log = LoggerFactory.getLogger(WebhookService.class);

  private static final String SECRET_PREFIX = "whsec_";
  private static final int SECRET_BYTES = 24;

  private final WebhookRepository webhookRepository;
  private final ResourceAuthorizationService authorizationService;
  private final AuditService auditService;
  private final SecureRandom secureRandom = new SecureRandom();

  public WebhookService(
      WebhookRepository webhookRepository,
      ResourceAuthorizationService authorizationService,
      AuditService auditService) {
    this.webhookRepository = webhookRepository;
    this.authorizationService = authorizationService;
    this.auditService = auditService;
  }

  @Transactional
  public Webhook create(
      UUID requestedAccountId, String name, String url, List<String> events, UUID principalId) {
    UUID accountId =
        authorizationService.requireCreateAccount(
            ResourceType.WEBHOOK, requestedAccountId, principalId);
    var webhook =
        webhookRepository.save(new Webhook(accountId, name, url, events, generateSecret()));
    log.info("Created webhook {} for account {}", webhook.getId(), accountId);
    return webhook;
  }

  @Transactional(readOnly = true)
  public List<Webhook> list(UUID principalId, UUID requestedAccountId) {
    return authorizationService
        .listableAccountId(principalId, requestedAccountId)
        .map(webhookRepository::findByUserIdOrderByCreatedAtDesc)
        .orElse(List.of());
  }

  @Transactional(readOnly = true)
  public Webhook get(UUID webhookId, UUID principalId) {
    var webhook = find(webhookId);
    authorizationService.requireViewAccess(ResourceType.WEBHOOK, webhook, principalId);
    return webhook;
  }

  @Transactional
  public Webhook update(
      UUID webhookId,
      String name,
      String url,
      List<String> events,
      Boolean active,
      UUID principalId) {
    var webhook = find(webhookId);
    authorizationService.requireEditAccess(ResourceType.WEBHOOK, webhook, principalId);
    webhook.update(name, url, events, active);
    return webhook;
  }

  /** Replaces the signing secret. Returns the webhook carrying the new secret. */
  @Transactional
  public Webhook rotateSecret(UUID webhookId, UUID principalId) {
    var webhook = find(webhookId);
    authorizationService.requireSensitiveAccess(ResourceType.WEBHOOK, webhook, principalId);
    webhook.rotateSecret(generateSecret());
    log.info("Rotated secret of webhook {}", webhookId);

    auditService.log(
        AuditEventBuilder.builder()
            .action("webhook.secret_rotated")
            .resourceType("webhook")
            .resourceId(webhookId)
            .actorId(principalId)
            .details(Map.of("account_id", webhook.getUserId().toString()))
            .build());
    return webhook;
  }

  @Transactional
  public void delete(UUID webhookId, UUID principalId) {
    var webhook = find(webhookId);
    authorizationService.requireDeleteAccess(ResourceType.WEBHOOK, webhook, principalId);
    webhookRepository.delete(webhook);
    log.info("Deleted webhook {} from account {}", webhookId, webhook.getUserId());
  }

  private Webhook find(UUID webhookId) {
    return webhookRepository
        .findById(webhookId)
        .orElseThrow(() -> new ResourceNotFoundException("Webhook", webhookId));
  }

  private String generateSecret() {
    byte[] bytes = new byte[SECRET_BYTES];
    secureRandom.nextBytes(bytes);
    return SECRET_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }
}
