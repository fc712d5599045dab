package io.chatpad.pilot.subscription;

import io.chatpad.pilot.audit.AuditEventBuilder;
import io.chatpad.pilot.audit.AuditService;
import java.time.Instant;
import java.util.HashMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Mirrors the billing provider's view of a subscriber into {@code subscriptions}. */
@Service
public class SubscriptionSyncService {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionSyncService.class);

  private final SubscriptionRepository subscriptionRepository;
  private final AuditService auditService;

  public SubscriptionSyncService(
      SubscriptionRepository subscriptionRepository, AuditService auditService) {
    this.subscriptionRepository = subscriptionRepository;
    this.auditService = auditService;
  }

  @Transactional
  public Subscription sync(UUID userId, String planId, String status, Instant currentPeriodEnd) {
    var existing = subscriptionRepository.findFirstByUserIdOrderByCreatedAtDesc(userId);
    String previousStatus = existing.map(Subscription::getStatus).orElse(null);

    Subscription subscription;
    if (existing.isPresent()) {
      subscription = existing.get();
      subscription.syncFrom(planId, status, currentPeriodEnd);
    } else {
      subscription =
          subscriptionRepository.save(new Subscription(userId, planId, status, currentPeriodEnd));
    }

    if (previousStatus == null || !previousStatus.equals(status)) {
      log.info("Subscription of {} is now {} (was {})", userId, status, previousStatus);
    }

    var details = new HashMap<String, Object>();
    details.put("plan_id", planId);
    details.put("status", status);
    if (previousStatus != null) {
      details.put("previous_status", previousStatus);
    }
    auditService.log(
        AuditEventBuilder.builder()
            .action("subscription.synced")
            .resourceType("subscription")
            .resourceId(subscription.getId())
            .actorId(null)
            .details(details)
            .build());
    return subscription;
  }
}
