package io.chatpad.pilot.subscription;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/subscriptions")
public class InternalSubscriptionController {

  private final SubscriptionSyncService subscriptionSyncService;

  public InternalSubscriptionController(SubscriptionSyncService subscriptionSyncService) {
    this.subscriptionSyncService = subscriptionSyncService;
  }

  @PostMapping
  public ResponseEntity<SubscriptionResponse> sync(
      @Valid @RequestBody SyncSubscriptionRequest request) {
    var subscription =
        subscriptionSyncService.sync(
            request.userId(), request.planId(), request.status(), request.currentPeriodEnd());
    return ResponseEntity.ok(SubscriptionResponse.from(subscription));
  }

  public record SyncSubscriptionRequest(
      @NotNull UUID userId, String planId, @NotBlank String status, Instant currentPeriodEnd) {}

  public record SubscriptionResponse(
      UUID id,
      UUID userId,
      String planId,
      String status,
      boolean active,
      Instant currentPeriodEnd) {

    static SubscriptionResponse from(Subscription subscription) {
      return new SubscriptionResponse(
          subscription.getId(),
          subscription.getUserId(),
          subscription.getPlanId(),
          subscription.getStatus(),
          subscription.isActive(),
          subscription.getCurrentPeriodEnd());
    }
  }
}
