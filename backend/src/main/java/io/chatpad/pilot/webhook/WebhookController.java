package io.chatpad.pilot.webhook;

import io.chatpad.pilot.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/webhooks")
public class WebhookController {

  private final WebhookService webhookService;

  public WebhookController(WebhookService webhookService) {
    this.webhookService = webhookService;
  }

  @GetMapping
  public ResponseEntity<List<WebhookResponse>> list(
      @RequestParam(required = false) UUID accountId) {
    var webhooks =
        webhookService.list(RequestScopes.requirePrincipalId(), accountId).stream()
            .map(WebhookResponse::from)
            .toList();
    return ResponseEntity.ok(webhooks);
  }

  @GetMapping("/{id}")
  public ResponseEntity<WebhookResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(
        WebhookResponse.from(webhookService.get(id, RequestScopes.requirePrincipalId())));
  }

  @PostMapping
  public ResponseEntity<WebhookSecretResponse> create(
      @Valid @RequestBody CreateWebhookRequest request) {
    var webhook =
        webhookService.create(
            request.accountId(),
            request.name(),
            request.url(),
            request.events(),
            RequestScopes.requirePrincipalId());
    return ResponseEntity.created(URI.create("/api/webhooks/" + webhook.getId()))
        .body(new WebhookSecretResponse(WebhookResponse.from(webhook), webhook.getSecret()));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<WebhookResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdateWebhookRequest request) {
    var webhook =
        webhookService.update(
            id,
            request.name(),
            request.url(),
            request.events(),
            request.active(),
            RequestScopes.requirePrincipalId());
    return ResponseEntity.ok(WebhookResponse.from(webhook));
  }

  @PostMapping("/{id}/rotate-secret")
  public ResponseEntity<WebhookSecretResponse> rotateSecret(@PathVariable UUID id) {
    var webhook = webhookService.rotateSecret(id, RequestScopes.requirePrincipalId());
    return ResponseEntity.ok(
        new WebhookSecretResponse(WebhookResponse.from(webhook), webhook.getSecret()));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    webhookService.delete(id, RequestScopes.requirePrincipalId());
    return ResponseEntity.noContent().build();
  }

  public record CreateWebhookRequest(
      UUID accountId,
      @NotBlank @Size(max = 255) String name,
      @NotBlank @Size(max = 2000) String url,
      List<String> events) {}

  public record UpdateWebhookRequest(
      @Size(max = 255) String name,
      @Size(max = 2000) String url,
      List<String> events,
      Boolean active) {}

  public record WebhookResponse(
      UUID id,
      UUID accountId,
      String name,
      String url,
      List<String> events,
      boolean active,
      Instant createdAt,
      Instant updatedAt) {

    public static WebhookResponse from(Webhook webhook) {
      return new WebhookResponse(
          webhook.getId(),
          webhook.getUserId(),
          webhook.getName(),
          webhook.getUrl(),
          List.copyOf(webhook.getEvents()),
          webhook.isActive(),
          webhook.getCreatedAt(),
          webhook.getUpdatedAt());
    }
  }

  public record WebhookSecretResponse(WebhookResponse webhook, String secret) {}
}
