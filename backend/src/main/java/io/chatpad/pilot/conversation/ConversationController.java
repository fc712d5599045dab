package io.chatpad.pilot.conversation;

import io.chatpad.pilot.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

  private final ConversationService conversationService;

  public ConversationController(ConversationService conversationService) {
    this.conversationService = conversationService;
  }

  @GetMapping
  public ResponseEntity<Page<ConversationResponse>> list(
      @RequestParam(required = false) UUID accountId,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    var conversations =
        conversationService.list(
            RequestScopes.requirePrincipalId(),
            accountId,
            PageRequest.of(page, Math.min(size, 200)));
    return ResponseEntity.ok(conversations.map(ConversationResponse::from));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ConversationResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(
        ConversationResponse.from(conversationService.get(id, RequestScopes.requirePrincipalId())));
  }

  @PostMapping
  public ResponseEntity<ConversationResponse> create(
      @Valid @RequestBody CreateConversationRequest request) {
    var conversation =
        conversationService.create(
            request.accountId(),
            request.agentId(),
            request.channel(),
            RequestScopes.requirePrincipalId());
    return ResponseEntity.created(URI.create("/api/conversations/" + conversation.getId()))
        .body(ConversationResponse.from(conversation));
  }

  @PutMapping("/{id}/status")
  public ResponseEntity<ConversationResponse> updateStatus(
      @PathVariable UUID id, @Valid @RequestBody UpdateStatusRequest request) {
    var conversation =
        conversationService.updateStatus(id, request.status(), RequestScopes.requirePrincipalId());
    return ResponseEntity.ok(ConversationResponse.from(conversation));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    conversationService.delete(id, RequestScopes.requirePrincipalId());
    return ResponseEntity.noContent().build();
  }

  public record CreateConversationRequest(UUID accountId, @NotNull UUID agentId, String channel) {}

  public record UpdateStatusRequest(@NotBlank String status) {}

  public record ConversationResponse(
      UUID id,
      UUID accountId,
      UUID agentId,
      String channel,
      String status,
      Instant createdAt,
      Instant updatedAt) {

    public static ConversationResponse from(Conversation conversation) {
      return new ConversationResponse(
          conversation.getId(),
          conversation.getUserId(),
          conversation.getAgentId(),
          conversation.getChannel(),
          conversation.getStatus(),
          conversation.getCreatedAt(),
          conversation.getUpdatedAt());
    }
  }
}
