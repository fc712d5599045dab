package io.chatpad.pilot.apikey;

import io.chatpad.pilot.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/api-keys")
public class ApiKeyController {

  private final ApiKeyService apiKeyService;

  public ApiKeyController(ApiKeyService apiKeyService) {
    this.apiKeyService = apiKeyService;
  }

  @GetMapping
  public ResponseEntity<List<ApiKeyResponse>> list(@RequestParam(required = false) UUID accountId) {
    var keys =
        apiKeyService.list(RequestScopes.requirePrincipalId(), accountId).stream()
            .map(ApiKeyResponse::from)
            .toList();
    return ResponseEntity.ok(keys);
  }

  @GetMapping("/{id}")
  public ResponseEntity<ApiKeyResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(
        ApiKeyResponse.from(apiKeyService.get(id, RequestScopes.requirePrincipalId())));
  }

  @PostMapping
  public ResponseEntity<CreatedApiKeyResponse> create(
      @Valid @RequestBody CreateApiKeyRequest request) {
    var created =
        apiKeyService.create(
            request.accountId(),
            request.name(),
            request.agentId(),
            RequestScopes.requirePrincipalId());
    return ResponseEntity.created(URI.create("/api/api-keys/" + created.apiKey().getId()))
        .body(new CreatedApiKeyResponse(ApiKeyResponse.from(created.apiKey()), created.rawKey()));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<ApiKeyResponse> rename(
      @PathVariable UUID id, @Valid @RequestBody RenameApiKeyRequest request) {
    return ResponseEntity.ok(
        ApiKeyResponse.from(
            apiKeyService.rename(id, request.name(), RequestScopes.requirePrincipalId())));
  }

  @PostMapping("/{id}/revoke")
  public ResponseEntity<ApiKeyResponse> revoke(@PathVariable UUID id) {
    return ResponseEntity.ok(
        ApiKeyResponse.from(apiKeyService.revoke(id, RequestScopes.requirePrincipalId())));
  }

  public record CreateApiKeyRequest(
      UUID accountId, @NotBlank @Size(max = 255) String name, UUID agentId) {}

  public record RenameApiKeyRequest(@NotBlank @Size(max = 255) String name) {}

  public record ApiKeyResponse(
      UUID id,
      UUID accountId,
      UUID agentId,
      String name,
      String keyPrefix,
      boolean revoked,
      Instant lastUsedAt,
      Instant createdAt) {

    public static ApiKeyResponse from(ApiKey key) {
      return new ApiKeyResponse(
          key.getId(),
          key.getUserId(),
          key.getAgentId(),
          key.getName(),
          key.getKeyPrefix(),
          key.isRevoked(),
          key.getLastUsedAt(),
          key.getCreatedAt());
    }
  }

  /** {@code key} is shown once, at creation. */
  public record CreatedApiKeyResponse(ApiKeyResponse apiKey, String key) {}
}
