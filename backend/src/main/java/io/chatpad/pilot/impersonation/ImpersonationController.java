package io.chatpad.pilot.impersonation;

import io.chatpad.pilot.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/impersonation")
public class ImpersonationController {

  private final ImpersonationService impersonationService;

  public ImpersonationController(ImpersonationService impersonationService) {
    this.impersonationService = impersonationService;
  }

  @PostMapping
  public ResponseEntity<ImpersonationService.StartResult> start(
      @Valid @RequestBody StartRequest request) {
    var result =
        impersonationService.start(
            RequestScopes.requirePrincipalId(), request.targetUserId(), request.reason());
    return ResponseEntity.ok(result);
  }

  @PostMapping("/{sessionId}/end")
  public ResponseEntity<ImpersonationService.EndResult> end(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(
        impersonationService.end(RequestScopes.requirePrincipalId(), sessionId));
  }

  @GetMapping("/current")
  public ResponseEntity<SessionResponse> current() {
    return impersonationService
        .findActiveSession(RequestScopes.requirePrincipalId())
        .map(
            s ->
                ResponseEntity.ok(
                    new SessionResponse(
                        s.getId(), s.getTargetUserId(), s.getReason(), s.getStartedAt())))
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  public record StartRequest(@NotNull UUID targetUserId, @NotBlank String reason) {}

  public record SessionResponse(
      UUID sessionId, UUID targetUserId, String reason, Instant startedAt) {}
}
