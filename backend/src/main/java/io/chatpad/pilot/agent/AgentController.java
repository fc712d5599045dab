package io.chatpad.pilot.agent;

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
@RequestMapping("/api/agents")
public class AgentController {

  private final AgentService agentService;

  public AgentController(AgentService agentService) {
    this.agentService = agentService;
  }

  @GetMapping
  public ResponseEntity<List<AgentResponse>> list(@RequestParam(required = false) UUID accountId) {
    var agents =
        agentService.list(RequestScopes.requirePrincipalId(), accountId).stream()
            .map(AgentResponse::from)
            .toList();
    return ResponseEntity.ok(agents);
  }

  @GetMapping("/{id}")
  public ResponseEntity<AgentResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(
        AgentResponse.from(agentService.get(id, RequestScopes.requirePrincipalId())));
  }

  @PostMapping
  public ResponseEntity<AgentResponse> create(@Valid @RequestBody CreateAgentRequest request) {
    var agent =
        agentService.create(
            request.accountId(),
            request.name(),
            request.description(),
            RequestScopes.requirePrincipalId());
    return ResponseEntity.created(URI.create("/api/agents/" + agent.getId()))
        .body(AgentResponse.from(agent));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<AgentResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdateAgentRequest request) {
    var agent =
        agentService.update(
            id,
            request.name(),
            request.description(),
            request.status(),
            RequestScopes.requirePrincipalId());
    return ResponseEntity.ok(AgentResponse.from(agent));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    agentService.delete(id, RequestScopes.requirePrincipalId());
    return ResponseEntity.noContent().build();
  }

  public record CreateAgentRequest(
      UUID accountId, @NotBlank @Size(max = 255) String name, String description) {}

  public record UpdateAgentRequest(
      @Size(max = 255) String name, String description, String status) {}

  public record AgentResponse(
      UUID id,
      UUID accountId,
      String name,
      String description,
      String status,
      Instant createdAt,
      Instant updatedAt) {

    public static AgentResponse from(Agent agent) {
      return new AgentResponse(
          agent.getId(),
          agent.getUserId(),
          agent.getName(),
          agent.getDescription(),
          agent.getStatus(),
          agent.getCreatedAt(),
          agent.getUpdatedAt());
    }
  }
}
