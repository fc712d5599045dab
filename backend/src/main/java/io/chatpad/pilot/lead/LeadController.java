package io.chatpad.pilot.lead;

import io.chatpad.pilot.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
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
@RequestMapping("/api/leads")
public class LeadController {

  private final LeadService leadService;

  public LeadController(LeadService leadService) {
    this.leadService = leadService;
  }

  @GetMapping
  public ResponseEntity<Page<LeadResponse>> list(
      @RequestParam(required = false) UUID accountId,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    var leads =
        leadService.list(
            RequestScopes.requirePrincipalId(),
            accountId,
            PageRequest.of(page, Math.min(size, 200)));
    return ResponseEntity.ok(leads.map(LeadResponse::from));
  }

  @GetMapping("/{id}")
  public ResponseEntity<LeadResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(
        LeadResponse.from(leadService.get(id, RequestScopes.requirePrincipalId())));
  }

  @PostMapping
  public ResponseEntity<LeadResponse> create(@Valid @RequestBody CreateLeadRequest request) {
    var lead =
        leadService.create(
            request.accountId(),
            new LeadService.LeadDraft(
                request.agentId(),
                request.conversationId(),
                request.name(),
                request.email(),
                request.phone(),
                request.data()),
            RequestScopes.requirePrincipalId());
    return ResponseEntity.created(URI.create("/api/leads/" + lead.getId()))
        .body(LeadResponse.from(lead));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<LeadResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdateLeadRequest request) {
    var lead =
        leadService.update(
            id,
            request.name(),
            request.email(),
            request.phone(),
            request.status(),
            request.data(),
            RequestScopes.requirePrincipalId());
    return ResponseEntity.ok(LeadResponse.from(lead));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    leadService.delete(id, RequestScopes.requirePrincipalId());
    return ResponseEntity.noContent().build();
  }

  public record CreateLeadRequest(
      UUID accountId,
      UUID agentId,
      UUID conversationId,
      @Size(max = 255) String name,
      @Email String email,
      @Size(max = 50) String phone,
      Map<String, Object> data) {}

  public record UpdateLeadRequest(
      @Size(max = 255) String name,
      @Email String email,
      @Size(max = 50) String phone,
      @Size(max = 30) String status,
      Map<String, Object> data) {}

  public record LeadResponse(
      UUID id,
      UUID accountId,
      UUID agentId,
      UUID conversationId,
      String name,
      String email,
      String phone,
      String status,
      Map<String, Object> data,
      Instant createdAt,
      Instant updatedAt) {

    public static LeadResponse from(Lead lead) {
      return new LeadResponse(
          lead.getId(),
          lead.getUserId(),
          lead.getAgentId(),
          lead.getConversationId(),
          lead.getName(),
          lead.getEmail(),
          lead.getPhone(),
          lead.getStatus(),
          lead.getData(),
          lead.getCreatedAt(),
          lead.getUpdatedAt());
    }
  }
}
