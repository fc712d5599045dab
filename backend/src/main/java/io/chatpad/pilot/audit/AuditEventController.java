package io.chatpad.pilot.audit;

import io.chatpad.pilot.context.RequestScopes;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuditEventController {

  private final AuditService auditService;

  public AuditEventController(AuditService auditService) {
    this.auditService = auditService;
  }

  @GetMapping("/api/admin/audit-events")
  public ResponseEntity<Page<AuditEventResponse>> listAuditEvents(
      @RequestParam(required = false) String resourceType,
      @RequestParam(required = false) UUID resourceId,
      @RequestParam(required = false) UUID actorId,
      @RequestParam(required = false) String action,
      @RequestParam(required = false) Instant from,
      @RequestParam(required = false) Instant to,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {

    var filter = new AuditEventFilter(resourceType, resourceId, actorId, action, from, to);
    var pageable = PageRequest.of(page, Math.min(size, 200));
    var events = auditService.findEvents(filter, pageable, RequestScopes.requirePrincipalId());

    return ResponseEntity.ok(events.map(AuditEventResponse::from));
  }

  public record AuditEventResponse(
      UUID id,
      String action,
      String resourceType,
      UUID resourceId,
      UUID actorId,
      String actorType,
      boolean success,
      String ipAddress,
      Map<String, Object> details,
      Instant occurredAt) {

    public static AuditEventResponse from(AuditEvent event) {
      return new AuditEventResponse(
          event.getId(),
          event.getAction(),
          event.getResourceType(),
          event.getResourceId(),
          event.getActorId(),
          event.getActorType(),
          event.isSuccess(),
          event.getIpAddress(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }
}
