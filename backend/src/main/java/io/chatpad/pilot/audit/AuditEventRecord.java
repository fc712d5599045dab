package io.chatpad.pilot.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Built by {@link
 * AuditEventBuilder}, which fills in actor and request metadata.
 *
 * @param action event name following the {@code {resource}.{verb}} convention
 * @param resourceType the kind of resource affected (e.g. "api_key", "team_member")
 * @param resourceId id of the affected resource; not a foreign key, the row may be gone later
 * @param actorId principal performing the action; null for system actions
 * @param actorType USER, SYSTEM or INTERNAL
 * @param success whether the audited action succeeded
 * @param ipAddress client IP; null outside HTTP requests
 * @param userAgent truncated User-Agent header; null outside HTTP requests
 * @param details free-form JSONB payload; nullable
 */
public record AuditEventRecord(
    String action,
    String resourceType,
    UUID resourceId,
    UUID actorId,
    String actorType,
    boolean success,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {

  public AuditEventRecord withDetails(Map<String, Object> newDetails) {
    return new AuditEventRecord(
        action,
        resourceType,
        resourceId,
        actorId,
        actorType,
        success,
        ipAddress,
        userAgent,
        newDetails);
  }
}
