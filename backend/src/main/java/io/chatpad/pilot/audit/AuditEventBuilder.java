package io.chatpad.pilot.audit;

import io.chatpad.pilot.context.RequestScopes;
import io.chatpad.pilot.security.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builds an {@link AuditEventRecord}, filling actor and request metadata from the current request
 * when they are not set explicitly.
 *
 * <p>Required fields: {@code action} and {@code resourceType}.
 *
 * <pre>{@code
 * auditService.log(
 *     AuditEventBuilder.builder()
 *         .action("api_key.revoked")
 *         .resourceType("api_key")
 *         .resourceId(key.getId())
 *         .details(Map.of("account_id", key.getUserId()))
 *         .build());
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;

  private String action;
  private String resourceType;
  private UUID resourceId;
  private UUID actorId;
  private String actorType;
  private boolean success = true;
  private Map<String, Object> details;

  private boolean actorIdExplicitlySet;
  private boolean actorTypeExplicitlySet;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder action(String action) {
    this.action = action;
    return this;
  }

  public AuditEventBuilder resourceType(String resourceType) {
    this.resourceType = resourceType;
    return this;
  }

  public AuditEventBuilder resourceId(UUID resourceId) {
    this.resourceId = resourceId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder actorType(String actorType) {
    this.actorType = actorType;
    this.actorTypeExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder success(boolean success) {
    this.success = success;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the record. Unless set explicitly:
   *
   * <ul>
   *   <li>{@code actorId} comes from {@link RequestScopes} when a principal is bound
   *   <li>{@code actorType} is "USER" when an actor is known, "SYSTEM" otherwise
   *   <li>{@code ipAddress} and {@code userAgent} come from the current servlet request
   * </ul>
   */
  public AuditEventRecord build() {
    if (action == null || resourceType == null) {
      throw new IllegalStateException("Audit events require action and resourceType");
    }

    UUID resolvedActorId = this.actorId;
    if (!actorIdExplicitlySet) {
      resolvedActorId = RequestScopes.getPrincipalIdOrNull();
    }

    String resolvedActorType = this.actorType;
    if (!actorTypeExplicitlySet) {
      resolvedActorType = resolvedActorId != null ? "USER" : "SYSTEM";
    }

    String resolvedIpAddress = null;
    String resolvedUserAgent = null;
    HttpServletRequest request = resolveHttpRequest();
    if (request != null) {
      resolvedIpAddress = ClientIpResolver.resolve(request);
      String ua = request.getHeader("User-Agent");
      if (ua != null && ua.length() > MAX_USER_AGENT_LENGTH) {
        ua = ua.substring(0, MAX_USER_AGENT_LENGTH);
      }
      resolvedUserAgent = ua;
    }

    return new AuditEventRecord(
        action,
        resourceType,
        resourceId,
        resolvedActorId,
        resolvedActorType,
        success,
        resolvedIpAddress,
        resolvedUserAgent,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
