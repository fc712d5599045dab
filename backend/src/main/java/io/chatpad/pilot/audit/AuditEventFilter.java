package io.chatpad.pilot.audit;

import java.time.Instant;
import java.util.UUID;

/** Optional filters for audit queries; null means "no filter on this field". */
public record AuditEventFilter(
    String resourceType,
    UUID resourceId,
    UUID actorId,
    String actionPrefix,
    Instant from,
    Instant to) {}
