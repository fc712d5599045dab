package io.chatpad.pilot.audit;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/** Records and queries the platform audit trail. */
public interface AuditService {

  /**
   * Records a single audit event. Never throws: a failed write is logged and dropped so that the
   * audited action is not rolled back or blocked by the audit trail.
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);

  /**
   * Queries audit events. Only platform operations staff ({@code super_admin} or {@code
   * pilot_support}) may read the audit trail.
   *
   * @param filter optional resource, actor, action-prefix and time-range filters
   * @param pageable pagination parameters
   * @param principalId the reader
   * @return a page of matching events, newest first
   */
  Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable, UUID principalId);
}
