package io.chatpad.pilot.audit;

import java.time.Instant;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  /**
   * JPQL query with nullable filters, each written as {@code (:param IS NULL OR e.field = :param)}.
   * The action filter is a prefix match. Results are ordered newest first.
   */
  @Query(
      """
      SELECT e FROM AuditEvent e
      WHERE (:resourceType IS NULL OR e.resourceType = :resourceType)
        AND (:resourceId IS NULL OR e.resourceId = :resourceId)
        AND (:actorId IS NULL OR e.actorId = :actorId)
        AND (CAST(:actionPrefix AS string) IS NULL
             OR e.action LIKE CONCAT(CAST(:actionPrefix AS string), '%'))
        AND (CAST(:from AS timestamp) IS NULL OR e.occurredAt >= :from)
        AND (CAST(:to AS timestamp) IS NULL OR e.occurredAt < :to)
      ORDER BY e.occurredAt DESC
      """)
  Page<AuditEvent> findByFilter(
      @Param("resourceType") String resourceType,
      @Param("resourceId") UUID resourceId,
      @Param("actorId") UUID actorId,
      @Param("actionPrefix") String actionPrefix,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);
}
