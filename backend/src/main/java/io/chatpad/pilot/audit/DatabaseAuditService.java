package io.chatpad.pilot.audit;

import io.chatpad.pilot.exception.ForbiddenException;
import io.chatpad.pilot.platform.PlatformAccessService;
import io.chatpad.pilot.profile.ProfileRepository;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Database-backed implementation of {@link AuditService}.
 *
 * <p>Transaction semantics: {@code log()} writes in its own transaction (REQUIRES_NEW), so an
 * audit entry survives a rollback of the audited operation and a failed audit insert never rolls
 * the caller back. The actor profile lookup also runs in a separate read-only transaction; a
 * failing lookup must not mark the caller's transaction rollback-only.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final ProfileRepository profileRepository;
  private final PlatformAccessService platformAccessService;
  private final TransactionTemplate requiresNew;
  private final TransactionTemplate enrichmentLookup;

  public DatabaseAuditService(
      AuditEventRepository auditEventRepository,
      ProfileRepository profileRepository,
      PlatformAccessService platformAccessService,
      PlatformTransactionManager transactionManager) {
    this.auditEventRepository = auditEventRepository;
    this.profileRepository = profileRepository;
    this.platformAccessService = platformAccessService;
    this.requiresNew = new TransactionTemplate(transactionManager);
    this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.enrichmentLookup = new TransactionTemplate(transactionManager);
    this.enrichmentLookup.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.enrichmentLookup.setReadOnly(true);
  }

  @Override
  public void log(AuditEventRecord record) {
    try {
      var enrichedRecord = enrichActor(record);
      requiresNew.executeWithoutResult(
          status -> auditEventRepository.saveAndFlush(new AuditEvent(enrichedRecord)));
      log.debug(
          "Recorded audit event: action={}, resource={}/{}, actor={}",
          record.action(),
          record.resourceType(),
          record.resourceId(),
          record.actorId());
    } catch (RuntimeException e) {
      log.warn(
          "Failed to record audit event: action={}, resource={}/{}, actor={}",
          record.action(),
          record.resourceType(),
          record.resourceId(),
          record.actorId(),
          e);
    }
  }

  /**
   * Adds {@code actor_name} and {@code actor_email} from the actor's profile unless the caller
   * already set them. A failing lookup keeps the record and marks it {@code enrichment_failed}.
   */
  AuditEventRecord enrichActor(AuditEventRecord record) {
    var details =
        new HashMap<String, Object>(record.details() != null ? record.details() : Map.of());
    if (details.containsKey("actor_name")) {
      return record.withDetails(details);
    }
    if (record.actorId() != null && "USER".equals(record.actorType())) {
      try {
        enrichmentLookup.executeWithoutResult(
            status ->
                profileRepository
                    .findByUserId(record.actorId())
                    .ifPresent(
                        profile -> {
                          if (profile.getDisplayName() != null) {
                            details.put("actor_name", profile.getDisplayName());
                          }
                          if (profile.getEmail() != null) {
                            details.put("actor_email", profile.getEmail());
                          }
                        }));
      } catch (RuntimeException e) {
        log.warn("Audit actor enrichment failed for actor={}", record.actorId(), e);
        details.put("enrichment_failed", true);
      }
    } else if (record.actorId() == null) {
      details.put("actor_name", "System");
    }
    return record.withDetails(details);
  }

  @Override
  @Transactional(readOnly = true)
  public Page<AuditEvent> findEvents(
      AuditEventFilter filter, Pageable pageable, UUID principalId) {
    if (!platformAccessService.isPilotTeamMember(principalId)) {
      throw new ForbiddenException(
          "Cannot read audit events", "Only platform operations staff may read the audit trail");
    }
    return auditEventRepository.findByFilter(
        filter.resourceType(),
        filter.resourceId(),
        filter.actorId(),
        filter.actionPrefix(),
        filter.from(),
        filter.to(),
        pageable);
  }
}
