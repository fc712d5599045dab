package io.chatpad.pilot.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.chatpad.pilot.exception.ForbiddenException;
import io.chatpad.pilot.platform.PlatformAccessService;
import io.chatpad.pilot.profile.Profile;
import io.chatpad.pilot.profile.ProfileRepository;
import io.chatpad.pilot.testutil.InMemoryTransactionManager;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.aop.framework.ProxyFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.interceptor.MatchAlwaysTransactionAttributeSource;
import org.springframework.transaction.interceptor.RuleBasedTransactionAttribute;
import org.springframework.transaction.interceptor.TransactionInterceptor;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class DatabaseAuditServiceTest {

  private static final UUID ACTOR = UUID.randomUUID();

  @Mock private AuditEventRepository auditEventRepository;
  @Mock private ProfileRepository profileRepository;
  @Mock private PlatformAccessService platformAccessService;
  @Mock private PlatformTransactionManager transactionManager;

  private DatabaseAuditService service;

  @BeforeEach
  void setUp() {
    service =
        new DatabaseAuditService(
            auditEventRepository, profileRepository, platformAccessService, transactionManager);
  }

  @Test
  void enrichesActorFromProfile() {
    when(profileRepository.findByUserId(ACTOR))
        .thenReturn(Optional.of(new Profile(ACTOR, "jane@example.com", "Jane")));

    var enriched = service.enrichActor(userRecord(Map.of("reason", "x")));

    assertThat(enriched.details())
        .containsEntry("actor_name", "Jane")
        .containsEntry("actor_email", "jane@example.com")
        .containsEntry("reason", "x");
  }

  @Test
  void failedProfileLookupMarksEnrichmentFailed() {
    when(profileRepository.findByUserId(ACTOR)).thenThrow(new IllegalStateException("db down"));

    var enriched = service.enrichActor(userRecord(null));

    assertThat(enriched.details()).containsEntry("enrichment_failed", true);
    assertThat(enriched.action()).isEqualTo("api_key.revoked");
  }

  @Test
  void systemActorIsNamedSystem() {
    var record =
        new AuditEventRecord(
            "subscription.synced", "subscription", null, null, "SYSTEM", true, null, null, null);

    assertThat(service.enrichActor(record).details()).containsEntry("actor_name", "System");
    verifyNoInteractions(profileRepository);
  }

  @Test
  void explicitActorNameIsKept() {
    var enriched = service.enrichActor(userRecord(Map.of("actor_name", "Override")));

    assertThat(enriched.details()).containsEntry("actor_name", "Override");
    verifyNoInteractions(profileRepository);
  }

  @Test
  void logPersistsEnrichedEvent() {
    when(profileRepository.findByUserId(ACTOR)).thenReturn(Optional.empty());

    service.log(userRecord(null));

    var captor = ArgumentCaptor.forClass(AuditEvent.class);
    verify(auditEventRepository).saveAndFlush(captor.capture());
    assertThat(captor.getValue().getAction()).isEqualTo("api_key.revoked");
    assertThat(captor.getValue().getActorId()).isEqualTo(ACTOR);
  }

  @Test
  void failedWriteNeverPropagates() {
    when(profileRepository.findByUserId(ACTOR)).thenReturn(Optional.empty());
    when(auditEventRepository.saveAndFlush(any(AuditEvent.class)))
        .thenThrow(new DataIntegrityViolationException("constraint"));

    assertThatCode(() -> service.log(userRecord(null))).doesNotThrowAnyException();
  }

  @Test
  void failedLookupDoesNotRollBackTheAuditedAction() {
    var transactionManager = new InMemoryTransactionManager();
    when(profileRepository.findByUserId(ACTOR)).thenThrow(new IllegalStateException("db down"));
    var transactionalService =
        new DatabaseAuditService(
            auditEventRepository,
            transactionalProfiles(transactionManager),
            platformAccessService,
            transactionManager);

    assertThatCode(
            () ->
                new TransactionTemplate(transactionManager)
                    .executeWithoutResult(status -> transactionalService.log(userRecord(null))))
        .doesNotThrowAnyException();

    var captor = ArgumentCaptor.forClass(AuditEvent.class);
    verify(auditEventRepository).saveAndFlush(captor.capture());
    assertThat(captor.getValue().getDetails()).containsEntry("enrichment_failed", true);
  }

  /** Wraps the mock the way Spring Data does: read-only, joining any surrounding transaction. */
  private ProfileRepository transactionalProfiles(InMemoryTransactionManager transactionManager) {
    var attribute = new RuleBasedTransactionAttribute();
    attribute.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
    attribute.setReadOnly(true);
    var attributeSource = new MatchAlwaysTransactionAttributeSource();
    attributeSource.setTransactionAttribute(attribute);

    var proxyFactory = new ProxyFactory();
    proxyFactory.setTarget(profileRepository);
    proxyFactory.setInterfaces(ProfileRepository.class);
    proxyFactory.addAdvice(new TransactionInterceptor(transactionManager, attributeSource));
    return (ProfileRepository) proxyFactory.getProxy();
  }

  @Test
  void readsRestrictedToPilotTeam() {
    when(platformAccessService.isPilotTeamMember(ACTOR)).thenReturn(false);
    var filter = new AuditEventFilter(null, null, null, null, null, null);

    assertThatThrownBy(() -> service.findEvents(filter, PageRequest.of(0, 20), ACTOR))
        .isInstanceOf(ForbiddenException.class);
    verify(auditEventRepository, never())
        .findByFilter(any(), any(), any(), any(), any(), any(), any());
  }

  private static AuditEventRecord userRecord(Map<String, Object> details) {
    return new AuditEventRecord(
        "api_key.revoked",
        "api_key",
        UUID.randomUUID(),
        ACTOR,
        "USER",
        true,
        "10.0.0.1",
        "junit",
        details);
  }
}
