package io.chatpad.pilot.content;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.chatpad.pilot.audit.AuditEventRecord;
import io.chatpad.pilot.audit.AuditService;
import io.chatpad.pilot.exception.ForbiddenException;
import io.chatpad.pilot.exception.ResourceConflictException;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.platform.AdminPermission;
import io.chatpad.pilot.platform.PlatformAccessService;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmailTemplateServiceTest {

  private static final UUID EDITOR = UUID.randomUUID();

  @Mock private EmailTemplateRepository templateRepository;
  @Mock private PlatformAccessService platformAccessService;
  @Mock private AuditService auditService;
  @InjectMocks private EmailTemplateService service;

  @Test
  void publicLookupOnlyFindsActiveTemplates() {
    when(templateRepository.findByNameAndActiveTrue("welcome")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getActive("welcome"))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(templateRepository, never()).findByName(any());
  }

  @Test
  void listingNeedsViewContent() {
    when(platformAccessService.hasAdminPermission(EDITOR, AdminPermission.VIEW_CONTENT))
        .thenReturn(false);

    assertThatThrownBy(() -> service.listAll(EDITOR)).isInstanceOf(ForbiddenException.class);
    verifyNoInteractions(templateRepository);
  }

  @Test
  void viewerSeesInactiveTemplatesToo() {
    var inactive = template("digest");
    inactive.setActive(false);
    when(platformAccessService.hasAdminPermission(EDITOR, AdminPermission.VIEW_CONTENT))
        .thenReturn(true);
    when(templateRepository.findAllByOrderByNameAsc())
        .thenReturn(List.of(inactive, template("welcome")));

    assertThat(service.listAll(EDITOR)).hasSize(2);
  }

  @Test
  void viewContentAloneCannotEdit() {
    when(platformAccessService.hasAdminPermission(EDITOR, AdminPermission.MANAGE_CONTENT))
        .thenReturn(false);

    assertThatThrownBy(
            () -> service.update("welcome", "Hi", null, null, null, false, EDITOR))
        .isInstanceOf(ForbiddenException.class);
    verifyNoInteractions(templateRepository, auditService);
  }

  @Test
  void deactivatingIsAuditedAndHidesFromPublicLookup() {
    var welcome = template("welcome");
    when(platformAccessService.hasAdminPermission(EDITOR, AdminPermission.MANAGE_CONTENT))
        .thenReturn(true);
    when(templateRepository.findByName("welcome")).thenReturn(Optional.of(welcome));

    service.update("welcome", null, null, null, null, false, EDITOR);

    assertThat(welcome.isActive()).isFalse();
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().action()).isEqualTo("email_template.updated");
    assertThat(captor.getValue().details()).containsEntry("active", false);
  }

  @Test
  void duplicateNameIsRejected() {
    when(platformAccessService.hasAdminPermission(EDITOR, AdminPermission.MANAGE_CONTENT))
        .thenReturn(true);
    when(templateRepository.existsByName("welcome")).thenReturn(true);

    assertThatThrownBy(
            () -> service.create("welcome", "Hi", "<p>Hi</p>", null, Map.of(), EDITOR))
        .isInstanceOf(ResourceConflictException.class);
    verify(templateRepository, never()).save(any());
  }

  @Test
  void previewRendersInactiveTemplate() {
    var digest = template("digest");
    digest.setActive(false);
    when(platformAccessService.hasAdminPermission(EDITOR, AdminPermission.VIEW_CONTENT))
        .thenReturn(true);
    when(templateRepository.findByName("digest")).thenReturn(Optional.of(digest));

    var rendered = service.preview("digest", Map.of("name", "Ada"), EDITOR);

    assertThat(rendered.subject()).isEqualTo("Hello Ada");
  }

  private static EmailTemplate template(String name) {
    return new EmailTemplate(name, "Hello {{name}}", "<p>Hello {{name}}</p>", null, Map.of());
  }
}
