package io.chatpad.pilot.content;

import io.chatpad.pilot.audit.AuditEventBuilder;
import io.chatpad.pilot.audit.AuditService;
import io.chatpad.pilot.exception.ForbiddenException;
import io.chatpad.pilot.exception.ResourceConflictException;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.platform.AdminPermission;
import io.chatpad.pilot.platform.PlatformAccessService;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class EmailTemplateService {

  private final EmailTemplateRepository templateRepository;
  private final PlatformAccessService platformAccessService;
  private final AuditService auditService;

  public EmailTemplateService(
      EmailTemplateRepository templateRepository,
      PlatformAccessService platformAccessService,
      AuditService auditService) {
    this.templateRepository = templateRepository;
    this.platformAccessService = platformAccessService;
    this.auditService = auditService;
  }

  /** Public lookup. Inactive templates are reported as not found. */
  @Transactional(readOnly = true)
  public EmailTemplate getActive(String name) {
    return templateRepository
        .findByNameAndActiveTrue(name)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Email template not found", "No active template named " + name));
  }

  @Transactional(readOnly = true)
  public List<EmailTemplate> listAll(UUID principalId) {
    requirePermission(principalId, AdminPermission.VIEW_CONTENT);
    return templateRepository.findAllByOrderByNameAsc();
  }

  @Transactional
  public EmailTemplate create(
      String name,
      String subject,
      String htmlContent,
      String textContent,
      Map<String, Object> variables,
      UUID principalId) {
    requirePermission(principalId, AdminPermission.MANAGE_CONTENT);
    if (templateRepository.existsByName(name)) {
      throw new ResourceConflictException(
          "Email template exists", "A template named '" + name + "' already exists");
    }
    return templateRepository.save(
        new EmailTemplate(name, subject, htmlContent, textContent, variables));
  }

  @Transactional
  public EmailTemplate update(
      String name,
      String subject,
      String htmlContent,
      String textContent,
      Map<String, Object> variables,
      Boolean active,
      UUID principalId) {
    requirePermission(principalId, AdminPermission.MANAGE_CONTENT);
    var template = findByName(name);
    template.update(subject, htmlContent, textContent, variables);
    if (active != null) {
      template.setActive(active);
    }
    auditService.log(
        AuditEventBuilder.builder()
            .action("email_template.updated")
            .resourceType("email_template")
            .resourceId(template.getId())
            .actorId(principalId)
            .details(Map.of("name", name, "active", template.isActive()))
            .build());
    return template;
  }

  /** Renders any template, active or not, with sample values. */
  @Transactional(readOnly = true)
  public EmailTemplate.Rendered preview(String name, Map<String, String> values, UUID principalId) {
    requirePermission(principalId, AdminPermission.VIEW_CONTENT);
    return findByName(name).render(values != null ? values : Map.of());
  }

  private EmailTemplate findByName(String name) {
    return templateRepository
        .findByName(name)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Email template not found", "No template named " + name));
  }

  private void requirePermission(UUID principalId, String capability) {
    if (!platformAccessService.hasAdminPermission(principalId, capability)) {
      throw new ForbiddenException(
          "Insufficient content permission", "The " + capability + " permission is required");
    }
  }
}
