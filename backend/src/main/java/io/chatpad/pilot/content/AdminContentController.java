package io.chatpad.pilot.content;

import io.chatpad.pilot.content.ContentResponses.ArticleResponse;
import io.chatpad.pilot.content.ContentResponses.CategoryResponse;
import io.chatpad.pilot.content.ContentResponses.EmailTemplateResponse;
import io.chatpad.pilot.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
public class AdminContentController {

  private static final String SLUG = "^[a-z0-9]+(?:-[a-z0-9]+)*$";

  private final HelpCenterService helpCenterService;
  private final EmailTemplateService emailTemplateService;

  public AdminContentController(
      HelpCenterService helpCenterService, EmailTemplateService emailTemplateService) {
    this.helpCenterService = helpCenterService;
    this.emailTemplateService = emailTemplateService;
  }

  // --- help categories ---

  @PostMapping("/help-center/categories")
  public ResponseEntity<CategoryResponse> createCategory(
      @Valid @RequestBody CreateCategoryRequest request) {
    var category =
        helpCenterService.createCategory(
            request.name(),
            request.slug(),
            request.description(),
            request.orderIndex() != null ? request.orderIndex() : 0,
            RequestScopes.requirePrincipalId());
    return ResponseEntity.created(
            URI.create("/api/admin/help-center/categories/" + category.getId()))
        .body(CategoryResponse.from(category));
  }

  @PatchMapping("/help-center/categories/{id}")
  public ResponseEntity<CategoryResponse> updateCategory(
      @PathVariable UUID id, @Valid @RequestBody UpdateCategoryRequest request) {
    var category =
        helpCenterService.updateCategory(
            id,
            request.name(),
            request.description(),
            request.color(),
            request.iconName(),
            request.orderIndex(),
            RequestScopes.requirePrincipalId());
    return ResponseEntity.ok(CategoryResponse.from(category));
  }

  @DeleteMapping("/help-center/categories/{id}")
  public ResponseEntity<Void> deleteCategory(@PathVariable UUID id) {
    helpCenterService.deleteCategory(id, RequestScopes.requirePrincipalId());
    return ResponseEntity.noContent().build();
  }

  // --- help articles ---

  @GetMapping("/help-center/articles")
  public ResponseEntity<List<ArticleResponse>> listArticles() {
    return ResponseEntity.ok(
        helpCenterService.listAllArticles(RequestScopes.requirePrincipalId()).stream()
            .map(ArticleResponse::from)
            .toList());
  }

  @GetMapping("/help-center/articles/{id}")
  public ResponseEntity<ArticleResponse> getArticle(@PathVariable UUID id) {
    return ResponseEntity.ok(
        ArticleResponse.from(helpCenterService.getArticle(id, RequestScopes.requirePrincipalId())));
  }

  @PostMapping("/help-center/articles")
  public ResponseEntity<ArticleResponse> createArticle(
      @Valid @RequestBody CreateArticleRequest request) {
    var article =
        helpCenterService.createArticle(
            request.categoryId(),
            request.title(),
            request.slug(),
            request.description(),
            request.content(),
            request.orderIndex() != null ? request.orderIndex() : 0,
            RequestScopes.requirePrincipalId());
    return ResponseEntity.created(URI.create("/api/admin/help-center/articles/" + article.getId()))
        .body(ArticleResponse.from(article));
  }

  @PatchMapping("/help-center/articles/{id}")
  public ResponseEntity<ArticleResponse> updateArticle(
      @PathVariable UUID id, @Valid @RequestBody UpdateArticleRequest request) {
    var article =
        helpCenterService.updateArticle(
            id,
            request.categoryId(),
            request.title(),
            request.description(),
            request.content(),
            request.orderIndex(),
            RequestScopes.requirePrincipalId());
    return ResponseEntity.ok(ArticleResponse.from(article));
  }

  @PostMapping("/help-center/articles/{id}/publish")
  public ResponseEntity<ArticleResponse> publish(@PathVariable UUID id) {
    return ResponseEntity.ok(
        ArticleResponse.from(
            helpCenterService.setPublished(id, true, RequestScopes.requirePrincipalId())));
  }

  @PostMapping("/help-center/articles/{id}/unpublish")
  public ResponseEntity<ArticleResponse> unpublish(@PathVariable UUID id) {
    return ResponseEntity.ok(
        ArticleResponse.from(
            helpCenterService.setPublished(id, false, RequestScopes.requirePrincipalId())));
  }

  @DeleteMapping("/help-center/articles/{id}")
  public ResponseEntity<Void> deleteArticle(@PathVariable UUID id) {
    helpCenterService.deleteArticle(id, RequestScopes.requirePrincipalId());
    return ResponseEntity.noContent().build();
  }

  // --- email templates ---

  @GetMapping("/email-templates")
  public ResponseEntity<List<EmailTemplateResponse>> listTemplates() {
    return ResponseEntity.ok(
        emailTemplateService.listAll(RequestScopes.requirePrincipalId()).stream()
            .map(EmailTemplateResponse::from)
            .toList());
  }

  @PostMapping("/email-templates")
  public ResponseEntity<EmailTemplateResponse> createTemplate(
      @Valid @RequestBody CreateTemplateRequest request) {
    var template =
        emailTemplateService.create(
            request.name(),
            request.subject(),
            request.htmlContent(),
            request.textContent(),
            request.variables(),
            RequestScopes.requirePrincipalId());
    return ResponseEntity.created(URI.create("/api/admin/email-templates/" + template.getName()))
        .body(EmailTemplateResponse.from(template));
  }

  @PatchMapping("/email-templates/{name}")
  public ResponseEntity<EmailTemplateResponse> updateTemplate(
      @PathVariable String name, @Valid @RequestBody UpdateTemplateRequest request) {
    var template =
        emailTemplateService.update(
            name,
            request.subject(),
            request.htmlContent(),
            request.textContent(),
            request.variables(),
            request.active(),
            RequestScopes.requirePrincipalId());
    return ResponseEntity.ok(EmailTemplateResponse.from(template));
  }

  @PostMapping("/email-templates/{name}/preview")
  public ResponseEntity<EmailTemplate.Rendered> preview(
      @PathVariable String name, @RequestBody(required = false) Map<String, String> values) {
    return ResponseEntity.ok(
        emailTemplateService.preview(name, values, RequestScopes.requirePrincipalId()));
  }

  public record CreateCategoryRequest(
      @NotBlank @Size(max = 255) String name,
      @NotBlank @Pattern(regexp = SLUG) String slug,
      String description,
      Integer orderIndex) {}

  public record UpdateCategoryRequest(
      @Size(max = 255) String name,
      String description,
      String color,
      String iconName,
      Integer orderIndex) {}

  public record CreateArticleRequest(
      @NotNull UUID categoryId,
      @NotBlank @Size(max = 255) String title,
      @NotBlank @Pattern(regexp = SLUG) String slug,
      String description,
      @NotBlank String content,
      Integer orderIndex) {}

  public record UpdateArticleRequest(
      UUID categoryId,
      @Size(max = 255) String title,
      String description,
      String content,
      Integer orderIndex) {}

  public record CreateTemplateRequest(
      @NotBlank @Size(max = 100) String name,
      @NotBlank String subject,
      @NotBlank String htmlContent,
      String textContent,
      Map<String, Object> variables) {}

  public record UpdateTemplateRequest(
      String subject,
      String htmlContent,
      String textContent,
      Map<String, Object> variables,
      Boolean active) {}
}
