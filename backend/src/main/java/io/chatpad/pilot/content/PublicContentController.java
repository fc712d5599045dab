package io.chatpad.pilot.content;

import io.chatpad.pilot.content.ContentResponses.ArticleResponse;
import io.chatpad.pilot.content.ContentResponses.CategoryResponse;
import io.chatpad.pilot.content.ContentResponses.EmailTemplateResponse;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Unauthenticated reads of published content. */
@RestController
@RequestMapping("/api/public")
public class PublicContentController {

  private final HelpCenterService helpCenterService;
  private final EmailTemplateService emailTemplateService;

  public PublicContentController(
      HelpCenterService helpCenterService, EmailTemplateService emailTemplateService) {
    this.helpCenterService = helpCenterService;
    this.emailTemplateService = emailTemplateService;
  }

  @GetMapping("/help-center/categories")
  public ResponseEntity<List<CategoryResponse>> listCategories() {
    return ResponseEntity.ok(
        helpCenterService.listCategories().stream().map(CategoryResponse::from).toList());
  }

  @GetMapping("/help-center/articles")
  public ResponseEntity<List<ArticleResponse>> listArticles(
      @RequestParam(required = false) String category) {
    return ResponseEntity.ok(
        helpCenterService.listPublishedArticles(category).stream()
            .map(ArticleResponse::from)
            .toList());
  }

  @GetMapping("/help-center/articles/{categorySlug}/{slug}")
  public ResponseEntity<ArticleResponse> getArticle(
      @PathVariable String categorySlug, @PathVariable String slug) {
    return ResponseEntity.ok(
        ArticleResponse.from(helpCenterService.getPublishedArticle(categorySlug, slug)));
  }

  @GetMapping("/email-templates/{name}")
  public ResponseEntity<EmailTemplateResponse> getEmailTemplate(@PathVariable String name) {
    return ResponseEntity.ok(EmailTemplateResponse.from(emailTemplateService.getActive(name)));
  }
}
