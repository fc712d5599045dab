package io.chatpad.pilot.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Transactional email template with {@code {{variable}}} placeholders. {@code variables} maps each
 * placeholder name to its type hint.
 */
@Entity
@Table(name = "email_templates")
public class EmailTemplate {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([a-zA-Z0-9_]+)\\s*}}");

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, unique = true, length = 100)
  private String name;

  @Column(name = "subject", nullable = false, length = 500)
  private String subject;

  @Column(name = "html_content", nullable = false, columnDefinition = "TEXT")
  private String htmlContent;

  @Column(name = "text_content", columnDefinition = "TEXT")
  private String textContent;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "variables", columnDefinition = "jsonb")
  private Map<String, Object> variables;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected EmailTemplate() {}

  public EmailTemplate(
      String name,
      String subject,
      String htmlContent,
      String textContent,
      Map<String, Object> variables) {
    this.name = name;
    this.subject = subject;
    this.htmlContent = htmlContent;
    this.textContent = textContent;
    this.variables = variables != null ? new HashMap<>(variables) : new HashMap<>();
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(
      String subject, String htmlContent, String textContent, Map<String, Object> variables) {
    if (subject != null) {
      this.subject = subject;
    }
    if (htmlContent != null) {
      this.htmlContent = htmlContent;
    }
    if (textContent != null) {
      this.textContent = textContent;
    }
    if (variables != null) {
      this.variables = new HashMap<>(variables);
    }
    this.updatedAt = Instant.now();
  }

  public void setActive(boolean active) {
    this.active = active;
    this.updatedAt = Instant.now();
  }

  /** Substitutes placeholders; unknown placeholders are left as written. */
  public Rendered render(Map<String, String> values) {
    return new Rendered(
        substitute(subject, values),
        substitute(htmlContent, values),
        textContent != null ? substitute(textContent, values) : null);
  }

  static String substitute(String template, Map<String, String> values) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String value = values.get(matcher.group(1));
      matcher.appendReplacement(
          out, Matcher.quoteReplacement(value != null ? value : matcher.group(0)));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getSubject() {
    return subject;
  }

  public String getHtmlContent() {
    return htmlContent;
  }

  public String getTextContent() {
    return textContent;
  }

  public Map<String, Object> getVariables() {
    return variables;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public record Rendered(String subject, String html, String text) {}
}
