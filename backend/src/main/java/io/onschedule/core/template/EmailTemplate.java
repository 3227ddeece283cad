package io.onschedule.core.template;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Reusable reminder email. {@code providerTemplateId} points at the dynamic template hosted by the
 * primary provider; {@code content} keeps the raw markup (with {@code {{variable}}} placeholders)
 * used when a send has to be compiled locally for the fallback provider.
 */
@Entity
@Table(name = "email_templates")
public class EmailTemplate {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "subject", length = 500)
  private String subject;

  @Column(name = "content", length = 20000)
  private String content;

  @Column(name = "provider_template_id", length = 100)
  private String providerTemplateId;

  @Column(name = "deleted", nullable = false)
  private boolean deleted;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected EmailTemplate() {}

  public EmailTemplate(String name, String subject, String content, String providerTemplateId) {
    this.name = name;
    this.subject = subject;
    this.content = content;
    this.providerTemplateId = providerTemplateId;
    this.deleted = false;
    this.createdAt = Instant.now();
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

  public String getContent() {
    return content;
  }

  public String getProviderTemplateId() {
    return providerTemplateId;
  }

  public boolean isDeleted() {
    return deleted;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
