package io.onschedule.core.integration.email;

import java.util.Map;
import java.util.Objects;

/** An email whose content lives in a provider-hosted template filled from {@code templateData}. */
public record TemplateEmailMessage(
    String to, String templateId, Map<String, Object> templateData, String replyTo) {

  public TemplateEmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(templateId, "templateId");
    templateData = templateData == null ? Map.of() : Map.copyOf(templateData);
  }
}
