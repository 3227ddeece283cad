package io.onschedule.core.notification;

import io.onschedule.core.integration.email.RenderedEmail;
import java.util.Map;

/**
 * What to send for one reminder email. When {@code providerTemplateId} is set the primary provider
 * renders its hosted template from {@code templateData}; {@code content} is the locally rendered
 * version used otherwise and by the fallback provider.
 */
public record ReminderEmail(
    String providerTemplateId, Map<String, Object> templateData, RenderedEmail content) {

  public static ReminderEmail plainText(String subject, String body) {
    return new ReminderEmail(null, Map.of(), new RenderedEmail(subject, null, body));
  }

  public boolean usesProviderTemplate() {
    return providerTemplateId != null;
  }
}
