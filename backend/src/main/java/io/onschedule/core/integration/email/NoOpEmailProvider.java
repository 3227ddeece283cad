package io.onschedule.core.integration.email;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs email details instead of sending them. Used in development and tests. */
public class NoOpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpEmailProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    log.info("NoOp email: would send to {} with subject '{}'", message.to(), message.subject());
    return new SendResult(true, "NOOP-" + UUID.randomUUID(), null);
  }

  @Override
  public SendResult sendTemplateEmail(TemplateEmailMessage message) {
    log.info(
        "NoOp email: would send template {} to {} with {} variable(s)",
        message.templateId(),
        message.to(),
        message.templateData().size());
    return new SendResult(true, "NOOP-" + UUID.randomUUID(), null);
  }
}
