package io.onschedule.core.integration.email;

/**
 * Port for sending emails via an external provider. One instance is wired as the primary provider
 * and one as the fallback for recipients the primary rejects as unauthorized.
 */
public interface EmailProvider {

  /** Provider identifier (e.g., "sendgrid", "ses", "noop"). */
  String providerId();

  /** Send a fully rendered email. */
  SendResult sendEmail(EmailMessage message);

  /** Send using a template hosted by the provider. Providers without hosted templates refuse. */
  default SendResult sendTemplateEmail(TemplateEmailMessage message) {
    return new SendResult(
        false, null, "Provider " + providerId() + " does not support hosted templates");
  }
}
