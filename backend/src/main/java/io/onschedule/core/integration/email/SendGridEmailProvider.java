package io.onschedule.core.integration.email;

import com.sendgrid.Client;
import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import com.sendgrid.helpers.mail.Mail;
import com.sendgrid.helpers.mail.objects.Content;
import com.sendgrid.helpers.mail.objects.Email;
import com.sendgrid.helpers.mail.objects.Personalization;
import io.onschedule.core.config.EmailProperties;
import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.function.Function;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.HttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Primary email provider. Reminder templates live in SendGrid as dynamic templates and are filled
 * from {@link TemplateEmailMessage#templateData()}. Transient failures (I/O errors, 429, 5xx) are
 * retried with linear backoff; 401/403 are reported as unauthorized so the caller can fall back.
 */
public class SendGridEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SendGridEmailProvider.class);

  private final SendGrid sendGrid;
  private final String senderAddress;
  private final String senderName;
  private final String replyTo;
  private final int maxAttempts;
  private final Duration retryBaseDelay;

  public SendGridEmailProvider(EmailProperties properties) {
    this(properties, apiKey -> new SendGrid(apiKey, httpClient(properties.requestTimeout())));
  }

  SendGridEmailProvider(EmailProperties properties, Function<String, SendGrid> sendGridFactory) {
    String apiKey = properties.sendgrid().apiKey();
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "onschedule.email.sendgrid.api-key must be set when SendGrid is the email provider");
    }
    this.sendGrid = sendGridFactory.apply(apiKey);
    this.senderAddress = properties.senderAddress();
    this.senderName = properties.senderName();
    this.replyTo = properties.replyTo();
    this.maxAttempts = Math.max(1, properties.maxAttempts());
    this.retryBaseDelay = properties.retryBaseDelay();
  }

  @Override
  public String providerId() {
    return "sendgrid";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    if (message.htmlBody() == null && message.plainTextBody() == null) {
      throw new IllegalArgumentException(
          "Email must have at least one of htmlBody or plainTextBody");
    }
    Personalization personalization = new Personalization();
    personalization.addTo(new Email(message.to()));
    message.metadata().forEach(personalization::addCustomArg);

    Mail mail = baseMail(message.replyTo());
    mail.setSubject(message.subject());
    mail.addPersonalization(personalization);
    if (message.plainTextBody() != null) {
      mail.addContent(new Content("text/plain", message.plainTextBody()));
    }
    if (message.htmlBody() != null) {
      mail.addContent(new Content("text/html", message.htmlBody()));
    }
    return send(mail, message.to());
  }

  @Override
  public SendResult sendTemplateEmail(TemplateEmailMessage message) {
    Personalization personalization = new Personalization();
    personalization.addTo(new Email(message.to()));
    message.templateData().forEach(personalization::addDynamicTemplateData);

    Mail mail = baseMail(message.replyTo());
    mail.setTemplateId(message.templateId());
    mail.addPersonalization(personalization);
    return send(mail, message.to());
  }

  private Mail baseMail(String messageReplyTo) {
    Mail mail = new Mail();
    mail.setFrom(new Email(senderAddress, senderName));
    String effectiveReplyTo = messageReplyTo != null ? messageReplyTo : replyTo;
    if (effectiveReplyTo != null && !effectiveReplyTo.isBlank()) {
      mail.setReplyTo(new Email(effectiveReplyTo));
    }
    return mail;
  }

  private SendResult send(Mail mail, String to) {
    String body;
    try {
      body = mail.build();
    } catch (IOException e) {
      log.error("Failed to serialize SendGrid request for {}: {}", to, e.getMessage());
      return new SendResult(false, null, e.getMessage());
    }

    String lastError = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        Request request = new Request();
        request.setMethod(Method.POST);
        request.setEndpoint("mail/send");
        request.setBody(body);

        Response response = sendGrid.api(request);
        int status = response.getStatusCode();
        if (status >= 200 && status < 300) {
          String sgMessageId = response.getHeaders().get("X-Message-Id");
          log.debug("SendGrid email sent to {}, sg_message_id: {}", to, sgMessageId);
          return new SendResult(true, sgMessageId, null);
        }
        lastError = "SendGrid API error " + status + ": " + response.getBody();
        if (status == 401 || status == 403) {
          log.warn("SendGrid refused email to {}: HTTP {}", to, status);
          return SendResult.unauthorized(lastError);
        }
        if (status != 429 && status < 500) {
          log.error("SendGrid API returned {} for {}: {}", status, to, response.getBody());
          return new SendResult(false, null, lastError);
        }
      } catch (IOException e) {
        // the SDK raises IOException for non-2xx responses, carrying only the body
        lastError = e.getMessage();
        if (isUnauthorized(lastError)) {
          log.warn("SendGrid refused email to {}: {}", to, lastError);
          return SendResult.unauthorized(lastError);
        }
      }

      if (attempt < maxAttempts) {
        log.warn(
            "SendGrid send to {} failed (attempt {}/{}): {}", to, attempt, maxAttempts, lastError);
        if (!backoff(attempt)) {
          break;
        }
      }
    }
    log.error("SendGrid send to {} failed after {} attempt(s): {}", to, maxAttempts, lastError);
    return new SendResult(false, null, lastError);
  }

  private boolean backoff(int attempt) {
    long millis = retryBaseDelay.toMillis() * attempt;
    if (millis <= 0) {
      return true;
    }
    try {
      Thread.sleep(millis);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  static boolean isUnauthorized(String error) {
    if (error == null) {
      return false;
    }
    String lower = error.toLowerCase(Locale.ROOT);
    return lower.contains("unauthorized")
        || lower.contains("forbidden")
        || lower.contains("authorization grant is invalid")
        || lower.contains("verified sender identity");
  }

  private static Client httpClient(Duration timeout) {
    int millis = (int) timeout.toMillis();
    var requestConfig =
        RequestConfig.custom()
            .setConnectTimeout(millis)
            .setConnectionRequestTimeout(millis)
            .setSocketTimeout(millis)
            .build();
    return new Client(HttpClients.custom().setDefaultRequestConfig(requestConfig).build());
  }
}
