package io.onschedule.core.notification;

import io.onschedule.core.config.EmailProperties;
import io.onschedule.core.integration.email.EmailMessage;
import io.onschedule.core.integration.email.EmailProvider;
import io.onschedule.core.integration.email.EmailRateLimiter;
import io.onschedule.core.integration.email.SendResult;
import io.onschedule.core.integration.email.TemplateEmailMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Sends one reminder email to many recipients. Recipients are split into batches; sends inside a
 * batch run concurrently and batches run one after another. Recipients the primary provider
 * rejects as unauthorized are re-sent through the fallback provider, and the returned list holds
 * exactly one result per recipient in recipient order.
 */
@Component
public class BulkEmailSender {

  private static final Logger log = LoggerFactory.getLogger(BulkEmailSender.class);

  private final EmailProvider primaryProvider;
  private final EmailProvider fallbackProvider;
  private final EmailRateLimiter rateLimiter;
  private final Executor notificationExecutor;
  private final int batchSize;
  private final String replyTo;

  public BulkEmailSender(
      @Qualifier("primaryEmailProvider") EmailProvider primaryProvider,
      @Qualifier("fallbackEmailProvider") EmailProvider fallbackProvider,
      EmailRateLimiter rateLimiter,
      @Qualifier("notificationExecutor") Executor notificationExecutor,
      EmailProperties emailProperties) {
    this.primaryProvider = primaryProvider;
    this.fallbackProvider = fallbackProvider;
    this.rateLimiter = rateLimiter;
    this.notificationExecutor = notificationExecutor;
    this.batchSize = Math.max(1, emailProperties.batchSize());
    this.replyTo = emailProperties.replyTo();
  }

  public BatchSummary send(List<String> recipients, ReminderEmail email) {
    List<Attempt> attempts = sendInBatches(recipients, to -> sendPrimary(to, email));

    List<Integer> unauthorized = new ArrayList<>();
    for (int i = 0; i < attempts.size(); i++) {
      if (attempts.get(i).unauthorized()) {
        unauthorized.add(i);
      }
    }

    if (!unauthorized.isEmpty()) {
      log.warn(
          "{} of {} recipient(s) rejected as unauthorized by {}, retrying via {}",
          unauthorized.size(),
          recipients.size(),
          primaryProvider.providerId(),
          fallbackProvider.providerId());
      List<String> retryRecipients = unauthorized.stream().map(recipients::get).toList();
      List<Attempt> retried = sendInBatches(retryRecipients, to -> sendFallback(to, email));
      for (int i = 0; i < unauthorized.size(); i++) {
        attempts.set(unauthorized.get(i), retried.get(i));
      }
    }

    var summary = BatchSummary.of(attempts.stream().map(Attempt::result).toList());
    log.info(
        "Email batch finished: {} sent, {} failed, {} total ({} via fallback)",
        summary.success(),
        summary.failed(),
        summary.total(),
        unauthorized.size());
    return summary;
  }

  private List<Attempt> sendInBatches(List<String> recipients, Function<String, Attempt> sender) {
    List<Attempt> attempts = new ArrayList<>(recipients.size());
    for (int start = 0; start < recipients.size(); start += batchSize) {
      var batch = recipients.subList(start, Math.min(start + batchSize, recipients.size()));
      log.debug("Sending email batch of {} starting at {}", batch.size(), start);
      var futures =
          batch.stream()
              .map(
                  to -> CompletableFuture.supplyAsync(() -> sender.apply(to), notificationExecutor))
              .toList();
      for (int i = 0; i < futures.size(); i++) {
        attempts.add(join(futures.get(i), batch.get(i)));
      }
    }
    return attempts;
  }

  private Attempt join(CompletableFuture<Attempt> future, String recipient) {
    try {
      return future.join();
    } catch (RuntimeException e) {
      log.error("Email send task for {} failed: {}", recipient, e.getMessage());
      return new Attempt(NotificationResult.failure(recipient, e.getMessage(), null), false);
    }
  }

  private Attempt sendPrimary(String to, ReminderEmail email) {
    String providerId = primaryProvider.providerId();
    if (!rateLimiter.tryAcquire(providerId)) {
      log.warn("Rate limit reached for {}, email to {} not sent", providerId, to);
      return new Attempt(
          NotificationResult.failure(to, "Rate limit exceeded for " + providerId, providerId),
          false);
    }
    try {
      SendResult result =
          email.usesProviderTemplate()
              ? primaryProvider.sendTemplateEmail(
                  new TemplateEmailMessage(
                      to, email.providerTemplateId(), email.templateData(), replyTo))
              : primaryProvider.sendEmail(toMessage(to, email));
      return new Attempt(NotificationResult.from(to, result, providerId), result.unauthorized());
    } catch (RuntimeException e) {
      log.error("Email to {} via {} failed: {}", to, providerId, e.getMessage());
      return new Attempt(NotificationResult.failure(to, e.getMessage(), providerId), false);
    }
  }

  private Attempt sendFallback(String to, ReminderEmail email) {
    String providerId = fallbackProvider.providerId();
    if (!rateLimiter.tryAcquire(providerId)) {
      log.warn("Rate limit reached for fallback {}, email to {} not sent", providerId, to);
      return new Attempt(
          NotificationResult.failure(to, "Rate limit exceeded for " + providerId, providerId),
          false);
    }
    try {
      SendResult result = fallbackProvider.sendEmail(toMessage(to, email));
      return new Attempt(NotificationResult.from(to, result, providerId), false);
    } catch (RuntimeException e) {
      log.error("Fallback email to {} via {} failed: {}", to, providerId, e.getMessage());
      return new Attempt(NotificationResult.failure(to, e.getMessage(), providerId), false);
    }
  }

  private EmailMessage toMessage(String to, ReminderEmail email) {
    var content = email.content();
    return new EmailMessage(
        to,
        content.subject(),
        content.htmlBody(),
        content.plainTextBody(),
        replyTo,
        Map.of("category", "inspection-reminder"));
  }

  private record Attempt(NotificationResult result, boolean unauthorized) {}
}
