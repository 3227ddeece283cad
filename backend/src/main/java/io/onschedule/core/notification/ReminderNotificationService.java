package io.onschedule.core.notification;

import io.onschedule.core.notification.template.FallbackEmailRenderer;
import io.onschedule.core.reminder.ReminderMessage;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sends the reminder bound to an inspection's due date to the client and the assigned inspectors.
 * Called by reminder jobs when they fire. Nothing here de-duplicates repeated calls.
 */
@Service
public class ReminderNotificationService {

  private static final Logger log = LoggerFactory.getLogger(ReminderNotificationService.class);

  private final ReminderContextLoader contextLoader;
  private final ReminderContentBuilder contentBuilder;
  private final FallbackEmailRenderer fallbackRenderer;
  private final BulkEmailSender bulkEmailSender;
  private final BulkSmsSender bulkSmsSender;

  public ReminderNotificationService(
      ReminderContextLoader contextLoader,
      ReminderContentBuilder contentBuilder,
      FallbackEmailRenderer fallbackRenderer,
      BulkEmailSender bulkEmailSender,
      BulkSmsSender bulkSmsSender) {
    this.contextLoader = contextLoader;
    this.contentBuilder = contentBuilder;
    this.fallbackRenderer = fallbackRenderer;
    this.bulkEmailSender = bulkEmailSender;
    this.bulkSmsSender = bulkSmsSender;
  }

  public BatchSummary sendReminderEmail(UUID inspectionId) {
    var ctx = contextLoader.load(inspectionId).orElse(null);
    if (ctx == null) {
      return BatchSummary.empty();
    }
    if (!ctx.reminder().getNotificationMethod().includesEmail()) {
      log.debug("Reminder {} does not notify by email", ctx.reminder().getId());
      return BatchSummary.empty();
    }
    var recipients = ctx.emailRecipients();
    if (recipients.isEmpty()) {
      log.warn("No email recipients for inspection {}", inspectionId);
      return BatchSummary.empty();
    }

    ReminderEmail email;
    if (ctx.reminder().getMessage() instanceof ReminderMessage.ManualMessage manual
        && manual.text() != null
        && !manual.text().isBlank()) {
      email =
          ReminderEmail.plainText(
              contentBuilder.subject(ctx), contentBuilder.manualEmailBody(ctx, manual.text()));
    } else {
      var template = ctx.emailTemplate();
      if (template == null) {
        log.warn(
            "Email template for reminder {} not found, inspection {} not notified",
            ctx.reminder().getId(),
            inspectionId);
        return BatchSummary.empty();
      }
      if (template.getProviderTemplateId() == null || template.getProviderTemplateId().isBlank()) {
        log.warn(
            "Email template {} has no provider template id, inspection {} not notified",
            template.getId(),
            inspectionId);
        return BatchSummary.empty();
      }
      var variables = contentBuilder.templateVariables(ctx);
      email =
          new ReminderEmail(
              template.getProviderTemplateId(),
              variables,
              fallbackRenderer.render(template, variables));
    }

    var summary = bulkEmailSender.send(recipients, email);
    log.info(
        "Reminder email for inspection {}: {} sent, {} failed of {}",
        inspectionId,
        summary.success(),
        summary.failed(),
        summary.total());
    return summary;
  }

  public BatchSummary sendSmsReminder(UUID inspectionId) {
    var ctx = contextLoader.load(inspectionId).orElse(null);
    if (ctx == null) {
      return BatchSummary.empty();
    }
    if (!ctx.reminder().getNotificationMethod().includesSms()) {
      log.debug("Reminder {} does not notify by SMS", ctx.reminder().getId());
      return BatchSummary.empty();
    }
    var phoneNumbers = ctx.phoneRecipients();
    if (phoneNumbers.isEmpty()) {
      log.warn("No SMS recipients for inspection {}", inspectionId);
      return BatchSummary.empty();
    }

    String manualMessage =
        ctx.reminder().getMessage() instanceof ReminderMessage.ManualMessage manual
            ? manual.text()
            : null;
    var summary = bulkSmsSender.send(phoneNumbers, contentBuilder.smsBody(ctx, manualMessage));
    log.info(
        "Reminder SMS for inspection {}: {} sent, {} failed of {}",
        inspectionId,
        summary.success(),
        summary.failed(),
        summary.total());
    return summary;
  }
}
