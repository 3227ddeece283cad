package io.onschedule.core.reminder;

import java.util.UUID;

/**
 * Notification settings attached to an inspection binding.
 *
 * @param method channels to notify on; required
 * @param reminderType lead-time cadence, or {@code null} to derive it from the inspection type
 * @param message template references or a manual message
 */
public record NotificationConfig(
    NotificationMethod method, ReminderType reminderType, ReminderMessage message) {

  /**
   * Builds a config from loose fields as they arrive from a form or a prior reminder. A missing
   * source means template mode.
   */
  public static NotificationConfig of(
      NotificationMethod method,
      ReminderType reminderType,
      MessageSource source,
      UUID emailTemplateId,
      UUID smsTemplateId,
      String manualMessage) {
    ReminderMessage message =
        source == MessageSource.MANUAL
            ? new ReminderMessage.ManualMessage(manualMessage)
            : new ReminderMessage.TemplateMessage(emailTemplateId, smsTemplateId);
    return new NotificationConfig(method, reminderType, message);
  }
}
