package io.onschedule.core.reminder;

import java.util.UUID;

/** What a reminder says: either references to stored templates or a free-text message. */
public sealed interface ReminderMessage
    permits ReminderMessage.TemplateMessage, ReminderMessage.ManualMessage {

  MessageSource source();

  record TemplateMessage(UUID emailTemplateId, UUID smsTemplateId) implements ReminderMessage {
    @Override
    public MessageSource source() {
      return MessageSource.TEMPLATE;
    }
  }

  record ManualMessage(String text) implements ReminderMessage {
    @Override
    public MessageSource source() {
      return MessageSource.MANUAL;
    }
  }
}
