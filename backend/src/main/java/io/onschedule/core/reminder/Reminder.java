package io.onschedule.core.reminder;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Notification configuration for one inspection occurrence. Linked to its inspection by (client,
 * asset, reminder date = due date) rather than by id.
 */
@Entity
@Table(name = "reminders")
public class Reminder {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "client_id", nullable = false)
  private UUID clientId;

  @Column(name = "asset_id", nullable = false)
  private UUID assetId;

  @Enumerated(EnumType.STRING)
  @Column(name = "reminder_type", nullable = false, length = 30)
  private ReminderType reminderType;

  @Column(name = "reminder_date", nullable = false)
  private LocalDate reminderDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "notification_method", nullable = false, length = 10)
  private NotificationMethod notificationMethod;

  @Enumerated(EnumType.STRING)
  @Column(name = "message_source", nullable = false, length = 10)
  private MessageSource messageSource;

  @Column(name = "email_template_id")
  private UUID emailTemplateId;

  @Column(name = "sms_template_id")
  private UUID smsTemplateId;

  @Column(name = "manual_message", length = 4000)
  private String manualMessage;

  @Column(name = "additional_notes", length = 4000)
  private String additionalNotes;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ReminderStatus status;

  @Column(name = "deleted", nullable = false)
  private boolean deleted;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Reminder() {}

  public Reminder(
      UUID clientId,
      UUID assetId,
      ReminderType reminderType,
      LocalDate reminderDate,
      NotificationMethod notificationMethod,
      ReminderMessage message,
      String additionalNotes) {
    this.clientId = clientId;
    this.assetId = assetId;
    this.reminderType = reminderType;
    this.reminderDate = reminderDate;
    this.notificationMethod = notificationMethod;
    this.messageSource = message.source();
    if (message instanceof ReminderMessage.ManualMessage manual) {
      this.manualMessage = manual.text().strip();
    } else if (message instanceof ReminderMessage.TemplateMessage template) {
      this.emailTemplateId = template.emailTemplateId();
      this.smsTemplateId = template.smsTemplateId();
    }
    this.additionalNotes = additionalNotes;
    this.status = ReminderStatus.SCHEDULED;
    this.deleted = false;
    this.createdAt = Instant.now();
  }

  /** The authoritative message for this reminder, resolved from its stored source. */
  public ReminderMessage getMessage() {
    if (messageSource == MessageSource.MANUAL) {
      return new ReminderMessage.ManualMessage(manualMessage);
    }
    return new ReminderMessage.TemplateMessage(emailTemplateId, smsTemplateId);
  }

  /** Rebuilds the configuration this reminder was bound with, for carrying to a successor. */
  public NotificationConfig toNotificationConfig() {
    return new NotificationConfig(notificationMethod, reminderType, getMessage());
  }

  public UUID getId() {
    return id;
  }

  public UUID getClientId() {
    return clientId;
  }

  public UUID getAssetId() {
    return assetId;
  }

  public ReminderType getReminderType() {
    return reminderType;
  }

  public LocalDate getReminderDate() {
    return reminderDate;
  }

  public NotificationMethod getNotificationMethod() {
    return notificationMethod;
  }

  public MessageSource getMessageSource() {
    return messageSource;
  }

  public UUID getEmailTemplateId() {
    return emailTemplateId;
  }

  public UUID getSmsTemplateId() {
    return smsTemplateId;
  }

  public String getManualMessage() {
    return manualMessage;
  }

  public String getAdditionalNotes() {
    return additionalNotes;
  }

  public ReminderStatus getStatus() {
    return status;
  }

  public boolean isDeleted() {
    return deleted;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
