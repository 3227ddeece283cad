package io.onschedule.core.reminder;

import io.onschedule.core.exception.ResourceNotFoundException;
import io.onschedule.core.exception.ValidationFailedException;
import io.onschedule.core.inspection.Inspection;
import io.onschedule.core.template.EmailTemplateRepository;
import io.onschedule.core.template.SmsTemplateRepository;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ReminderService {

  private static final Logger log = LoggerFactory.getLogger(ReminderService.class);

  static final int MIN_MANUAL_MESSAGE_LENGTH = 10;

  private final ReminderRepository reminderRepository;
  private final ReminderInspectorRepository reminderInspectorRepository;
  private final EmailTemplateRepository emailTemplateRepository;
  private final SmsTemplateRepository smsTemplateRepository;
  private final ApplicationEventPublisher eventPublisher;

  public ReminderService(
      ReminderRepository reminderRepository,
      ReminderInspectorRepository reminderInspectorRepository,
      EmailTemplateRepository emailTemplateRepository,
      SmsTemplateRepository smsTemplateRepository,
      ApplicationEventPublisher eventPublisher) {
    this.reminderRepository = reminderRepository;
    this.reminderInspectorRepository = reminderInspectorRepository;
    this.emailTemplateRepository = emailTemplateRepository;
    this.smsTemplateRepository = smsTemplateRepository;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Checks a notification config before anything is persisted. Template mode needs a template for
   * every enabled channel and the template must exist; manual mode needs a message of at least ten
   * characters once trimmed.
   */
  public void validate(NotificationConfig config) {
    if (config.method() == null) {
      throw new ValidationFailedException("notificationMethod is required");
    }
    var message = config.message();
    if (message == null) {
      throw new ValidationFailedException("Reminder message is required");
    }
    if (message instanceof ReminderMessage.ManualMessage manual) {
      String text = manual.text() == null ? "" : manual.text().strip();
      if (text.length() < MIN_MANUAL_MESSAGE_LENGTH) {
        throw new ValidationFailedException(
            "manual message must be at least " + MIN_MANUAL_MESSAGE_LENGTH + " characters");
      }
    } else if (message instanceof ReminderMessage.TemplateMessage template) {
      if (config.method().includesEmail()) {
        if (template.emailTemplateId() == null) {
          throw new ValidationFailedException("emailTemplateId required");
        }
        if (!emailTemplateRepository.existsByIdAndDeletedFalse(template.emailTemplateId())) {
          throw new ResourceNotFoundException("EmailTemplate", template.emailTemplateId());
        }
      }
      if (config.method().includesSms()) {
        if (template.smsTemplateId() == null) {
          throw new ValidationFailedException("smsTemplateId required");
        }
        if (!smsTemplateRepository.existsByIdAndDeletedFalse(template.smsTemplateId())) {
          throw new ResourceNotFoundException("SmsTemplate", template.smsTemplateId());
        }
      }
    }
  }

  /**
   * Persists a reminder for the inspection's due date together with its inspector assignments and
   * publishes a {@link ReminderBoundEvent}. The config must already have passed {@link
   * #validate(NotificationConfig)}.
   */
  @Transactional
  public Reminder bindToInspection(
      Inspection inspection, NotificationConfig config, Collection<UUID> inspectorIds) {
    var reminderType =
        config.reminderType() != null
            ? config.reminderType()
            : ReminderType.forInspectionType(inspection.getInspectionType());

    var reminder =
        reminderRepository.save(
            new Reminder(
                inspection.getClientId(),
                inspection.getAssetId(),
                reminderType,
                inspection.getDueDate(),
                config.method(),
                config.message(),
                "Auto-generated reminder for inspection " + inspection.getId()));

    for (UUID employeeId : inspectorIds) {
      reminderInspectorRepository.save(new ReminderInspector(reminder.getId(), employeeId));
    }

    eventPublisher.publishEvent(
        new ReminderBoundEvent(
            reminder.getId(),
            inspection.getId(),
            inspection.getDueDate(),
            reminderType,
            config.method()));

    log.info(
        "Bound {} reminder {} ({}, {}) to inspection {} due {}",
        reminderType,
        reminder.getId(),
        config.method(),
        reminder.getMessageSource(),
        inspection.getId(),
        inspection.getDueDate());
    return reminder;
  }

  /** Most recent live reminder for an asset on a date; this is how reminders find inspections. */
  @Transactional(readOnly = true)
  public Optional<Reminder> findLatest(UUID clientId, UUID assetId, LocalDate reminderDate) {
    return reminderRepository
        .findFirstByClientIdAndAssetIdAndReminderDateAndDeletedFalseOrderByCreatedAtDesc(
            clientId, assetId, reminderDate);
  }

  @Transactional(readOnly = true)
  public List<Reminder> findUpcoming(LocalDate from) {
    return reminderRepository.findByReminderDateGreaterThanEqualAndStatusAndDeletedFalse(
        from, ReminderStatus.SCHEDULED);
  }
}
