package io.onschedule.core.schedule;

import io.onschedule.core.exception.ResourceNotFoundException;
import io.onschedule.core.exception.ValidationFailedException;
import io.onschedule.core.inspection.BindInspectionRequest;
import io.onschedule.core.inspection.Inspection;
import io.onschedule.core.inspection.InspectionRepository;
import io.onschedule.core.inspection.InspectionService;
import io.onschedule.core.inspection.InspectionType;
import io.onschedule.core.reminder.NotificationConfig;
import io.onschedule.core.reminder.Reminder;
import io.onschedule.core.reminder.ReminderService;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RecurringInspectionService {

  private static final Logger log = LoggerFactory.getLogger(RecurringInspectionService.class);

  private final InspectionRepository inspectionRepository;
  private final InspectionService inspectionService;
  private final ReminderService reminderService;

  public RecurringInspectionService(
      InspectionRepository inspectionRepository,
      InspectionService inspectionService,
      ReminderService reminderService) {
    this.inspectionRepository = inspectionRepository;
    this.inspectionService = inspectionService;
    this.reminderService = reminderService;
  }

  /** Live recurring inspections whose due date is strictly before {@code today}. */
  @Transactional(readOnly = true)
  public List<Inspection> findOverdue(LocalDate today) {
    return inspectionRepository.findByInspectionTypeInAndDueDateBeforeAndDeletedFalse(
        InspectionType.recurringTypes(), today);
  }

  /**
   * Creates the successor of {@code current} one period later, carrying over its inspectors and
   * the notification settings of its latest reminder. Runs in its own transaction so a failure
   * only affects this inspection.
   *
   * @return the new inspection, or empty when the type does not advance or the successor exists
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Optional<Inspection> advance(Inspection current) {
    LocalDate nextDue = current.getInspectionType().nextDueDate(current.getDueDate());
    if (!nextDue.isAfter(current.getDueDate())) {
      log.debug(
          "Inspection {} type {} does not recur", current.getId(), current.getInspectionType());
      return Optional.empty();
    }
    if (inspectionService.exists(
        current.getClientId(), current.getAssetId(), current.getInspectionType(), nextDue)) {
      log.debug(
          "Successor of inspection {} on {} already exists, skipping", current.getId(), nextDue);
      return Optional.empty();
    }

    var inspectorIds = inspectionService.findActiveInspectorIds(current.getId());
    NotificationConfig notification =
        reminderService
            .findLatest(current.getClientId(), current.getAssetId(), current.getDueDate())
            .map(Reminder::toNotificationConfig)
            .orElse(null);
    if (notification == null) {
      log.info(
          "No reminder found for inspection {}, successor will have no notifications",
          current.getId());
    } else if (!inspectorIds.isEmpty() && !isStillValid(notification, current)) {
      notification = null;
    }

    var successor =
        inspectionService.bind(
            new BindInspectionRequest(
                current.getClientId(),
                current.getAssetId(),
                current.getInspectionType(),
                nextDue,
                current.getLocation(),
                current.getNotes(),
                inspectorIds,
                notification));
    log.info(
        "Advanced {} inspection {} ({}) to {} as {}",
        current.getInspectionType(),
        current.getId(),
        current.getDueDate(),
        nextDue,
        successor.getId());
    return Optional.of(successor);
  }

  // Templates retired since the prior reminder was bound must not stop the series.
  private boolean isStillValid(NotificationConfig notification, Inspection current) {
    try {
      reminderService.validate(notification);
      return true;
    } catch (ResourceNotFoundException | ValidationFailedException e) {
      log.warn(
          "Notification settings of inspection {} are no longer valid ({}), successor will have"
              + " no notifications",
          current.getId(),
          e.getBody().getDetail());
      return false;
    }
  }
}
