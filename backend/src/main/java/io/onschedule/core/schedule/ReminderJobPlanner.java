package io.onschedule.core.schedule;

import io.onschedule.core.config.ReminderProperties;
import io.onschedule.core.notification.ReminderNotificationService;
import io.onschedule.core.reminder.NotificationMethod;
import io.onschedule.core.reminder.ReminderType;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a bound reminder into timer jobs: one at the lead time before the due date and one on the
 * due date, for each enabled channel. Triggers that are not in the future are skipped.
 */
@Component
public class ReminderJobPlanner {

  private static final Logger log = LoggerFactory.getLogger(ReminderJobPlanner.class);

  private final ReminderJobScheduler jobScheduler;
  private final ReminderNotificationService notificationService;
  private final ReminderProperties reminderProperties;
  private final Clock clock;

  public ReminderJobPlanner(
      ReminderJobScheduler jobScheduler,
      ReminderNotificationService notificationService,
      ReminderProperties reminderProperties,
      Clock clock) {
    this.jobScheduler = jobScheduler;
    this.notificationService = notificationService;
    this.reminderProperties = reminderProperties;
    this.clock = clock;
  }

  public PlanOutcome plan(
      UUID inspectionId, LocalDate dueDate, ReminderType reminderType, NotificationMethod method) {
    Set<Integer> leadDays = new LinkedHashSet<>();
    leadDays.add(reminderType.leadDays());
    leadDays.add(0);

    Instant now = clock.instant();
    int registered = 0;
    int stale = 0;
    for (int days : leadDays) {
      Instant fireAt = fireTime(dueDate, days);
      if (!fireAt.isAfter(now)) {
        log.debug(
            "Skipping {}-day reminder for inspection {}: {} is not in the future",
            days,
            inspectionId,
            fireAt);
        stale++;
        continue;
      }
      if (method.includesEmail()) {
        jobScheduler.scheduleJob(
            new JobId(days, inspectionId, JobId.Channel.EMAIL),
            fireAt,
            () -> notificationService.sendReminderEmail(inspectionId));
        registered++;
      }
      if (method.includesSms()) {
        jobScheduler.scheduleJob(
            new JobId(days, inspectionId, JobId.Channel.SMS),
            fireAt,
            () -> notificationService.sendSmsReminder(inspectionId));
        registered++;
      }
    }

    log.info(
        "Planned {} reminder job(s) for inspection {} due {} ({}, {})",
        registered,
        inspectionId,
        dueDate,
        reminderType,
        method);
    return new PlanOutcome(registered, stale);
  }

  /** The instant a reminder {@code leadDays} before {@code dueDate} fires. */
  public Instant fireTime(LocalDate dueDate, int leadDays) {
    return dueDate
        .minusDays(leadDays)
        .atTime(reminderProperties.sendTime())
        .atZone(reminderProperties.zone())
        .toInstant();
  }

  /**
   * @param registered jobs handed to the scheduler, one per channel and trigger
   * @param staleTriggers triggers dropped because their time had already passed
   */
  public record PlanOutcome(int registered, int staleTriggers) {}
}
