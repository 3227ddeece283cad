package io.onschedule.core.schedule;

import io.onschedule.core.config.ReminderProperties;
import io.onschedule.core.inspection.InspectionService;
import io.onschedule.core.reminder.Reminder;
import io.onschedule.core.reminder.ReminderService;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the in-memory job registry at startup from reminders dated today or later. Triggers that
 * fell inside the downtime are not replayed; their count is logged.
 */
@Component
public class ReminderJobReloader {

  private static final Logger log = LoggerFactory.getLogger(ReminderJobReloader.class);

  private final ReminderService reminderService;
  private final InspectionService inspectionService;
  private final ReminderJobPlanner planner;
  private final ReminderProperties reminderProperties;
  private final Clock clock;

  public ReminderJobReloader(
      ReminderService reminderService,
      InspectionService inspectionService,
      ReminderJobPlanner planner,
      ReminderProperties reminderProperties,
      Clock clock) {
    this.reminderService = reminderService;
    this.inspectionService = inspectionService;
    this.planner = planner;
    this.reminderProperties = reminderProperties;
    this.clock = clock;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (!reminderProperties.reloadOnStartup()) {
      log.info("Reminder job reload disabled");
      return;
    }
    try {
      reload();
    } catch (Exception e) {
      log.error("Failed to reload reminder jobs", e);
    }
  }

  public ReloadResult reload() {
    LocalDate today = LocalDate.now(clock);
    // latest reminder per (client, asset, date) wins, as it does at send time
    Map<String, Reminder> latest = new LinkedHashMap<>();
    reminderService.findUpcoming(today).stream()
        .sorted(Comparator.comparing(Reminder::getCreatedAt))
        .forEach(
            r -> latest.put(r.getClientId() + ":" + r.getAssetId() + ":" + r.getReminderDate(), r));

    int reminders = 0;
    int registered = 0;
    int dropped = 0;
    for (Reminder reminder : latest.values()) {
      List<UUID> inspectionIds =
          inspectionService.findIdsByAssetAndDueDate(
              reminder.getClientId(), reminder.getAssetId(), reminder.getReminderDate());
      if (inspectionIds.isEmpty()) {
        log.debug("Reminder {} has no live inspection, not reloaded", reminder.getId());
        continue;
      }
      reminders++;
      for (var inspectionId : inspectionIds) {
        var outcome =
            planner.plan(
                inspectionId,
                reminder.getReminderDate(),
                reminder.getReminderType(),
                reminder.getNotificationMethod());
        registered += outcome.registered();
        dropped += outcome.staleTriggers();
      }
    }

    if (dropped > 0) {
      log.warn(
          "{} reminder trigger(s) were already in the past at startup and will not fire", dropped);
    }
    log.info("Reloaded {} reminder job(s) for {} reminder(s)", registered, reminders);
    return new ReloadResult(reminders, registered, dropped);
  }

  public record ReloadResult(int reminders, int jobsRegistered, int triggersDropped) {}
}
