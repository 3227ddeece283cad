package io.onschedule.core.schedule;

import java.time.Clock;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily sweep that advances overdue recurring inspections. Runs at 02:00 by default.
 *
 * <p>The loop is in the executor (not the service) so that each {@code advance} call goes through
 * the Spring proxy and its {@code REQUIRES_NEW} transaction takes effect.
 */
@Component
public class RecurringInspectionExecutor {

  private static final Logger log = LoggerFactory.getLogger(RecurringInspectionExecutor.class);

  private final RecurringInspectionService recurringInspectionService;
  private final Clock clock;

  public RecurringInspectionExecutor(
      RecurringInspectionService recurringInspectionService, Clock clock) {
    this.recurringInspectionService = recurringInspectionService;
    this.clock = clock;
  }

  @Scheduled(
      cron = "${onschedule.reminders.sweep-cron:0 0 2 * * *}",
      zone = "${onschedule.reminders.zone:UTC}")
  public void scheduledSweep() {
    executeSweep();
  }

  public SweepResult executeSweep() {
    LocalDate today = LocalDate.now(clock);
    log.info("Recurring inspection sweep started for {}", today);
    var overdue = recurringInspectionService.findOverdue(today);

    int processed = 0;
    int created = 0;
    int skipped = 0;
    int failed = 0;
    for (var inspection : overdue) {
      processed++;
      try {
        if (recurringInspectionService.advance(inspection).isPresent()) {
          created++;
        } else {
          skipped++;
        }
      } catch (Exception e) {
        failed++;
        log.error(
            "Failed to advance inspection {} for asset {} (next due {}): {}",
            inspection.getId(),
            inspection.getAssetId(),
            inspection.getInspectionType().nextDueDate(inspection.getDueDate()),
            e.getMessage(),
            e);
      }
    }

    log.info(
        "Recurring inspection sweep completed: {} processed, {} created, {} skipped, {} failed",
        processed,
        created,
        skipped,
        failed);
    return new SweepResult(processed, created, skipped, failed);
  }

  public record SweepResult(int processed, int created, int skipped, int failed) {}
}
