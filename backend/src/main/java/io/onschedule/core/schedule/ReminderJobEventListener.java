package io.onschedule.core.schedule;

import io.onschedule.core.reminder.ReminderBoundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Registers reminder jobs once the binding that created them has committed. */
@Component
public class ReminderJobEventListener {

  private static final Logger log = LoggerFactory.getLogger(ReminderJobEventListener.class);

  private final ReminderJobPlanner planner;

  public ReminderJobEventListener(ReminderJobPlanner planner) {
    this.planner = planner;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onReminderBound(ReminderBoundEvent event) {
    try {
      planner.plan(event.inspectionId(), event.dueDate(), event.reminderType(), event.method());
    } catch (Exception e) {
      log.error(
          "Failed to register reminder jobs for inspection {} (reminder {})",
          event.inspectionId(),
          event.reminderId(),
          e);
    }
  }
}
