package io.onschedule.core.reminder;

public enum ReminderStatus {
  SCHEDULED,
  CANCELLED
}
