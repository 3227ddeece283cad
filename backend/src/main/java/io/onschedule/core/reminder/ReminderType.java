package io.onschedule.core.reminder;

import io.onschedule.core.inspection.InspectionType;

/**
 * Reminder cadence. The {@code DAYS_N_BEFORE} kinds carry a lead time: the first reminder fires N
 * days before the due date and a second one on the due date. Every other kind only fires on the
 * due date.
 */
public enum ReminderType {
  WEEKLY(0),
  MONTHLY(0),
  QUARTERLY(0),
  SEMI_ANNUAL(0),
  ANNUAL(0),
  ONE_TIME(0),
  DAYS_2_BEFORE(2),
  DAYS_15_BEFORE(15),
  DAYS_30_BEFORE(30);

  private final int leadDays;

  ReminderType(int leadDays) {
    this.leadDays = leadDays;
  }

  public int leadDays() {
    return leadDays;
  }

  /** Reminder type used when a binding does not name one: recurring kinds mirror themselves. */
  public static ReminderType forInspectionType(InspectionType inspectionType) {
    return switch (inspectionType) {
      case WEEKLY -> WEEKLY;
      case MONTHLY -> MONTHLY;
      case QUARTERLY -> QUARTERLY;
      case SEMI_ANNUAL -> SEMI_ANNUAL;
      case ANNUAL -> ANNUAL;
      default -> ONE_TIME;
    };
  }
}
