package io.onschedule.core.inspection;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

public enum InspectionType {
  PRE_OPERATION,
  DAILY,
  WEEKLY,
  MONTHLY,
  QUARTERLY,
  SEMI_ANNUAL,
  ANNUAL,
  PREVENTIVE_MAINTENANCE,
  CORRECTIVE_MAINTENANCE,
  REPAIR,
  SAFETY,
  CALIBRATION,
  PERFORMANCE,
  LOAD_TEST,
  ELECTRICAL,
  STRUCTURAL,
  ENVIRONMENTAL,
  FIRE_SAFETY,
  INSTALLATION,
  POST_INCIDENT,
  SHUTDOWN,
  COMMISSIONING,
  SPECIAL;

  private static final Set<InspectionType> RECURRING =
      EnumSet.of(WEEKLY, MONTHLY, QUARTERLY, SEMI_ANNUAL, ANNUAL);

  /** Types the recurrence sweep advances. */
  public static Set<InspectionType> recurringTypes() {
    return EnumSet.copyOf(RECURRING);
  }

  public boolean isRecurring() {
    return RECURRING.contains(this);
  }

  /**
   * Calculates the due date of the occurrence following {@code current}. Month-based periods clamp
   * to the last valid day of the target month (2024-01-31 monthly gives 2024-02-29). The period is
   * always applied to the previous occurrence, so a clamped day carries forward (2024-02-29 gives
   * 2024-03-29, not 2024-03-31).
   *
   * @param current the due date of the current occurrence
   * @return the next due date, or {@code current} unchanged for non-recurring types
   */
  public LocalDate nextDueDate(LocalDate current) {
    Objects.requireNonNull(current, "current");
    return switch (this) {
      case WEEKLY -> current.plusWeeks(1);
      case MONTHLY -> current.plusMonths(1);
      case QUARTERLY -> current.plusMonths(3);
      case SEMI_ANNUAL -> current.plusMonths(6);
      case ANNUAL -> current.plusMonths(12);
      default -> current;
    };
  }
}
