package io.onschedule.core.inspection;

public enum InspectionStatus {
  SCHEDULED,
  NOT_SCHEDULED,
  IN_PROGRESS,
  COMPLETED,
  OVERDUE,
  CANCELLED
}
