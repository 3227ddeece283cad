package io.onschedule.core.reminder;

import java.time.LocalDate;
import java.util.UUID;

/** Published once a reminder has been bound to an inspection; jobs are planned after commit. */
public record ReminderBoundEvent(
    UUID reminderId,
    UUID inspectionId,
    LocalDate dueDate,
    ReminderType reminderType,
    NotificationMethod method) {}
