package io.onschedule.core.schedule;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of a reminder job. Registering a second job under an equal id replaces the first, so
 * re-planning an inspection never doubles its reminders.
 *
 * @param leadDays days before the due date the job fires; 0 fires on the due date
 * @param inspectionId inspection the reminder is about
 * @param channel delivery channel
 */
public record JobId(int leadDays, UUID inspectionId, Channel channel) {

  public enum Channel {
    EMAIL,
    SMS
  }

  public JobId {
    Objects.requireNonNull(inspectionId, "inspectionId");
    Objects.requireNonNull(channel, "channel");
  }

  /** Stable string form, e.g. {@code reminder_15d_before_<id>_email}. */
  public String key() {
    return "reminder_" + leadDays + "d_before_" + inspectionId + "_" + channel.name().toLowerCase();
  }

  @Override
  public String toString() {
    return key();
  }
}
