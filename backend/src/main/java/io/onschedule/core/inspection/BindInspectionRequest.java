package io.onschedule.core.inspection;

import io.onschedule.core.reminder.NotificationConfig;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Input to {@link InspectionService#bind}. {@code notification} may be null, in which case the
 * inspection is created without a reminder.
 */
public record BindInspectionRequest(
    UUID clientId,
    UUID assetId,
    InspectionType inspectionType,
    LocalDate dueDate,
    String location,
    String notes,
    List<UUID> inspectorIds,
    NotificationConfig notification) {

  public BindInspectionRequest {
    inspectorIds = inspectorIds == null ? List.of() : List.copyOf(inspectorIds);
  }
}
