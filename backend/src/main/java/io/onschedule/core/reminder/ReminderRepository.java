package io.onschedule.core.reminder;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ReminderRepository extends JpaRepository<Reminder, UUID> {
  Optional<Reminder>
      findFirstByClientIdAndAssetIdAndReminderDateAndDeletedFalseOrderByCreatedAtDesc(
      UUID clientId, UUID assetId, LocalDate reminderDate);

  List<Reminder> findByReminderDateGreaterThanEqualAndStatusAndDeletedFalse(
      LocalDate date, ReminderStatus status);
}
