package io.onschedule.core.reminder;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ReminderInspectorRepository extends JpaRepository<ReminderInspector, UUID> {
  List<ReminderInspector> findByReminderId(UUID reminderId);
}
