package io.onschedule.core.inspection;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InspectionRepository extends JpaRepository<Inspection, UUID> {
  Optional<Inspection> findByIdAndDeletedFalse(UUID id);

  boolean existsByClientIdAndAssetIdAndInspectionTypeAndDueDateAndDeletedFalse(
      UUID clientId, UUID assetId, InspectionType inspectionType, LocalDate dueDate);

  List<Inspection> findByInspectionTypeInAndDueDateBeforeAndDeletedFalse(
      Collection<InspectionType> inspectionTypes, LocalDate date);

  List<Inspection> findByClientIdAndAssetIdAndDueDateAndDeletedFalse(
      UUID clientId, UUID assetId, LocalDate dueDate);
}
