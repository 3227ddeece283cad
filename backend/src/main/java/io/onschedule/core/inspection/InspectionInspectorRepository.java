package io.onschedule.core.inspection;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InspectionInspectorRepository extends JpaRepository<InspectionInspector, UUID> {
  List<InspectionInspector> findByInspectionId(UUID inspectionId);
}
