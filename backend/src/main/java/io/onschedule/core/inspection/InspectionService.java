package io.onschedule.core.inspection;

import io.onschedule.core.asset.AssetRepository;
import io.onschedule.core.client.ClientRepository;
import io.onschedule.core.employee.Employee;
import io.onschedule.core.employee.EmployeeRepository;
import io.onschedule.core.exception.ResourceConflictException;
import io.onschedule.core.exception.ResourceNotFoundException;
import io.onschedule.core.exception.ValidationFailedException;
import io.onschedule.core.reminder.ReminderService;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class InspectionService {

  private static final Logger log = LoggerFactory.getLogger(InspectionService.class);

  private final InspectionRepository inspectionRepository;
  private final InspectionInspectorRepository inspectionInspectorRepository;
  private final ClientRepository clientRepository;
  private final AssetRepository assetRepository;
  private final EmployeeRepository employeeRepository;
  private final ReminderService reminderService;

  public InspectionService(
      InspectionRepository inspectionRepository,
      InspectionInspectorRepository inspectionInspectorRepository,
      ClientRepository clientRepository,
      AssetRepository assetRepository,
      EmployeeRepository employeeRepository,
      ReminderService reminderService) {
    this.inspectionRepository = inspectionRepository;
    this.inspectionInspectorRepository = inspectionInspectorRepository;
    this.clientRepository = clientRepository;
    this.assetRepository = assetRepository;
    this.employeeRepository = employeeRepository;
    this.reminderService = reminderService;
  }

  /**
   * Creates a scheduled inspection, assigns its inspectors and, when a notification config is given
   * and at least one inspector is assigned, binds a reminder to its due date. All checks run before
   * the first write, so a rejected request leaves nothing behind. Reminder jobs are registered only
   * after the surrounding transaction commits.
   */
  @Transactional
  public Inspection bind(BindInspectionRequest request) {
    if (request.inspectionType() == null) {
      throw new ValidationFailedException("inspectionType is required");
    }
    if (request.dueDate() == null) {
      throw new ValidationFailedException("dueDate is required");
    }
    if (exists(
        request.clientId(), request.assetId(), request.inspectionType(), request.dueDate())) {
      throw duplicate(request.inspectionType(), request.assetId(), request.dueDate());
    }
    clientRepository
        .findByIdAndDeletedFalse(request.clientId())
        .orElseThrow(() -> new ResourceNotFoundException("Client", request.clientId()));
    assetRepository
        .findByIdAndDeletedFalse(request.assetId())
        .orElseThrow(() -> new ResourceNotFoundException("Asset", request.assetId()));

    Set<UUID> inspectorIds = new LinkedHashSet<>(request.inspectorIds());
    requireEmployees(inspectorIds);

    boolean withReminder = request.notification() != null && !inspectorIds.isEmpty();
    if (withReminder) {
      reminderService.validate(request.notification());
    }

    var inspection =
        insert(
            new Inspection(
                request.clientId(),
                request.assetId(),
                request.inspectionType(),
                request.dueDate(),
                request.location(),
                request.notes()));
    for (UUID employeeId : inspectorIds) {
      inspectionInspectorRepository.save(new InspectionInspector(inspection.getId(), employeeId));
    }

    if (withReminder) {
      reminderService.bindToInspection(inspection, request.notification(), inspectorIds);
    } else if (request.notification() != null) {
      log.info("Inspection {} has no inspectors, no reminder bound", inspection.getId());
    } else {
      log.debug("Inspection {} created without notification config", inspection.getId());
    }

    log.info(
        "Created {} inspection {} for asset {} due {} with {} inspector(s)",
        inspection.getInspectionType(),
        inspection.getId(),
        inspection.getAssetId(),
        inspection.getDueDate(),
        inspectorIds.size());
    return inspection;
  }

  @Transactional(readOnly = true)
  public boolean exists(
      UUID clientId, UUID assetId, InspectionType inspectionType, LocalDate dueDate) {
    return inspectionRepository.existsByClientIdAndAssetIdAndInspectionTypeAndDueDateAndDeletedFalse(
        clientId, assetId, inspectionType, dueDate);
  }

  @Transactional(readOnly = true)
  public List<UUID> findInspectorIds(UUID inspectionId) {
    return inspectionInspectorRepository.findByInspectionId(inspectionId).stream()
        .map(InspectionInspector::getEmployeeId)
        .distinct()
        .toList();
  }

  /** Assigned inspectors that are still live employees, in assignment order. */
  @Transactional(readOnly = true)
  public List<UUID> findActiveInspectorIds(UUID inspectionId) {
    var assigned = findInspectorIds(inspectionId);
    if (assigned.isEmpty()) {
      return assigned;
    }
    Set<UUID> live =
        employeeRepository.findByIdInAndDeletedFalse(assigned).stream()
            .map(Employee::getId)
            .collect(Collectors.toSet());
    if (live.size() < assigned.size()) {
      log.info(
          "Inspection {} has {} retired inspector(s), skipping them",
          inspectionId,
          assigned.size() - live.size());
    }
    return assigned.stream().filter(live::contains).toList();
  }

  /** Live inspections an asset has on a date, as reminders reference them. */
  @Transactional(readOnly = true)
  public List<UUID> findIdsByAssetAndDueDate(UUID clientId, UUID assetId, LocalDate dueDate) {
    return inspectionRepository
        .findByClientIdAndAssetIdAndDueDateAndDeletedFalse(clientId, assetId, dueDate)
        .stream()
        .map(Inspection::getId)
        .toList();
  }

  // The live-key unique index catches a concurrent bind that passed the exists() check.
  private Inspection insert(Inspection inspection) {
    try {
      return inspectionRepository.saveAndFlush(inspection);
    } catch (DataIntegrityViolationException e) {
      log.warn(
          "Insert of {} inspection for asset {} due {} rejected: {}",
          inspection.getInspectionType(),
          inspection.getAssetId(),
          inspection.getDueDate(),
          e.getMostSpecificCause().getMessage());
      throw duplicate(
          inspection.getInspectionType(), inspection.getAssetId(), inspection.getDueDate());
    }
  }

  private static ResourceConflictException duplicate(
      InspectionType inspectionType, UUID assetId, LocalDate dueDate) {
    return new ResourceConflictException(
        "Inspection already exists",
        "A "
            + inspectionType
            + " inspection for asset "
            + assetId
            + " is already due on "
            + dueDate);
  }

  private void requireEmployees(Set<UUID> employeeIds) {
    if (employeeIds.isEmpty()) {
      return;
    }
    Set<UUID> found =
        employeeRepository.findByIdInAndDeletedFalse(employeeIds).stream()
            .map(Employee::getId)
            .collect(Collectors.toSet());
    for (UUID employeeId : employeeIds) {
      if (!found.contains(employeeId)) {
        throw new ResourceNotFoundException("Employee", employeeId);
      }
    }
  }
}
