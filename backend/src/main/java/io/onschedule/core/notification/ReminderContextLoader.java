package io.onschedule.core.notification;

import io.onschedule.core.asset.AssetRepository;
import io.onschedule.core.client.ClientRepository;
import io.onschedule.core.employee.Employee;
import io.onschedule.core.employee.EmployeeRepository;
import io.onschedule.core.inspection.InspectionInspector;
import io.onschedule.core.inspection.InspectionInspectorRepository;
import io.onschedule.core.inspection.InspectionRepository;
import io.onschedule.core.reminder.ReminderMessage;
import io.onschedule.core.reminder.ReminderRepository;
import io.onschedule.core.template.EmailTemplate;
import io.onschedule.core.template.EmailTemplateRepository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class ReminderContextLoader {

  private static final Logger log = LoggerFactory.getLogger(ReminderContextLoader.class);

  private final InspectionRepository inspectionRepository;
  private final InspectionInspectorRepository inspectionInspectorRepository;
  private final ClientRepository clientRepository;
  private final AssetRepository assetRepository;
  private final EmployeeRepository employeeRepository;
  private final ReminderRepository reminderRepository;
  private final EmailTemplateRepository emailTemplateRepository;

  public ReminderContextLoader(
      InspectionRepository inspectionRepository,
      InspectionInspectorRepository inspectionInspectorRepository,
      ClientRepository clientRepository,
      AssetRepository assetRepository,
      EmployeeRepository employeeRepository,
      ReminderRepository reminderRepository,
      EmailTemplateRepository emailTemplateRepository) {
    this.inspectionRepository = inspectionRepository;
    this.inspectionInspectorRepository = inspectionInspectorRepository;
    this.clientRepository = clientRepository;
    this.assetRepository = assetRepository;
    this.employeeRepository = employeeRepository;
    this.reminderRepository = reminderRepository;
    this.emailTemplateRepository = emailTemplateRepository;
  }

  /** Loads the reminder context, or empty (with a warning) when any required part is gone. */
  @Transactional(readOnly = true)
  public Optional<ReminderContext> load(UUID inspectionId) {
    var inspection = inspectionRepository.findByIdAndDeletedFalse(inspectionId).orElse(null);
    if (inspection == null) {
      log.warn("Inspection {} not found, reminder not sent", inspectionId);
      return Optional.empty();
    }
    var client = clientRepository.findByIdAndDeletedFalse(inspection.getClientId()).orElse(null);
    if (client == null) {
      log.warn("Client {} of inspection {} not found", inspection.getClientId(), inspectionId);
      return Optional.empty();
    }
    var asset = assetRepository.findByIdAndDeletedFalse(inspection.getAssetId()).orElse(null);
    if (asset == null) {
      log.warn("Asset {} of inspection {} not found", inspection.getAssetId(), inspectionId);
      return Optional.empty();
    }
    var reminder =
        reminderRepository
            .findFirstByClientIdAndAssetIdAndReminderDateAndDeletedFalseOrderByCreatedAtDesc(
                inspection.getClientId(), inspection.getAssetId(), inspection.getDueDate())
            .orElse(null);
    if (reminder == null) {
      log.warn(
          "No reminder for asset {} on {}, inspection {} not notified",
          inspection.getAssetId(),
          inspection.getDueDate(),
          inspectionId);
      return Optional.empty();
    }

    var employeeIds =
        inspectionInspectorRepository.findByInspectionId(inspectionId).stream()
            .map(InspectionInspector::getEmployeeId)
            .toList();
    List<Employee> inspectors =
        employeeIds.isEmpty()
            ? List.of()
            : employeeRepository.findByIdInAndDeletedFalse(employeeIds);

    EmailTemplate emailTemplate = null;
    if (reminder.getMessage() instanceof ReminderMessage.TemplateMessage template
        && template.emailTemplateId() != null) {
      emailTemplate =
          emailTemplateRepository.findByIdAndDeletedFalse(template.emailTemplateId()).orElse(null);
    }

    return Optional.of(
        new ReminderContext(inspection, client, asset, inspectors, reminder, emailTemplate));
  }
}
