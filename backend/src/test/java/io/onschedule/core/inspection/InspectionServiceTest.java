package io.onschedule.core.inspection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.onschedule.core.asset.Asset;
import io.onschedule.core.asset.AssetRepository;
import io.onschedule.core.client.Client;
import io.onschedule.core.client.ClientRepository;
import io.onschedule.core.employee.Employee;
import io.onschedule.core.employee.EmployeeRepository;
import io.onschedule.core.exception.ResourceConflictException;
import io.onschedule.core.exception.ResourceNotFoundException;
import io.onschedule.core.exception.ValidationFailedException;
import io.onschedule.core.reminder.NotificationConfig;
import io.onschedule.core.reminder.NotificationMethod;
import io.onschedule.core.reminder.ReminderMessage;
import io.onschedule.core.reminder.ReminderService;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class InspectionServiceTest {

  private static final LocalDate DUE = LocalDate.of(2024, 3, 1);

  @Mock private InspectionRepository inspectionRepository;
  @Mock private InspectionInspectorRepository inspectionInspectorRepository;
  @Mock private ClientRepository clientRepository;
  @Mock private AssetRepository assetRepository;
  @Mock private EmployeeRepository employeeRepository;
  @Mock private ReminderService reminderService;

  private InspectionService service;
  private final UUID clientId = UUID.randomUUID();
  private final UUID assetId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    service =
        new InspectionService(
            inspectionRepository,
            inspectionInspectorRepository,
            clientRepository,
            assetRepository,
            employeeRepository,
            reminderService);
  }

  @Test
  void bind_withoutDueDate_isRejected() {
    var request = request(null, List.of(), null);

    assertThatThrownBy(() -> service.bind(request))
        .isInstanceOf(ValidationFailedException.class)
        .hasMessageContaining("dueDate");
    verifyNoInteractions(inspectionRepository);
  }

  @Test
  void bind_duplicateKey_isConflict() {
    when(inspectionRepository.existsByClientIdAndAssetIdAndInspectionTypeAndDueDateAndDeletedFalse(
            clientId, assetId, InspectionType.MONTHLY, DUE))
        .thenReturn(true);

    assertThatThrownBy(() -> service.bind(request(DUE, List.of(), null)))
        .isInstanceOf(ResourceConflictException.class);
    verify(inspectionRepository, never()).saveAndFlush(any());
  }

  @Test
  void bind_unknownClient_isNotFound() {
    when(clientRepository.findByIdAndDeletedFalse(clientId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.bind(request(DUE, List.of(), null)))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void bind_unknownInspector_isNotFound() {
    stubClientAndAsset();
    var known = employee();
    UUID unknown = UUID.randomUUID();
    when(employeeRepository.findByIdInAndDeletedFalse(anyCollection())).thenReturn(List.of(known));

    assertThatThrownBy(() -> service.bind(request(DUE, List.of(known.getId(), unknown), null)))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessageContaining(unknown.toString());
    verify(inspectionRepository, never()).saveAndFlush(any());
  }

  @Test
  void bind_duplicateInspectorIds_areAssignedOnce() {
    stubClientAndAsset();
    stubSave();
    var first = employee();
    var second = employee();
    when(employeeRepository.findByIdInAndDeletedFalse(anyCollection()))
        .thenReturn(List.of(first, second));
    var config = manualConfig();

    var inspection =
        service.bind(
            request(DUE, List.of(first.getId(), first.getId(), second.getId()), config));

    assertThat(inspection.getStatus()).isEqualTo(InspectionStatus.SCHEDULED);
    verify(inspectionInspectorRepository, times(2)).save(any(InspectionInspector.class));
    verify(reminderService).validate(config);
    verify(reminderService)
        .bindToInspection(eq(inspection), eq(config), argThat(ids -> ids.size() == 2));
  }

  @Test
  void bind_invalidNotification_writesNothing() {
    stubClientAndAsset();
    var inspector = employee();
    when(employeeRepository.findByIdInAndDeletedFalse(anyCollection()))
        .thenReturn(List.of(inspector));
    var config = manualConfig();
    doThrow(new ValidationFailedException("manual message must be at least 10 characters"))
        .when(reminderService)
        .validate(config);

    assertThatThrownBy(() -> service.bind(request(DUE, List.of(inspector.getId()), config)))
        .isInstanceOf(ValidationFailedException.class);
    verify(inspectionRepository, never()).saveAndFlush(any());
    verify(inspectionInspectorRepository, never()).save(any());
  }

  @Test
  void bind_withoutInspectors_skipsReminder() {
    stubClientAndAsset();
    stubSave();

    service.bind(request(DUE, List.of(), manualConfig()));

    verify(reminderService, never()).validate(any());
    verify(reminderService, never()).bindToInspection(any(), any(), any());
  }

  @Test
  void bind_withoutNotification_createsInspectionOnly() {
    stubClientAndAsset();
    stubSave();
    var inspector = employee();
    when(employeeRepository.findByIdInAndDeletedFalse(anyCollection()))
        .thenReturn(List.of(inspector));

    var inspection = service.bind(request(DUE, List.of(inspector.getId()), null));

    assertThat(inspection.getDueDate()).isEqualTo(DUE);
    verify(inspectionInspectorRepository).save(any(InspectionInspector.class));
    verify(reminderService, never()).bindToInspection(any(), any(), any());
  }

  @Test
  void bind_uniqueIndexViolation_isConflict() {
    stubClientAndAsset();
    when(inspectionRepository.saveAndFlush(any(Inspection.class)))
        .thenThrow(
            new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException("duplicate key violates \"uq_inspections_live_key\"")));

    assertThatThrownBy(() -> service.bind(request(DUE, List.of(), manualConfig())))
        .isInstanceOf(ResourceConflictException.class)
        .hasMessageContaining("already due on 2024-03-01");
    verifyNoInteractions(inspectionInspectorRepository);
    verify(reminderService, never()).bindToInspection(any(), any(), any());
  }

  @Test
  void findActiveInspectorIds_skipsRetiredEmployees() {
    UUID inspectionId = UUID.randomUUID();
    var active = employee();
    UUID retired = UUID.randomUUID();
    when(inspectionInspectorRepository.findByInspectionId(inspectionId))
        .thenReturn(
            List.of(
                new InspectionInspector(inspectionId, retired),
                new InspectionInspector(inspectionId, active.getId())));
    when(employeeRepository.findByIdInAndDeletedFalse(anyCollection()))
        .thenReturn(List.of(active));

    assertThat(service.findActiveInspectorIds(inspectionId)).containsExactly(active.getId());
  }

  private BindInspectionRequest request(
      LocalDate dueDate, List<UUID> inspectorIds, NotificationConfig config) {
    return new BindInspectionRequest(
        clientId, assetId, InspectionType.MONTHLY, dueDate, "Bay 4", null, inspectorIds, config);
  }

  private static NotificationConfig manualConfig() {
    return new NotificationConfig(
        NotificationMethod.EMAIL, null, new ReminderMessage.ManualMessage("Check the hoist cable"));
  }

  private void stubClientAndAsset() {
    when(clientRepository.findByIdAndDeletedFalse(clientId))
        .thenReturn(Optional.of(new Client("Acme Lifting", "ops@acme.test", null)));
    when(assetRepository.findByIdAndDeletedFalse(assetId))
        .thenReturn(Optional.of(new Asset(clientId, "Crane 7", "CR-7", "Yard")));
  }

  private void stubSave() {
    when(inspectionRepository.saveAndFlush(any(Inspection.class)))
        .thenAnswer(
            inv -> {
              Inspection inspection = inv.getArgument(0);
              ReflectionTestUtils.setField(inspection, "id", UUID.randomUUID());
              return inspection;
            });
  }

  private static Employee employee() {
    var employee = new Employee("Sam", "Inspector", "sam@acme.test", null);
    ReflectionTestUtils.setField(employee, "id", UUID.randomUUID());
    return employee;
  }
}
