package io.onschedule.core.inspection;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "inspection_inspectors")
public class InspectionInspector {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "inspection_id", nullable = false, updatable = false)
  private UUID inspectionId;

  @Column(name = "employee_id", nullable = false, updatable = false)
  private UUID employeeId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected InspectionInspector() {}

  public InspectionInspector(UUID inspectionId, UUID employeeId) {
    this.inspectionId = inspectionId;
    this.employeeId = employeeId;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getInspectionId() {
    return inspectionId;
  }

  public UUID getEmployeeId() {
    return employeeId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
