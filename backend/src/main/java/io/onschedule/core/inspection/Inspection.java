package io.onschedule.core.inspection;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One dated occurrence of an inspection of an asset. Recurring occurrences are never updated in
 * place: the sweep creates a successor row and leaves this one untouched.
 */
@Entity
@Table(name = "inspections")
public class Inspection {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "client_id", nullable = false)
  private UUID clientId;

  @Column(name = "asset_id", nullable = false)
  private UUID assetId;

  @Enumerated(EnumType.STRING)
  @Column(name = "inspection_type", nullable = false, length = 40)
  private InspectionType inspectionType;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InspectionStatus status;

  @Column(name = "location", length = 255)
  private String location;

  @Column(name = "notes", length = 4000)
  private String notes;

  @Column(name = "deleted", nullable = false)
  private boolean deleted;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Inspection() {}

  public Inspection(
      UUID clientId,
      UUID assetId,
      InspectionType inspectionType,
      LocalDate dueDate,
      String location,
      String notes) {
    this.clientId = clientId;
    this.assetId = assetId;
    this.inspectionType = inspectionType;
    this.dueDate = dueDate;
    this.location = location;
    this.notes = notes;
    this.status = InspectionStatus.SCHEDULED;
    this.deleted = false;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void softDelete() {
    this.deleted = true;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getClientId() {
    return clientId;
  }

  public UUID getAssetId() {
    return assetId;
  }

  public InspectionType getInspectionType() {
    return inspectionType;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public InspectionStatus getStatus() {
    return status;
  }

  public String getLocation() {
    return location;
  }

  public String getNotes() {
    return notes;
  }

  public boolean isDeleted() {
    return deleted;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
