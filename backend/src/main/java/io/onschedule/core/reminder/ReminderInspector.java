package io.onschedule.core.reminder;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "reminder_inspectors")
public class ReminderInspector {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "reminder_id", nullable = false, updatable = false)
  private UUID reminderId;

  @Column(name = "employee_id", nullable = false, updatable = false)
  private UUID employeeId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ReminderInspector() {}

  public ReminderInspector(UUID reminderId, UUID employeeId) {
    this.reminderId = reminderId;
    this.employeeId = employeeId;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getReminderId() {
    return reminderId;
  }

  public UUID getEmployeeId() {
    return employeeId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
