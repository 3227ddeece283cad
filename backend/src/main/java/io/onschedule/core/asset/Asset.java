package io.onschedule.core.asset;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "assets")
public class Asset {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "client_id", nullable = false)
  private UUID clientId;

  @Column(name = "name", length = 255)
  private String name;

  @Column(name = "serial_no", length = 100)
  private String serialNo;

  @Column(name = "location", length = 255)
  private String location;

  @Column(name = "deleted", nullable = false)
  private boolean deleted;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Asset() {}

  public Asset(UUID clientId, String name, String serialNo, String location) {
    this.clientId = clientId;
    this.name = name;
    this.serialNo = serialNo;
    this.location = location;
    this.deleted = false;
    this.createdAt = Instant.now();
  }

  /** Name when present, otherwise the serial number. Reminders identify the asset by this label. */
  public String getLabel() {
    if (name != null && !name.isBlank()) {
      return name;
    }
    return serialNo != null ? serialNo : "";
  }

  public UUID getId() {
    return id;
  }

  public UUID getClientId() {
    return clientId;
  }

  public String getName() {
    return name;
  }

  public String getSerialNo() {
    return serialNo;
  }

  public String getLocation() {
    return location;
  }

  public boolean isDeleted() {
    return deleted;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
