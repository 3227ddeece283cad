package io.onschedule.core.client;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "clients")
public class Client {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company", nullable = false, length = 255)
  private String company;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "phone", length = 50)
  private String phone;

  @Column(name = "deleted", nullable = false)
  private boolean deleted;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Client() {}

  public Client(String company, String email, String phone) {
    this.company = company;
    this.email = email;
    this.phone = phone;
    this.deleted = false;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getCompany() {
    return company;
  }

  public String getEmail() {
    return email;
  }

  public String getPhone() {
    return phone;
  }

  public boolean isDeleted() {
    return deleted;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
