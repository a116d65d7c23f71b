package io.b2mash.b2b.checkinmonitor.company;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.ZoneId;
import java.util.UUID;

/** Tenant. Every other entity carries its {@code company_id}. */
@Entity
@Table(name = "companies")
public class Company {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false)
  private String name;

  /** IANA zone name, e.g. "Asia/Manila". */
  @Column(name = "timezone", nullable = false, length = 64)
  private String timezone;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Company() {}

  public Company(String name, String timezone) {
    this.name = name;
    this.timezone = timezone;
    this.active = true;
    this.createdAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
  }

  public ZoneId zoneId() {
    return ZoneId.of(timezone);
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getTimezone() {
    return timezone;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
