package io.b2mash.b2b.checkinmonitor.checkin;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Daily check-in submitted by a worker. Written by the submission path; read-only to detection.
 * {@code checkInDate} is the tenant-local calendar date.
 */
@Entity
@Table(name = "check_ins")
public class CheckIn {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false)
  private UUID companyId;

  @Column(name = "person_id", nullable = false)
  private UUID personId;

  @Column(name = "check_in_date", nullable = false)
  private LocalDate checkInDate;

  @Column(name = "readiness_score", nullable = false)
  private int readinessScore;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CheckIn() {}

  public CheckIn(UUID companyId, UUID personId, LocalDate checkInDate, int readinessScore) {
    this.companyId = companyId;
    this.personId = personId;
    this.checkInDate = checkInDate;
    this.readinessScore = readinessScore;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public UUID getPersonId() {
    return personId;
  }

  public LocalDate getCheckInDate() {
    return checkInDate;
  }

  public int getReadinessScore() {
    return readinessScore;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
