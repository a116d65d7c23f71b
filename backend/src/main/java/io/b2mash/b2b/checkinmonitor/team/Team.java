package io.b2mash.b2b.checkinmonitor.team;

import io.b2mash.b2b.checkinmonitor.schedule.TeamSchedule;
import io.b2mash.b2b.checkinmonitor.schedule.WorkDaysConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "teams")
public class Team {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false)
  private UUID companyId;

  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Convert(converter = WorkDaysConverter.class)
  @Column(name = "work_days", nullable = false, length = 20)
  private Set<DayOfWeek> workDays;

  @Column(name = "check_in_start", nullable = false)
  private LocalTime checkInStart;

  @Column(name = "check_in_end", nullable = false)
  private LocalTime checkInEnd;

  @Column(name = "leader_id")
  private UUID leaderId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Team() {}

  public Team(
      UUID companyId,
      String name,
      Set<DayOfWeek> workDays,
      LocalTime checkInStart,
      LocalTime checkInEnd,
      UUID leaderId) {
    this.companyId = companyId;
    this.name = name;
    this.active = true;
    this.workDays = workDays;
    this.checkInStart = checkInStart;
    this.checkInEnd = checkInEnd;
    this.leaderId = leaderId;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void assignLeader(UUID leaderId) {
    this.leaderId = leaderId;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  /** Team default schedule used as the fallback tier for its workers. */
  public TeamSchedule schedule() {
    return new TeamSchedule(workDays, checkInStart, checkInEnd);
  }

  public UUID getId() {
    return id;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public String getName() {
    return name;
  }

  public boolean isActive() {
    return active;
  }

  public Set<DayOfWeek> getWorkDays() {
    return workDays;
  }

  public LocalTime getCheckInStart() {
    return checkInStart;
  }

  public LocalTime getCheckInEnd() {
    return checkInEnd;
  }

  public UUID getLeaderId() {
    return leaderId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
