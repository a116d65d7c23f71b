package io.b2mash.b2b.checkinmonitor.person;

import io.b2mash.b2b.checkinmonitor.schedule.ScheduleOverride;
import io.b2mash.b2b.checkinmonitor.schedule.WorkDaysConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
@Table(name = "persons")
public class Person {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false)
  private UUID companyId;

  @Column(name = "first_name", nullable = false, length = 100)
  private String firstName;

  @Column(name = "last_name", nullable = false, length = 100)
  private String lastName;

  @Column(name = "email", nullable = false)
  private String email;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 20)
  private Role role;

  @Column(name = "team_id")
  private UUID teamId;

  @Column(name = "team_assigned_at")
  private Instant teamAssignedAt;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  // Schedule override; each column null means "use the team default"
  @Convert(converter = WorkDaysConverter.class)
  @Column(name = "work_days", length = 20)
  private Set<DayOfWeek> workDays;

  @Column(name = "check_in_start")
  private LocalTime checkInStart;

  @Column(name = "check_in_end")
  private LocalTime checkInEnd;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Person() {}

  public Person(UUID companyId, String firstName, String lastName, String email, Role role) {
    this.companyId = companyId;
    this.firstName = firstName;
    this.lastName = lastName;
    this.email = email;
    this.role = role;
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void assignToTeam(UUID teamId, Instant assignedAt) {
    this.teamId = teamId;
    this.teamAssignedAt = assignedAt;
    this.updatedAt = Instant.now();
  }

  public void overrideSchedule(
      Set<DayOfWeek> workDays, LocalTime checkInStart, LocalTime checkInEnd) {
    this.workDays = workDays;
    this.checkInStart = checkInStart;
    this.checkInEnd = checkInEnd;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  public ScheduleOverride scheduleOverride() {
    return new ScheduleOverride(workDays, checkInStart, checkInEnd);
  }

  public String getFullName() {
    return firstName + " " + lastName;
  }

  public UUID getId() {
    return id;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public String getFirstName() {
    return firstName;
  }

  public String getLastName() {
    return lastName;
  }

  public String getEmail() {
    return email;
  }

  public Role getRole() {
    return role;
  }

  public UUID getTeamId() {
    return teamId;
  }

  public Instant getTeamAssignedAt() {
    return teamAssignedAt;
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

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
