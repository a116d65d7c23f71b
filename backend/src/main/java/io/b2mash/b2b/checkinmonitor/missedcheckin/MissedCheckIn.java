package io.b2mash.b2b.checkinmonitor.missedcheckin;

import io.b2mash.b2b.checkinmonitor.exception.InvalidStateException;
import io.b2mash.b2b.checkinmonitor.person.Role;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A worker's missed daily check-in. Rows are inserted by {@link MissedCheckInInsertRepository}
 * (insert-or-ignore on company, person and date); afterwards only the review status, notes and
 * resolution fields change. The leader snapshot and {@link MissedCheckInSnapshot} are frozen.
 */
@Entity
@Table(name = "missed_check_ins")
public class MissedCheckIn {

  @Id private UUID id;

  @Column(name = "company_id", nullable = false, updatable = false)
  private UUID companyId;

  @Column(name = "person_id", nullable = false, updatable = false)
  private UUID personId;

  @Column(name = "team_id", nullable = false, updatable = false)
  private UUID teamId;

  @Column(name = "missed_date", nullable = false, updatable = false)
  private LocalDate missedDate;

  @Column(name = "schedule_window", nullable = false, updatable = false, length = 50)
  private String scheduleWindow;

  @Column(name = "team_leader_id_at_miss", updatable = false)
  private UUID teamLeaderIdAtMiss;

  @Column(name = "team_leader_name_at_miss", updatable = false, length = 200)
  private String teamLeaderNameAtMiss;

  @Enumerated(EnumType.STRING)
  @Column(name = "worker_role_at_miss", updatable = false, length = 20)
  private Role workerRoleAtMiss;

  @Embedded private MissedCheckInSnapshot snapshot;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private MissedCheckInStatus status;

  @Column(name = "notes", length = 500)
  private String notes;

  @Column(name = "resolved_by")
  private UUID resolvedBy;

  @Column(name = "resolved_at")
  private Instant resolvedAt;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected MissedCheckIn() {}

  /**
   * Moves the record to {@code target}. Notes, when given, replace the current notes on any
   * transition. Entering a terminal state records the reviewer and timestamp.
   *
   * @throws InvalidStateException if the transition table does not allow it; nothing is changed
   */
  public void transitionTo(
      MissedCheckInStatus target, UUID actingUserId, String newNotes, Instant now) {
    if (!this.status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid status transition",
          "Cannot transition missed check-in from " + this.status + " to " + target);
    }
    this.status = target;
    if (newNotes != null) {
      this.notes = newNotes;
    }
    if (target.isTerminal()) {
      this.resolvedBy = actingUserId;
      this.resolvedAt = now;
    }
    this.updatedAt = now;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public UUID getPersonId() {
    return personId;
  }

  public UUID getTeamId() {
    return teamId;
  }

  public LocalDate getMissedDate() {
    return missedDate;
  }

  public String getScheduleWindow() {
    return scheduleWindow;
  }

  public UUID getTeamLeaderIdAtMiss() {
    return teamLeaderIdAtMiss;
  }

  public String getTeamLeaderNameAtMiss() {
    return teamLeaderNameAtMiss;
  }

  public Role getWorkerRoleAtMiss() {
    return workerRoleAtMiss;
  }

  public MissedCheckInSnapshot getSnapshot() {
    return snapshot;
  }

  public MissedCheckInStatus getStatus() {
    return status;
  }

  public String getNotes() {
    return notes;
  }

  public UUID getResolvedBy() {
    return resolvedBy;
  }

  public Instant getResolvedAt() {
    return resolvedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
