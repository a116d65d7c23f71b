package io.b2mash.b2b.checkinmonitor.missedcheckin.dto;

import io.b2mash.b2b.checkinmonitor.missedcheckin.MissedCheckIn;
import io.b2mash.b2b.checkinmonitor.missedcheckin.MissedCheckInSnapshot;
import io.b2mash.b2b.checkinmonitor.missedcheckin.MissedCheckInStatus;
import io.b2mash.b2b.checkinmonitor.person.Role;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

public record MissedCheckInView(
    UUID id,
    UUID personId,
    String workerName,
    UUID teamId,
    String teamName,
    LocalDate missedDate,
    String scheduleWindow,
    UUID teamLeaderIdAtMiss,
    String teamLeaderNameAtMiss,
    Role workerRoleAtMiss,
    MissedCheckInStatus status,
    String notes,
    UUID resolvedBy,
    Instant resolvedAt,
    Instant createdAt,
    SnapshotView snapshot) {

  public static MissedCheckInView from(
      MissedCheckIn record, Map<UUID, String> personNames, Map<UUID, String> teamNames) {
    return new MissedCheckInView(
        record.getId(),
        record.getPersonId(),
        personNames.get(record.getPersonId()),
        record.getTeamId(),
        teamNames.get(record.getTeamId()),
        record.getMissedDate(),
        record.getScheduleWindow(),
        record.getTeamLeaderIdAtMiss(),
        record.getTeamLeaderNameAtMiss(),
        record.getWorkerRoleAtMiss(),
        record.getStatus(),
        record.getNotes(),
        record.getResolvedBy(),
        record.getResolvedAt(),
        record.getCreatedAt(),
        SnapshotView.from(record.getSnapshot()));
  }

  public record SnapshotView(
      int dayOfWeek,
      int weekOfMonth,
      int checkInStreakBefore,
      Integer daysSinceLastCheckIn,
      Integer daysSinceLastMiss,
      int missesInLast30d,
      int missesInLast60d,
      int missesInLast90d,
      Double recentReadinessAvg,
      double baselineCompletionRate,
      boolean isFirstMissIn30d,
      boolean isIncreasingFrequency) {

    public static SnapshotView from(MissedCheckInSnapshot s) {
      if (s == null) {
        return null;
      }
      return new SnapshotView(
          s.getDayOfWeek(),
          s.getWeekOfMonth(),
          s.getCheckInStreakBefore(),
          s.getDaysSinceLastCheckIn(),
          s.getDaysSinceLastMiss(),
          s.getMissesInLast30d(),
          s.getMissesInLast60d(),
          s.getMissesInLast90d(),
          s.getRecentReadinessAvg(),
          s.getBaselineCompletionRate(),
          s.isFirstMissIn30d(),
          s.isIncreasingFrequency());
    }
  }
}
