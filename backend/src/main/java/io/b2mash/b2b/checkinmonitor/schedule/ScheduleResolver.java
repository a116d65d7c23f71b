package io.b2mash.b2b.checkinmonitor.schedule;

import java.time.DayOfWeek;
import java.util.Set;

/**
 * Merges a worker's schedule override with the team default. Precedence is per field: a worker may
 * override only the work days, only the window, or any combination.
 *
 * <p>All methods are pure and never throw for missing override data.
 */
public final class ScheduleResolver {

  private ScheduleResolver() {}

  /**
   * Resolves the effective schedule. If merging produces an inverted window (start not before end),
   * the team's window is used as a whole. If neither tier has work days, Monday to Friday applies.
   */
  public static EffectiveSchedule effectiveSchedule(ScheduleOverride person, TeamSchedule team) {
    var override = person != null ? person : ScheduleOverride.NONE;
    var workDays = resolveWorkDays(override, team);

    var start = override.checkInStart() != null ? override.checkInStart() : team.checkInStart();
    var end = override.checkInEnd() != null ? override.checkInEnd() : team.checkInEnd();

    if (!end.isAfter(start)) {
      return new EffectiveSchedule(workDays, team.checkInStart(), team.checkInEnd());
    }
    return new EffectiveSchedule(workDays, start, end);
  }

  /** Applies the same precedence as {@link #effectiveSchedule} to the work-day set only. */
  public static boolean isWorkDay(DayOfWeek day, ScheduleOverride person, TeamSchedule team) {
    var override = person != null ? person : ScheduleOverride.NONE;
    return resolveWorkDays(override, team).contains(day);
  }

  private static Set<DayOfWeek> resolveWorkDays(ScheduleOverride person, TeamSchedule team) {
    if (person.workDays() != null && !person.workDays().isEmpty()) {
      return person.workDays();
    }
    if (team.workDays() != null && !team.workDays().isEmpty()) {
      return team.workDays();
    }
    return WorkDays.MONDAY_TO_FRIDAY;
  }
}
