package io.b2mash.b2b.checkinmonitor.schedule;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Set;

/**
 * Worker-level schedule tier. Every field is optional; a null field defers to the team default for
 * that field only.
 */
public record ScheduleOverride(
    Set<DayOfWeek> workDays, LocalTime checkInStart, LocalTime checkInEnd) {

  public static final ScheduleOverride NONE = new ScheduleOverride(null, null, null);
}
