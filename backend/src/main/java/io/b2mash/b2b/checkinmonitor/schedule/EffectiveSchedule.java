package io.b2mash.b2b.checkinmonitor.schedule;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Set;

/** Schedule a worker is held to after merging their override with the team default. */
public record EffectiveSchedule(
    Set<DayOfWeek> workDays, LocalTime checkInStart, LocalTime checkInEnd) {

  private static final DateTimeFormatter TIME_12H =
      DateTimeFormatter.ofPattern("h:mm a", Locale.ENGLISH);

  public EffectiveSchedule {
    workDays = Set.copyOf(workDays);
  }

  public boolean isWorkDay(DayOfWeek day) {
    return workDays.contains(day);
  }

  /** Human-readable window, e.g. {@code "6:00 AM - 10:00 AM"}. */
  public String windowLabel() {
    return TIME_12H.format(checkInStart) + " - " + TIME_12H.format(checkInEnd);
  }
}
