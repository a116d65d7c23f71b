package io.b2mash.b2b.checkinmonitor.schedule;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Conversions between stored work-day strings and {@link DayOfWeek} sets. Stored form is a
 * comma-separated list of day numbers where 0 is Sunday and 6 is Saturday (e.g. {@code "1,2,3,4,5"}
 * for Monday to Friday).
 */
public final class WorkDays {

  /** CSV of 0-6, at least one entry. */
  private static final Pattern WORK_DAYS_PATTERN = Pattern.compile("^[0-6](,[0-6])*$");

  public static final Set<DayOfWeek> MONDAY_TO_FRIDAY =
      Collections.unmodifiableSet(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY));

  private WorkDays() {}

  /**
   * Parses a stored work-day string. Returns null for null, blank or malformed input so callers can
   * fall back to the next schedule tier.
   */
  public static Set<DayOfWeek> parse(String value) {
    if (value == null) {
      return null;
    }
    var trimmed = value.replace(" ", "");
    if (!WORK_DAYS_PATTERN.matcher(trimmed).matches()) {
      return null;
    }
    var days = EnumSet.noneOf(DayOfWeek.class);
    for (String part : trimmed.split(",")) {
      days.add(fromDayNumber(Integer.parseInt(part)));
    }
    return Collections.unmodifiableSet(days);
  }

  /** Formats a day set in stored form, ordered Sunday first. Returns null for null input. */
  public static String format(Set<DayOfWeek> days) {
    if (days == null) {
      return null;
    }
    return days.stream()
        .map(WorkDays::toDayNumber)
        .sorted()
        .map(String::valueOf)
        .collect(Collectors.joining(","));
  }

  /** Day number in stored form: 0 = Sunday, 1 = Monday, ..., 6 = Saturday. */
  public static int toDayNumber(DayOfWeek day) {
    return day.getValue() % 7;
  }

  public static DayOfWeek fromDayNumber(int number) {
    return number == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(number);
  }
}
