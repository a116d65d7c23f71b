package io.b2mash.b2b.checkinmonitor.schedule;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Set;

/** Team-level default schedule. The window is [checkInStart, checkInEnd) in tenant-local time. */
public record TeamSchedule(Set<DayOfWeek> workDays, LocalTime checkInStart, LocalTime checkInEnd) {}
