package io.b2mash.b2b.checkinmonitor.missedcheckin;

import java.time.LocalDate;
import java.util.List;

/**
 * Check-ins and prior misses of one worker inside the lookback window, both newest first.
 */
public record WorkerHistory(List<CheckInEntry> checkIns, List<LocalDate> missDates) {

  public static final WorkerHistory EMPTY = new WorkerHistory(List.of(), List.of());

  public WorkerHistory {
    checkIns = List.copyOf(checkIns);
    missDates = List.copyOf(missDates);
  }

  public record CheckInEntry(LocalDate date, int readinessScore) {}
}
