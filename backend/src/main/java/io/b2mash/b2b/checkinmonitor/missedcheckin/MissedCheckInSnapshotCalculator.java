package io.b2mash.b2b.checkinmonitor.missedcheckin;

import io.b2mash.b2b.checkinmonitor.config.DetectionProperties;
import io.b2mash.b2b.checkinmonitor.schedule.WorkDays;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Computes the frozen behavioral snapshot for workers about to be recorded as missing. All history
 * is taken from [asOf - lookback, asOf), so nothing on or after the missed date counts.
 */
@Component
public class MissedCheckInSnapshotCalculator {

  private final MissedCheckInHistoryLoader historyLoader;
  private final DetectionProperties properties;

  public MissedCheckInSnapshotCalculator(
      MissedCheckInHistoryLoader historyLoader, DetectionProperties properties) {
    this.historyLoader = historyLoader;
    this.properties = properties;
  }

  /**
   * Calculates snapshots for all workers of one tenant. History is fetched in one batch for the
   * whole list.
   */
  public Map<UUID, MissedCheckInSnapshot> calculateBatch(
      UUID companyId, List<WorkerContext> workers, LocalDate asOf, Set<LocalDate> holidays) {
    if (workers.isEmpty()) {
      return Map.of();
    }
    var personIds = workers.stream().map(WorkerContext::personId).toList();
    var histories =
        historyLoader.load(
            companyId, personIds, asOf.minusDays(properties.historyLookbackDays()), asOf);

    var result = new HashMap<UUID, MissedCheckInSnapshot>();
    for (var worker : workers) {
      var history = histories.getOrDefault(worker.personId(), WorkerHistory.EMPTY);
      result.put(worker.personId(), calculate(worker, history, asOf, holidays));
    }
    return result;
  }

  MissedCheckInSnapshot calculate(
      WorkerContext worker, WorkerHistory history, LocalDate asOf, Set<LocalDate> holidays) {
    var windowStart = asOf.minusDays(properties.historyLookbackDays());
    var checkIns = history.checkIns();
    var misses = history.missDates();

    Integer daysSinceLastCheckIn =
        checkIns.isEmpty() ? null : daysBetween(checkIns.get(0).date(), asOf);
    Integer daysSinceLastMiss = misses.isEmpty() ? null : daysBetween(misses.get(0), asOf);

    var readinessFrom = asOf.minusDays(properties.readinessLookbackDays());
    var recentScores =
        checkIns.stream()
            .filter(c -> !c.date().isBefore(readinessFrom))
            .mapToInt(WorkerHistory.CheckInEntry::readinessScore)
            .average();
    Double recentReadinessAvg =
        recentScores.isPresent() ? roundToOneDecimal(recentScores.getAsDouble()) : null;

    var from30 = asOf.minusDays(30);
    var from60 = asOf.minusDays(60);
    int misses30 = (int) misses.stream().filter(d -> !d.isBefore(from30)).count();
    int misses60 = (int) misses.stream().filter(d -> !d.isBefore(from60)).count();
    int misses90 = misses.size();

    var checkInDates = new HashSet<LocalDate>();
    checkIns.forEach(c -> checkInDates.add(c.date()));

    // 30-day rate above 60-day rate, i.e. misses30 / 30 > misses60 / 60
    boolean increasing = misses30 * 2 > misses60 && misses30 >= 2;

    return new MissedCheckInSnapshot(
        WorkDays.toDayNumber(asOf.getDayOfWeek()),
        (asOf.getDayOfMonth() + 6) / 7,
        streak(worker, checkInDates, windowStart, asOf, holidays),
        daysSinceLastCheckIn,
        daysSinceLastMiss,
        misses30,
        misses60,
        misses90,
        recentReadinessAvg,
        completionRate(worker, checkIns, windowStart, asOf, holidays),
        misses30 == 0,
        increasing);
  }

  /** Consecutive required work days with a check-in, walking back from the day before asOf. */
  private int streak(
      WorkerContext worker,
      Set<LocalDate> checkInDates,
      LocalDate windowStart,
      LocalDate asOf,
      Set<LocalDate> holidays) {
    int streak = 0;
    for (var day = asOf.minusDays(1); !day.isBefore(windowStart); day = day.minusDays(1)) {
      if (holidays.contains(day) || !worker.schedule().isWorkDay(day.getDayOfWeek())) {
        continue;
      }
      if (!checkInDates.contains(day)) {
        break;
      }
      streak++;
    }
    return streak;
  }

  /** Check-ins since assignment as a percentage of required work days in the same span. */
  private double completionRate(
      WorkerContext worker,
      List<WorkerHistory.CheckInEntry> checkIns,
      LocalDate windowStart,
      LocalDate asOf,
      Set<LocalDate> holidays) {
    var from = worker.assignedOn().isAfter(windowStart) ? worker.assignedOn() : windowStart;

    int requiredDays = 0;
    for (var day = from; day.isBefore(asOf); day = day.plusDays(1)) {
      if (worker.schedule().isWorkDay(day.getDayOfWeek()) && !holidays.contains(day)) {
        requiredDays++;
      }
    }
    if (requiredDays == 0) {
      return 100;
    }

    long submitted =
        checkIns.stream()
            .filter(c -> !c.date().isBefore(worker.assignedOn()) && c.date().isBefore(asOf))
            .count();
    return roundToOneDecimal(submitted * 100.0 / requiredDays);
  }

  private static int daysBetween(LocalDate earlier, LocalDate later) {
    return (int) ChronoUnit.DAYS.between(earlier, later);
  }

  private static double roundToOneDecimal(double value) {
    return Math.round(value * 10) / 10.0;
  }
}
