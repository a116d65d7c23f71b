package io.b2mash.b2b.checkinmonitor.missedcheckin;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Behavioral indicators captured when a miss is detected. Computed once from history strictly
 * before the missed date and never recalculated, even if schedules or holidays change later.
 */
@Embeddable
public class MissedCheckInSnapshot {

  /** 0 = Sunday ... 6 = Saturday. */
  @Column(name = "day_of_week", nullable = false)
  private int dayOfWeek;

  /** 1..5, ceil(dayOfMonth / 7). */
  @Column(name = "week_of_month", nullable = false)
  private int weekOfMonth;

  @Column(name = "check_in_streak_before", nullable = false)
  private int checkInStreakBefore;

  @Column(name = "days_since_last_check_in")
  private Integer daysSinceLastCheckIn;

  @Column(name = "days_since_last_miss")
  private Integer daysSinceLastMiss;

  @Column(name = "misses_in_last_30d", nullable = false)
  private int missesInLast30d;

  @Column(name = "misses_in_last_60d", nullable = false)
  private int missesInLast60d;

  @Column(name = "misses_in_last_90d", nullable = false)
  private int missesInLast90d;

  @Column(name = "recent_readiness_avg")
  private Double recentReadinessAvg;

  /** Percentage, 0..100 (may exceed 100 when check-ins were submitted on non-work days). */
  @Column(name = "baseline_completion_rate", nullable = false)
  private double baselineCompletionRate;

  @Column(name = "is_first_miss_in_30d", nullable = false)
  private boolean firstMissIn30d;

  @Column(name = "is_increasing_frequency", nullable = false)
  private boolean increasingFrequency;

  protected MissedCheckInSnapshot() {}

  public MissedCheckInSnapshot(
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
      boolean firstMissIn30d,
      boolean increasingFrequency) {
    this.dayOfWeek = dayOfWeek;
    this.weekOfMonth = weekOfMonth;
    this.checkInStreakBefore = checkInStreakBefore;
    this.daysSinceLastCheckIn = daysSinceLastCheckIn;
    this.daysSinceLastMiss = daysSinceLastMiss;
    this.missesInLast30d = missesInLast30d;
    this.missesInLast60d = missesInLast60d;
    this.missesInLast90d = missesInLast90d;
    this.recentReadinessAvg = recentReadinessAvg;
    this.baselineCompletionRate = baselineCompletionRate;
    this.firstMissIn30d = firstMissIn30d;
    this.increasingFrequency = increasingFrequency;
  }

  public int getDayOfWeek() {
    return dayOfWeek;
  }

  public int getWeekOfMonth() {
    return weekOfMonth;
  }

  public int getCheckInStreakBefore() {
    return checkInStreakBefore;
  }

  public Integer getDaysSinceLastCheckIn() {
    return daysSinceLastCheckIn;
  }

  public Integer getDaysSinceLastMiss() {
    return daysSinceLastMiss;
  }

  public int getMissesInLast30d() {
    return missesInLast30d;
  }

  public int getMissesInLast60d() {
    return missesInLast60d;
  }

  public int getMissesInLast90d() {
    return missesInLast90d;
  }

  public Double getRecentReadinessAvg() {
    return recentReadinessAvg;
  }

  public double getBaselineCompletionRate() {
    return baselineCompletionRate;
  }

  public boolean isFirstMissIn30d() {
    return firstMissIn30d;
  }

  public boolean isIncreasingFrequency() {
    return increasingFrequency;
  }
}
