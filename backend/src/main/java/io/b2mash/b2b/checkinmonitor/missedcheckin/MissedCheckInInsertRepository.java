package io.b2mash.b2b.checkinmonitor.missedcheckin;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Batched insert-or-ignore writer for missed check-ins. The unique constraint on (company_id,
 * person_id, missed_date) is the only guard against duplicates when passes overlap with other
 * writers; rows that hit it are skipped silently.
 */
@Repository
public class MissedCheckInInsertRepository {

  static final int CHUNK_SIZE = 500;

  private static final String INSERT_PREFIX =
      """
      INSERT INTO missed_check_ins
          (id, company_id, person_id, team_id, missed_date, schedule_window,
           team_leader_id_at_miss, team_leader_name_at_miss, worker_role_at_miss,
           day_of_week, week_of_month, check_in_streak_before, days_since_last_check_in,
           days_since_last_miss, misses_in_last_30d, misses_in_last_60d, misses_in_last_90d,
           recent_readiness_avg, baseline_completion_rate, is_first_miss_in_30d,
           is_increasing_frequency, status, version, created_at, updated_at)
      VALUES
      """;

  private static final String ROW_PLACEHOLDERS =
      "(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0, ?, ?)";

  private static final String INSERT_SUFFIX =
      """

      ON CONFLICT (company_id, person_id, missed_date) DO NOTHING
      RETURNING id, person_id
      """;

  private final JdbcClient jdbc;
  private final Clock clock;

  public MissedCheckInInsertRepository(JdbcClient jdbc, Clock clock) {
    this.jdbc = jdbc;
    this.clock = clock;
  }

  /**
   * Inserts all rows, skipping any that already exist for the same worker and date.
   *
   * @return new record id keyed by person id, for the rows that were actually inserted
   */
  @Transactional
  public Map<UUID, UUID> insertIgnoringDuplicates(UUID companyId, List<NewMissedCheckIn> rows) {
    var inserted = new HashMap<UUID, UUID>();
    for (int start = 0; start < rows.size(); start += CHUNK_SIZE) {
      var chunk = rows.subList(start, Math.min(start + CHUNK_SIZE, rows.size()));
      inserted.putAll(insertChunk(companyId, chunk));
    }
    return inserted;
  }

  private Map<UUID, UUID> insertChunk(UUID companyId, List<NewMissedCheckIn> chunk) {
    var now = Timestamp.from(clock.instant());
    var params = new ArrayList<Object>(chunk.size() * 24);
    var sql = new StringBuilder(INSERT_PREFIX);
    for (int i = 0; i < chunk.size(); i++) {
      var row = chunk.get(i);
      var s = row.snapshot();
      sql.append(i == 0 ? "    " : ",\n    ").append(ROW_PLACEHOLDERS);
      params.add(UUID.randomUUID());
      params.add(companyId);
      params.add(row.personId());
      params.add(row.teamId());
      params.add(row.missedDate());
      params.add(row.scheduleWindow());
      params.add(row.teamLeaderId());
      params.add(row.teamLeaderName());
      params.add(row.workerRole() != null ? row.workerRole().name() : null);
      params.add(s.getDayOfWeek());
      params.add(s.getWeekOfMonth());
      params.add(s.getCheckInStreakBefore());
      params.add(s.getDaysSinceLastCheckIn());
      params.add(s.getDaysSinceLastMiss());
      params.add(s.getMissesInLast30d());
      params.add(s.getMissesInLast60d());
      params.add(s.getMissesInLast90d());
      params.add(s.getRecentReadinessAvg());
      params.add(s.getBaselineCompletionRate());
      params.add(s.isFirstMissIn30d());
      params.add(s.isIncreasingFrequency());
      params.add(MissedCheckInStatus.OPEN.name());
      params.add(now);
      params.add(now);
    }
    sql.append(INSERT_SUFFIX);

    var result = new HashMap<UUID, UUID>();
    jdbc.sql(sql.toString())
        .params(params)
        .query(
            (rs, rowNum) ->
                Map.entry(rs.getObject("person_id", UUID.class), rs.getObject("id", UUID.class)))
        .list()
        .forEach(e -> result.put(e.getKey(), e.getValue()));
    return result;
  }
}
