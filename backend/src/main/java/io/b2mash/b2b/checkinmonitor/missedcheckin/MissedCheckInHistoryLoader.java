package io.b2mash.b2b.checkinmonitor.missedcheckin;

import io.b2mash.b2b.checkinmonitor.checkin.CheckInRepository;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Loads snapshot history for a whole batch of workers with one query per source table. */
@Component
public class MissedCheckInHistoryLoader {

  private final CheckInRepository checkInRepository;
  private final MissedCheckInRepository missedCheckInRepository;

  public MissedCheckInHistoryLoader(
      CheckInRepository checkInRepository, MissedCheckInRepository missedCheckInRepository) {
    this.checkInRepository = checkInRepository;
    this.missedCheckInRepository = missedCheckInRepository;
  }

  /**
   * Returns history in [from, to) for every requested worker. Workers without any rows map to an
   * empty history.
   */
  @Transactional(readOnly = true)
  public Map<UUID, WorkerHistory> load(
      UUID companyId, Collection<UUID> personIds, LocalDate from, LocalDate to) {
    if (personIds.isEmpty()) {
      return Map.of();
    }

    var checkIns = new HashMap<UUID, List<WorkerHistory.CheckInEntry>>();
    for (var fact : checkInRepository.findFactsInRange(companyId, personIds, from, to)) {
      checkIns
          .computeIfAbsent(fact.getPersonId(), k -> new ArrayList<>())
          .add(new WorkerHistory.CheckInEntry(fact.getCheckInDate(), fact.getReadinessScore()));
    }

    var misses = new HashMap<UUID, List<LocalDate>>();
    for (var fact : missedCheckInRepository.findMissFactsInRange(companyId, personIds, from, to)) {
      misses.computeIfAbsent(fact.getPersonId(), k -> new ArrayList<>()).add(fact.getMissedDate());
    }

    var result = new HashMap<UUID, WorkerHistory>();
    for (var personId : personIds) {
      result.put(
          personId,
          new WorkerHistory(
              checkIns.getOrDefault(personId, List.of()),
              misses.getOrDefault(personId, List.of())));
    }
    return result;
  }
}
