package io.b2mash.b2b.checkinmonitor.missedcheckin;

import io.b2mash.b2b.checkinmonitor.checkin.CheckInRepository;
import io.b2mash.b2b.checkinmonitor.company.Company;
import io.b2mash.b2b.checkinmonitor.config.DetectionProperties;
import io.b2mash.b2b.checkinmonitor.holiday.HolidayService;
import io.b2mash.b2b.checkinmonitor.person.Person;
import io.b2mash.b2b.checkinmonitor.person.PersonRepository;
import io.b2mash.b2b.checkinmonitor.schedule.EffectiveSchedule;
import io.b2mash.b2b.checkinmonitor.schedule.ScheduleResolver;
import io.b2mash.b2b.checkinmonitor.team.Team;
import io.b2mash.b2b.checkinmonitor.team.TeamRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Detects missed check-ins for a single company, for its current local date. Workers whose window
 * closes at or after midnight are checked for the previous date on the next day's passes.
 * Exceptions propagate to the caller, which isolates failures per company.
 */
@Service
public class TenantMissedCheckInProcessor {

  private static final Logger log = LoggerFactory.getLogger(TenantMissedCheckInProcessor.class);

  private static final long SECONDS_PER_DAY = 24 * 60 * 60;

  private final Clock clock;
  private final DetectionProperties properties;
  private final HolidayService holidayService;
  private final TeamRepository teamRepository;
  private final PersonRepository personRepository;
  private final CheckInRepository checkInRepository;
  private final MissedCheckInRepository missedCheckInRepository;
  private final MissedCheckInSnapshotCalculator snapshotCalculator;
  private final MissedCheckInInsertRepository insertRepository;

  public TenantMissedCheckInProcessor(
      Clock clock,
      DetectionProperties properties,
      HolidayService holidayService,
      TeamRepository teamRepository,
      PersonRepository personRepository,
      CheckInRepository checkInRepository,
      MissedCheckInRepository missedCheckInRepository,
      MissedCheckInSnapshotCalculator snapshotCalculator,
      MissedCheckInInsertRepository insertRepository) {
    this.clock = clock;
    this.properties = properties;
    this.holidayService = holidayService;
    this.teamRepository = teamRepository;
    this.personRepository = personRepository;
    this.checkInRepository = checkInRepository;
    this.missedCheckInRepository = missedCheckInRepository;
    this.snapshotCalculator = snapshotCalculator;
    this.insertRepository = insertRepository;
  }

  public TenantDetectionResult processCompany(Company company) {
    var companyId = company.getId();
    var zone = company.zoneId();
    var now = ZonedDateTime.ofInstant(clock.instant(), zone);
    var today = now.toLocalDate();

    if (holidayService.isHoliday(companyId, today)) {
      log.info("Skipping company {}: {} is a holiday", companyId, today);
      return TenantDetectionResult.holiday(companyId, today);
    }

    var teams = teamRepository.findByCompanyIdAndActiveTrue(companyId);
    if (teams.isEmpty()) {
      return TenantDetectionResult.none(companyId, today);
    }
    Map<UUID, Team> teamsById =
        teams.stream().collect(Collectors.toMap(Team::getId, Function.identity()));

    var workers = personRepository.findActiveWorkersOnTeams(companyId, teamsById.keySet());
    var candidatesByDate = new TreeMap<LocalDate, List<WorkerContext>>();
    for (var worker : workers) {
      var due = dueCheckIn(worker, teamsById.get(worker.getTeamId()), now, today);
      if (due != null) {
        candidatesByDate
            .computeIfAbsent(due.missedDate(), d -> new ArrayList<>())
            .add(due.worker());
      }
    }

    var yesterday = today.minusDays(1);
    if (candidatesByDate.containsKey(yesterday) && holidayService.isHoliday(companyId, yesterday)) {
      log.debug(
          "Dropping late-window candidates for company {}: {} was a holiday", companyId, yesterday);
      candidatesByDate.remove(yesterday);
    }
    if (candidatesByDate.isEmpty()) {
      log.debug("No workers past their check-in window for company {}", companyId);
      return TenantDetectionResult.none(companyId, today);
    }

    var detected = new ArrayList<DetectedMiss>();
    candidatesByDate.forEach(
        (missedDate, candidates) ->
            detected.addAll(detectOn(companyId, missedDate, candidates, teamsById)));
    return new TenantDetectionResult(companyId, today, false, detected);
  }

  private List<DetectedMiss> detectOn(
      UUID companyId,
      LocalDate missedDate,
      List<WorkerContext> candidates,
      Map<UUID, Team> teamsById) {
    var candidateIds = candidates.stream().map(WorkerContext::personId).toList();
    var excluded = new HashSet<UUID>();
    excluded.addAll(
        checkInRepository.findPersonIdsCheckedInOn(companyId, candidateIds, missedDate));
    excluded.addAll(
        missedCheckInRepository.findPersonIdsRecordedOn(companyId, missedDate, candidateIds));
    var missing = candidates.stream().filter(c -> !excluded.contains(c.personId())).toList();
    if (missing.isEmpty()) {
      return List.of();
    }

    var holidays =
        holidayService.holidaySet(
            companyId, missedDate.minusDays(properties.historyLookbackDays()), missedDate);
    var snapshots = snapshotCalculator.calculateBatch(companyId, missing, missedDate, holidays);
    var leaderNames = leaderNames(companyId, missing, teamsById);

    var rows = new ArrayList<NewMissedCheckIn>(missing.size());
    for (var worker : missing) {
      var leaderId = teamsById.get(worker.teamId()).getLeaderId();
      rows.add(
          new NewMissedCheckIn(
              worker.personId(),
              worker.teamId(),
              missedDate,
              worker.schedule().windowLabel(),
              leaderId,
              leaderId != null ? leaderNames.get(leaderId) : null,
              worker.role(),
              snapshots.get(worker.personId())));
    }

    var inserted = insertRepository.insertIgnoringDuplicates(companyId, rows);
    var detected = new ArrayList<DetectedMiss>(inserted.size());
    for (var row : rows) {
      var recordId = inserted.get(row.personId());
      if (recordId != null) {
        detected.add(
            new DetectedMiss(
                recordId,
                row.personId(),
                row.teamId(),
                row.teamLeaderId(),
                row.missedDate(),
                row.scheduleWindow()));
      }
    }
    if (detected.size() < rows.size()) {
      log.debug(
          "{} of {} misses for company {} on {} were already recorded",
          rows.size() - detected.size(),
          rows.size(),
          companyId,
          missedDate);
    }
    return detected;
  }

  /**
   * Returns the date the worker is now overdue for, or null if no closed window is pending. A
   * window whose end plus buffer reaches midnight is judged against the previous day.
   */
  private DueCheckIn dueCheckIn(Person worker, Team team, ZonedDateTime now, LocalDate today) {
    if (team == null) {
      return null;
    }
    EffectiveSchedule schedule =
        ScheduleResolver.effectiveSchedule(worker.scheduleOverride(), team.schedule());
    var date = closesNextDay(schedule) ? today.minusDays(1) : today;

    var assignedOn = LocalDate.ofInstant(worker.getTeamAssignedAt(), now.getZone());
    if (!assignedOn.isBefore(date)) {
      return null;
    }
    if (!schedule.isWorkDay(date.getDayOfWeek())) {
      return null;
    }
    LocalDateTime deadline =
        date.atTime(schedule.checkInEnd()).plusMinutes(properties.windowBufferMinutes());
    if (now.toLocalDateTime().isBefore(deadline)) {
      return null;
    }
    return new DueCheckIn(
        date,
        new WorkerContext(worker.getId(), team.getId(), worker.getRole(), assignedOn, schedule));
  }

  private boolean closesNextDay(EffectiveSchedule schedule) {
    long deadlineSeconds =
        schedule.checkInEnd().toSecondOfDay() + properties.windowBufferMinutes() * 60L;
    return deadlineSeconds >= SECONDS_PER_DAY;
  }

  private Map<UUID, String> leaderNames(
      UUID companyId, List<WorkerContext> missing, Map<UUID, Team> teamsById) {
    var leaderIds =
        missing.stream()
            .map(w -> teamsById.get(w.teamId()).getLeaderId())
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
    if (leaderIds.isEmpty()) {
      return Map.of();
    }
    return personRepository.findByCompanyIdAndIdIn(companyId, leaderIds).stream()
        .collect(Collectors.toMap(Person::getId, Person::getFullName));
  }

  private record DueCheckIn(LocalDate missedDate, WorkerContext worker) {}
}
