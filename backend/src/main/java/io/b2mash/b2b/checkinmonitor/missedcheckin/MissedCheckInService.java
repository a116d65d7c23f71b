package io.b2mash.b2b.checkinmonitor.missedcheckin;

import io.b2mash.b2b.checkinmonitor.audit.AuditEventBuilder;
import io.b2mash.b2b.checkinmonitor.audit.AuditService;
import io.b2mash.b2b.checkinmonitor.exception.ResourceNotFoundException;
import io.b2mash.b2b.checkinmonitor.missedcheckin.dto.MissedCheckInFilter;
import io.b2mash.b2b.checkinmonitor.missedcheckin.dto.MissedCheckInView;
import io.b2mash.b2b.checkinmonitor.missedcheckin.dto.UpdateMissedCheckInStatusRequest;
import io.b2mash.b2b.checkinmonitor.person.Person;
import io.b2mash.b2b.checkinmonitor.person.PersonRepository;
import io.b2mash.b2b.checkinmonitor.team.Team;
import io.b2mash.b2b.checkinmonitor.team.TeamRepository;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

/** Review workflow and read access for persisted missed check-ins. */
@Service
@Validated
public class MissedCheckInService {

  private static final Logger log = LoggerFactory.getLogger(MissedCheckInService.class);

  static final String EVENT_STATUS_CHANGED = "missed_check_in.status_changed";

  private final MissedCheckInRepository missedCheckInRepository;
  private final PersonRepository personRepository;
  private final TeamRepository teamRepository;
  private final AuditService auditService;
  private final Clock clock;

  public MissedCheckInService(
      MissedCheckInRepository missedCheckInRepository,
      PersonRepository personRepository,
      TeamRepository teamRepository,
      AuditService auditService,
      Clock clock) {
    this.missedCheckInRepository = missedCheckInRepository;
    this.personRepository = personRepository;
    this.teamRepository = teamRepository;
    this.auditService = auditService;
    this.clock = clock;
  }

  /**
   * Moves a record to a new review status.
   *
   * @throws ResourceNotFoundException if the record does not exist in the company
   * @throws io.b2mash.b2b.checkinmonitor.exception.InvalidStateException if the transition is not
   *     allowed from the record's current status
   */
  @Transactional
  public MissedCheckInView transitionStatus(
      UUID companyId,
      UUID recordId,
      @Valid UpdateMissedCheckInStatusRequest request,
      UUID actingUserId) {
    var record =
        missedCheckInRepository
            .findOneByIdAndCompanyId(recordId, companyId)
            .orElseThrow(() -> new ResourceNotFoundException("MissedCheckIn", recordId));

    var previous = record.getStatus();
    record.transitionTo(request.status(), actingUserId, request.notes(), clock.instant());
    record = missedCheckInRepository.save(record);

    var details = new HashMap<String, Object>();
    details.put("from", previous.name());
    details.put("to", record.getStatus().name());
    if (request.notes() != null) {
      details.put("notes", request.notes());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .companyId(companyId)
            .eventType(EVENT_STATUS_CHANGED)
            .entityType("missed_check_in")
            .entityId(record.getId())
            .actorId(actingUserId)
            .source("API")
            .details(details)
            .build());

    log.info(
        "Missed check-in {} moved from {} to {} by {}",
        recordId,
        previous,
        record.getStatus(),
        actingUserId);
    return toView(companyId, List.of(record)).get(0);
  }

  @Transactional(readOnly = true)
  public Page<MissedCheckInView> findRecords(
      UUID companyId, MissedCheckInFilter filter, Pageable pageable) {
    // Ordering is fixed by the queries (newest missed date first)
    var unsorted = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize());
    Page<MissedCheckIn> page =
        filter.hasTeams()
            ? missedCheckInRepository.findFilteredOnTeams(
                companyId,
                filter.teamIds(),
                filter.status(),
                filter.personId(),
                filter.fromDate(),
                filter.toDate(),
                unsorted)
            : missedCheckInRepository.findFiltered(
                companyId,
                filter.status(),
                filter.personId(),
                filter.fromDate(),
                filter.toDate(),
                unsorted);
    var viewsById =
        toView(companyId, page.getContent()).stream()
            .collect(Collectors.toMap(MissedCheckInView::id, Function.identity()));
    return page.map(r -> viewsById.get(r.getId()));
  }

  /** Record count per status, with zero for statuses that have no records. */
  @Transactional(readOnly = true)
  public Map<MissedCheckInStatus, Long> countByStatus(UUID companyId, List<UUID> teamIds) {
    var rows =
        teamIds == null || teamIds.isEmpty()
            ? missedCheckInRepository.countByStatus(companyId)
            : missedCheckInRepository.countByStatusOnTeams(companyId, teamIds);
    var counts = new EnumMap<MissedCheckInStatus, Long>(MissedCheckInStatus.class);
    for (var status : MissedCheckInStatus.values()) {
      counts.put(status, 0L);
    }
    rows.forEach(row -> counts.put(row.getStatus(), row.getCount()));
    return counts;
  }

  private List<MissedCheckInView> toView(UUID companyId, List<MissedCheckIn> records) {
    if (records.isEmpty()) {
      return List.of();
    }
    var personIds = records.stream().map(MissedCheckIn::getPersonId).distinct().toList();
    var teamIds = records.stream().map(MissedCheckIn::getTeamId).distinct().toList();
    Map<UUID, String> personNames =
        personRepository.findByCompanyIdAndIdIn(companyId, personIds).stream()
            .collect(Collectors.toMap(Person::getId, Person::getFullName));
    Map<UUID, String> teamNames =
        teamRepository.findByCompanyIdAndIdIn(companyId, teamIds).stream()
            .collect(Collectors.toMap(Team::getId, Team::getName));
    return records.stream()
        .map(r -> MissedCheckInView.from(r, personNames, teamNames))
        .toList();
  }
}
