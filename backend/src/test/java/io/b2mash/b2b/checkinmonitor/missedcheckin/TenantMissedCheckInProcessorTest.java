package io.b2mash.b2b.checkinmonitor.missedcheckin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.checkinmonitor.checkin.CheckInRepository;
import io.b2mash.b2b.checkinmonitor.company.Company;
import io.b2mash.b2b.checkinmonitor.config.DetectionProperties;
import io.b2mash.b2b.checkinmonitor.holiday.HolidayService;
import io.b2mash.b2b.checkinmonitor.person.Person;
import io.b2mash.b2b.checkinmonitor.person.PersonRepository;
import io.b2mash.b2b.checkinmonitor.person.Role;
import io.b2mash.b2b.checkinmonitor.schedule.WorkDays;
import io.b2mash.b2b.checkinmonitor.team.Team;
import io.b2mash.b2b.checkinmonitor.team.TeamRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class TenantMissedCheckInProcessorTest {

  private static final UUID COMPANY_ID = UUID.randomUUID();
  private static final UUID TEAM_ID = UUID.randomUUID();
  private static final UUID LEADER_ID = UUID.randomUUID();
  private static final UUID WORKER_ID = UUID.randomUUID();

  /** Wednesday in Asia/Manila (UTC+8). */
  private static final LocalDate TODAY = LocalDate.of(2026, 10, 14);

  private static final Instant WINDOW_END_PLUS_1_MIN = Instant.parse("2026-10-14T02:01:00Z");
  private static final Instant WINDOW_END_PLUS_2_MIN = Instant.parse("2026-10-14T02:02:00Z");

  /** 00:15 on Thursday the 15th in Manila. */
  private static final Instant AFTER_MIDNIGHT_00_15 = Instant.parse("2026-10-14T16:15:00Z");

  private static final MissedCheckInSnapshot SNAPSHOT =
      new MissedCheckInSnapshot(3, 2, 5, 1, null, 0, 0, 0, 4.5, 100.0, true, false);

  @Mock private HolidayService holidayService;
  @Mock private TeamRepository teamRepository;
  @Mock private PersonRepository personRepository;
  @Mock private CheckInRepository checkInRepository;
  @Mock private MissedCheckInRepository missedCheckInRepository;
  @Mock private MissedCheckInSnapshotCalculator snapshotCalculator;
  @Mock private MissedCheckInInsertRepository insertRepository;

  @Captor private ArgumentCaptor<List<NewMissedCheckIn>> rowsCaptor;

  private Company company;
  private Team team;
  private Person leader;
  private Person worker;

  @BeforeEach
  void setUp() {
    company = new Company("Acme Logistics", "Asia/Manila");
    ReflectionTestUtils.setField(company, "id", COMPANY_ID);

    team =
        new Team(
            COMPANY_ID,
            "Warehouse A",
            WorkDays.MONDAY_TO_FRIDAY,
            LocalTime.of(6, 0),
            LocalTime.of(10, 0),
            LEADER_ID);
    ReflectionTestUtils.setField(team, "id", TEAM_ID);

    leader = new Person(COMPANY_ID, "Lea", "Santos", "lea@acme.test", Role.TEAM_LEAD);
    ReflectionTestUtils.setField(leader, "id", LEADER_ID);

    worker = new Person(COMPANY_ID, "Wes", "Cruz", "wes@acme.test", Role.WORKER);
    ReflectionTestUtils.setField(worker, "id", WORKER_ID);
    worker.assignToTeam(TEAM_ID, Instant.parse("2026-10-01T00:00:00Z"));
  }

  @Test
  void processCompany_holiday_fetchesNoTeamsOrWorkers() {
    when(holidayService.isHoliday(COMPANY_ID, TODAY)).thenReturn(true);

    var result = processorAt(WINDOW_END_PLUS_2_MIN).processCompany(company);

    assertThat(result.holiday()).isTrue();
    assertThat(result.detected()).isEmpty();
    verifyNoInteractions(
        teamRepository, personRepository, checkInRepository, insertRepository, snapshotCalculator);
  }

  @Test
  void processCompany_withinBuffer_detectsNothing() {
    stubTeamWithWorker();

    var result = processorAt(WINDOW_END_PLUS_1_MIN).processCompany(company);

    assertThat(result.detected()).isEmpty();
    verifyNoInteractions(checkInRepository, insertRepository);
  }

  @Test
  void processCompany_bufferElapsed_recordsMissWithLeaderSnapshot() {
    stubTeamWithWorker();
    stubNothingRecordedYet();
    var recordId = UUID.randomUUID();
    when(insertRepository.insertIgnoringDuplicates(eq(COMPANY_ID), anyList()))
        .thenReturn(Map.of(WORKER_ID, recordId));

    var result = processorAt(WINDOW_END_PLUS_2_MIN).processCompany(company);

    verify(insertRepository).insertIgnoringDuplicates(eq(COMPANY_ID), rowsCaptor.capture());
    var row = rowsCaptor.getValue().get(0);
    assertThat(row.personId()).isEqualTo(WORKER_ID);
    assertThat(row.missedDate()).isEqualTo(TODAY);
    assertThat(row.scheduleWindow()).isEqualTo("6:00 AM - 10:00 AM");
    assertThat(row.teamLeaderId()).isEqualTo(LEADER_ID);
    assertThat(row.teamLeaderName()).isEqualTo("Lea Santos");
    assertThat(row.workerRole()).isEqualTo(Role.WORKER);
    assertThat(row.snapshot()).isSameAs(SNAPSHOT);

    assertThat(result.detected())
        .singleElement()
        .satisfies(
            miss -> {
              assertThat(miss.recordId()).isEqualTo(recordId);
              assertThat(miss.leaderId()).isEqualTo(LEADER_ID);
              assertThat(miss.missedDate()).isEqualTo(TODAY);
            });
  }

  @Test
  void processCompany_usesHolidaySetOverLookbackWindow() {
    stubTeamWithWorker();
    stubNothingRecordedYet();
    when(insertRepository.insertIgnoringDuplicates(eq(COMPANY_ID), anyList()))
        .thenReturn(Map.of());

    processorAt(WINDOW_END_PLUS_2_MIN).processCompany(company);

    verify(holidayService).holidaySet(COMPANY_ID, TODAY.minusDays(90), TODAY);
  }

  @Test
  void processCompany_assignedEarlierTodayInLocalTime_isNotEligible() {
    // 01:00 on the 14th in Manila, still the 13th in UTC
    worker.assignToTeam(TEAM_ID, Instant.parse("2026-10-13T17:00:00Z"));
    stubTeamWithWorker();

    var result = processorAt(WINDOW_END_PLUS_2_MIN).processCompany(company);

    assertThat(result.detected()).isEmpty();
    verifyNoInteractions(insertRepository);
  }

  @Test
  void processCompany_assignedYesterday_isEligible() {
    worker.assignToTeam(TEAM_ID, Instant.parse("2026-10-13T15:59:00Z"));
    stubTeamWithWorker();
    stubNothingRecordedYet();
    when(insertRepository.insertIgnoringDuplicates(eq(COMPANY_ID), anyList()))
        .thenReturn(Map.of(WORKER_ID, UUID.randomUUID()));

    var result = processorAt(WINDOW_END_PLUS_2_MIN).processCompany(company);

    assertThat(result.detected()).hasSize(1);
  }

  @Test
  void processCompany_workerAlreadyCheckedIn_isExcluded() {
    stubTeamWithWorker();
    when(checkInRepository.findPersonIdsCheckedInOn(eq(COMPANY_ID), any(), eq(TODAY)))
        .thenReturn(List.of(WORKER_ID));
    when(missedCheckInRepository.findPersonIdsRecordedOn(eq(COMPANY_ID), eq(TODAY), any()))
        .thenReturn(List.of());

    var result = processorAt(WINDOW_END_PLUS_2_MIN).processCompany(company);

    assertThat(result.detected()).isEmpty();
    verifyNoInteractions(insertRepository, snapshotCalculator);
  }

  @Test
  void processCompany_missAlreadyRecorded_isExcluded() {
    stubTeamWithWorker();
    when(checkInRepository.findPersonIdsCheckedInOn(eq(COMPANY_ID), any(), eq(TODAY)))
        .thenReturn(List.of());
    when(missedCheckInRepository.findPersonIdsRecordedOn(eq(COMPANY_ID), eq(TODAY), any()))
        .thenReturn(List.of(WORKER_ID));

    var result = processorAt(WINDOW_END_PLUS_2_MIN).processCompany(company);

    assertThat(result.detected()).isEmpty();
    verify(insertRepository, never()).insertIgnoringDuplicates(any(), anyList());
  }

  @Test
  void processCompany_concurrentInsertWon_reportsNothingNew() {
    stubTeamWithWorker();
    stubNothingRecordedYet();
    when(insertRepository.insertIgnoringDuplicates(eq(COMPANY_ID), anyList()))
        .thenReturn(Map.of());

    var result = processorAt(WINDOW_END_PLUS_2_MIN).processCompany(company);

    assertThat(result.detected()).isEmpty();
  }

  @Test
  void processCompany_nonWorkDay_detectsNothing() {
    stubTeamWithWorker();
    // Saturday 17th, 11:00 Manila
    var result =
        processorAt(Instant.parse("2026-10-17T03:00:00Z")).processCompany(company);

    assertThat(result.detected()).isEmpty();
    verifyNoInteractions(checkInRepository, insertRepository);
  }

  @Test
  void processCompany_overrideWindowEndsLater_waitsForWorkersOwnWindow() {
    worker.overrideSchedule(null, null, LocalTime.of(12, 0));
    stubTeamWithWorker();

    var result = processorAt(WINDOW_END_PLUS_2_MIN).processCompany(company);

    assertThat(result.detected()).isEmpty();
    verifyNoInteractions(checkInRepository, insertRepository);
  }

  @Test
  void processCompany_lateWindow_recordsPreviousDateOnFirstPassAfterMidnight() {
    worker.overrideSchedule(null, LocalTime.of(20, 0), LocalTime.of(23, 59));
    stubTeamWithWorker();
    stubNothingRecordedYet();
    when(insertRepository.insertIgnoringDuplicates(eq(COMPANY_ID), anyList()))
        .thenReturn(Map.of(WORKER_ID, UUID.randomUUID()));

    var result = processorAt(AFTER_MIDNIGHT_00_15).processCompany(company);

    verify(insertRepository).insertIgnoringDuplicates(eq(COMPANY_ID), rowsCaptor.capture());
    var row = rowsCaptor.getValue().get(0);
    assertThat(row.missedDate()).isEqualTo(TODAY);
    assertThat(row.scheduleWindow()).isEqualTo("8:00 PM - 11:59 PM");
    assertThat(result.localDate()).isEqualTo(TODAY.plusDays(1));
    assertThat(result.detected())
        .singleElement()
        .extracting(DetectedMiss::missedDate)
        .isEqualTo(TODAY);
    verify(holidayService).isHoliday(COMPANY_ID, TODAY);
  }

  @Test
  void processCompany_lateWindow_notDueUntilBufferPassesMidnight() {
    worker.overrideSchedule(null, LocalTime.of(20, 0), LocalTime.of(23, 59));
    stubTeamWithWorker();

    // 00:00:30 on the 15th Manila, deadline is 00:01
    var result =
        processorAt(Instant.parse("2026-10-14T16:00:30Z")).processCompany(company);

    assertThat(result.detected()).isEmpty();
    verifyNoInteractions(checkInRepository, insertRepository);
  }

  @Test
  void processCompany_lateWindow_previousDateHoliday_recordsNothing() {
    worker.overrideSchedule(null, LocalTime.of(20, 0), LocalTime.of(23, 59));
    when(holidayService.isHoliday(COMPANY_ID, TODAY.plusDays(1))).thenReturn(false);
    when(holidayService.isHoliday(COMPANY_ID, TODAY)).thenReturn(true);
    when(teamRepository.findByCompanyIdAndActiveTrue(COMPANY_ID)).thenReturn(List.of(team));
    when(personRepository.findActiveWorkersOnTeams(eq(COMPANY_ID), any()))
        .thenReturn(List.of(worker));

    var result = processorAt(AFTER_MIDNIGHT_00_15).processCompany(company);

    assertThat(result.holiday()).isFalse();
    assertThat(result.detected()).isEmpty();
    verifyNoInteractions(checkInRepository, insertRepository, snapshotCalculator);
  }

  @Test
  void processCompany_lateWindow_alreadyCheckedInOnPreviousDate_isExcluded() {
    worker.overrideSchedule(null, LocalTime.of(20, 0), LocalTime.of(23, 59));
    stubTeamWithWorker();
    when(checkInRepository.findPersonIdsCheckedInOn(eq(COMPANY_ID), any(), eq(TODAY)))
        .thenReturn(List.of(WORKER_ID));
    when(missedCheckInRepository.findPersonIdsRecordedOn(eq(COMPANY_ID), eq(TODAY), any()))
        .thenReturn(List.of());

    var result = processorAt(AFTER_MIDNIGHT_00_15).processCompany(company);

    assertThat(result.detected()).isEmpty();
    verifyNoInteractions(insertRepository);
  }

  @Test
  void processCompany_noActiveTeams_skipsWorkerQuery() {
    when(holidayService.isHoliday(COMPANY_ID, TODAY)).thenReturn(false);
    when(teamRepository.findByCompanyIdAndActiveTrue(COMPANY_ID)).thenReturn(List.of());

    var result = processorAt(WINDOW_END_PLUS_2_MIN).processCompany(company);

    assertThat(result.detected()).isEmpty();
    verifyNoInteractions(personRepository);
  }

  private void stubTeamWithWorker() {
    when(holidayService.isHoliday(eq(COMPANY_ID), any())).thenReturn(false);
    when(teamRepository.findByCompanyIdAndActiveTrue(COMPANY_ID)).thenReturn(List.of(team));
    when(personRepository.findActiveWorkersOnTeams(eq(COMPANY_ID), any()))
        .thenReturn(List.of(worker));
  }

  private void stubNothingRecordedYet() {
    stubNothingRecordedYet();
  }

  private void stubNothingRecordedYet(LocalDate date) {
    when(checkInRepository.findPersonIdsCheckedInOn(eq(COMPANY_ID), any(), eq(date)))
        .thenReturn(List.of());
    when(missedCheckInRepository.findPersonIdsRecordedOn(eq(COMPANY_ID), eq(date), any()))
        .thenReturn(List.of());
    when(holidayService.holidaySet(COMPANY_ID, date.minusDays(90), date)).thenReturn(Set.of());
    when(snapshotCalculator.calculateBatch(eq(COMPANY_ID), anyList(), eq(date), any()))
        .thenReturn(Map.of(WORKER_ID, SNAPSHOT));
    when(personRepository.findByCompanyIdAndIdIn(eq(COMPANY_ID), any()))
        .thenReturn(List.of(leader));
  }

  private TenantMissedCheckInProcessor processorAt(Instant instant) {
    return new TenantMissedCheckInProcessor(
        Clock.fixed(instant, ZoneOffset.UTC),
        DetectionProperties.defaults(),
        holidayService,
        teamRepository,
        personRepository,
        checkInRepository,
        missedCheckInRepository,
        snapshotCalculator,
        insertRepository);
  }
}
