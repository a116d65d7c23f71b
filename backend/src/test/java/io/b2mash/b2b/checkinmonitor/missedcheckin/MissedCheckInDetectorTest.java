package io.b2mash.b2b.checkinmonitor.missedcheckin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.checkinmonitor.audit.AuditEventRecord;
import io.b2mash.b2b.checkinmonitor.audit.AuditService;
import io.b2mash.b2b.checkinmonitor.company.Company;
import io.b2mash.b2b.checkinmonitor.company.CompanyRepository;
import io.b2mash.b2b.checkinmonitor.config.DetectionProperties;
import io.b2mash.b2b.checkinmonitor.notification.NotificationService;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class MissedCheckInDetectorTest {

  private static final LocalDate TODAY = LocalDate.of(2026, 10, 14);

  @Mock private CompanyRepository companyRepository;
  @Mock private TenantMissedCheckInProcessor processor;
  @Mock private NotificationService notificationService;
  @Mock private AuditService auditService;

  @Captor private ArgumentCaptor<List<AuditEventRecord>> auditCaptor;

  private final MissedCheckInNotificationBatcher notificationBatcher =
      new MissedCheckInNotificationBatcher();
  private InMemoryDetectionRunLock runLock;
  private MissedCheckInDetector detector;

  @BeforeEach
  void setUp() {
    runLock = new InMemoryDetectionRunLock();
    detector = detectorWith(DetectionProperties.defaults());
  }

  @Test
  void runDetectionPass_noCompanies_completesAndReleasesLock() {
    when(companyRepository.findByActiveTrueOrderByCreatedAtAsc()).thenReturn(List.of());

    detector.runDetectionPass();

    verifyNoInteractions(processor);
    assertThat(runLock.tryAcquire()).isTrue();
  }

  @Test
  void runDetectionPass_whileAnotherPassRuns_isNoOp() {
    assertThat(runLock.tryAcquire()).isTrue();

    detector.runDetectionPass();

    verifyNoInteractions(companyRepository, processor, notificationService, auditService);
    // the skipped invocation must not release a lock it never held
    assertThat(runLock.tryAcquire()).isFalse();
  }

  @Test
  void runDetectionPass_failingCompany_doesNotStopOthers() {
    var failing = company("Failing Co");
    var healthy = company("Healthy Co");
    when(companyRepository.findByActiveTrueOrderByCreatedAtAsc())
        .thenReturn(List.of(failing, healthy));
    when(processor.processCompany(failing))
        .thenThrow(new DataAccessResourceFailureException("holiday lookup failed"));
    var miss = miss();
    when(processor.processCompany(healthy))
        .thenReturn(new TenantDetectionResult(healthy.getId(), TODAY, false, List.of(miss)));

    detector.runDetectionPass();

    verify(processor).processCompany(healthy);
    verify(notificationService).sendNotifications(eq(healthy.getId()), anyList());
    verify(notificationService, never()).sendNotifications(eq(failing.getId()), anyList());
    assertThat(runLock.tryAcquire()).isTrue();
  }

  @Test
  void runDetectionPass_notificationFailure_stillRecordsAuditEvents() {
    var acme = company("Acme");
    var miss = miss();
    when(companyRepository.findByActiveTrueOrderByCreatedAtAsc()).thenReturn(List.of(acme));
    when(processor.processCompany(acme))
        .thenReturn(new TenantDetectionResult(acme.getId(), TODAY, false, List.of(miss)));
    when(notificationService.sendNotifications(any(), anyList()))
        .thenThrow(new IllegalStateException("notification store unavailable"));

    detector.runDetectionPass();

    verify(auditService).logAll(auditCaptor.capture());
    assertThat(auditCaptor.getValue())
        .singleElement()
        .satisfies(
            event -> {
              assertThat(event.eventType()).isEqualTo("missed_check_in.detected");
              assertThat(event.entityId()).isEqualTo(miss.recordId());
              assertThat(event.actorType()).isEqualTo("SYSTEM");
              assertThat(event.details()).containsEntry("missed_date", "2026-10-14");
            });
    assertThat(runLock.tryAcquire()).isTrue();
  }

  @Test
  void runDetectionPass_nothingDetected_sendsNoNotifications() {
    var acme = company("Acme");
    when(companyRepository.findByActiveTrueOrderByCreatedAtAsc()).thenReturn(List.of(acme));
    when(processor.processCompany(acme))
        .thenReturn(TenantDetectionResult.none(acme.getId(), TODAY));

    detector.runDetectionPass();

    verifyNoInteractions(notificationService, auditService);
  }

  @Test
  void scheduledDetection_disabled_doesNothing() {
    var disabled = new DetectionProperties(false, 2, 90, 7);

    detectorWith(disabled).scheduledDetection();

    verifyNoInteractions(companyRepository, processor);
  }

  private MissedCheckInDetector detectorWith(DetectionProperties properties) {
    return new MissedCheckInDetector(
        runLock,
        properties,
        companyRepository,
        processor,
        notificationBatcher,
        notificationService,
        auditService);
  }

  private static Company company(String name) {
    var company = new Company(name, "Asia/Manila");
    ReflectionTestUtils.setField(company, "id", UUID.randomUUID());
    return company;
  }

  private static DetectedMiss miss() {
    return new DetectedMiss(
        UUID.randomUUID(),
        UUID.randomUUID(),
        UUID.randomUUID(),
        UUID.randomUUID(),
        TODAY,
        "6:00 AM - 10:00 AM");
  }
}
