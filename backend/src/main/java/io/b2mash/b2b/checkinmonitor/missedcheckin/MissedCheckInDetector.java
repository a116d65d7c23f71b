package io.b2mash.b2b.checkinmonitor.missedcheckin;

import io.b2mash.b2b.checkinmonitor.audit.AuditEventBuilder;
import io.b2mash.b2b.checkinmonitor.audit.AuditService;
import io.b2mash.b2b.checkinmonitor.company.CompanyRepository;
import io.b2mash.b2b.checkinmonitor.config.DetectionProperties;
import io.b2mash.b2b.checkinmonitor.notification.NotificationService;
import java.util.HashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job that records missed check-ins for every active company. Companies are processed
 * one after another; a failure in one is logged and the pass moves on to the next. Overlapping
 * invocations are skipped, not queued.
 */
@Component
public class MissedCheckInDetector {

  private static final Logger log = LoggerFactory.getLogger(MissedCheckInDetector.class);

  static final String EVENT_DETECTED = "missed_check_in.detected";

  private final DetectionRunLock runLock;
  private final DetectionProperties properties;
  private final CompanyRepository companyRepository;
  private final TenantMissedCheckInProcessor processor;
  private final MissedCheckInNotificationBatcher notificationBatcher;
  private final NotificationService notificationService;
  private final AuditService auditService;

  public MissedCheckInDetector(
      DetectionRunLock runLock,
      DetectionProperties properties,
      CompanyRepository companyRepository,
      TenantMissedCheckInProcessor processor,
      MissedCheckInNotificationBatcher notificationBatcher,
      NotificationService notificationService,
      AuditService auditService) {
    this.runLock = runLock;
    this.properties = properties;
    this.companyRepository = companyRepository;
    this.processor = processor;
    this.notificationBatcher = notificationBatcher;
    this.notificationService = notificationService;
    this.auditService = auditService;
  }

  @Scheduled(
      fixedRateString = "${missed-check-in.detection.interval-ms:900000}",
      initialDelayString = "${missed-check-in.detection.interval-ms:900000}")
  public void scheduledDetection() {
    if (!properties.enabled()) {
      log.debug("Missed check-in detection is disabled");
      return;
    }
    runDetectionPass();
  }

  /** Runs one detection pass over all active companies. A no-op if a pass is already running. */
  public void runDetectionPass() {
    if (!runLock.tryAcquire()) {
      log.info("Missed check-in detection already running, skipping this invocation");
      return;
    }
    try {
      log.info("Missed check-in detection started");
      var companies = companyRepository.findByActiveTrueOrderByCreatedAtAsc();
      int totalDetected = 0;
      int failed = 0;

      for (var company : companies) {
        MDC.put("tenantId", company.getId().toString());
        try {
          var result = processor.processCompany(company);
          if (!result.detected().isEmpty()) {
            totalDetected += result.detected().size();
            log.info(
                "Detected {} missed check-ins for company {} on {}",
                result.detected().size(),
                company.getId(),
                result.localDate());
            notifyMisses(result);
            auditMisses(result);
          }
        } catch (Exception e) {
          failed++;
          log.error("Missed check-in detection failed for company {}", company.getId(), e);
        } finally {
          MDC.remove("tenantId");
        }
      }

      log.info(
          "Missed check-in detection completed: {} companies processed, {} failed, {} detected",
          companies.size(),
          failed,
          totalDetected);
    } finally {
      runLock.release();
    }
  }

  private void notifyMisses(TenantDetectionResult result) {
    try {
      var intents = notificationBatcher.buildIntents(result.detected());
      notificationService.sendNotifications(result.companyId(), intents);
    } catch (Exception e) {
      log.error(
          "Failed to send missed check-in notifications for company {}", result.companyId(), e);
    }
  }

  private void auditMisses(TenantDetectionResult result) {
    try {
      var records =
          result.detected().stream()
              .map(
                  miss -> {
                    var details = new HashMap<String, Object>();
                    details.put("missed_date", miss.missedDate().toString());
                    details.put("schedule_window", miss.scheduleWindow());
                    details.put("team_id", miss.teamId().toString());
                    details.put("person_id", miss.personId().toString());
                    return AuditEventBuilder.builder()
                        .companyId(result.companyId())
                        .eventType(EVENT_DETECTED)
                        .entityType("missed_check_in")
                        .entityId(miss.recordId())
                        .source("SCHEDULED")
                        .details(details)
                        .build();
                  })
              .toList();
      auditService.logAll(records);
    } catch (Exception e) {
      log.error(
          "Failed to record missed check-in audit events for company {}", result.companyId(), e);
    }
  }
}
