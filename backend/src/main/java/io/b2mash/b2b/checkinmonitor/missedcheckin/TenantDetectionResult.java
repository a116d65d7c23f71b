package io.b2mash.b2b.checkinmonitor.missedcheckin;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/** Outcome of processing one company in a detection pass. */
public record TenantDetectionResult(
    UUID companyId, LocalDate localDate, boolean holiday, List<DetectedMiss> detected) {

  public static TenantDetectionResult holiday(UUID companyId, LocalDate localDate) {
    return new TenantDetectionResult(companyId, localDate, true, List.of());
  }

  public static TenantDetectionResult none(UUID companyId, LocalDate localDate) {
    return new TenantDetectionResult(companyId, localDate, false, List.of());
  }
}
